package com.work.almanac.core.store;

import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.EntityStateVersion;
import com.work.almanac.core.model.FinalityPromotion;
import com.work.almanac.core.model.HistoricalState;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.model.RetractionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.almanac.core.support.ValidationUtils.requireNonNull;

/**
 * 双后端协调：关系型为事实来源，keyed 为可滞后的投影。
 *
 * <ul>
 *     <li>同一 batch / 撤回：先写关系型，成功后再写 keyed</li>
 *     <li>关系型失败：异常上抛，keyed 不动</li>
 *     <li>keyed 失败：记录日志并把该链标记为 lagging，调用仍视为成功，由 {@link KeyedStoreReconciler} 追平</li>
 *     <li>区块/事件读取走关系型；按高度的历史状态读取走 keyed（结果自带已观测高度）</li>
 * </ul>
 *
 * keyed 为空表示未启用 keyed 后端，此时历史状态查询退化为关系型查询。
 */
public class DualBlockEventStore implements BlockEventStore {

    private static final Logger log = LoggerFactory.getLogger(DualBlockEventStore.class);

    private final RelationalStore relational;
    private final BlockEventStore keyedBlocks;
    private final HistoricalStateStore keyedState;

    private final Map<String, Object> chainLocks = new ConcurrentHashMap<>();
    private final Set<String> lagging = ConcurrentHashMap.newKeySet();
    private final Map<String, Long> pendingKeyedRetractions = new ConcurrentHashMap<>();
    private final Map<String, Long> pendingStateReplays = new ConcurrentHashMap<>();

    public DualBlockEventStore(RelationalStore relational, BlockEventStore keyedBlocks, HistoricalStateStore keyedState) {
        this.relational = requireNonNull(relational, "relational");
        if ((keyedBlocks == null) != (keyedState == null)) {
            throw new IllegalArgumentException("keyedBlocks 与 keyedState 必须同时提供或同时为空");
        }
        this.keyedBlocks = keyedBlocks;
        this.keyedState = keyedState;
    }

    public static DualBlockEventStore relationalOnly(RelationalStore relational) {
        return new DualBlockEventStore(relational, null, null);
    }

    Object mutex(String chain) {
        return chainLocks.computeIfAbsent(chain, key -> new Object());
    }

    public boolean isKeyedEnabled() {
        return keyedBlocks != null;
    }

    public boolean isLagging(String chain) {
        return lagging.contains(chain);
    }

    void markLagging(String chain) {
        lagging.add(chain);
    }

    void clearLagging(String chain) {
        lagging.remove(chain);
    }

    /**
     * 取出并清除该链待补做的 keyed 撤回高度。
     */
    Long takePendingRetraction(String chain) {
        return pendingKeyedRetractions.remove(chain);
    }

    void restorePendingRetraction(String chain, long height) {
        pendingKeyedRetractions.merge(chain, height, Math::min);
    }

    /**
     * 取出并清除该链待重放的状态版本起始高度（keyed 状态写入失败或被跳过的最低版本高度）。
     */
    Long takePendingStateReplay(String chain) {
        return pendingStateReplays.remove(chain);
    }

    void restorePendingStateReplay(String chain, long height) {
        pendingStateReplays.merge(chain, height, Math::min);
    }

    RelationalStore relational() {
        return relational;
    }

    BlockEventStore keyedBlocks() {
        return keyedBlocks;
    }

    HistoricalStateStore keyedState() {
        return keyedState;
    }

    @Override
    public void putBlocksAndEvents(IngestionBatch batch) {
        relational.putBlocksAndEvents(batch);
        if (!isKeyedEnabled()) {
            return;
        }
        String chain = batch.getChain();
        synchronized (mutex(chain)) {
            if (isLagging(chain)) {
                // 落后时不跳着写，交给 reconciler 按顺序追平
                return;
            }
            try {
                if (batch.hasBlocks() && !keyedContiguous(chain, batch.firstHeight())) {
                    markLagging(chain);
                    log.info("keyed backend behind batch start, chain marked lagging chain={} batch={}", chain, batch);
                    return;
                }
                keyedBlocks.putBlocksAndEvents(batch);
            } catch (RuntimeException e) {
                markLagging(chain);
                log.warn("keyed write failed, chain marked lagging chain={} batch={} err={}", chain, batch, e.toString());
            }
        }
    }

    /**
     * keyed 为空库，或其游标正好接在 firstHeight 之前。
     */
    private boolean keyedContiguous(String chain, long firstHeight) {
        OptionalLong keyedCursor = keyedBlocks.getCursor(chain);
        if (!keyedCursor.isPresent()) {
            OptionalLong earliest = relational.getEarliestBlock(chain);
            return !earliest.isPresent() || earliest.getAsLong() >= firstHeight;
        }
        return keyedCursor.getAsLong() >= firstHeight - 1;
    }

    @Override
    public RetractionResult retractFromHeight(String chain, long height) {
        RetractionResult result = relational.retractFromHeight(chain, height);
        if (!isKeyedEnabled()) {
            return result;
        }
        synchronized (mutex(chain)) {
            try {
                keyedState.retractFromHeight(chain, height);
                keyedBlocks.retractFromHeight(chain, height);
            } catch (RuntimeException e) {
                restorePendingRetraction(chain, height);
                markLagging(chain);
                log.warn("keyed retract failed, chain marked lagging chain={} fromHeight={} err={}", chain, height, e.toString());
            }
        }
        return result;
    }

    @Override
    public int promoteStatus(String chain, FinalityPromotion promotion) {
        int n = relational.promoteStatus(chain, promotion);
        if (isKeyedEnabled()) {
            synchronized (mutex(chain)) {
                if (!isLagging(chain)) {
                    try {
                        keyedBlocks.promoteStatus(chain, promotion);
                    } catch (RuntimeException e) {
                        markLagging(chain);
                        log.warn("keyed promote failed, chain marked lagging chain={} promotion={} err={}", chain, promotion, e.toString());
                    }
                }
            }
        }
        return n;
    }

    /**
     * 记录实体状态版本：先写关系型，再写 keyed（keyed 尚未观测到该高度时留给 reconciler）。
     */
    public void recordStateVersions(String chain, List<EntityStateVersion> versions) {
        if (versions == null || versions.isEmpty()) {
            return;
        }
        for (EntityStateVersion v : versions) {
            relational.record(v);
        }
        if (!isKeyedEnabled()) {
            return;
        }
        long floor = lowestHeight(versions);
        synchronized (mutex(chain)) {
            if (isLagging(chain)) {
                restorePendingStateReplay(chain, floor);
                return;
            }
            try {
                if (!keyedState.putVersions(chain, versions)) {
                    restorePendingStateReplay(chain, floor);
                    markLagging(chain);
                    log.info("keyed state behind observed height, deferred to reconciler chain={} versions={}", chain, versions.size());
                }
            } catch (RuntimeException e) {
                restorePendingStateReplay(chain, floor);
                markLagging(chain);
                log.warn("keyed state write failed, chain marked lagging chain={} fromHeight={} err={}", chain, floor, e.toString());
            }
        }
    }

    private static long lowestHeight(List<EntityStateVersion> versions) {
        long min = Long.MAX_VALUE;
        for (EntityStateVersion v : versions) {
            min = Math.min(min, v.getBlockNumber());
        }
        return min;
    }

    /**
     * 截至 height 的实体状态。keyed 未启用时用关系型兜底，此时已观测高度即关系型游标。
     */
    public Optional<HistoricalState> findStateAsOf(String chain, String entityKind, String entityId, long height) {
        if (isKeyedEnabled()) {
            return keyedState.findAsOf(chain, entityKind, entityId, height);
        }
        Optional<EntityStateVersion> v = relational.findLatestAtOrBelow(entityKind, entityId, height);
        long observed = relational.getCursor(chain).orElse(-1L);
        return v.map(version -> new HistoricalState(version, height, observed));
    }

    public OptionalLong getKeyedObservedHeight(String chain) {
        return isKeyedEnabled() ? keyedBlocks.getCursor(chain) : OptionalLong.empty();
    }

    @Override
    public OptionalLong getLatestBlock(String chain, BlockStatus minStatus) {
        return relational.getLatestBlock(chain, minStatus);
    }

    @Override
    public OptionalLong getEarliestBlock(String chain) {
        return relational.getEarliestBlock(chain);
    }

    @Override
    public Optional<Block> getBlock(String chain, long height) {
        return relational.getBlock(chain, height);
    }

    @Override
    public List<Block> getBlocks(String chain, long fromHeight, long toHeight) {
        return relational.getBlocks(chain, fromHeight, toHeight);
    }

    @Override
    public List<ChainEvent> getEvents(EventFilter filter) {
        return relational.getEvents(filter);
    }

    @Override
    public OptionalLong getCursor(String chain) {
        return relational.getCursor(chain);
    }
}
