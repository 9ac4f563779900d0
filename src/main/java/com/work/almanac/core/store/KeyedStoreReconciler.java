package com.work.almanac.core.store;

import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.EntityStateVersion;
import com.work.almanac.core.model.FinalityPromotion;
import com.work.almanac.core.model.IngestionBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 把关系型后端重放到 keyed 后端，直到两者已观测高度一致。
 *
 * 每条链每轮：
 * 1) 补做失败过的 keyed 撤回；
 * 2) keyed 超前或链尖 hash 不一致时，撤回 keyed 多出来的部分；
 * 3) 按 batchSize 分段重放区块、事件与状态版本；
 * 4) 区块追平后补写此前失败的状态版本；
 * 5) 最后按关系型同步终局水位并清除 lagging 标记。
 */
public class KeyedStoreReconciler {

    private static final Logger log = LoggerFactory.getLogger(KeyedStoreReconciler.class);

    /**
     * 单轮单链最多重放的分段数，避免一次调度占用过久。
     */
    private static final int MAX_SEGMENTS_PER_RUN = 50;

    private final DualBlockEventStore dual;
    private final List<String> chains;
    private final int batchSize;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public KeyedStoreReconciler(DualBlockEventStore dual, List<String> chains, int batchSize) {
        this.dual = dual;
        this.chains = Collections.unmodifiableList(new ArrayList<>(chains));
        this.batchSize = Math.max(1, batchSize);
    }

    @Scheduled(fixedDelayString = "${indexer.keyed.reconcile-interval:PT10S}")
    public void reconcileAll() {
        if (!dual.isKeyedEnabled() || !running.compareAndSet(false, true)) {
            return;
        }
        try {
            for (String chain : chains) {
                try {
                    reconcile(chain);
                } catch (Exception e) {
                    log.warn("keyed reconcile error chain={} err={}", chain, e.toString());
                }
            }
        } finally {
            running.set(false);
        }
    }

    /**
     * 对单条链执行一轮对账，返回本轮结束时是否已追平。
     */
    public boolean reconcile(String chain) {
        RelationalStore relational = dual.relational();
        BlockEventStore keyed = dual.keyedBlocks();
        HistoricalStateStore keyedState = dual.keyedState();

        synchronized (dual.mutex(chain)) {
            Long pending = dual.takePendingRetraction(chain);
            if (pending != null) {
                try {
                    keyedState.retractFromHeight(chain, pending);
                    keyed.retractFromHeight(chain, pending);
                } catch (RuntimeException e) {
                    dual.restorePendingRetraction(chain, pending);
                    throw e;
                }
            }

            long relCursor = relational.getCursor(chain).orElse(-1L);
            long keyedCursor = keyed.getCursor(chain).orElse(-1L);

            if (keyedCursor > relCursor) {
                retractKeyed(chain, relCursor + 1);
                keyedCursor = keyed.getCursor(chain).orElse(-1L);
            }
            keyedCursor = dropDivergentTip(chain, keyedCursor);

            int segments = 0;
            while (keyedCursor < relCursor && segments < MAX_SEGMENTS_PER_RUN) {
                long from = keyedCursor < 0 ? relational.getEarliestBlock(chain).orElse(0L) : keyedCursor + 1;
                long to = Math.min(from + batchSize - 1, relCursor);
                replay(chain, from, to);
                keyedCursor = to;
                segments++;
            }

            if (keyedCursor == relCursor) {
                if (!replayPendingState(chain, relCursor)) {
                    dual.markLagging(chain);
                    return false;
                }
                syncWatermarks(chain);
                if (dual.isLagging(chain)) {
                    log.info("keyed backend caught up chain={} height={}", chain, relCursor);
                }
                dual.clearLagging(chain);
                return true;
            }
            dual.markLagging(chain);
            return false;
        }
    }

    /**
     * keyed 链尖与关系型不一致（例如 keyed 撤回丢失）时向下找到一致的高度，撤回其上的 keyed 数据。
     */
    private long dropDivergentTip(String chain, long keyedCursor) {
        long h = keyedCursor;
        long floor = Math.max(-1L, keyedCursor - batchSize);
        while (h > floor) {
            Optional<Block> k = dual.keyedBlocks().getBlock(chain, h);
            Optional<Block> r = dual.relational().getBlock(chain, h);
            if (k.isPresent() && r.isPresent() && k.get().getHash().equals(r.get().getHash())) {
                break;
            }
            h--;
        }
        if (h == keyedCursor) {
            return keyedCursor;
        }
        log.warn("keyed tip diverged from relational chain={} keyedCursor={} retractFrom={}", chain, keyedCursor, h + 1);
        retractKeyed(chain, h + 1);
        return dual.keyedBlocks().getCursor(chain).orElse(-1L);
    }

    private void retractKeyed(String chain, long fromHeight) {
        dual.keyedState().retractFromHeight(chain, fromHeight);
        dual.keyedBlocks().retractFromHeight(chain, fromHeight);
    }

    private void replay(String chain, long from, long to) {
        RelationalStore relational = dual.relational();
        List<Block> blocks = relational.getBlocks(chain, from, to);
        List<ChainEvent> events = new ArrayList<>();
        int offset = 0;
        while (true) {
            List<ChainEvent> page = relational.getEvents(EventFilter.forChain(chain).range(from, to)
                    .limit(EventFilter.MAX_LIMIT).offset(offset).build());
            events.addAll(page);
            if (page.size() < EventFilter.MAX_LIMIT) {
                break;
            }
            offset += page.size();
        }
        dual.keyedBlocks().putBlocksAndEvents(new IngestionBatch(chain, blocks, events, Collections.emptyList(), to));
        List<EntityStateVersion> versions = relational.listByChainRange(chain, from, to);
        if (!versions.isEmpty() && !dual.keyedState().putVersions(chain, versions)) {
            throw new IllegalStateException("keyed state rejected replayed versions chain=" + chain + " range=" + from + ".." + to);
        }
        log.debug("keyed replay chain={} range={}..{} blocks={} events={} versions={}",
                chain, from, to, blocks.size(), events.size(), versions.size());
    }

    /**
     * 区块已对齐但之前有状态版本没写进 keyed：从记录的最低高度起按关系型重放。
     */
    private boolean replayPendingState(String chain, long relCursor) {
        Long floor = dual.takePendingStateReplay(chain);
        if (floor == null || floor > relCursor) {
            return true;
        }
        List<EntityStateVersion> versions;
        boolean accepted;
        try {
            versions = dual.relational().listByChainRange(chain, floor, relCursor);
            accepted = versions.isEmpty() || dual.keyedState().putVersions(chain, versions);
        } catch (RuntimeException e) {
            dual.restorePendingStateReplay(chain, floor);
            throw e;
        }
        if (!accepted) {
            dual.restorePendingStateReplay(chain, floor);
            log.warn("keyed state replay rejected chain={} fromHeight={} toHeight={}", chain, floor, relCursor);
            return false;
        }
        log.info("keyed state replayed chain={} fromHeight={} versions={}", chain, floor, versions.size());
        return true;
    }

    private void syncWatermarks(String chain) {
        for (BlockStatus tier : BlockStatus.values()) {
            if (tier == BlockStatus.PENDING) {
                continue;
            }
            OptionalLong h = dual.relational().getLatestBlock(chain, tier);
            if (h.isPresent()) {
                dual.keyedBlocks().promoteStatus(chain, new FinalityPromotion(tier, h.getAsLong()));
            }
        }
    }
}
