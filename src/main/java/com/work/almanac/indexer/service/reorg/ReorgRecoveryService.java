package com.work.almanac.indexer.service.reorg;

import com.work.almanac.core.chain.ChainAdapter;
import com.work.almanac.core.chain.FetchedBlock;
import com.work.almanac.core.exception.FinalityViolationException;
import com.work.almanac.core.exception.ReorgUnrecoverableException;
import com.work.almanac.core.exception.TransientFetchException;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.RetractionResult;
import com.work.almanac.core.repository.entity.ReorgLogEntity;
import com.work.almanac.core.repository.mapper.ReorgLogMapper;
import com.work.almanac.core.store.BlockEventStore;
import com.work.almanac.indexer.config.IndexerProperties;
import com.work.almanac.indexer.support.metrics.IndexerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * reorg 检测与恢复。
 *
 * 检测：新 batch 第一个区块的 parentHash 与已存 (H-1) 的 hash 不一致。
 * 恢复：从 H-1 向下逐个高度重新拉取规范区块比对 hash，找到公共祖先后一次性撤回祖先之上的全部区块与事件。
 * 途中遇到不一致的 finalized 区块，或祖先之上仍有 finalized 区块（规范链变短），即终局违例，不做任何撤回。
 */
@Service
public class ReorgRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(ReorgRecoveryService.class);

    private final BlockEventStore store;
    private final ReorgLogMapper reorgLogMapper;
    private final IndexerProperties props;
    private final IndexerMetrics metrics;

    public ReorgRecoveryService(BlockEventStore store,
                                ReorgLogMapper reorgLogMapper,
                                IndexerProperties props,
                                IndexerMetrics metrics) {
        this.store = store;
        this.reorgLogMapper = reorgLogMapper;
        this.props = props;
        this.metrics = metrics;
    }

    /**
     * candidate 是否与已存链尖相连。已存储中没有 H-1 时（首次写入或起始高度之前）视为相连。
     */
    public boolean connects(String chain, Block candidateFirst) {
        if (candidateFirst.getNumber() == 0) {
            return true;
        }
        Optional<Block> parent = store.getBlock(chain, candidateFirst.getNumber() - 1);
        return !parent.isPresent() || parent.get().getHash().equals(candidateFirst.getParentHash());
    }

    /**
     * 在 detectedAt 处发现分叉后执行恢复：新 batch 第一个区块高度，已存链尖高度 + 1，或规范链头 + 1。
     *
     * @throws FinalityViolationException   回溯途中遇到不一致的 finalized 区块
     * @throws ReorgUnrecoverableException  已索引范围 / 最大深度内找不到公共祖先
     * @throws TransientFetchException      重新拉取规范区块失败（由调用方退避重试）
     */
    public ReorgOutcome recover(String chain, ChainAdapter adapter, long detectedAt) {
        OptionalLong cursor = store.getCursor(chain);
        OptionalLong earliest = store.getEarliestBlock(chain);
        if (!cursor.isPresent() || !earliest.isPresent()) {
            throw new ReorgUnrecoverableException(chain, detectedAt, "reorg detected but nothing indexed chain=" + chain);
        }
        int maxDepth = Math.max(1, props.getReorg().getMaxDepth());
        long floor = Math.max(earliest.getAsLong(), detectedAt - maxDepth);

        Long ancestor = null;
        for (long h = detectedAt - 1; h >= floor; h--) {
            Optional<Block> stored = store.getBlock(chain, h);
            if (!stored.isPresent()) {
                continue;
            }
            Block canonical = fetchCanonical(adapter, h);
            if (canonical.getHash().equals(stored.get().getHash())) {
                ancestor = h;
                break;
            }
            if (stored.get().getStatus() == BlockStatus.FINALIZED) {
                metrics.chainHalted(chain, "finality_violation");
                throw new FinalityViolationException(chain, h, stored.get().getHash(), canonical.getHash());
            }
        }

        if (ancestor == null) {
            metrics.chainHalted(chain, "reorg_unrecoverable");
            throw new ReorgUnrecoverableException(chain, detectedAt,
                    "no common ancestor within indexed range chain=" + chain + " detectedAt=" + detectedAt
                            + " searchedDownTo=" + floor + " maxDepth=" + maxDepth);
        }

        // 规范链变短时祖先之上的已存区块不会在回溯中逐个比对，finalized 的同样不能撤回
        OptionalLong finalized = store.getLatestBlock(chain, BlockStatus.FINALIZED);
        if (finalized.isPresent() && finalized.getAsLong() > ancestor) {
            long h = finalized.getAsLong();
            String storedHash = store.getBlock(chain, h).map(Block::getHash).orElse(null);
            metrics.chainHalted(chain, "finality_violation");
            throw new FinalityViolationException(chain, h, storedHash, "absent");
        }

        long retractFrom = ancestor + 1;
        int depth = (int) Math.max(0, cursor.getAsLong() - ancestor);
        RetractionResult result = store.retractFromHeight(chain, retractFrom);
        ReorgOutcome outcome = new ReorgOutcome(chain, detectedAt, ancestor, depth, result);
        recordHistory(outcome);
        metrics.reorgRecovered(chain, depth);
        log.warn("reorg recovered chain={} detectedAt={} ancestor={} depth={} blocks={} events={}",
                chain, detectedAt, ancestor, depth, result.getBlocksRetracted(), result.getEventsRetracted());
        return outcome;
    }

    public List<ReorgLogEntity> recentReorgs(String chain, int limit) {
        return reorgLogMapper.selectRecent(chain, Math.max(1, Math.min(limit, 500)));
    }

    public ReorgStats stats(String chain) {
        return ReorgStats.fromRow(chain, reorgLogMapper.selectStats(chain));
    }

    private Block fetchCanonical(ChainAdapter adapter, long height) {
        List<FetchedBlock> fetched = adapter.fetchBlocks(height, height);
        if (fetched.isEmpty()) {
            throw new TransientFetchException("canonical block missing during reorg walk chain=" + adapter.chainId() + " height=" + height);
        }
        return fetched.get(0).getBlock();
    }

    private void recordHistory(ReorgOutcome outcome) {
        ReorgLogEntity e = new ReorgLogEntity();
        e.setChain(outcome.getChain());
        e.setDetectedAt(outcome.getDetectedAt());
        e.setAncestorHeight(outcome.getAncestorHeight());
        e.setDepth(outcome.getDepth());
        e.setBlocksRetracted(outcome.getRetraction().getBlocksRetracted());
        e.setEventsRetracted(outcome.getRetraction().getEventsRetracted());
        e.setCreatedAt(Instant.now());
        try {
            reorgLogMapper.insertLog(e);
        } catch (RuntimeException ex) {
            // 恢复本身已提交，历史记录失败只影响统计
            log.warn("reorg history write failed chain={} err={}", outcome.getChain(), ex.toString());
        }
    }
}
