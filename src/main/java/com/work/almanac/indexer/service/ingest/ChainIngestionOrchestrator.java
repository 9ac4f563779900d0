package com.work.almanac.indexer.service.ingest;

import com.work.almanac.core.chain.ChainAdapter;
import com.work.almanac.core.chain.FetchedBlock;
import com.work.almanac.core.exception.IndexerException;
import com.work.almanac.core.exception.StorageWriteException;
import com.work.almanac.core.exception.TransientFetchException;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.ChainDescriptor;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.FinalityPromotion;
import com.work.almanac.core.model.FinalitySignals;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.store.BlockEventStore;
import com.work.almanac.indexer.config.IndexerProperties;
import com.work.almanac.indexer.service.finality.FinalityTracker;
import com.work.almanac.indexer.service.reorg.ReorgOutcome;
import com.work.almanac.indexer.service.reorg.ReorgRecoveryService;
import com.work.almanac.indexer.support.metrics.IndexerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import static com.work.almanac.core.support.ValidationUtils.requirePositive;

/**
 * 单条链的摄取循环：IDLE -> FETCHING -> VALIDATING -> WRITING -> IDLE。
 *
 * 约束：
 * - 每条链一个专属线程，同一时刻最多一个 batch 在途
 * - 游标只在 batch 提交后推进（由存储在同一原子写入里完成）
 * - 停止/暂停只在 batch 之间生效，不会打断写入
 * - 致命错误只停本链，其他链不受影响
 */
public class ChainIngestionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChainIngestionOrchestrator.class);

    /**
     * 单个周期内 reorg 恢复后重新拉取的最大轮数（链在恢复期间再次分叉时交给下个周期）。
     */
    private static final int MAX_ROUNDS_PER_TICK = 3;

    private final ChainDescriptor chain;
    private final IndexerProperties.ChainProperties chainProps;
    private final ChainAdapter adapter;
    private final BlockEventStore store;
    private final FinalityTracker finality;
    private final ReorgRecoveryService reorg;
    private final List<IngestionListener> listeners;
    private final IndexerProperties props;
    private final IndexerMetrics metrics;

    private final ChainSyncState state;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean halted = new AtomicBoolean(false);
    private final Object signal = new Object();
    private Thread worker;

    public ChainIngestionOrchestrator(IndexerProperties.ChainProperties chainProps,
                                      ChainAdapter adapter,
                                      BlockEventStore store,
                                      FinalityTracker finality,
                                      ReorgRecoveryService reorg,
                                      List<IngestionListener> listeners,
                                      IndexerProperties props,
                                      IndexerMetrics metrics) {
        requirePositive(chainProps.getBatchSize(), "batchSize");
        requirePositive(chainProps.getPollingInterval(), "pollingInterval");
        this.chainProps = chainProps;
        this.chain = chainProps.toDescriptor();
        if (!chain.getId().equals(adapter.chainId())) {
            throw new IllegalArgumentException("adapter chain mismatch: " + adapter.chainId() + " != " + chain.getId());
        }
        this.adapter = adapter;
        this.store = store;
        this.finality = finality;
        this.reorg = reorg;
        this.listeners = listeners == null ? Collections.emptyList() : new ArrayList<>(listeners);
        this.props = props;
        this.metrics = metrics;
        this.state = new ChainSyncState(chain.getId());
    }

    public String chainId() {
        return chain.getId();
    }

    public ChainSyncState state() {
        return state.snapshot();
    }

    public boolean isHalted() {
        return halted.get();
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        worker = new Thread(this::runLoop, "ingest-" + chain.getId());
        worker.setDaemon(true);
        worker.start();
        log.info("ingestion started chain={} model={} batchSize={}", chain.getId(), chain.getFinalityModel(), chainProps.getBatchSize());
    }

    /**
     * 协作式停止：等待当前 batch 结束后退出，最多等待 timeout。
     */
    public void stop(Duration timeout) {
        running.set(false);
        wakeUp();
        Thread t;
        synchronized (this) {
            t = worker;
            worker = null;
        }
        if (t != null) {
            try {
                t.join(timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        state.phase(SyncPhase.STOPPED);
        log.info("ingestion stopped chain={}", chain.getId());
    }

    public void pause() {
        paused.set(true);
        state.phase(SyncPhase.PAUSED);
        log.info("ingestion paused chain={}", chain.getId());
    }

    public void resume() {
        paused.set(false);
        if (!halted.get()) {
            state.phase(SyncPhase.IDLE);
        }
        wakeUp();
        log.info("ingestion resumed chain={}", chain.getId());
    }

    /**
     * 人工处理致命错误后重新启用本链。
     */
    public void restart() {
        if (halted.compareAndSet(true, false)) {
            state.phase(paused.get() ? SyncPhase.PAUSED : SyncPhase.IDLE);
            log.warn("ingestion restarted after halt chain={}", chain.getId());
        }
        wakeUp();
    }

    private void wakeUp() {
        synchronized (signal) {
            signal.notifyAll();
        }
    }

    private void runLoop() {
        while (running.get()) {
            int written = 0;
            if (!paused.get() && !halted.get()) {
                written = runOnce();
            }
            // 满批说明还有积压，不等待直接进入下一批
            if (written >= chainProps.getBatchSize() && running.get()) {
                continue;
            }
            synchronized (signal) {
                if (!running.get()) {
                    break;
                }
                try {
                    signal.wait(Math.max(1L, chainProps.getPollingInterval().toMillis()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    /**
     * 执行一个周期并按错误类别处理，返回写入的区块数。
     */
    public int runOnce() {
        if (halted.get() || paused.get()) {
            return 0;
        }
        try {
            return tick();
        } catch (TransientFetchException e) {
            state.recordError(e.getMessage());
            log.warn("fetch failed after retries, cursor unchanged chain={} err={}", chain.getId(), e.getMessage());
        } catch (StorageWriteException e) {
            metrics.storageWriteFailed(chain.getId());
            state.recordError(e.getMessage());
            log.warn("storage write failed, batch will be retried chain={} err={}", chain.getId(), e.getMessage());
        } catch (IndexerException e) {
            // 不可重试的（终局违例、reorg 无法恢复）只停这一条链
            if (!e.isRetryable()) {
                halt(e);
                return 0;
            }
            state.recordError(e.getMessage());
            log.warn("ingestion tick failed, retry next cycle chain={} err={}", chain.getId(), e.getMessage());
        } catch (RuntimeException e) {
            state.recordError(e.toString());
            log.error("ingestion tick error chain={}", chain.getId(), e);
        }
        state.phase(SyncPhase.IDLE);
        return 0;
    }

    private void halt(RuntimeException e) {
        halted.set(true);
        state.recordError(e.getMessage());
        state.phase(SyncPhase.HALTED);
        metrics.chainHalted(chain.getId(), e.getClass().getSimpleName());
        log.error("CRITICAL chain halted, manual intervention required chain={} cursor={} err={}",
                chain.getId(), state.getLastIndexedHeight(), e.getMessage());
    }

    /**
     * 单个周期：拉取 -> 校验（含 reorg 恢复）-> 写入。异常原样抛出，由 {@link #runOnce()} 分类处理。
     */
    int tick() {
        for (int round = 0; round < MAX_ROUNDS_PER_TICK; round++) {
            state.phase(SyncPhase.FETCHING);
            long cursor = store.getCursor(chain.getId()).orElse(chainProps.getStartHeight() - 1);
            state.observeCursor(cursor);
            long head = withFetchRetry("currentHead", adapter::currentHead);
            Optional<FinalitySignals> signals = withFetchRetry("finalitySignals", adapter::finalitySignals);
            state.observeHead(head);

            if (head < cursor) {
                // 规范链比已存链短：从新链头向下找公共祖先，撤回其上的已存区块后再处理终局
                log.warn("canonical head below cursor chain={} head={} cursor={}", chain.getId(), head, cursor);
                recoverFrom(head + 1);
                continue;
            }
            if (head == cursor) {
                if (tipDiverged(cursor)) {
                    log.warn("reorg detected at stored tip chain={} height={}", chain.getId(), cursor);
                    recoverFrom(cursor + 1);
                    continue;
                }
                applyPromotions(head, signals, cursor);
                state.recordIdle();
                state.phase(SyncPhase.IDLE);
                return 0;
            }

            long from = cursor + 1;
            long to = Math.min(cursor + Math.max(1, chainProps.getBatchSize()), head);
            List<FetchedBlock> fetched = withFetchRetry("fetchBlocks", () -> fetchLinked(from, to));
            if (fetched.isEmpty()) {
                state.phase(SyncPhase.IDLE);
                return 0;
            }

            state.phase(SyncPhase.VALIDATING);
            Block first = fetched.get(0).getBlock();
            if (!reorg.connects(chain.getId(), first)) {
                log.warn("reorg detected chain={} height={} parentHash={}", chain.getId(), first.getNumber(), first.getParentHash());
                recoverFrom(first.getNumber());
                continue;
            }

            state.phase(SyncPhase.WRITING);
            IngestionBatch batch = buildBatch(fetched, head, signals);
            store.putBlocksAndEvents(batch);
            state.recordBatch(batch.getCursorHeight(), batch.getBlocks().size(), batch.getEvents().size());
            metrics.batchIndexed(chain.getId(), batch.getBlocks().size(), batch.getEvents().size());
            log.debug("batch indexed chain={} range={}..{} events={} head={}",
                    chain.getId(), batch.firstHeight(), batch.lastHeight(), batch.getEvents().size(), head);
            notifyCommitted(batch.getCursorHeight());
            state.phase(SyncPhase.IDLE);
            return batch.getBlocks().size();
        }
        log.warn("chain kept reorganizing during tick, retry next cycle chain={}", chain.getId());
        state.phase(SyncPhase.IDLE);
        return 0;
    }

    private void recoverFrom(long detectedAt) {
        ReorgOutcome outcome = reorg.recover(chain.getId(), adapter, detectedAt);
        state.recordReorg(outcome.getAncestorHeight());
        notifyRetracted(outcome.getAncestorHeight());
    }

    /**
     * 没有新区块时核对已存链尖：同高度替换的分叉不会改变链头，只能这样发现。
     */
    private boolean tipDiverged(long cursor) {
        if (cursor < 0) {
            return false;
        }
        Optional<Block> stored = store.getBlock(chain.getId(), cursor);
        if (!stored.isPresent()) {
            return false;
        }
        List<FetchedBlock> canonical = withFetchRetry("fetchBlocks", () -> adapter.fetchBlocks(cursor, cursor));
        return !canonical.isEmpty() && !canonical.get(0).getBlock().getHash().equals(stored.get().getHash());
    }

    /**
     * 拉取并校验 batch 内部的父子链接；节点视图在拉取过程中变化时视为临时错误重新拉取。
     */
    private List<FetchedBlock> fetchLinked(long from, long to) {
        List<FetchedBlock> fetched = adapter.fetchBlocks(from, to);
        long expected = from;
        Block prev = null;
        for (FetchedBlock fb : fetched) {
            Block b = fb.getBlock();
            if (b.getNumber() != expected) {
                throw new TransientFetchException("non-contiguous fetch chain=" + chain.getId() + " expected=" + expected + " got=" + b.getNumber());
            }
            if (prev != null && !prev.getHash().equals(b.getParentHash())) {
                throw new TransientFetchException("batch not parent-linked chain=" + chain.getId() + " height=" + b.getNumber());
            }
            prev = b;
            expected++;
        }
        return fetched;
    }

    private IngestionBatch buildBatch(List<FetchedBlock> fetched, long head, Optional<FinalitySignals> signals) {
        List<Block> raw = new ArrayList<>(fetched.size());
        List<ChainEvent> events = new ArrayList<>();
        for (FetchedBlock fb : fetched) {
            raw.add(fb.getBlock());
            events.addAll(fb.getEvents());
        }
        List<Block> blocks = finality.assign(chain, raw, head, signals);
        long last = blocks.get(blocks.size() - 1).getNumber();
        List<FinalityPromotion> promotions = finality.promotions(chain, head, signals, last);
        return new IngestionBatch(chain.getId(), blocks, events, promotions, last);
    }

    /**
     * 没有新区块时仍推进已存区块的终局状态。
     */
    private void applyPromotions(long head, Optional<FinalitySignals> signals, long cursor) {
        for (FinalityPromotion p : finality.promotions(chain, head, signals, cursor)) {
            int n = store.promoteStatus(chain.getId(), p);
            if (n > 0) {
                metrics.finalityPromoted(chain.getId(), p.getTarget().getValue(), n);
                log.debug("finality promoted chain={} tier={} upTo={} blocks={}", chain.getId(), p.getTarget().getValue(), p.getUpToHeight(), n);
            }
        }
    }

    private void notifyCommitted(long cursorHeight) {
        for (IngestionListener l : listeners) {
            try {
                l.onBatchCommitted(chain.getId(), cursorHeight);
            } catch (RuntimeException e) {
                log.warn("ingestion listener failed chain={} listener={} err={}", chain.getId(), l.getClass().getSimpleName(), e.toString());
            }
        }
    }

    private void notifyRetracted(long ancestorHeight) {
        for (IngestionListener l : listeners) {
            try {
                l.onRetracted(chain.getId(), ancestorHeight);
            } catch (RuntimeException e) {
                log.warn("retraction listener failed chain={} listener={} err={}", chain.getId(), l.getClass().getSimpleName(), e.toString());
            }
        }
    }

    private <T> T withFetchRetry(String op, Supplier<T> call) {
        int maxAttempts = Math.max(1, props.getFetchMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientFetchException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                metrics.fetchRetry(chain.getId(), attempt);
                Duration wait = backoff(attempt);
                log.info("transient fetch error, retrying chain={} op={} attempt={} wait={}ms err={}",
                        chain.getId(), op, attempt, wait.toMillis(), e.getMessage());
                sleep(wait, e);
            }
        }
    }

    private Duration backoff(int attempt) {
        long base = Math.max(1L, props.getFetchBackoffBase().toMillis());
        long max = Math.max(base, props.getFetchBackoffMax().toMillis());
        long pow = 1L << Math.min(10, Math.max(0, attempt - 1));
        return Duration.ofMillis(Math.min(max, base * pow));
    }

    private void sleep(Duration wait, TransientFetchException cause) {
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
