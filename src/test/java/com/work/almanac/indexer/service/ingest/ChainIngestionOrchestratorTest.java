package com.work.almanac.indexer.service.ingest;

import com.work.almanac.core.exception.StorageWriteException;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.FinalitySignals;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.repository.mapper.ReorgLogMapper;
import com.work.almanac.core.store.BlockEventStore;
import com.work.almanac.core.store.EventFilter;
import com.work.almanac.core.support.InMemoryBlockEventStore;
import com.work.almanac.indexer.chain.MockChainAdapter;
import com.work.almanac.indexer.config.IndexerProperties;
import com.work.almanac.indexer.service.finality.FinalityTracker;
import com.work.almanac.indexer.service.reorg.ReorgRecoveryService;
import com.work.almanac.indexer.support.metrics.IndexerMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class ChainIngestionOrchestratorTest {

    private IndexerProperties props;
    private InMemoryBlockEventStore store;
    private IndexerMetrics metrics;
    private IngestionListener listener;
    private ReorgLogMapper reorgLogMapper;

    @BeforeEach
    public void setUp() {
        props = new IndexerProperties();
        props.setFetchBackoffBase(Duration.ofMillis(1));
        props.setFetchBackoffMax(Duration.ofMillis(2));
        store = new InMemoryBlockEventStore();
        metrics = mock(IndexerMetrics.class);
        listener = mock(IngestionListener.class);
        reorgLogMapper = mock(ReorgLogMapper.class);
    }

    private IndexerProperties.ChainProperties chainProps(String id, String model, long depth) {
        IndexerProperties.ChainProperties c = new IndexerProperties.ChainProperties();
        c.setId(id);
        c.setFinalityModel(model);
        c.setConfirmationDepth(depth);
        c.setBatchSize(200);
        c.setPollingInterval(Duration.ofMillis(10));
        return c;
    }

    private ChainIngestionOrchestrator orchestrator(IndexerProperties.ChainProperties cp, MockChainAdapter chain, BlockEventStore s) {
        ReorgRecoveryService reorg = new ReorgRecoveryService(s, reorgLogMapper, props, metrics);
        return new ChainIngestionOrchestrator(cp, chain, s, new FinalityTracker(), reorg,
                Collections.singletonList(listener), props, metrics);
    }

    @Test
    public void reorg_is_recovered_and_canonical_blocks_reingested() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(95);
        chain.emit("transfer", "{\"orphaned\":true}");
        chain.mine(6);
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);

        assertEquals(101, o.runOnce());
        assertEquals(100, store.getCursor("eth").getAsLong());

        chain.reorg(95);
        chain.mine(1);
        int written = o.runOnce();

        assertEquals(7, written);
        assertEquals(101, store.getCursor("eth").getAsLong());
        for (long h = 95; h <= 101; h++) {
            assertEquals(chain.hashAt(h), store.getBlock("eth", h).get().getHash());
        }
        assertEquals("0xeth-94-g0", store.getBlock("eth", 94).get().getHash());
        // 孤块上的事件随区块一起撤回
        assertTrue(store.getEvents(EventFilter.forChain("eth").range(95, 101).build()).isEmpty());
        assertEquals(1, o.state().getReorgsRecovered());
        verify(listener).onRetracted(eq("eth"), eq(94L));
        verify(listener).onBatchCommitted(eq("eth"), eq(101L));
        verify(reorgLogMapper, times(1)).insertLog(any());
    }

    @Test
    public void same_height_fork_is_detected_at_stored_tip() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(95);
        chain.emit("transfer", "{\"orphaned\":true}");
        chain.mine(6);
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);
        o.runOnce();

        // 新分叉与旧链同高，链头不变
        chain.reorg(95);
        assertEquals(100, chain.currentHead());
        int written = o.runOnce();

        assertEquals(6, written);
        assertEquals(100, store.getCursor("eth").getAsLong());
        for (long h = 95; h <= 100; h++) {
            assertEquals(chain.hashAt(h), store.getBlock("eth", h).get().getHash());
        }
        assertTrue(store.getEvents(EventFilter.forChain("eth").range(95, 100).build()).isEmpty());
        assertEquals(1, o.state().getReorgsRecovered());
        verify(listener).onRetracted(eq("eth"), eq(94L));
        verify(listener, times(2)).onBatchCommitted(eq("eth"), eq(100L));
    }

    @Test
    public void fork_onto_shorter_chain_retracts_orphans_before_applying_signals() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(101);
        chain.setSignals(new FinalitySignals(null, null, 90L));
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);
        o.runOnce();
        assertEquals(90, store.getLatestBlock("eth", BlockStatus.FINALIZED).getAsLong());

        // 新分叉从 95 开始，只到 98，新分支的信号已把 97 标为 finalized
        chain.reorg(95, 98);
        chain.setSignals(new FinalitySignals(null, null, 97L));
        assertEquals(4, o.runOnce());

        assertFalse(o.isHalted());
        assertEquals(98, store.getCursor("eth").getAsLong());
        assertEquals(98, store.getLatestBlock("eth", BlockStatus.PENDING).getAsLong());
        for (long h = 95; h <= 98; h++) {
            assertEquals(chain.hashAt(h), store.getBlock("eth", h).get().getHash());
        }
        assertEquals(BlockStatus.FINALIZED, store.getBlock("eth", 96).get().getStatus());
        assertEquals(97, store.getLatestBlock("eth", BlockStatus.FINALIZED).getAsLong());
        verify(listener).onRetracted(eq("eth"), eq(94L));

        chain.mine(12);
        o.runOnce();
        assertFalse(o.isHalted());
        assertEquals(110, store.getCursor("eth").getAsLong());
    }

    @Test
    public void truncated_chain_drops_blocks_above_new_head() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(101);
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);
        o.runOnce();

        chain.reorg(99, 98);
        assertEquals(0, o.runOnce());

        assertFalse(o.isHalted());
        assertEquals(98, store.getCursor("eth").getAsLong());
        assertEquals(98, store.getLatestBlock("eth", BlockStatus.PENDING).getAsLong());
        assertFalse(store.getBlock("eth", 99).isPresent());
        assertEquals(1, o.state().getReorgsRecovered());
        verify(listener).onRetracted(eq("eth"), eq(98L));
    }

    @Test
    public void shorter_chain_below_finalized_block_halts() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(101);
        chain.setSignals(new FinalitySignals(null, null, 100L));
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);
        o.runOnce();

        chain.reorg(99, 98);
        assertEquals(0, o.runOnce());

        assertTrue(o.isHalted());
        assertEquals(100, store.getCursor("eth").getAsLong());
        verify(metrics).chainHalted(eq("eth"), eq("FinalityViolationException"));
    }

    @Test
    public void instant_chain_blocks_are_finalized_on_ingestion() {
        MockChainAdapter chain = new MockChainAdapter("cosmos");
        chain.mine(11);
        ChainIngestionOrchestrator o = orchestrator(chainProps("cosmos", "instant", 0), chain, store);

        o.runOnce();

        assertEquals(BlockStatus.FINALIZED, store.getBlock("cosmos", 10).get().getStatus());
        assertEquals(10, store.getLatestBlock("cosmos", BlockStatus.FINALIZED).getAsLong());
    }

    @Test
    public void progressive_chain_finalizes_by_depth() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(30);
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);

        o.runOnce();

        assertEquals(17, store.getLatestBlock("eth", BlockStatus.FINALIZED).getAsLong());
        assertEquals(BlockStatus.CONFIRMED, store.getBlock("eth", 18).get().getStatus());
        assertEquals(29, store.getLatestBlock("eth", BlockStatus.CONFIRMED).getAsLong());
    }

    @Test
    public void finality_advances_without_new_blocks() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(30);
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);
        o.runOnce();

        chain.setSignals(new FinalitySignals(28L, null, 25L));
        assertEquals(0, o.runOnce());

        assertEquals(BlockStatus.FINALIZED, store.getBlock("eth", 25).get().getStatus());
        assertEquals(BlockStatus.SAFE, store.getBlock("eth", 28).get().getStatus());
        assertEquals(BlockStatus.CONFIRMED, store.getBlock("eth", 29).get().getStatus());
        assertEquals(29, store.getCursor("eth").getAsLong());
    }

    @Test
    public void rerun_without_new_blocks_is_a_noop() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.emit("transfer", "{}");
        chain.mine(10);
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);

        o.runOnce();
        assertEquals(0, o.runOnce());

        assertEquals(9, store.getCursor("eth").getAsLong());
        assertEquals(1, store.getEvents(EventFilter.forChain("eth").build()).size());
        verify(listener, times(1)).onBatchCommitted(eq("eth"), anyLong());
    }

    @Test
    public void start_height_is_used_when_store_has_no_cursor() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(50);
        IndexerProperties.ChainProperties cp = chainProps("eth", "progressive", 12);
        cp.setStartHeight(40);
        ChainIngestionOrchestrator o = orchestrator(cp, chain, store);

        assertEquals(10, o.runOnce());
        assertEquals(40, store.getEarliestBlock("eth").getAsLong());
    }

    @Test
    public void batch_size_bounds_each_tick() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(25);
        IndexerProperties.ChainProperties cp = chainProps("eth", "progressive", 12);
        cp.setBatchSize(10);
        ChainIngestionOrchestrator o = orchestrator(cp, chain, store);

        assertEquals(10, o.runOnce());
        assertEquals(9, store.getCursor("eth").getAsLong());
        assertEquals(10, o.runOnce());
        assertEquals(5, o.runOnce());
        assertEquals(24, store.getCursor("eth").getAsLong());
    }

    @Test
    public void transient_fetch_errors_are_retried_within_tick() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(5);
        chain.failNext(2);
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);

        assertEquals(5, o.runOnce());

        verify(metrics, times(2)).fetchRetry(eq("eth"), anyInt());
        assertEquals(0, o.state().getConsecutiveErrors());
    }

    @Test
    public void exhausted_fetch_retries_leave_cursor_untouched() {
        props.setFetchMaxAttempts(2);
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(5);
        chain.failNext(2);
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);

        assertEquals(0, o.runOnce());

        assertFalse(store.getCursor("eth").isPresent());
        ChainSyncState s = o.state();
        assertEquals(1, s.getConsecutiveErrors());
        assertNotNull(s.getLastError());
        assertEquals(SyncPhase.IDLE, s.getPhase());

        assertEquals(5, o.runOnce());
    }

    @Test
    public void storage_failure_aborts_batch_and_retries_next_tick() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(5);
        InMemoryBlockEventStore failing = spy(store);
        doThrow(new StorageWriteException("connection reset")).doCallRealMethod()
                .when(failing).putBlocksAndEvents(any(IngestionBatch.class));
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, failing);

        assertEquals(0, o.runOnce());
        assertFalse(failing.getCursor("eth").isPresent());
        verify(metrics).storageWriteFailed(eq("eth"));
        verify(listener, never()).onBatchCommitted(anyString(), anyLong());

        assertEquals(5, o.runOnce());
        assertEquals(4, failing.getCursor("eth").getAsLong());
    }

    @Test
    public void finality_violation_halts_only_this_chain_until_restart() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(101);
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 2), chain, store);
        o.runOnce();
        assertEquals(98, store.getLatestBlock("eth", BlockStatus.FINALIZED).getAsLong());

        chain.reorg(95);
        chain.mine(1);
        assertEquals(0, o.runOnce());

        assertTrue(o.isHalted());
        assertEquals(SyncPhase.HALTED, o.state().getPhase());
        assertEquals(100, store.getCursor("eth").getAsLong());
        verify(metrics).chainHalted(eq("eth"), eq("FinalityViolationException"));

        // 停机后不再拉取
        chain.failNext(100);
        assertEquals(0, o.runOnce());

        o.restart();
        assertFalse(o.isHalted());
        assertEquals(SyncPhase.IDLE, o.state().getPhase());
    }

    @Test
    public void paused_chain_does_not_ingest_until_resumed() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(3);
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);

        o.pause();
        assertEquals(0, o.runOnce());
        assertEquals(SyncPhase.PAUSED, o.state().getPhase());

        o.resume();
        assertEquals(3, o.runOnce());
    }

    @Test
    public void listener_failure_does_not_roll_back_ingestion() {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(3);
        doThrow(new RuntimeException("engine down")).when(listener).onBatchCommitted(anyString(), anyLong());
        ChainIngestionOrchestrator o = orchestrator(chainProps("eth", "progressive", 12), chain, store);

        assertEquals(3, o.runOnce());
        assertEquals(2, store.getCursor("eth").getAsLong());
    }

    @Test
    public void background_loop_catches_up_and_stops_cooperatively() throws InterruptedException {
        MockChainAdapter chain = new MockChainAdapter("eth");
        chain.mine(50);
        IndexerProperties.ChainProperties cp = chainProps("eth", "progressive", 12);
        cp.setBatchSize(7);
        ChainIngestionOrchestrator o = orchestrator(cp, chain, store);

        o.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (store.getCursor("eth").orElse(-1L) < 49 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        o.stop(Duration.ofSeconds(2));

        assertEquals(49, store.getCursor("eth").getAsLong());
        assertEquals(SyncPhase.STOPPED, o.state().getPhase());
    }
}
