package com.work.almanac.core.store;

import com.work.almanac.core.exception.StorageWriteException;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.EntityStateVersion;
import com.work.almanac.core.model.FinalityPromotion;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.support.InMemoryBlockEventStore;
import com.work.almanac.core.support.InMemoryHistoricalStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.work.almanac.core.store.DualBlockEventStoreTest.batch;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class KeyedStoreReconcilerTest {

    private InMemoryBlockEventStore relational;
    private InMemoryBlockEventStore keyedBlocks;
    private InMemoryHistoricalStateStore keyedState;
    private DualBlockEventStore dual;
    private KeyedStoreReconciler reconciler;

    @BeforeEach
    public void setUp() {
        relational = new InMemoryBlockEventStore();
        keyedBlocks = spy(new InMemoryBlockEventStore());
        keyedState = new InMemoryHistoricalStateStore(keyedBlocks);
        dual = new DualBlockEventStore(relational, keyedBlocks, keyedState);
        reconciler = new KeyedStoreReconciler(dual, Collections.singletonList("eth"), 4);
    }

    @Test
    public void lagging_keyed_backend_is_replayed_in_order() {
        doThrow(new StorageWriteException("redis down")).when(keyedBlocks).putBlocksAndEvents(any());
        dual.putBlocksAndEvents(batch("eth", 0, 9));
        dual.putBlocksAndEvents(batch("eth", 10, 14));
        dual.promoteStatus("eth", new FinalityPromotion(BlockStatus.FINALIZED, 6));
        dual.recordStateVersions("eth", Collections.singletonList(new EntityStateVersion("processor", "eth:0xp", "eth", 12, "{}")));
        assertTrue(dual.isLagging("eth"));

        doCallRealMethod().when(keyedBlocks).putBlocksAndEvents(any());
        assertTrue(reconciler.reconcile("eth"));

        assertFalse(dual.isLagging("eth"));
        assertEquals(14, keyedBlocks.getCursor("eth").getAsLong());
        assertEquals(15, keyedBlocks.getBlocks("eth", 0, 14).size());
        assertEquals(6, keyedBlocks.getLatestBlock("eth", BlockStatus.FINALIZED).getAsLong());
        assertEquals(12, keyedState.findAsOf("eth", "processor", "eth:0xp", 14).get().getReflectedHeight());
    }

    @Test
    public void failed_keyed_state_write_is_replayed_after_blocks_are_in_sync() {
        InMemoryHistoricalStateStore flakyState = spy(new InMemoryHistoricalStateStore(keyedBlocks));
        dual = new DualBlockEventStore(relational, keyedBlocks, flakyState);
        reconciler = new KeyedStoreReconciler(dual, Collections.singletonList("eth"), 4);
        dual.putBlocksAndEvents(batch("eth", 0, 9));
        doThrow(new StorageWriteException("redis down")).doCallRealMethod()
                .when(flakyState).putVersions(eq("eth"), anyList());

        dual.recordStateVersions("eth", Collections.singletonList(new EntityStateVersion("processor", "eth:0xp", "eth", 5, "{\"owner\":\"0xa\"}")));
        assertTrue(dual.isLagging("eth"));
        // 区块游标两边一致，只有状态版本缺失
        assertEquals(9, keyedBlocks.getCursor("eth").getAsLong());
        assertFalse(flakyState.findAsOf("eth", "processor", "eth:0xp", 9).isPresent());

        assertTrue(reconciler.reconcile("eth"));

        assertFalse(dual.isLagging("eth"));
        assertEquals(5, flakyState.findAsOf("eth", "processor", "eth:0xp", 9).get().getReflectedHeight());
        assertNull(dual.takePendingStateReplay("eth"));
    }

    @Test
    public void state_replay_failure_keeps_chain_lagging_and_floor_pending() {
        InMemoryHistoricalStateStore flakyState = spy(new InMemoryHistoricalStateStore(keyedBlocks));
        dual = new DualBlockEventStore(relational, keyedBlocks, flakyState);
        reconciler = new KeyedStoreReconciler(dual, Collections.singletonList("eth"), 4);
        dual.putBlocksAndEvents(batch("eth", 0, 9));
        doThrow(new StorageWriteException("redis down")).when(flakyState).putVersions(eq("eth"), anyList());
        dual.recordStateVersions("eth", Collections.singletonList(new EntityStateVersion("processor", "eth:0xp", "eth", 7, "{}")));

        reconciler.reconcileAll();

        assertTrue(dual.isLagging("eth"));
        assertEquals(Long.valueOf(7), dual.takePendingStateReplay("eth"));
    }

    @Test
    public void pending_keyed_retraction_is_applied_first() {
        dual.putBlocksAndEvents(batch("eth", 0, 9));
        doThrow(new StorageWriteException("redis down")).when(keyedBlocks).retractFromHeight(eq("eth"), anyLong());
        dual.retractFromHeight("eth", 5);
        doCallRealMethod().when(keyedBlocks).retractFromHeight(eq("eth"), anyLong());

        assertTrue(reconciler.reconcile("eth"));

        assertEquals(4, keyedBlocks.getCursor("eth").getAsLong());
        assertFalse(keyedBlocks.getBlock("eth", 5).isPresent());
        assertNull(dual.takePendingRetraction("eth"));
    }

    @Test
    public void divergent_keyed_tip_is_dropped_and_replaced() {
        dual.putBlocksAndEvents(batch("eth", 0, 9));
        // keyed 撤回丢失：关系型已换成新分叉，keyed 仍是旧块
        relational.retractFromHeight("eth", 8);
        relational.putBlocksAndEvents(new IngestionBatch("eth",
                Arrays.asList(
                        new Block("eth", 8, "0xfork-8", "0xeth-7", 1L, BlockStatus.CONFIRMED),
                        new Block("eth", 9, "0xfork-9", "0xfork-8", 2L, BlockStatus.CONFIRMED)),
                Collections.emptyList(), Collections.emptyList(), 9));

        assertTrue(reconciler.reconcile("eth"));

        assertEquals("0xfork-8", keyedBlocks.getBlock("eth", 8).get().getHash());
        assertEquals("0xfork-9", keyedBlocks.getBlock("eth", 9).get().getHash());
        assertEquals("0xeth-7", keyedBlocks.getBlock("eth", 7).get().getHash());
    }

    @Test
    public void replay_is_bounded_per_run_and_resumes() {
        doThrow(new StorageWriteException("redis down")).when(keyedBlocks).putBlocksAndEvents(any());
        for (long from = 0; from < 400; from += 100) {
            dual.putBlocksAndEvents(batch("eth", from, from + 99));
        }
        doCallRealMethod().when(keyedBlocks).putBlocksAndEvents(any());

        // 每轮最多 50 段 * 4 块
        assertFalse(reconciler.reconcile("eth"));
        assertEquals(199, keyedBlocks.getCursor("eth").getAsLong());
        assertTrue(dual.isLagging("eth"));

        assertTrue(reconciler.reconcile("eth"));
        assertEquals(399, keyedBlocks.getCursor("eth").getAsLong());
    }

    @Test
    public void scheduled_run_is_noop_when_in_sync() {
        dual.putBlocksAndEvents(batch("eth", 0, 3));
        reconciler.reconcileAll();

        verify(keyedBlocks, times(1)).putBlocksAndEvents(any());
        assertFalse(dual.isLagging("eth"));
    }
}
