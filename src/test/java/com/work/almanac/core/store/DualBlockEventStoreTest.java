package com.work.almanac.core.store;

import com.work.almanac.core.exception.StorageWriteException;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.EntityStateVersion;
import com.work.almanac.core.model.HistoricalState;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.support.InMemoryBlockEventStore;
import com.work.almanac.core.support.InMemoryHistoricalStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class DualBlockEventStoreTest {

    private InMemoryBlockEventStore relational;
    private InMemoryBlockEventStore keyedBlocks;
    private InMemoryHistoricalStateStore keyedState;
    private DualBlockEventStore dual;

    @BeforeEach
    public void setUp() {
        relational = spy(new InMemoryBlockEventStore());
        keyedBlocks = spy(new InMemoryBlockEventStore());
        keyedState = new InMemoryHistoricalStateStore(keyedBlocks);
        dual = new DualBlockEventStore(relational, keyedBlocks, keyedState);
    }

    static IngestionBatch batch(String chain, long from, long to) {
        List<Block> blocks = new ArrayList<>();
        for (long h = from; h <= to; h++) {
            blocks.add(new Block(chain, h, "0x" + chain + "-" + h, h == 0 ? null : "0x" + chain + "-" + (h - 1),
                    1_700_000_000L + h, BlockStatus.CONFIRMED));
        }
        return new IngestionBatch(chain, blocks, Collections.emptyList(), Collections.emptyList(), to);
    }

    @Test
    public void relational_is_written_before_keyed() {
        IngestionBatch b = batch("eth", 0, 9);
        dual.putBlocksAndEvents(b);

        InOrder inOrder = inOrder(relational, keyedBlocks);
        inOrder.verify(relational).putBlocksAndEvents(b);
        inOrder.verify(keyedBlocks).putBlocksAndEvents(b);
        assertEquals(9, keyedBlocks.getCursor("eth").getAsLong());
        assertFalse(dual.isLagging("eth"));
    }

    @Test
    public void relational_failure_leaves_keyed_untouched() {
        doThrow(new StorageWriteException("db down")).when(relational).putBlocksAndEvents(any());

        assertThrows(StorageWriteException.class, () -> dual.putBlocksAndEvents(batch("eth", 0, 9)));

        verify(keyedBlocks, never()).putBlocksAndEvents(any());
    }

    @Test
    public void keyed_failure_marks_chain_lagging_without_failing_the_write() {
        doThrow(new StorageWriteException("redis down")).when(keyedBlocks).putBlocksAndEvents(any());

        dual.putBlocksAndEvents(batch("eth", 0, 9));

        assertTrue(dual.isLagging("eth"));
        assertEquals(9, dual.getCursor("eth").getAsLong());
        assertFalse(keyedBlocks.getCursor("eth").isPresent());

        // 落后期间后续 batch 不再写 keyed
        dual.putBlocksAndEvents(batch("eth", 10, 19));
        verify(keyedBlocks, times(1)).putBlocksAndEvents(any());
    }

    @Test
    public void keyed_retract_failure_is_recorded_for_reconciler() {
        dual.putBlocksAndEvents(batch("eth", 0, 9));
        doThrow(new StorageWriteException("redis down")).when(keyedBlocks).retractFromHeight(eq("eth"), anyLong());

        assertEquals(5, dual.retractFromHeight("eth", 5).getBlocksRetracted());

        assertTrue(dual.isLagging("eth"));
        assertEquals(Long.valueOf(5), dual.takePendingRetraction("eth"));
        assertEquals(4, relational.getCursor("eth").getAsLong());
    }

    @Test
    public void state_versions_ahead_of_keyed_height_defer_to_reconciler() {
        dual.putBlocksAndEvents(batch("eth", 0, 9));

        dual.recordStateVersions("eth", Collections.singletonList(new EntityStateVersion("processor", "eth:0xp", "eth", 20, "{}")));

        assertTrue(dual.isLagging("eth"));
        assertTrue(relational.findLatestAtOrBelow("processor", "eth:0xp", 20).isPresent());
    }

    @Test
    public void historical_state_reads_carry_observed_height() {
        dual.putBlocksAndEvents(batch("eth", 0, 9));
        dual.recordStateVersions("eth", Collections.singletonList(new EntityStateVersion("processor", "eth:0xp", "eth", 5, "{\"v\":1}")));

        Optional<HistoricalState> s = dual.findStateAsOf("eth", "processor", "eth:0xp", 100);

        assertTrue(s.isPresent());
        assertEquals(5, s.get().getReflectedHeight());
        assertEquals(9, s.get().getObservedHeight());
        assertTrue(s.get().isPossiblyStale());
    }

    @Test
    public void relational_only_mode_answers_state_queries_from_relational() {
        InMemoryBlockEventStore rel = new InMemoryBlockEventStore();
        DualBlockEventStore only = DualBlockEventStore.relationalOnly(rel);
        only.putBlocksAndEvents(batch("eth", 0, 3));
        only.recordStateVersions("eth", Collections.singletonList(new EntityStateVersion("processor", "eth:0xp", "eth", 2, "{}")));

        assertFalse(only.isKeyedEnabled());
        assertEquals(2, only.findStateAsOf("eth", "processor", "eth:0xp", 3).get().getReflectedHeight());
        assertFalse(only.findStateAsOf("eth", "processor", "eth:0xp", 1).isPresent());
    }
}
