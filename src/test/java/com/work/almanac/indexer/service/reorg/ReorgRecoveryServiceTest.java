package com.work.almanac.indexer.service.reorg;

import com.work.almanac.core.chain.FetchedBlock;
import com.work.almanac.core.exception.FinalityViolationException;
import com.work.almanac.core.exception.ReorgUnrecoverableException;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.repository.entity.ReorgLogEntity;
import com.work.almanac.core.repository.mapper.ReorgLogMapper;
import com.work.almanac.core.store.EventFilter;
import com.work.almanac.core.support.InMemoryBlockEventStore;
import com.work.almanac.indexer.chain.MockChainAdapter;
import com.work.almanac.indexer.config.IndexerProperties;
import com.work.almanac.indexer.support.metrics.IndexerMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class ReorgRecoveryServiceTest {

    private InMemoryBlockEventStore store;
    private MockChainAdapter chain;
    private ReorgLogMapper reorgLogMapper;
    private IndexerMetrics metrics;
    private IndexerProperties props;

    @BeforeEach
    public void setUp() {
        store = new InMemoryBlockEventStore();
        chain = new MockChainAdapter("eth");
        reorgLogMapper = mock(ReorgLogMapper.class);
        metrics = mock(IndexerMetrics.class);
        props = new IndexerProperties();
    }

    private void index(long from, long to, long finalizedUpTo) {
        List<Block> blocks = new ArrayList<>();
        List<ChainEvent> events = new ArrayList<>();
        for (FetchedBlock fb : chain.fetchBlocks(from, to)) {
            BlockStatus st = fb.getNumber() <= finalizedUpTo ? BlockStatus.FINALIZED : BlockStatus.CONFIRMED;
            blocks.add(fb.getBlock().withStatus(st));
            events.addAll(fb.getEvents());
        }
        store.putBlocksAndEvents(new IngestionBatch("eth", blocks, events, Collections.emptyList(), to));
    }

    private ReorgRecoveryService service() {
        return new ReorgRecoveryService(store, reorgLogMapper, props, metrics);
    }

    @Test
    public void recover_finds_common_ancestor_and_retracts_above_it() {
        chain.mine(95);
        chain.emit("transfer", "{\"v\":1}");
        chain.mine(6);
        index(0, 100, 80);
        assertEquals(1, store.getEvents(EventFilter.forChain("eth").range(95, 100).build()).size());

        chain.reorg(95);
        chain.mine(1);
        Block candidate = chain.fetchBlocks(101, 101).get(0).getBlock();

        ReorgRecoveryService svc = service();
        assertFalse(svc.connects("eth", candidate));

        ReorgOutcome out = svc.recover("eth", chain, 101);

        assertEquals(94, out.getAncestorHeight());
        assertEquals(6, out.getDepth());
        assertEquals(6, out.getRetraction().getBlocksRetracted());
        assertEquals(1, out.getRetraction().getEventsRetracted());
        assertEquals(94, store.getCursor("eth").getAsLong());
        assertEquals(94, store.getLatestBlock("eth", BlockStatus.PENDING).getAsLong());
        assertTrue(store.getEvents(EventFilter.forChain("eth").fromHeight(95L).build()).isEmpty());

        ArgumentCaptor<ReorgLogEntity> logged = ArgumentCaptor.forClass(ReorgLogEntity.class);
        verify(reorgLogMapper, times(1)).insertLog(logged.capture());
        assertEquals(94L, logged.getValue().getAncestorHeight());
        assertEquals(101L, logged.getValue().getDetectedAt());
        verify(metrics).reorgRecovered(eq("eth"), eq(6));
    }

    @Test
    public void unrecoverable_when_no_ancestor_in_indexed_range() {
        chain.mine(101);
        index(50, 100, 0);
        chain.reorg(10);
        chain.mine(1);

        assertThrows(ReorgUnrecoverableException.class, () -> service().recover("eth", chain, 101));

        assertEquals(100, store.getCursor("eth").getAsLong());
        verify(reorgLogMapper, never()).insertLog(any());
        verify(metrics).chainHalted(eq("eth"), eq("reorg_unrecoverable"));
    }

    @Test
    public void unrecoverable_when_walk_exceeds_max_depth() {
        props.getReorg().setMaxDepth(3);
        chain.mine(101);
        index(0, 100, 0);
        chain.reorg(95);
        chain.mine(1);

        ReorgUnrecoverableException e = assertThrows(ReorgUnrecoverableException.class,
                () -> service().recover("eth", chain, 101));
        assertEquals(101, e.getDetectedAt());
        assertEquals(100, store.getCursor("eth").getAsLong());
    }

    @Test
    public void mismatching_finalized_block_is_a_finality_violation() {
        chain.mine(101);
        index(0, 100, 96);
        chain.reorg(95);
        chain.mine(1);

        FinalityViolationException e = assertThrows(FinalityViolationException.class,
                () -> service().recover("eth", chain, 101));

        assertEquals(96, e.getHeight());
        // 终局违例不做任何撤回
        assertEquals(100, store.getCursor("eth").getAsLong());
        assertTrue(store.getBlock("eth", 97).isPresent());
        verify(reorgLogMapper, never()).insertLog(any());
    }

    @Test
    public void history_write_failure_does_not_undo_recovery() {
        chain.mine(101);
        index(0, 100, 0);
        chain.reorg(99);
        chain.mine(1);
        when(reorgLogMapper.insertLog(any())).thenThrow(new RuntimeException("db down"));

        ReorgOutcome out = service().recover("eth", chain, 101);

        assertEquals(98, out.getAncestorHeight());
        assertEquals(98, store.getCursor("eth").getAsLong());
    }

    @Test
    public void stats_are_read_from_reorg_log() {
        Map<String, Object> row = new HashMap<>();
        row.put("total", 3L);
        row.put("max_depth", 6);
        row.put("blocks", 10L);
        row.put("events", 4L);
        when(reorgLogMapper.selectStats(eq("eth"))).thenReturn(row);

        ReorgStats stats = service().stats("eth");

        assertEquals(3, stats.getTotal());
        assertEquals(6, stats.getMaxDepth());
        assertEquals(10, stats.getBlocksRetracted());
        assertEquals(4, stats.getEventsRetracted());
    }
}
