package com.work.almanac.core.repository.impl;

import com.work.almanac.core.exception.StorageWriteException;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.FinalityPromotion;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.model.RetractionResult;
import com.work.almanac.core.repository.entity.BlockEntity;
import com.work.almanac.core.repository.mapper.BlockMapper;
import com.work.almanac.core.repository.mapper.ChainCursorMapper;
import com.work.almanac.core.repository.mapper.EntityStateHistoryMapper;
import com.work.almanac.core.repository.mapper.EventMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.support.TransactionOperations;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class PostgresBlockEventStoreTest {

    private BlockMapper blockMapper;
    private EventMapper eventMapper;
    private ChainCursorMapper cursorMapper;
    private EntityStateHistoryMapper stateHistoryMapper;
    private PostgresBlockEventStore store;

    @BeforeEach
    public void setUp() {
        blockMapper = mock(BlockMapper.class);
        eventMapper = mock(EventMapper.class);
        cursorMapper = mock(ChainCursorMapper.class);
        stateHistoryMapper = mock(EntityStateHistoryMapper.class);
        store = new PostgresBlockEventStore(blockMapper, eventMapper, cursorMapper, stateHistoryMapper,
                TransactionOperations.withoutTransaction());
    }

    private IngestionBatch batch(Block... blocks) {
        ChainEvent e = new ChainEvent("eth:0xtx:0", "eth", 1, blocks[0].getHash(), "0xtx", 1L, "transfer", new byte[0]);
        return new IngestionBatch("eth", Arrays.asList(blocks), Collections.singletonList(e),
                Collections.singletonList(new FinalityPromotion(BlockStatus.FINALIZED, 0)), blocks[blocks.length - 1].getNumber());
    }

    @Test
    public void batch_writes_blocks_events_promotions_then_cursor() {
        when(blockMapper.insertOrPromote(anyString(), anyLong(), anyString(), any(), anyLong(), anyString(), anyList())).thenReturn(1);

        store.putBlocksAndEvents(batch(
                new Block("eth", 1, "0xa1", "0xa0", 1L, BlockStatus.CONFIRMED),
                new Block("eth", 2, "0xa2", "0xa1", 2L, BlockStatus.CONFIRMED)));

        InOrder inOrder = inOrder(blockMapper, eventMapper, cursorMapper);
        inOrder.verify(blockMapper, times(2)).insertOrPromote(eq("eth"), anyLong(), anyString(), anyString(), anyLong(), eq("confirmed"), anyList());
        inOrder.verify(eventMapper).insertIgnore(any());
        inOrder.verify(blockMapper).promote(eq("eth"), eq("finalized"), eq(0L), anyList());
        inOrder.verify(cursorMapper).upsert(eq("eth"), eq(2L), any());
    }

    @Test
    public void same_hash_rewrite_is_idempotent() {
        when(blockMapper.insertOrPromote(anyString(), anyLong(), anyString(), any(), anyLong(), anyString(), anyList())).thenReturn(0);
        BlockEntity existing = new BlockEntity();
        existing.setChain("eth");
        existing.setBlockNumber(1L);
        existing.setBlockHash("0xa1");
        existing.setStatus("finalized");
        when(blockMapper.selectOne("eth", 1L)).thenReturn(existing);

        store.putBlocksAndEvents(batch(new Block("eth", 1, "0xa1", "0xa0", 1L, BlockStatus.CONFIRMED)));

        verify(cursorMapper).upsert(eq("eth"), eq(1L), any());
    }

    @Test
    public void conflicting_hash_fails_the_batch_before_cursor_moves() {
        when(blockMapper.insertOrPromote(anyString(), anyLong(), anyString(), any(), anyLong(), anyString(), anyList())).thenReturn(0);
        BlockEntity existing = new BlockEntity();
        existing.setBlockHash("0xother");
        when(blockMapper.selectOne("eth", 1L)).thenReturn(existing);

        assertThrows(StorageWriteException.class,
                () -> store.putBlocksAndEvents(batch(new Block("eth", 1, "0xa1", "0xa0", 1L, BlockStatus.CONFIRMED))));

        verify(cursorMapper, never()).upsert(anyString(), anyLong(), any());
    }

    @Test
    public void database_errors_surface_as_storage_write_errors() {
        when(blockMapper.insertOrPromote(anyString(), anyLong(), anyString(), any(), anyLong(), anyString(), anyList()))
                .thenThrow(new QueryTimeoutException("statement timeout"));

        StorageWriteException e = assertThrows(StorageWriteException.class,
                () -> store.putBlocksAndEvents(batch(new Block("eth", 1, "0xa1", "0xa0", 1L, BlockStatus.CONFIRMED))));
        assertEquals(QueryTimeoutException.class, e.getCause().getClass());
    }

    @Test
    public void retract_removes_events_blocks_state_and_rewinds_cursor() {
        when(eventMapper.deleteFromHeight("eth", 95L)).thenReturn(1);
        when(blockMapper.deleteFromHeight("eth", 95L)).thenReturn(6);

        RetractionResult r = store.retractFromHeight("eth", 95);

        assertEquals(6, r.getBlocksRetracted());
        assertEquals(1, r.getEventsRetracted());
        verify(stateHistoryMapper).deleteFromHeight("eth", 95L);
        verify(cursorMapper).rewind(eq("eth"), eq(95L), any());
    }

    @Test
    public void latest_block_queries_statuses_at_or_above_min() {
        when(blockMapper.selectLatestHeight(eq("eth"), anyList())).thenReturn(88L);

        assertEquals(88L, store.getLatestBlock("eth", BlockStatus.FINALIZED).getAsLong());
        verify(blockMapper).selectLatestHeight("eth", BlockStatus.valuesAtLeast(BlockStatus.FINALIZED));
    }
}
