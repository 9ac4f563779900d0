package com.work.almanac.indexer.service.message;

import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.model.MessageStatus;
import com.work.almanac.core.repository.entity.ProcessorEntity;
import com.work.almanac.core.repository.entity.ProcessorMessageEntity;
import com.work.almanac.core.support.InMemoryBlockEventStore;
import com.work.almanac.core.support.InMemoryMessageRepository;
import com.work.almanac.indexer.config.IndexerProperties;
import com.work.almanac.indexer.support.metrics.IndexerMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.*;

public class MessageTimeoutSweeperTest {

    private InMemoryBlockEventStore store;
    private InMemoryMessageRepository repository;
    private IndexerProperties props;
    private IndexerMetrics metrics;
    private MessageTimeoutSweeper sweeper;

    @BeforeEach
    public void setUp() {
        store = new InMemoryBlockEventStore();
        repository = new InMemoryMessageRepository();
        props = new IndexerProperties();
        metrics = mock(IndexerMetrics.class);
        sweeper = new MessageTimeoutSweeper(store, repository, new ProcessorPolicyResolver(repository, props), props, metrics);

        ProcessorEntity p = new ProcessorEntity();
        p.setId("eth:0xproc");
        p.setChain("eth");
        p.setContractAddress("0xproc");
        p.setMessageTimeoutBlocks(50L);
        p.setPaused(Boolean.FALSE);
        p.setCreatedAtBlock(900L);
        p.setLastUpdatedBlock(900L);
        repository.upsertProcessor(p);
    }

    private void indexTo(long height) {
        Block b = new Block("eth", height, "0xeth-" + height, null, 1_700_000_000L + height, BlockStatus.CONFIRMED);
        store.putBlocksAndEvents(new IngestionBatch("eth", Collections.singletonList(b), Collections.emptyList(),
                Collections.emptyList(), height));
    }

    private void submit(String id, String processorId, long block) {
        ProcessorMessageEntity m = new ProcessorMessageEntity();
        m.setId(id);
        m.setProcessorId(processorId);
        m.setSourceChain("eth");
        m.setTargetChain("cosmos");
        m.setCreatedAtBlock(block);
        m.setCreatedAtTx("0xtx-" + id);
        repository.insertMessageIfAbsent(m);
    }

    @Test
    public void message_times_out_strictly_after_timeout_blocks() {
        submit("m1", "eth:0xproc", 1000);

        indexTo(1050);
        assertEquals(0, sweeper.sweepChain("eth"));
        assertEquals(MessageStatus.PENDING, repository.findMessage("m1").statusEnum());

        indexTo(1051);
        assertEquals(1, sweeper.sweepChain("eth"));

        ProcessorMessageEntity m = repository.findMessage("m1");
        assertEquals(MessageStatus.TIMED_OUT, m.statusEnum());
        assertEquals(1051L, m.getLastUpdatedBlock().longValue());
        assertTrue(m.getError().contains("51 blocks"));
        verify(metrics).messageTransition("pending", "timed_out");
    }

    @Test
    public void processing_and_failed_messages_also_time_out() {
        submit("m1", "eth:0xproc", 1000);
        submit("m2", "eth:0xproc", 1000);
        repository.markProcessing("m1", 1010, false);
        repository.markProcessing("m2", 1010, false);
        repository.markFailed("m2", 0, 1, 1030L, 1020, "revert");

        indexTo(1100);
        assertEquals(2, sweeper.sweepChain("eth"));
        assertEquals(MessageStatus.TIMED_OUT, repository.findMessage("m1").statusEnum());
        assertEquals(MessageStatus.TIMED_OUT, repository.findMessage("m2").statusEnum());
    }

    @Test
    public void completed_before_sweep_wins() {
        submit("m1", "eth:0xproc", 1000);
        repository.markProcessing("m1", 1010, false);
        assertTrue(repository.markCompleted("m1", 1040, "0xdone", 21000L));

        indexTo(1100);
        assertEquals(0, sweeper.sweepChain("eth"));
        assertEquals(MessageStatus.COMPLETED, repository.findMessage("m1").statusEnum());
        assertFalse(repository.markCompleted("m1", 1101, "0xlate", 1L));
    }

    @Test
    public void processor_without_timeout_never_expires() {
        submit("m1", "eth:0xother", 0);

        indexTo(100_000);
        assertEquals(0, sweeper.sweepChain("eth"));
        assertEquals(MessageStatus.PENDING, repository.findMessage("m1").statusEnum());
    }

    @Test
    public void default_timeout_applies_to_unknown_processor() {
        props.getMessages().setDefaultTimeoutBlocks(5L);
        sweeper = new MessageTimeoutSweeper(store, repository, new ProcessorPolicyResolver(repository, props), props, metrics);
        submit("m1", "eth:0xother", 10);

        indexTo(16);
        assertEquals(1, sweeper.sweepChain("eth"));
    }

    @Test
    public void sweep_pages_through_all_candidates() {
        props.getMessages().setSweepBatchSize(2);
        for (int i = 0; i < 5; i++) {
            submit("m" + i, "eth:0xproc", 1000);
        }

        indexTo(1200);
        assertEquals(5, sweeper.sweepChain("eth"));
        assertTrue(repository.listNonTerminalBySource("eth", "", 10).isEmpty());
    }

    @Test
    public void chain_without_cursor_is_skipped() {
        submit("m1", "eth:0xproc", 0);
        assertEquals(0, sweeper.sweepChain("eth"));
    }
}
