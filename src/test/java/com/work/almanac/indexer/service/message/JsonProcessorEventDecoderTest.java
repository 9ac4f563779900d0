package com.work.almanac.indexer.service.message;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.indexer.config.IndexerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JsonProcessorEventDecoderTest {

    private IndexerProperties props;
    private JsonProcessorEventDecoder decoder;

    @BeforeEach
    public void setUp() {
        props = new IndexerProperties();
        props.getMessages().getEventTypes().put("MessageSent", "message_submitted");
        decoder = new JsonProcessorEventDecoder(new ObjectMapper(), props);
    }

    private ChainEvent raw(String type, String json) {
        return new ChainEvent("eth:0xtx:0", "eth", 42, "0xeth-42", "0xtx", 1_700_000_042L, type,
                json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void decodes_processor_created_with_policy() {
        Optional<ProcessorEvent> e = decoder.decode(raw("processor_created",
                "{\"processor\":\"0xproc\",\"owner\":\"0xo\",\"max_gas_per_message\":\"100000\","
                        + "\"message_timeout_blocks\":50,\"retry_interval_blocks\":10,\"max_retry_count\":3,\"paused\":false}"));

        assertTrue(e.isPresent());
        ProcessorEvent pe = e.get();
        assertEquals(ProcessorEventKind.PROCESSOR_CREATED, pe.getKind());
        assertEquals("eth:0xproc", pe.processorId());
        assertEquals("0xo", pe.getOwner());
        assertEquals(100000L, pe.getPolicy().getMaxGasPerMessage().longValue());
        assertEquals(50L, pe.getPolicy().getMessageTimeoutBlocks().longValue());
        assertEquals(10L, pe.getPolicy().getRetryIntervalBlocks().longValue());
        assertEquals(3, pe.getPolicy().getMaxRetryCount().intValue());
        assertEquals(Boolean.FALSE, pe.getPaused());
        assertEquals(42, pe.getBlockNumber());
        assertEquals("0xtx", pe.getTxHash());
    }

    @Test
    public void configured_type_alias_maps_to_kind() {
        Optional<ProcessorEvent> e = decoder.decode(raw("MessageSent",
                "{\"processor\":\"0xproc\",\"message_id\":\"m1\",\"target_chain\":\"cosmos\"}"));

        assertTrue(e.isPresent());
        assertEquals(ProcessorEventKind.MESSAGE_SUBMITTED, e.get().getKind());
        assertEquals("cosmos", e.get().getTargetChain());
    }

    @Test
    public void transition_without_processor_is_accepted() {
        Optional<ProcessorEvent> e = decoder.decode(raw("message_failed", "{\"message_id\":\"m1\",\"error\":\"out of gas\"}"));

        assertTrue(e.isPresent());
        assertNull(e.get().getProcessorAddress());
        assertEquals("out of gas", e.get().getError());
    }

    @Test
    public void unknown_type_is_not_a_processor_event() {
        assertFalse(decoder.decode(raw("transfer", "{\"processor\":\"0xproc\"}")).isPresent());
    }

    @Test
    public void malformed_or_incomplete_payloads_are_skipped() {
        assertFalse(decoder.decode(raw("message_completed", "{oops")).isPresent());
        assertFalse(decoder.decode(raw("message_completed", "[1,2]")).isPresent());
        assertFalse(decoder.decode(raw("message_completed", "{\"gas_used\":1}")).isPresent());
        assertFalse(decoder.decode(raw("paused", "{}")).isPresent());
        assertFalse(decoder.decode(raw("message_submitted", "{\"message_id\":\"m1\"}")).isPresent());
    }
}
