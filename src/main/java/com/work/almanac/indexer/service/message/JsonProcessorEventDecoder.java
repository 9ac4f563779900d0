package com.work.almanac.indexer.service.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.ProcessorPolicy;
import com.work.almanac.indexer.config.IndexerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 识别 JSON 载荷的处理器事件。
 *
 * 事件类型按小写种类名识别（processor_created、message_submitted ...），
 * 也可通过 indexer.messages.event-types 把合约自定义的类型名映射到种类。
 * 载荷字段：processor、message_id、target_chain、sender、payload、owner、gas_used、error、
 * max_gas_per_message、message_timeout_blocks、retry_interval_blocks、max_retry_count、paused。
 */
@Component
public class JsonProcessorEventDecoder implements ProcessorEventDecoder {

    private static final Logger log = LoggerFactory.getLogger(JsonProcessorEventDecoder.class);

    private final ObjectMapper objectMapper;
    private final Map<String, ProcessorEventKind> kinds = new HashMap<>();

    public JsonProcessorEventDecoder(ObjectMapper objectMapper, IndexerProperties props) {
        this.objectMapper = objectMapper;
        for (ProcessorEventKind k : ProcessorEventKind.values()) {
            kinds.put(k.name().toLowerCase(Locale.ROOT), k);
        }
        for (Map.Entry<String, String> e : props.getMessages().getEventTypes().entrySet()) {
            kinds.put(e.getKey(), ProcessorEventKind.valueOf(e.getValue().trim().toUpperCase(Locale.ROOT)));
        }
    }

    @Override
    public Optional<ProcessorEvent> decode(ChainEvent event) {
        ProcessorEventKind kind = kinds.get(event.getEventType());
        if (kind == null) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(event.getRawData());
        } catch (IOException e) {
            log.warn("undecodable processor event skipped eventId={} type={} err={}", event.getEventId(), event.getEventType(), e.getMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.warn("processor event payload is not an object eventId={} type={}", event.getEventId(), event.getEventType());
            return Optional.empty();
        }

        ProcessorEvent pe = new ProcessorEvent(kind, event);
        pe.setProcessorAddress(text(node, "processor"));
        pe.setMessageId(text(node, "message_id"));
        pe.setTargetChain(text(node, "target_chain"));
        pe.setSender(text(node, "sender"));
        pe.setPayload(text(node, "payload"));
        pe.setOwner(text(node, "owner"));
        pe.setGasUsed(number(node, "gas_used"));
        pe.setError(text(node, "error"));
        Long maxRetry = number(node, "max_retry_count");
        pe.setPolicy(new ProcessorPolicy(
                number(node, "max_gas_per_message"),
                number(node, "message_timeout_blocks"),
                number(node, "retry_interval_blocks"),
                maxRetry == null ? null : maxRetry.intValue()));
        JsonNode paused = node.get("paused");
        if (paused != null && paused.isBoolean()) {
            pe.setPaused(paused.booleanValue());
        }

        if (kind.isLifecycle() && pe.getProcessorAddress() == null) {
            log.warn("processor event without processor address skipped eventId={} kind={}", event.getEventId(), kind);
            return Optional.empty();
        }
        if ((kind == ProcessorEventKind.MESSAGE_SUBMITTED || kind.isMessageTransition()) && pe.getMessageId() == null) {
            log.warn("message event without message_id skipped eventId={} kind={}", event.getEventId(), kind);
            return Optional.empty();
        }
        if (kind == ProcessorEventKind.MESSAGE_SUBMITTED && pe.getProcessorAddress() == null) {
            log.warn("submission without processor address skipped eventId={}", event.getEventId());
            return Optional.empty();
        }
        return Optional.of(pe);
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        String s = v.asText();
        return s.isEmpty() ? null : s;
    }

    private static Long number(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isNumber()) {
            return v.longValue();
        }
        if (v.isTextual()) {
            try {
                return Long.parseLong(v.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
