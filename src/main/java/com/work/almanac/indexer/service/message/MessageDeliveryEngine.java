package com.work.almanac.indexer.service.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.almanac.core.exception.MessagePolicyViolationException;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.EntityStateVersion;
import com.work.almanac.core.model.MessageStatus;
import com.work.almanac.core.model.ProcessorPolicy;
import com.work.almanac.core.repository.entity.DeferredMessageEventEntity;
import com.work.almanac.core.repository.entity.ProcessorEntity;
import com.work.almanac.core.repository.entity.ProcessorMessageEntity;
import com.work.almanac.core.store.DualBlockEventStore;
import com.work.almanac.core.store.EventFilter;
import com.work.almanac.core.store.MessageRepository;
import com.work.almanac.indexer.config.IndexerProperties;
import com.work.almanac.indexer.service.ingest.IngestionListener;
import com.work.almanac.indexer.support.metrics.IndexerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 跨链消息投递状态机。
 *
 * 引擎只观察存储：每条链维护自己的消息游标，从游标之后按 (blockNumber, eventId) 顺序读取已入库事件并应用迁移。
 * 所有迁移都是条件更新，重复应用是 no-op，因此语义是 at-least-once + 幂等。
 *
 * <pre>
 * pending --processing--> processing --completed--> completed
 *                             |
 *                             +--failed--> failed --processing(next_retry_block 非空)--> processing
 * 任一非终态 --超时扫描--> timed_out
 * </pre>
 *
 * 目标链上的迁移事件可能早于源链上的提交事件被索引，此时事件暂存，消息创建后再重放。
 */
@Service
public class MessageDeliveryEngine implements IngestionListener {

    private static final Logger log = LoggerFactory.getLogger(MessageDeliveryEngine.class);

    static final String PROCESSOR_ENTITY_KIND = "processor";

    /**
     * 单次推进游标的区块窗口。
     */
    private static final long BLOCK_WINDOW = 1000;

    private final DualBlockEventStore store;
    private final MessageRepository repository;
    private final ProcessorEventDecoder decoder;
    private final ProcessorPolicyResolver policies;
    private final TransactionOperations tx;
    private final ObjectMapper objectMapper;
    private final IndexerProperties props;
    private final IndexerMetrics metrics;

    private final Map<String, Object> chainLocks = new ConcurrentHashMap<>();

    public MessageDeliveryEngine(DualBlockEventStore store,
                                 MessageRepository repository,
                                 ProcessorEventDecoder decoder,
                                 ProcessorPolicyResolver policies,
                                 TransactionOperations tx,
                                 ObjectMapper objectMapper,
                                 IndexerProperties props,
                                 IndexerMetrics metrics) {
        this.store = store;
        this.repository = repository;
        this.decoder = decoder;
        this.policies = policies;
        this.tx = tx;
        this.objectMapper = objectMapper;
        this.props = props;
        this.metrics = metrics;
    }

    private Object mutex(String chain) {
        return chainLocks.computeIfAbsent(chain, k -> new Object());
    }

    @Override
    public void onBatchCommitted(String chain, long cursorHeight) {
        catchUp(chain);
    }

    /**
     * reorg 后把消息游标回退到公共祖先，重新索引的规范事件会被再次应用。
     */
    @Override
    public void onRetracted(String chain, long ancestorHeight) {
        synchronized (mutex(chain)) {
            repository.rewindMessageCursor(chain, ancestorHeight);
            log.info("message cursor rewound chain={} height={}", chain, ancestorHeight);
        }
    }

    @Scheduled(fixedDelayString = "${indexer.messages.sweep-interval:PT5S}")
    public void catchUpAll() {
        for (String chain : props.enabledChainIds()) {
            try {
                catchUp(chain);
            } catch (Exception e) {
                log.warn("message catch-up error chain={} err={}", chain, e.toString());
            }
        }
    }

    /**
     * 把该链的消息游标推进到存储游标，返回应用的处理器事件数。
     */
    public int catchUp(String chain) {
        synchronized (mutex(chain)) {
            OptionalLong indexed = store.getCursor(chain);
            if (!indexed.isPresent()) {
                return 0;
            }
            long applied = repository.getMessageCursor(chain).orElse(-1L);
            long target = indexed.getAsLong();
            int count = 0;
            long from = applied + 1;
            while (from <= target) {
                long to = Math.min(target, from + BLOCK_WINDOW - 1);
                count += applyRange(chain, from, to);
                repository.setMessageCursor(chain, to);
                from = to + 1;
            }
            if (count > 0) {
                log.debug("message events applied chain={} upTo={} events={}", chain, target, count);
            }
            return count;
        }
    }

    private int applyRange(String chain, long from, long to) {
        int pageSize = Math.max(1, Math.min(props.getMessages().getEventPageSize(), EventFilter.MAX_LIMIT));
        int offset = 0;
        int count = 0;
        while (true) {
            List<ChainEvent> page = store.getEvents(EventFilter.forChain(chain).range(from, to)
                    .limit(pageSize).offset(offset).build());
            for (ChainEvent e : page) {
                Optional<ProcessorEvent> decoded = decoder.decode(e);
                if (decoded.isPresent()) {
                    apply(decoded.get());
                    count++;
                }
            }
            if (page.size() < pageSize) {
                return count;
            }
            offset += page.size();
        }
    }

    /**
     * 应用单个处理器事件。
     */
    public void apply(ProcessorEvent event) {
        switch (event.getKind()) {
            case PROCESSOR_CREATED:
            case CONFIG_UPDATED:
            case PAUSED:
            case RESUMED:
            case OWNERSHIP_TRANSFERRED:
                applyLifecycle(event);
                break;
            case MESSAGE_SUBMITTED:
                applySubmitted(event);
                break;
            default:
                applyTransition(event, true);
        }
    }

    private void applyLifecycle(ProcessorEvent event) {
        String processorId = event.processorId();
        ProcessorEntity updated = tx.execute(status -> {
            ProcessorEntity p = repository.findProcessor(processorId);
            if (p == null) {
                p = new ProcessorEntity();
                p.setId(processorId);
                p.setChain(event.getChain());
                p.setContractAddress(event.getProcessorAddress());
                p.setPaused(Boolean.FALSE);
                p.setCreatedAtBlock(event.getBlockNumber());
                p.setCreatedAtTx(event.getTxHash());
            } else if (p.getLastUpdatedBlock() != null && p.getLastUpdatedBlock() > event.getBlockNumber()) {
                // 重放旧事件，不覆盖新状态
                return null;
            }
            mergeLifecycle(p, event);
            p.setLastUpdatedBlock(event.getBlockNumber());
            p.setLastUpdatedTx(event.getTxHash());
            repository.upsertProcessor(p);
            return p;
        });
        policies.invalidate(processorId);
        if (updated == null) {
            return;
        }
        store.recordStateVersions(event.getChain(), Collections.singletonList(
                new EntityStateVersion(PROCESSOR_ENTITY_KIND, processorId, event.getChain(), event.getBlockNumber(), snapshot(updated))));
        log.info("processor updated id={} kind={} block={} paused={} policy={}",
                processorId, event.getKind(), event.getBlockNumber(), updated.isPausedNow(), updated.policy());
    }

    private void mergeLifecycle(ProcessorEntity p, ProcessorEvent event) {
        ProcessorPolicy merged = p.policy().merge(event.getPolicy());
        p.setMaxGasPerMessage(merged.getMaxGasPerMessage());
        p.setMessageTimeoutBlocks(merged.getMessageTimeoutBlocks());
        p.setRetryIntervalBlocks(merged.getRetryIntervalBlocks());
        p.setMaxRetryCount(merged.getMaxRetryCount());
        if (event.getOwner() != null) {
            p.setOwner(event.getOwner());
        }
        switch (event.getKind()) {
            case PAUSED:
                p.setPaused(Boolean.TRUE);
                break;
            case RESUMED:
                p.setPaused(Boolean.FALSE);
                break;
            default:
                if (event.getPaused() != null) {
                    p.setPaused(event.getPaused());
                }
        }
    }

    private String snapshot(ProcessorEntity p) {
        ObjectNode n = objectMapper.createObjectNode();
        n.put("processor_id", p.getId());
        n.put("chain_id", p.getChain());
        n.put("address", p.getContractAddress());
        n.put("owner", p.getOwner());
        ObjectNode config = n.putObject("config");
        config.put("max_gas_per_message", p.getMaxGasPerMessage());
        config.put("message_timeout_blocks", p.getMessageTimeoutBlocks());
        config.put("retry_interval_blocks", p.getRetryIntervalBlocks());
        config.put("max_retry_count", p.getMaxRetryCount());
        config.put("paused", p.isPausedNow());
        n.put("last_update_block", p.getLastUpdatedBlock());
        n.put("last_update_tx", p.getLastUpdatedTx());
        try {
            return objectMapper.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("processor snapshot serialization failed id=" + p.getId(), e);
        }
    }

    private void applySubmitted(ProcessorEvent event) {
        Instant now = Instant.now();
        ProcessorMessageEntity m = new ProcessorMessageEntity();
        m.setId(event.getMessageId());
        m.setProcessorId(event.processorId());
        m.setSourceChain(event.getChain());
        m.setTargetChain(event.getTargetChain() != null ? event.getTargetChain() : event.getChain());
        m.setSender(event.getSender());
        m.setPayload(event.getPayload());
        m.setStatus(MessageStatus.PENDING.getValue());
        m.setCreatedAtBlock(event.getBlockNumber());
        m.setCreatedAtTx(event.getTxHash());
        m.setLastUpdatedBlock(event.getBlockNumber());
        m.setRetryCount(0);
        m.setCreatedAt(now);
        m.setUpdatedAt(now);
        Boolean inserted = tx.execute(status -> repository.insertMessageIfAbsent(m));
        if (!Boolean.TRUE.equals(inserted)) {
            return;
        }
        metrics.messageTransition("none", MessageStatus.PENDING.getValue());
        log.info("message submitted id={} processor={} source={} target={} block={}",
                m.getId(), m.getProcessorId(), m.getSourceChain(), m.getTargetChain(), m.getCreatedAtBlock());
        replayDeferred(m.getId());
    }

    /**
     * 目标链上的 processing / completed / failed。消息尚未创建时（allowDefer）暂存事件。
     */
    private void applyTransition(ProcessorEvent event, boolean allowDefer) {
        String messageId = event.getMessageId();
        ProcessorMessageEntity msg = repository.findMessage(messageId);
        if (msg == null) {
            if (allowDefer) {
                repository.deferEvent(event.getSource().getEventId(), messageId, event.getChain(), event.getBlockNumber());
                log.info("transition deferred until message exists messageId={} kind={} chain={} block={}",
                        messageId, event.getKind(), event.getChain(), event.getBlockNumber());
            }
            return;
        }
        MessageStatus from = msg.statusEnum();
        switch (event.getKind()) {
            case MESSAGE_PROCESSING:
                try {
                    applyProcessing(event, msg, from);
                } catch (MessagePolicyViolationException v) {
                    metrics.messagePolicyViolation("processor_paused");
                    log.warn("message policy violation messageId={} block={} err={}", v.getMessageId(), event.getBlockNumber(), v.getMessage());
                }
                break;
            case MESSAGE_COMPLETED:
                applyCompleted(event, msg, from);
                break;
            case MESSAGE_FAILED:
                applyFailed(event, msg, from);
                break;
            default:
                throw new IllegalArgumentException("not a message transition: " + event.getKind());
        }
    }

    private void applyProcessing(ProcessorEvent event, ProcessorMessageEntity msg, MessageStatus from) {
        if (policies.isPaused(msg.getProcessorId())) {
            throw new MessagePolicyViolationException(msg.getId(),
                    "processor paused, transition held processor=" + msg.getProcessorId());
        }
        boolean allowRetry = from == MessageStatus.FAILED;
        Boolean ok = tx.execute(status -> repository.markProcessing(msg.getId(), event.getBlockNumber(), allowRetry));
        if (Boolean.TRUE.equals(ok)) {
            metrics.messageTransition(from.getValue(), MessageStatus.PROCESSING.getValue());
            log.info("message processing id={} from={} block={} retryCount={}", msg.getId(), from.getValue(), event.getBlockNumber(), msg.getRetryCount());
        } else {
            log.debug("processing transition not applicable id={} status={} nextRetryBlock={}", msg.getId(), from.getValue(), msg.getNextRetryBlock());
        }
    }

    private void applyCompleted(ProcessorEvent event, ProcessorMessageEntity msg, MessageStatus from) {
        ProcessorPolicy policy = policies.policyFor(msg.getProcessorId());
        if (event.getGasUsed() != null && policy.getMaxGasPerMessage() != null && event.getGasUsed() > policy.getMaxGasPerMessage()) {
            metrics.messagePolicyViolation("gas_exceeded");
            log.warn("message policy violation messageId={} gasUsed={} maxGasPerMessage={}",
                    msg.getId(), event.getGasUsed(), policy.getMaxGasPerMessage());
        }
        Boolean ok = tx.execute(status -> repository.markCompleted(msg.getId(), event.getBlockNumber(), event.getTxHash(), event.getGasUsed()));
        if (Boolean.TRUE.equals(ok)) {
            metrics.messageTransition(from.getValue(), MessageStatus.COMPLETED.getValue());
            log.info("message completed id={} block={} tx={} gasUsed={}", msg.getId(), event.getBlockNumber(), event.getTxHash(), event.getGasUsed());
        } else {
            log.debug("completed transition not applicable id={} status={}", msg.getId(), from.getValue());
        }
    }

    private void applyFailed(ProcessorEvent event, ProcessorMessageEntity msg, MessageStatus from) {
        if (from != MessageStatus.PROCESSING) {
            log.debug("failed transition not applicable id={} status={}", msg.getId(), from.getValue());
            return;
        }
        ProcessorPolicy policy = policies.policyFor(msg.getProcessorId());
        int maxRetry = policy.getMaxRetryCount() == null ? 0 : Math.max(0, policy.getMaxRetryCount());
        long interval = policy.getRetryIntervalBlocks() == null ? 0 : Math.max(0, policy.getRetryIntervalBlocks());
        int expected = msg.getRetryCount() == null ? 0 : msg.getRetryCount();
        int newRetry = Math.min(expected + 1, maxRetry);
        Long nextRetryBlock = newRetry < maxRetry ? event.getBlockNumber() + interval : null;
        Boolean ok = tx.execute(status -> repository.markFailed(msg.getId(), expected, newRetry, nextRetryBlock,
                event.getBlockNumber(), event.getError()));
        if (Boolean.TRUE.equals(ok)) {
            metrics.messageTransition(from.getValue(), MessageStatus.FAILED.getValue());
            log.info("message failed id={} block={} retryCount={}/{} nextRetryBlock={} err={}",
                    msg.getId(), event.getBlockNumber(), newRetry, maxRetry, nextRetryBlock, event.getError());
        }
    }

    private void replayDeferred(String messageId) {
        List<DeferredMessageEventEntity> deferred = repository.listDeferred(messageId);
        for (DeferredMessageEventEntity d : deferred) {
            Optional<ChainEvent> source = findEvent(d);
            if (source.isPresent()) {
                Optional<ProcessorEvent> decoded = decoder.decode(source.get());
                if (decoded.isPresent()) {
                    applyTransition(decoded.get(), false);
                }
            } else {
                log.info("deferred event no longer canonical, dropped eventId={} messageId={}", d.getEventId(), messageId);
            }
            repository.deleteDeferred(d.getEventId());
        }
    }

    private Optional<ChainEvent> findEvent(DeferredMessageEventEntity d) {
        int offset = 0;
        while (true) {
            List<ChainEvent> page = store.getEvents(EventFilter.forChain(d.getChain())
                    .range(d.getBlockNumber(), d.getBlockNumber())
                    .limit(EventFilter.MAX_LIMIT).offset(offset).build());
            for (ChainEvent e : page) {
                if (e.getEventId().equals(d.getEventId())) {
                    return Optional.of(e);
                }
            }
            if (page.size() < EventFilter.MAX_LIMIT) {
                return Optional.empty();
            }
            offset += page.size();
        }
    }
}
