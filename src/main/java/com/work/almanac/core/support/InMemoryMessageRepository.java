package com.work.almanac.core.support;

import com.work.almanac.core.model.MessageStatus;
import com.work.almanac.core.repository.entity.DeferredMessageEventEntity;
import com.work.almanac.core.repository.entity.ProcessorEntity;
import com.work.almanac.core.repository.entity.ProcessorMessageEntity;
import com.work.almanac.core.store.MessageRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 纯内存实现，条件迁移语义与 PostgresMessageRepository 的 SQL 一致。
 * 注意：该实现仅用于 demo / 测试，不具备跨进程一致性。
 */
public class InMemoryMessageRepository implements MessageRepository {

    private final Map<String, ProcessorEntity> processors = new ConcurrentHashMap<>();
    private final Map<String, ProcessorMessageEntity> messages = new ConcurrentHashMap<>();
    private final Map<String, Long> cursors = new ConcurrentHashMap<>();
    private final Map<String, DeferredMessageEventEntity> deferred = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    @Override
    public ProcessorEntity findProcessor(String processorId) {
        ProcessorEntity p = processors.get(processorId);
        return p == null ? null : p.copy();
    }

    @Override
    public void upsertProcessor(ProcessorEntity processor) {
        synchronized (lock) {
            ProcessorEntity existing = processors.get(processor.getId());
            if (existing == null) {
                processors.put(processor.getId(), processor.copy());
                return;
            }
            if (existing.getLastUpdatedBlock() != null && processor.getLastUpdatedBlock() != null
                    && existing.getLastUpdatedBlock() > processor.getLastUpdatedBlock()) {
                return;
            }
            ProcessorEntity merged = processor.copy();
            merged.setCreatedAtBlock(existing.getCreatedAtBlock());
            merged.setCreatedAtTx(existing.getCreatedAtTx());
            processors.put(processor.getId(), merged);
        }
    }

    @Override
    public ProcessorMessageEntity findMessage(String messageId) {
        ProcessorMessageEntity m = messages.get(messageId);
        return m == null ? null : m.copy();
    }

    @Override
    public boolean insertMessageIfAbsent(ProcessorMessageEntity message) {
        synchronized (lock) {
            if (messages.containsKey(message.getId())) {
                return false;
            }
            ProcessorMessageEntity m = message.copy();
            m.setStatus(MessageStatus.PENDING.getValue());
            m.setLastUpdatedBlock(m.getCreatedAtBlock());
            m.setRetryCount(0);
            m.setNextRetryBlock(null);
            m.setProcessedAtBlock(null);
            m.setProcessedAtTx(null);
            m.setGasUsed(null);
            m.setError(null);
            m.setCreatedAt(Instant.now());
            m.setUpdatedAt(m.getCreatedAt());
            messages.put(m.getId(), m);
            return true;
        }
    }

    @Override
    public boolean markProcessing(String messageId, long block, boolean allowRetry) {
        synchronized (lock) {
            ProcessorMessageEntity m = messages.get(messageId);
            if (m == null) {
                return false;
            }
            MessageStatus s = m.statusEnum();
            boolean ok = s == MessageStatus.PENDING
                    || (allowRetry && s == MessageStatus.FAILED && m.getNextRetryBlock() != null);
            if (!ok) {
                return false;
            }
            m.setStatus(MessageStatus.PROCESSING.getValue());
            m.setLastUpdatedBlock(block);
            m.setUpdatedAt(Instant.now());
            return true;
        }
    }

    @Override
    public boolean markCompleted(String messageId, long block, String txHash, Long gasUsed) {
        synchronized (lock) {
            ProcessorMessageEntity m = messages.get(messageId);
            if (m == null || m.statusEnum() != MessageStatus.PROCESSING) {
                return false;
            }
            m.setStatus(MessageStatus.COMPLETED.getValue());
            m.setLastUpdatedBlock(block);
            m.setProcessedAtBlock(block);
            m.setProcessedAtTx(txHash);
            m.setGasUsed(gasUsed);
            m.setNextRetryBlock(null);
            m.setError(null);
            m.setUpdatedAt(Instant.now());
            return true;
        }
    }

    @Override
    public boolean markFailed(String messageId, int expectedRetryCount, int newRetryCount, Long nextRetryBlock, long block, String error) {
        synchronized (lock) {
            ProcessorMessageEntity m = messages.get(messageId);
            if (m == null || m.statusEnum() != MessageStatus.PROCESSING
                    || m.getRetryCount() == null || m.getRetryCount() != expectedRetryCount) {
                return false;
            }
            m.setStatus(MessageStatus.FAILED.getValue());
            m.setRetryCount(newRetryCount);
            m.setNextRetryBlock(nextRetryBlock);
            m.setLastUpdatedBlock(block);
            m.setError(error);
            m.setUpdatedAt(Instant.now());
            return true;
        }
    }

    @Override
    public boolean markTimedOut(String messageId, long block, String reason) {
        synchronized (lock) {
            ProcessorMessageEntity m = messages.get(messageId);
            if (m == null || m.statusEnum().isTerminal()) {
                return false;
            }
            m.setStatus(MessageStatus.TIMED_OUT.getValue());
            m.setNextRetryBlock(null);
            m.setLastUpdatedBlock(block);
            m.setError(reason);
            m.setUpdatedAt(Instant.now());
            return true;
        }
    }

    @Override
    public List<ProcessorMessageEntity> listNonTerminalBySource(String sourceChain, String afterId, int limit) {
        String after = afterId == null ? "" : afterId;
        List<ProcessorMessageEntity> out = new ArrayList<>();
        synchronized (lock) {
            for (ProcessorMessageEntity m : messages.values()) {
                if (sourceChain.equals(m.getSourceChain()) && !m.statusEnum().isTerminal() && m.getId().compareTo(after) > 0) {
                    out.add(m.copy());
                }
            }
        }
        out.sort(Comparator.comparing(ProcessorMessageEntity::getId));
        return out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
    }

    @Override
    public List<ProcessorMessageEntity> listRetryable(String targetChain, long currentHeight, int limit) {
        List<ProcessorMessageEntity> out = new ArrayList<>();
        synchronized (lock) {
            for (ProcessorMessageEntity m : messages.values()) {
                if (targetChain.equals(m.getTargetChain()) && m.statusEnum() == MessageStatus.FAILED
                        && m.getNextRetryBlock() != null && m.getNextRetryBlock() <= currentHeight) {
                    out.add(m.copy());
                }
            }
        }
        out.sort(Comparator.comparing(ProcessorMessageEntity::getNextRetryBlock).thenComparing(ProcessorMessageEntity::getId));
        return out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
    }

    @Override
    public List<ProcessorMessageEntity> listByTargetAndStatus(String targetChain, String status, int limit) {
        List<ProcessorMessageEntity> out = new ArrayList<>();
        synchronized (lock) {
            for (ProcessorMessageEntity m : messages.values()) {
                if (targetChain.equals(m.getTargetChain()) && status.equals(m.getStatus())) {
                    out.add(m.copy());
                }
            }
        }
        out.sort(Comparator.comparing(ProcessorMessageEntity::getCreatedAtBlock).thenComparing(ProcessorMessageEntity::getId));
        return out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
    }

    @Override
    public OptionalLong getMessageCursor(String chain) {
        Long h = cursors.get(chain);
        return h == null ? OptionalLong.empty() : OptionalLong.of(h);
    }

    @Override
    public void setMessageCursor(String chain, long height) {
        cursors.put(chain, height);
    }

    @Override
    public void rewindMessageCursor(String chain, long height) {
        synchronized (lock) {
            cursors.computeIfPresent(chain, (k, v) -> v > height ? height : v);
            deferred.values().removeIf(d -> chain.equals(d.getChain()) && d.getBlockNumber() > height);
        }
    }

    @Override
    public void deferEvent(String eventId, String messageId, String chain, long blockNumber) {
        DeferredMessageEventEntity d = new DeferredMessageEventEntity();
        d.setEventId(eventId);
        d.setMessageId(messageId);
        d.setChain(chain);
        d.setBlockNumber(blockNumber);
        d.setCreatedAt(Instant.now());
        deferred.putIfAbsent(eventId, d);
    }

    @Override
    public List<DeferredMessageEventEntity> listDeferred(String messageId) {
        List<DeferredMessageEventEntity> out = new ArrayList<>();
        for (DeferredMessageEventEntity d : deferred.values()) {
            if (messageId.equals(d.getMessageId())) {
                out.add(d);
            }
        }
        out.sort(Comparator.comparing(DeferredMessageEventEntity::getBlockNumber).thenComparing(DeferredMessageEventEntity::getEventId));
        return out;
    }

    @Override
    public void deleteDeferred(String eventId) {
        deferred.remove(eventId);
    }
}
