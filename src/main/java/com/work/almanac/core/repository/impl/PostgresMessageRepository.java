package com.work.almanac.core.repository.impl;

import com.work.almanac.core.repository.entity.DeferredMessageEventEntity;
import com.work.almanac.core.repository.entity.ProcessorEntity;
import com.work.almanac.core.repository.entity.ProcessorMessageEntity;
import com.work.almanac.core.repository.mapper.DeferredMessageEventMapper;
import com.work.almanac.core.repository.mapper.MessageCursorMapper;
import com.work.almanac.core.repository.mapper.ProcessorMapper;
import com.work.almanac.core.repository.mapper.ProcessorMessageMapper;
import com.work.almanac.core.store.MessageRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;

import static com.work.almanac.core.support.ValidationUtils.requireNonEmpty;
import static com.work.almanac.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 MessageRepository 实现。
 *
 * 事务边界由调用方（MessageDeliveryEngine）统一管理，这里不加 @Transactional。
 */
@Repository
public class PostgresMessageRepository implements MessageRepository {

    private final ProcessorMapper processorMapper;
    private final ProcessorMessageMapper messageMapper;
    private final MessageCursorMapper cursorMapper;
    private final DeferredMessageEventMapper deferredMapper;

    public PostgresMessageRepository(ProcessorMapper processorMapper,
                                     ProcessorMessageMapper messageMapper,
                                     MessageCursorMapper cursorMapper,
                                     DeferredMessageEventMapper deferredMapper) {
        this.processorMapper = processorMapper;
        this.messageMapper = messageMapper;
        this.cursorMapper = cursorMapper;
        this.deferredMapper = deferredMapper;
    }

    @Override
    public ProcessorEntity findProcessor(String processorId) {
        requireNonEmpty(processorId, "processorId");
        return processorMapper.selectByProcessorId(processorId);
    }

    @Override
    public void upsertProcessor(ProcessorEntity processor) {
        requireNonNull(processor, "processor");
        requireNonEmpty(processor.getId(), "processor.id");
        processorMapper.upsert(processor);
    }

    @Override
    public ProcessorMessageEntity findMessage(String messageId) {
        requireNonEmpty(messageId, "messageId");
        return messageMapper.selectByMessageId(messageId);
    }

    @Override
    public boolean insertMessageIfAbsent(ProcessorMessageEntity message) {
        requireNonNull(message, "message");
        requireNonEmpty(message.getId(), "message.id");
        Instant now = Instant.now();
        message.setCreatedAt(now);
        message.setUpdatedAt(now);
        return messageMapper.insertIgnore(message) == 1;
    }

    @Override
    public boolean markProcessing(String messageId, long block, boolean allowRetry) {
        return messageMapper.markProcessing(messageId, block, allowRetry, Instant.now()) == 1;
    }

    @Override
    public boolean markCompleted(String messageId, long block, String txHash, Long gasUsed) {
        return messageMapper.markCompleted(messageId, block, txHash, gasUsed, Instant.now()) == 1;
    }

    @Override
    public boolean markFailed(String messageId, int expectedRetryCount, int newRetryCount, Long nextRetryBlock, long block, String error) {
        return messageMapper.markFailed(messageId, expectedRetryCount, newRetryCount, nextRetryBlock, block, error, Instant.now()) == 1;
    }

    @Override
    public boolean markTimedOut(String messageId, long block, String reason) {
        return messageMapper.markTimedOut(messageId, block, reason, Instant.now()) == 1;
    }

    @Override
    public List<ProcessorMessageEntity> listNonTerminalBySource(String sourceChain, String afterId, int limit) {
        return messageMapper.selectNonTerminalBySource(sourceChain, afterId == null ? "" : afterId, limit);
    }

    @Override
    public List<ProcessorMessageEntity> listRetryable(String targetChain, long currentHeight, int limit) {
        return messageMapper.selectRetryable(targetChain, currentHeight, limit);
    }

    @Override
    public List<ProcessorMessageEntity> listByTargetAndStatus(String targetChain, String status, int limit) {
        return messageMapper.selectByTargetAndStatus(targetChain, status, limit);
    }

    @Override
    public OptionalLong getMessageCursor(String chain) {
        Long h = cursorMapper.selectHeight(chain);
        return h == null ? OptionalLong.empty() : OptionalLong.of(h);
    }

    @Override
    public void setMessageCursor(String chain, long height) {
        cursorMapper.upsert(chain, height, Instant.now());
    }

    @Override
    public void rewindMessageCursor(String chain, long height) {
        cursorMapper.rewind(chain, height, Instant.now());
        deferredMapper.deleteFromHeight(chain, height + 1);
    }

    @Override
    public void deferEvent(String eventId, String messageId, String chain, long blockNumber) {
        deferredMapper.insertIgnore(eventId, messageId, chain, blockNumber, Instant.now());
    }

    @Override
    public List<DeferredMessageEventEntity> listDeferred(String messageId) {
        return deferredMapper.selectByMessageId(messageId);
    }

    @Override
    public void deleteDeferred(String eventId) {
        deferredMapper.deleteByEventId(eventId);
    }
}
