package com.work.almanac.core.store;

import com.work.almanac.core.repository.entity.DeferredMessageEventEntity;
import com.work.almanac.core.repository.entity.ProcessorEntity;
import com.work.almanac.core.repository.entity.ProcessorMessageEntity;

import java.util.List;
import java.util.OptionalLong;

/**
 * 处理器与跨链消息的持久化。
 *
 * mark* 方法都是条件更新：返回 true 表示迁移生效，false 表示消息不在要求的前置状态。
 */
public interface MessageRepository {

    ProcessorEntity findProcessor(String processorId);

    /**
     * 插入或按区块顺序覆盖处理器状态（旧高度不覆盖新高度）。
     */
    void upsertProcessor(ProcessorEntity processor);

    ProcessorMessageEntity findMessage(String messageId);

    /**
     * 以 pending 状态插入；已存在时返回 false。
     */
    boolean insertMessageIfAbsent(ProcessorMessageEntity message);

    /**
     * pending -&gt; processing；allowRetry 时也允许 failed(next_retry_block 非空) -&gt; processing。
     */
    boolean markProcessing(String messageId, long block, boolean allowRetry);

    boolean markCompleted(String messageId, long block, String txHash, Long gasUsed);

    boolean markFailed(String messageId, int expectedRetryCount, int newRetryCount, Long nextRetryBlock, long block, String error);

    /**
     * 非终态 -&gt; timed_out。
     */
    boolean markTimedOut(String messageId, long block, String reason);

    /**
     * 源链上的非终态消息，按 id 分页（afterId 为上一页最后一个 id，首页传空串）。
     */
    List<ProcessorMessageEntity> listNonTerminalBySource(String sourceChain, String afterId, int limit);

    /**
     * 目标链上 next_retry_block &lt;= currentHeight 的 failed 消息，供 relayer 轮询。
     */
    List<ProcessorMessageEntity> listRetryable(String targetChain, long currentHeight, int limit);

    List<ProcessorMessageEntity> listByTargetAndStatus(String targetChain, String status, int limit);

    OptionalLong getMessageCursor(String chain);

    void setMessageCursor(String chain, long height);

    /**
     * 游标回退到 height（仅当当前游标更大时），同时清理该链 height 之后的暂存事件。
     */
    void rewindMessageCursor(String chain, long height);

    void deferEvent(String eventId, String messageId, String chain, long blockNumber);

    List<DeferredMessageEventEntity> listDeferred(String messageId);

    void deleteDeferred(String eventId);
}
