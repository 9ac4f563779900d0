package com.work.almanac.core.exception;

/**
 * 事件要求的状态迁移被处理器策略拒绝（例如处理器已暂停）。只记录日志，消息保持原状态。
 */
public class MessagePolicyViolationException extends IndexerException {

    private final String messageId;

    public MessagePolicyViolationException(String messageId, String message) {
        super(message);
        this.messageId = messageId;
    }

    public String getMessageId() {
        return messageId;
    }
}
