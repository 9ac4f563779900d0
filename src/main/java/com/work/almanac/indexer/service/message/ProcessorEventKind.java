package com.work.almanac.indexer.service.message;

/**
 * 处理器合约相关的链上事件种类。
 */
public enum ProcessorEventKind {
    PROCESSOR_CREATED,
    CONFIG_UPDATED,
    PAUSED,
    RESUMED,
    OWNERSHIP_TRANSFERRED,
    /**
     * 源链上提交消息。
     */
    MESSAGE_SUBMITTED,
    /**
     * 目标链上开始执行（含按计划重试）。
     */
    MESSAGE_PROCESSING,
    MESSAGE_COMPLETED,
    MESSAGE_FAILED;

    public boolean isLifecycle() {
        return this == PROCESSOR_CREATED || this == CONFIG_UPDATED || this == PAUSED
                || this == RESUMED || this == OWNERSHIP_TRANSFERRED;
    }

    public boolean isMessageTransition() {
        return this == MESSAGE_PROCESSING || this == MESSAGE_COMPLETED || this == MESSAGE_FAILED;
    }
}
