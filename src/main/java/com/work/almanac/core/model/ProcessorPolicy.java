package com.work.almanac.core.model;

/**
 * 处理器的消息策略；字段为空时由调用方使用配置中的默认值。
 */
public final class ProcessorPolicy {

    private final Long maxGasPerMessage;
    private final Long messageTimeoutBlocks;
    private final Long retryIntervalBlocks;
    private final Integer maxRetryCount;

    public ProcessorPolicy(Long maxGasPerMessage, Long messageTimeoutBlocks, Long retryIntervalBlocks, Integer maxRetryCount) {
        this.maxGasPerMessage = maxGasPerMessage;
        this.messageTimeoutBlocks = messageTimeoutBlocks;
        this.retryIntervalBlocks = retryIntervalBlocks;
        this.maxRetryCount = maxRetryCount;
    }

    public static ProcessorPolicy empty() {
        return new ProcessorPolicy(null, null, null, null);
    }

    /**
     * 用 other 中非空的字段覆盖当前值。
     */
    public ProcessorPolicy merge(ProcessorPolicy other) {
        if (other == null) {
            return this;
        }
        return new ProcessorPolicy(
                other.maxGasPerMessage != null ? other.maxGasPerMessage : maxGasPerMessage,
                other.messageTimeoutBlocks != null ? other.messageTimeoutBlocks : messageTimeoutBlocks,
                other.retryIntervalBlocks != null ? other.retryIntervalBlocks : retryIntervalBlocks,
                other.maxRetryCount != null ? other.maxRetryCount : maxRetryCount);
    }

    public Long getMaxGasPerMessage() {
        return maxGasPerMessage;
    }

    public Long getMessageTimeoutBlocks() {
        return messageTimeoutBlocks;
    }

    public Long getRetryIntervalBlocks() {
        return retryIntervalBlocks;
    }

    public Integer getMaxRetryCount() {
        return maxRetryCount;
    }

    @Override
    public String toString() {
        return "ProcessorPolicy{maxGas=" + maxGasPerMessage + ", timeout=" + messageTimeoutBlocks
                + ", retryInterval=" + retryIntervalBlocks + ", maxRetry=" + maxRetryCount + "}";
    }
}
