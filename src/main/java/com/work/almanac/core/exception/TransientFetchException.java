package com.work.almanac.core.exception;

/**
 * 链适配器的临时错误（超时、限流、节点返回不一致的视图等），退避后重试，游标不变。
 */
public class TransientFetchException extends IndexerException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
