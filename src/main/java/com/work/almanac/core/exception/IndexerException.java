package com.work.almanac.core.exception;

/**
 * 索引器内部的统一异常类型。
 */
public class IndexerException extends RuntimeException {

    public IndexerException(String message) {
        super(message);
    }

    public IndexerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试解决。默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
