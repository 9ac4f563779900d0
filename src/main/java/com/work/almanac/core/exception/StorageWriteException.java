package com.work.almanac.core.exception;

/**
 * 存储写入失败：整批放弃，游标不变，下个周期重试同一区间。
 */
public class StorageWriteException extends IndexerException {

    public StorageWriteException(String message) {
        super(message);
    }

    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
