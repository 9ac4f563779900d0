package com.work.almanac.core.exception;

/**
 * 在已索引范围（或最大回溯深度）内找不到公共祖先。该链停止索引，需要人工介入。
 */
public class ReorgUnrecoverableException extends IndexerException {

    private final String chain;
    private final long detectedAt;

    public ReorgUnrecoverableException(String chain, long detectedAt, String message) {
        super(message);
        this.chain = chain;
        this.detectedAt = detectedAt;
    }

    public String getChain() {
        return chain;
    }

    public long getDetectedAt() {
        return detectedAt;
    }
}
