package com.work.almanac.core.exception;

/**
 * 已 finalized 的区块与链上规范区块不一致。绝不自动回滚，该链停止索引。
 */
public class FinalityViolationException extends IndexerException {

    private final String chain;
    private final long height;

    public FinalityViolationException(String chain, long height, String storedHash, String canonicalHash) {
        super("finalized block diverged chain=" + chain + " height=" + height
                + " stored=" + storedHash + " canonical=" + canonicalHash);
        this.chain = chain;
        this.height = height;
    }

    public String getChain() {
        return chain;
    }

    public long getHeight() {
        return height;
    }
}
