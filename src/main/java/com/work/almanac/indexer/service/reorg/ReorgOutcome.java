package com.work.almanac.indexer.service.reorg;

import com.work.almanac.core.model.RetractionResult;

/**
 * 一次 reorg 恢复的结果：公共祖先高度与撤回统计。
 */
public final class ReorgOutcome {

    private final String chain;
    private final long detectedAt;
    private final long ancestorHeight;
    private final int depth;
    private final RetractionResult retraction;

    public ReorgOutcome(String chain, long detectedAt, long ancestorHeight, int depth, RetractionResult retraction) {
        this.chain = chain;
        this.detectedAt = detectedAt;
        this.ancestorHeight = ancestorHeight;
        this.depth = depth;
        this.retraction = retraction;
    }

    public String getChain() {
        return chain;
    }

    public long getDetectedAt() {
        return detectedAt;
    }

    public long getAncestorHeight() {
        return ancestorHeight;
    }

    public int getDepth() {
        return depth;
    }

    public RetractionResult getRetraction() {
        return retraction;
    }

    @Override
    public String toString() {
        return "ReorgOutcome{" + chain + " detectedAt=" + detectedAt + " ancestor=" + ancestorHeight
                + " depth=" + depth + " " + retraction + "}";
    }
}
