package com.work.almanac.core.model;

import static com.work.almanac.core.support.ValidationUtils.requireNonNull;

/**
 * 把 (chain, height &lt;= upToHeight) 且状态低于 target 的区块提升到 target。
 */
public final class FinalityPromotion {

    private final BlockStatus target;
    private final long upToHeight;

    public FinalityPromotion(BlockStatus target, long upToHeight) {
        this.target = requireNonNull(target, "target");
        this.upToHeight = upToHeight;
    }

    public BlockStatus getTarget() {
        return target;
    }

    public long getUpToHeight() {
        return upToHeight;
    }

    @Override
    public String toString() {
        return target.getValue() + "<=" + upToHeight;
    }
}
