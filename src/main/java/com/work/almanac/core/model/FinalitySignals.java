package com.work.almanac.core.model;

import java.util.OptionalLong;

/**
 * progressive 链外部上报的终局高度（safe / justified / finalized），缺失的层级为空。
 */
public final class FinalitySignals {

    private final Long safeHeight;
    private final Long justifiedHeight;
    private final Long finalizedHeight;

    public FinalitySignals(Long safeHeight, Long justifiedHeight, Long finalizedHeight) {
        this.safeHeight = safeHeight;
        this.justifiedHeight = justifiedHeight;
        this.finalizedHeight = finalizedHeight;
    }

    public OptionalLong heightOf(BlockStatus tier) {
        Long h;
        switch (tier) {
            case SAFE:
                h = safeHeight;
                break;
            case JUSTIFIED:
                h = justifiedHeight;
                break;
            case FINALIZED:
                h = finalizedHeight;
                break;
            default:
                h = null;
        }
        return h == null ? OptionalLong.empty() : OptionalLong.of(h);
    }

    public Long getSafeHeight() {
        return safeHeight;
    }

    public Long getJustifiedHeight() {
        return justifiedHeight;
    }

    public Long getFinalizedHeight() {
        return finalizedHeight;
    }

    @Override
    public String toString() {
        return "FinalitySignals{safe=" + safeHeight + ", justified=" + justifiedHeight + ", finalized=" + finalizedHeight + "}";
    }
}
