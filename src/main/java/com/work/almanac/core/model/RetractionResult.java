package com.work.almanac.core.model;

/**
 * 一次撤回的结果统计。
 */
public final class RetractionResult {

    private final long fromHeight;
    private final int blocksRetracted;
    private final int eventsRetracted;

    public RetractionResult(long fromHeight, int blocksRetracted, int eventsRetracted) {
        this.fromHeight = fromHeight;
        this.blocksRetracted = blocksRetracted;
        this.eventsRetracted = eventsRetracted;
    }

    public long getFromHeight() {
        return fromHeight;
    }

    public int getBlocksRetracted() {
        return blocksRetracted;
    }

    public int getEventsRetracted() {
        return eventsRetracted;
    }

    @Override
    public String toString() {
        return "RetractionResult{from=" + fromHeight + ", blocks=" + blocksRetracted + ", events=" + eventsRetracted + "}";
    }
}
