package com.work.almanac.core.model;

/**
 * 按高度查询历史状态的结果。
 *
 * 自描述：version.blockNumber 是该快照真实反映的高度，observedHeight 是 keyed 存储在该链上已观测到的最高高度。
 * 若 observedHeight &lt; 请求高度，说明 keyed 存储仍在追赶，结果可能陈旧。
 */
public final class HistoricalState {

    private final EntityStateVersion version;
    private final long requestedHeight;
    private final long observedHeight;

    public HistoricalState(EntityStateVersion version, long requestedHeight, long observedHeight) {
        this.version = version;
        this.requestedHeight = requestedHeight;
        this.observedHeight = observedHeight;
    }

    public EntityStateVersion getVersion() {
        return version;
    }

    public long getReflectedHeight() {
        return version.getBlockNumber();
    }

    public long getRequestedHeight() {
        return requestedHeight;
    }

    public long getObservedHeight() {
        return observedHeight;
    }

    public boolean isPossiblyStale() {
        return observedHeight < requestedHeight;
    }
}
