package com.work.almanac.indexer.web.dto;

import java.time.Instant;

/**
 * 单条链的同步状态（含 keyed 后端滞后情况）。
 */
public class ChainStatusView {

    private String chain;
    private String phase;
    private long lastIndexedHeight;
    private long chainHead;
    private long blocksBehind;
    private Long latestFinalizedHeight;
    private long blocksProcessed;
    private long eventsExtracted;
    private long reorgsRecovered;
    private String lastError;
    private int consecutiveErrors;
    private Instant lastSuccessAt;
    private Long keyedObservedHeight;
    private boolean keyedLagging;

    public String getChain() {
        return chain;
    }

    public void setChain(String chain) {
        this.chain = chain;
    }

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public long getLastIndexedHeight() {
        return lastIndexedHeight;
    }

    public void setLastIndexedHeight(long lastIndexedHeight) {
        this.lastIndexedHeight = lastIndexedHeight;
    }

    public long getChainHead() {
        return chainHead;
    }

    public void setChainHead(long chainHead) {
        this.chainHead = chainHead;
    }

    public long getBlocksBehind() {
        return blocksBehind;
    }

    public void setBlocksBehind(long blocksBehind) {
        this.blocksBehind = blocksBehind;
    }

    public Long getLatestFinalizedHeight() {
        return latestFinalizedHeight;
    }

    public void setLatestFinalizedHeight(Long latestFinalizedHeight) {
        this.latestFinalizedHeight = latestFinalizedHeight;
    }

    public long getBlocksProcessed() {
        return blocksProcessed;
    }

    public void setBlocksProcessed(long blocksProcessed) {
        this.blocksProcessed = blocksProcessed;
    }

    public long getEventsExtracted() {
        return eventsExtracted;
    }

    public void setEventsExtracted(long eventsExtracted) {
        this.eventsExtracted = eventsExtracted;
    }

    public long getReorgsRecovered() {
        return reorgsRecovered;
    }

    public void setReorgsRecovered(long reorgsRecovered) {
        this.reorgsRecovered = reorgsRecovered;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public int getConsecutiveErrors() {
        return consecutiveErrors;
    }

    public void setConsecutiveErrors(int consecutiveErrors) {
        this.consecutiveErrors = consecutiveErrors;
    }

    public Instant getLastSuccessAt() {
        return lastSuccessAt;
    }

    public void setLastSuccessAt(Instant lastSuccessAt) {
        this.lastSuccessAt = lastSuccessAt;
    }

    public Long getKeyedObservedHeight() {
        return keyedObservedHeight;
    }

    public void setKeyedObservedHeight(Long keyedObservedHeight) {
        this.keyedObservedHeight = keyedObservedHeight;
    }

    public boolean isKeyedLagging() {
        return keyedLagging;
    }

    public void setKeyedLagging(boolean keyedLagging) {
        this.keyedLagging = keyedLagging;
    }
}
