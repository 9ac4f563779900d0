package com.work.almanac.indexer.service.ingest;

import java.time.Instant;

/**
 * 单条链的同步状态（供状态接口轮询）。由该链的摄取线程写，其他线程读快照。
 */
public class ChainSyncState {

    private final String chain;
    private SyncPhase phase = SyncPhase.IDLE;
    private long lastIndexedHeight = -1;
    private long chainHead = -1;
    private long blocksProcessed;
    private long eventsExtracted;
    private long reorgsRecovered;
    private String lastError;
    private int consecutiveErrors;
    private Instant lastSuccessAt;
    private Instant lastErrorAt;

    public ChainSyncState(String chain) {
        this.chain = chain;
    }

    private ChainSyncState(ChainSyncState other) {
        this.chain = other.chain;
        this.phase = other.phase;
        this.lastIndexedHeight = other.lastIndexedHeight;
        this.chainHead = other.chainHead;
        this.blocksProcessed = other.blocksProcessed;
        this.eventsExtracted = other.eventsExtracted;
        this.reorgsRecovered = other.reorgsRecovered;
        this.lastError = other.lastError;
        this.consecutiveErrors = other.consecutiveErrors;
        this.lastSuccessAt = other.lastSuccessAt;
        this.lastErrorAt = other.lastErrorAt;
    }

    public synchronized ChainSyncState snapshot() {
        return new ChainSyncState(this);
    }

    synchronized void phase(SyncPhase phase) {
        this.phase = phase;
    }

    synchronized void observeHead(long head) {
        this.chainHead = head;
    }

    synchronized void observeCursor(long cursor) {
        this.lastIndexedHeight = cursor;
    }

    synchronized void recordBatch(long cursor, int blocks, int events) {
        this.lastIndexedHeight = cursor;
        this.blocksProcessed += blocks;
        this.eventsExtracted += events;
        this.consecutiveErrors = 0;
        this.lastSuccessAt = Instant.now();
    }

    synchronized void recordIdle() {
        this.consecutiveErrors = 0;
        this.lastSuccessAt = Instant.now();
    }

    synchronized void recordReorg(long ancestorHeight) {
        this.reorgsRecovered++;
        this.lastIndexedHeight = ancestorHeight;
    }

    synchronized void recordError(String error) {
        this.lastError = error;
        this.consecutiveErrors++;
        this.lastErrorAt = Instant.now();
    }

    public String getChain() {
        return chain;
    }

    public synchronized SyncPhase getPhase() {
        return phase;
    }

    public synchronized long getLastIndexedHeight() {
        return lastIndexedHeight;
    }

    public synchronized long getChainHead() {
        return chainHead;
    }

    /**
     * 链头与已索引高度之差，未知时为 -1。
     */
    public synchronized long getBlocksBehind() {
        if (chainHead < 0) {
            return -1;
        }
        return Math.max(0, chainHead - lastIndexedHeight);
    }

    public synchronized long getBlocksProcessed() {
        return blocksProcessed;
    }

    public synchronized long getEventsExtracted() {
        return eventsExtracted;
    }

    public synchronized long getReorgsRecovered() {
        return reorgsRecovered;
    }

    public synchronized String getLastError() {
        return lastError;
    }

    public synchronized int getConsecutiveErrors() {
        return consecutiveErrors;
    }

    public synchronized Instant getLastSuccessAt() {
        return lastSuccessAt;
    }

    public synchronized Instant getLastErrorAt() {
        return lastErrorAt;
    }
}
