package com.work.almanac.indexer.web.dto;

import java.time.Instant;

public class ReorgView {

    private long detectedAt;
    private long ancestorHeight;
    private int depth;
    private int blocksRetracted;
    private int eventsRetracted;
    private Instant createdAt;

    public long getDetectedAt() {
        return detectedAt;
    }

    public void setDetectedAt(long detectedAt) {
        this.detectedAt = detectedAt;
    }

    public long getAncestorHeight() {
        return ancestorHeight;
    }

    public void setAncestorHeight(long ancestorHeight) {
        this.ancestorHeight = ancestorHeight;
    }

    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    public int getBlocksRetracted() {
        return blocksRetracted;
    }

    public void setBlocksRetracted(int blocksRetracted) {
        this.blocksRetracted = blocksRetracted;
    }

    public int getEventsRetracted() {
        return eventsRetracted;
    }

    public void setEventsRetracted(int eventsRetracted) {
        this.eventsRetracted = eventsRetracted;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
