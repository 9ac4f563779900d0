package com.work.almanac.core.model;

import java.util.Arrays;
import java.util.Objects;

import static com.work.almanac.core.support.ValidationUtils.requireNonEmpty;
import static com.work.almanac.core.support.ValidationUtils.requireNonNegative;

/**
 * 链上事件，归属于某个区块；写入后不再修改，随区块一起被撤回。
 */
public final class ChainEvent {

    private final String eventId;
    private final String chain;
    private final long blockNumber;
    private final String blockHash;
    private final String txHash;
    private final long timestamp;
    private final String eventType;
    private final byte[] rawData;

    public ChainEvent(String eventId, String chain, long blockNumber, String blockHash,
                      String txHash, long timestamp, String eventType, byte[] rawData) {
        this.eventId = requireNonEmpty(eventId, "eventId");
        this.chain = requireNonEmpty(chain, "chain");
        this.blockNumber = requireNonNegative(blockNumber, "blockNumber");
        this.blockHash = requireNonEmpty(blockHash, "blockHash");
        this.txHash = txHash;
        this.timestamp = timestamp;
        this.eventType = requireNonEmpty(eventType, "eventType");
        this.rawData = rawData == null ? new byte[0] : rawData.clone();
    }

    public String getEventId() {
        return eventId;
    }

    public String getChain() {
        return chain;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public String getTxHash() {
        return txHash;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getEventType() {
        return eventType;
    }

    public byte[] getRawData() {
        return rawData.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChainEvent)) {
            return false;
        }
        ChainEvent that = (ChainEvent) o;
        return blockNumber == that.blockNumber
                && timestamp == that.timestamp
                && eventId.equals(that.eventId)
                && chain.equals(that.chain)
                && blockHash.equals(that.blockHash)
                && Objects.equals(txHash, that.txHash)
                && eventType.equals(that.eventType)
                && Arrays.equals(rawData, that.rawData);
    }

    @Override
    public int hashCode() {
        return eventId.hashCode();
    }

    @Override
    public String toString() {
        return "ChainEvent{" + eventId + " " + eventType + " @" + chain + "#" + blockNumber + "}";
    }
}
