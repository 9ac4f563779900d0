package com.work.almanac.core.model;

import java.util.Objects;

import static com.work.almanac.core.support.ValidationUtils.requireNonEmpty;
import static com.work.almanac.core.support.ValidationUtils.requireNonNegative;
import static com.work.almanac.core.support.ValidationUtils.requireNonNull;

/**
 * 区块快照，(chain, number) 唯一。状态变化通过 {@link #withStatus(BlockStatus)} 生成新实例。
 */
public final class Block {

    private final String chain;
    private final long number;
    private final String hash;
    private final String parentHash;
    private final long timestamp;
    private final BlockStatus status;

    public Block(String chain, long number, String hash, String parentHash, long timestamp, BlockStatus status) {
        this.chain = requireNonEmpty(chain, "chain");
        this.number = requireNonNegative(number, "number");
        this.hash = requireNonEmpty(hash, "hash");
        this.parentHash = parentHash;
        this.timestamp = timestamp;
        this.status = requireNonNull(status, "status");
    }

    public Block withStatus(BlockStatus newStatus) {
        return new Block(chain, number, hash, parentHash, timestamp, newStatus);
    }

    public String getChain() {
        return chain;
    }

    public long getNumber() {
        return number;
    }

    public String getHash() {
        return hash;
    }

    public String getParentHash() {
        return parentHash;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public BlockStatus getStatus() {
        return status;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Block)) {
            return false;
        }
        Block block = (Block) o;
        return number == block.number
                && timestamp == block.timestamp
                && chain.equals(block.chain)
                && hash.equals(block.hash)
                && Objects.equals(parentHash, block.parentHash)
                && status == block.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(chain, number, hash);
    }

    @Override
    public String toString() {
        return "Block{" + chain + "#" + number + " " + hash + " " + status.getValue() + "}";
    }
}
