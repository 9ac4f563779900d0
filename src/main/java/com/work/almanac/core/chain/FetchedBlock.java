package com.work.almanac.core.chain;

import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.ChainEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.work.almanac.core.support.ValidationUtils.requireNonNull;

/**
 * 适配器返回的一个区块及其事件。区块状态由 FinalityTracker 决定，适配器给出的状态会被忽略。
 */
public final class FetchedBlock {

    private final Block block;
    private final List<ChainEvent> events;

    public FetchedBlock(Block block, List<ChainEvent> events) {
        this.block = requireNonNull(block, "block");
        this.events = Collections.unmodifiableList(new ArrayList<>(events == null ? Collections.emptyList() : events));
        for (ChainEvent e : this.events) {
            if (e.getBlockNumber() != block.getNumber() || !e.getBlockHash().equals(block.getHash())) {
                throw new IllegalArgumentException("事件不属于该区块: " + e + " block=" + block);
            }
        }
    }

    public Block getBlock() {
        return block;
    }

    public List<ChainEvent> getEvents() {
        return events;
    }

    public long getNumber() {
        return block.getNumber();
    }
}
