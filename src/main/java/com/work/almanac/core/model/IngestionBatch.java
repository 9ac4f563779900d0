package com.work.almanac.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.work.almanac.core.support.ValidationUtils.requireNonEmpty;

/**
 * 一次原子写入的单元：区块（已带终局状态）+ 事件 + 已有区块的终局提升 + 新游标。
 *
 * 约束：blocks 按高度连续递增，cursorHeight 等于最后一个区块的高度（无新区块时为当前游标）。
 */
public final class IngestionBatch {

    private final String chain;
    private final List<Block> blocks;
    private final List<ChainEvent> events;
    private final List<FinalityPromotion> promotions;
    private final long cursorHeight;

    public IngestionBatch(String chain, List<Block> blocks, List<ChainEvent> events,
                          List<FinalityPromotion> promotions, long cursorHeight) {
        this.chain = requireNonEmpty(chain, "chain");
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks == null ? Collections.emptyList() : blocks));
        this.events = Collections.unmodifiableList(new ArrayList<>(events == null ? Collections.emptyList() : events));
        this.promotions = Collections.unmodifiableList(new ArrayList<>(promotions == null ? Collections.emptyList() : promotions));
        this.cursorHeight = cursorHeight;
        for (Block b : this.blocks) {
            if (!chain.equals(b.getChain())) {
                throw new IllegalArgumentException("batch 中的区块不属于链 " + chain + ": " + b);
            }
        }
        for (ChainEvent e : this.events) {
            if (!chain.equals(e.getChain())) {
                throw new IllegalArgumentException("batch 中的事件不属于链 " + chain + ": " + e);
            }
        }
    }

    public String getChain() {
        return chain;
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    public List<ChainEvent> getEvents() {
        return events;
    }

    public List<FinalityPromotion> getPromotions() {
        return promotions;
    }

    public long getCursorHeight() {
        return cursorHeight;
    }

    public boolean hasBlocks() {
        return !blocks.isEmpty();
    }

    public long firstHeight() {
        return blocks.isEmpty() ? cursorHeight : blocks.get(0).getNumber();
    }

    public long lastHeight() {
        return blocks.isEmpty() ? cursorHeight : blocks.get(blocks.size() - 1).getNumber();
    }

    @Override
    public String toString() {
        return "IngestionBatch{" + chain + " [" + firstHeight() + ".." + lastHeight() + "] blocks=" + blocks.size()
                + " events=" + events.size() + " promotions=" + promotions + " cursor=" + cursorHeight + "}";
    }
}
