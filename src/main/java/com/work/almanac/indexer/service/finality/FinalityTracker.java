package com.work.almanac.indexer.service.finality;

import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainDescriptor;
import com.work.almanac.core.model.FinalityPromotion;
import com.work.almanac.core.model.FinalitySignals;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 区块终局判定（无状态，按链的终局模型计算）：
 * - instant：入库即 finalized
 * - progressive + 外部信号：取 "信号高度 &gt;= 区块高度" 的最高层级，否则 confirmed
 * - progressive 无信号：先 confirmed，head - height &gt;= confirmationDepth 后 finalized
 *
 * 只产出目标状态；"只升不降" 由存储的条件更新保证。
 */
@Service
public class FinalityTracker {

    private static final BlockStatus[] SIGNAL_TIERS = {BlockStatus.FINALIZED, BlockStatus.JUSTIFIED, BlockStatus.SAFE};

    /**
     * 单个区块在给定链头与信号下应处的状态。
     */
    public BlockStatus statusFor(ChainDescriptor chain, long height, long head, Optional<FinalitySignals> signals) {
        if (chain.isInstant()) {
            return BlockStatus.FINALIZED;
        }
        if (signals.isPresent()) {
            for (BlockStatus tier : SIGNAL_TIERS) {
                OptionalLong h = signals.get().heightOf(tier);
                if (h.isPresent() && h.getAsLong() >= height) {
                    return tier;
                }
            }
            return BlockStatus.CONFIRMED;
        }
        if (head - height >= chain.getConfirmationDepth()) {
            return BlockStatus.FINALIZED;
        }
        return BlockStatus.CONFIRMED;
    }

    /**
     * 为一批新区块打上状态。
     */
    public List<Block> assign(ChainDescriptor chain, List<Block> blocks, long head, Optional<FinalitySignals> signals) {
        List<Block> out = new ArrayList<>(blocks.size());
        for (Block b : blocks) {
            out.add(b.withStatus(statusFor(chain, b.getNumber(), head, signals)));
        }
        return out;
    }

    /**
     * 已入库区块（高度 &lt;= indexedHeight）应用的终局提升。instant 链入库即终局，无需提升。
     */
    public List<FinalityPromotion> promotions(ChainDescriptor chain, long head, Optional<FinalitySignals> signals, long indexedHeight) {
        if (chain.isInstant() || indexedHeight < 0) {
            return Collections.emptyList();
        }
        List<FinalityPromotion> out = new ArrayList<>();
        if (signals.isPresent()) {
            for (BlockStatus tier : SIGNAL_TIERS) {
                OptionalLong h = signals.get().heightOf(tier);
                if (h.isPresent() && h.getAsLong() >= 0) {
                    out.add(new FinalityPromotion(tier, Math.min(h.getAsLong(), indexedHeight)));
                }
            }
            return out;
        }
        long finalizedUpTo = Math.min(head - chain.getConfirmationDepth(), indexedHeight);
        if (finalizedUpTo >= 0) {
            out.add(new FinalityPromotion(BlockStatus.FINALIZED, finalizedUpTo));
        }
        return out;
    }
}
