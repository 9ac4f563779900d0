package com.work.almanac.indexer.service.finality;

import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainDescriptor;
import com.work.almanac.core.model.FinalityPromotion;
import com.work.almanac.core.model.FinalitySignals;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FinalityTrackerTest {

    private final FinalityTracker tracker = new FinalityTracker();

    @Test
    public void instant_chain_block_is_finalized_immediately() {
        ChainDescriptor cosmos = ChainDescriptor.instant("cosmos");
        assertEquals(BlockStatus.FINALIZED, tracker.statusFor(cosmos, 10, 10, Optional.empty()));
        assertTrue(tracker.promotions(cosmos, 10, Optional.empty(), 10).isEmpty());
    }

    @Test
    public void progressive_without_signals_uses_confirmation_depth() {
        ChainDescriptor eth = ChainDescriptor.progressive("eth", 12);
        assertEquals(BlockStatus.CONFIRMED, tracker.statusFor(eth, 100, 111, Optional.empty()));
        assertEquals(BlockStatus.FINALIZED, tracker.statusFor(eth, 100, 112, Optional.empty()));
    }

    @Test
    public void progressive_with_signals_picks_highest_tier_covering_height() {
        ChainDescriptor eth = ChainDescriptor.progressive("eth", 12);
        Optional<FinalitySignals> s = Optional.of(new FinalitySignals(105L, null, 90L));
        assertEquals(BlockStatus.FINALIZED, tracker.statusFor(eth, 90, 110, s));
        assertEquals(BlockStatus.SAFE, tracker.statusFor(eth, 91, 110, s));
        assertEquals(BlockStatus.SAFE, tracker.statusFor(eth, 105, 110, s));
        assertEquals(BlockStatus.CONFIRMED, tracker.statusFor(eth, 106, 110, s));
    }

    @Test
    public void signals_take_precedence_over_confirmation_depth() {
        ChainDescriptor eth = ChainDescriptor.progressive("eth", 1);
        Optional<FinalitySignals> s = Optional.of(new FinalitySignals(null, null, 50L));
        // 深度早已满足，但信号说 60 还没 finalized
        assertEquals(BlockStatus.CONFIRMED, tracker.statusFor(eth, 60, 200, s));
    }

    @Test
    public void assign_keeps_block_identity_and_sets_status() {
        ChainDescriptor eth = ChainDescriptor.progressive("eth", 2);
        List<Block> in = Arrays.asList(
                new Block("eth", 1, "h1", "h0", 1L, BlockStatus.PENDING),
                new Block("eth", 2, "h2", "h1", 2L, BlockStatus.PENDING),
                new Block("eth", 3, "h3", "h2", 3L, BlockStatus.PENDING));
        List<Block> out = tracker.assign(eth, in, 3, Optional.empty());
        assertEquals(BlockStatus.FINALIZED, out.get(0).getStatus());
        assertEquals(BlockStatus.CONFIRMED, out.get(1).getStatus());
        assertEquals(BlockStatus.CONFIRMED, out.get(2).getStatus());
        assertEquals("h3", out.get(2).getHash());
    }

    @Test
    public void promotions_are_capped_at_indexed_height() {
        ChainDescriptor eth = ChainDescriptor.progressive("eth", 12);
        List<FinalityPromotion> p = tracker.promotions(eth, 200, Optional.empty(), 150);
        assertEquals(1, p.size());
        assertEquals(BlockStatus.FINALIZED, p.get(0).getTarget());
        assertEquals(150, p.get(0).getUpToHeight());

        List<FinalityPromotion> withSignals = tracker.promotions(eth, 200,
                Optional.of(new FinalitySignals(199L, 180L, 170L)), 175);
        assertEquals(3, withSignals.size());
        for (FinalityPromotion fp : withSignals) {
            assertTrue(fp.getUpToHeight() <= 175);
        }
    }

    @Test
    public void no_promotion_before_depth_reached() {
        ChainDescriptor eth = ChainDescriptor.progressive("eth", 12);
        assertTrue(tracker.promotions(eth, 5, Optional.empty(), 5).isEmpty());
    }
}
