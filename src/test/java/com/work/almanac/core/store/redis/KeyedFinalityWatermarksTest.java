package com.work.almanac.core.store.redis;

import com.work.almanac.core.model.BlockStatus;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class KeyedFinalityWatermarksTest {

    @Test
    public void status_is_highest_tier_covering_height() {
        KeyedFinalityWatermarks w = new KeyedFinalityWatermarks();
        w.raise(BlockStatus.CONFIRMED, 100);
        w.raise(BlockStatus.SAFE, 95);
        w.raise(BlockStatus.FINALIZED, 88);

        assertEquals(BlockStatus.FINALIZED, w.statusAt(88));
        assertEquals(BlockStatus.SAFE, w.statusAt(89));
        assertEquals(BlockStatus.CONFIRMED, w.statusAt(100));
        assertEquals(BlockStatus.PENDING, w.statusAt(101));
    }

    @Test
    public void raise_never_lowers() {
        KeyedFinalityWatermarks w = new KeyedFinalityWatermarks();
        assertTrue(w.raise(BlockStatus.FINALIZED, 50));
        assertFalse(w.raise(BlockStatus.FINALIZED, 40));
        assertEquals(50, w.latestAtLeast(BlockStatus.FINALIZED, 1000).getAsLong());
    }

    @Test
    public void truncate_caps_all_tiers_below_retracted_height() {
        KeyedFinalityWatermarks w = new KeyedFinalityWatermarks();
        w.raise(BlockStatus.CONFIRMED, 100);
        w.raise(BlockStatus.FINALIZED, 88);

        assertTrue(w.truncate(95));
        assertEquals(94, w.latestAtLeast(BlockStatus.CONFIRMED, 1000).getAsLong());
        assertEquals(88, w.latestAtLeast(BlockStatus.FINALIZED, 1000).getAsLong());
        assertFalse(w.truncate(95));
    }

    @Test
    public void latest_is_bounded_by_stored_blocks() {
        KeyedFinalityWatermarks w = new KeyedFinalityWatermarks();
        w.raise(BlockStatus.FINALIZED, 200);

        assertEquals(120, w.latestAtLeast(BlockStatus.SAFE, 120).getAsLong());
        assertFalse(new KeyedFinalityWatermarks().latestAtLeast(BlockStatus.CONFIRMED, 10).isPresent());
    }

    @Test
    public void hash_form_survives_reload() {
        KeyedFinalityWatermarks w = new KeyedFinalityWatermarks();
        w.raise(BlockStatus.JUSTIFIED, 70);
        Map<Object, Object> raw = new HashMap<>(w.toHash());

        KeyedFinalityWatermarks reloaded = KeyedFinalityWatermarks.fromHash(raw);

        assertEquals(BlockStatus.JUSTIFIED, reloaded.statusAt(70));
        assertEquals("70", raw.get("justified"));
    }

    @Test
    public void height_encoding_sorts_lexicographically() {
        assertTrue(RedisKeys.height(9).compareTo(RedisKeys.height(10)) < 0);
        assertTrue(RedisKeys.height(255).compareTo(RedisKeys.height(4096)) < 0);
        assertEquals(4096L, RedisKeys.parseHeight(RedisKeys.height(4096)));
        assertEquals("almanac:block:eth:000000000000000a", RedisKeys.block("eth", 10));
    }
}
