package com.work.almanac.core.store.redis;

import com.work.almanac.core.model.BlockStatus;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * keyed 后端不逐块保存状态，而是为每个层级保存一个水位：水位 h 表示高度 &lt;= h 的区块都已达到该层级。
 *
 * 由于终局层级随高度单调（低的区块不会比高的区块更不终局），区块状态 = 水位 &gt;= 高度的最高层级。
 */
public final class KeyedFinalityWatermarks {

    private final EnumMap<BlockStatus, Long> marks = new EnumMap<>(BlockStatus.class);

    public static KeyedFinalityWatermarks fromHash(Map<Object, Object> raw) {
        KeyedFinalityWatermarks w = new KeyedFinalityWatermarks();
        if (raw != null) {
            for (Map.Entry<Object, Object> e : raw.entrySet()) {
                w.marks.put(BlockStatus.fromValue(String.valueOf(e.getKey())), Long.parseLong(String.valueOf(e.getValue())));
            }
        }
        return w;
    }

    /**
     * 抬高水位，返回是否有变化。
     */
    public boolean raise(BlockStatus tier, long height) {
        Long cur = marks.get(tier);
        if (cur == null || cur < height) {
            marks.put(tier, height);
            return true;
        }
        return false;
    }

    /**
     * 撤回：所有水位截断到 fromHeight - 1。
     */
    public boolean truncate(long fromHeight) {
        boolean changed = false;
        for (Map.Entry<BlockStatus, Long> e : marks.entrySet()) {
            if (e.getValue() >= fromHeight) {
                e.setValue(fromHeight - 1);
                changed = true;
            }
        }
        return changed;
    }

    public BlockStatus statusAt(long height) {
        BlockStatus best = BlockStatus.PENDING;
        for (Map.Entry<BlockStatus, Long> e : marks.entrySet()) {
            if (e.getValue() >= height && e.getKey().isAtLeast(best)) {
                best = e.getKey();
            }
        }
        return best;
    }

    /**
     * 状态不低于 min 的最高高度（不超过 maxBlock）。
     */
    public OptionalLong latestAtLeast(BlockStatus min, long maxBlock) {
        long best = -1;
        for (Map.Entry<BlockStatus, Long> e : marks.entrySet()) {
            if (e.getKey().isAtLeast(min)) {
                best = Math.max(best, Math.min(e.getValue(), maxBlock));
            }
        }
        return best < 0 ? OptionalLong.empty() : OptionalLong.of(best);
    }

    public Map<String, String> toHash() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<BlockStatus, Long> e : marks.entrySet()) {
            out.put(e.getKey().getValue(), String.valueOf(e.getValue()));
        }
        return out;
    }
}
