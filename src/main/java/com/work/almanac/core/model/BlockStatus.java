package com.work.almanac.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 区块终局状态格：PENDING &lt; CONFIRMED &lt; SAFE &lt; JUSTIFIED &lt; FINALIZED。
 *
 * 数据库与 keyed 存储中保存的是小写的 {@link #getValue()}。
 */
public enum BlockStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    SAFE("safe"),
    JUSTIFIED("justified"),
    FINALIZED("finalized");

    private final String value;

    BlockStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public int rank() {
        return ordinal();
    }

    public boolean isAtLeast(BlockStatus other) {
        return rank() >= other.rank();
    }

    public boolean isBelow(BlockStatus other) {
        return rank() < other.rank();
    }

    public static BlockStatus max(BlockStatus a, BlockStatus b) {
        return a.rank() >= b.rank() ? a : b;
    }

    /**
     * 严格低于 target 的所有状态值，用于 "只升不降" 的条件更新。
     */
    public static List<String> valuesBelow(BlockStatus target) {
        List<String> out = new ArrayList<>();
        for (BlockStatus s : values()) {
            if (s.isBelow(target)) {
                out.add(s.value);
            }
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * 不低于 min 的所有状态值。
     */
    public static List<String> valuesAtLeast(BlockStatus min) {
        List<String> out = new ArrayList<>();
        for (BlockStatus s : values()) {
            if (s.isAtLeast(min)) {
                out.add(s.value);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public static BlockStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status 不能为空");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (BlockStatus s : values()) {
            if (s.value.equals(v)) {
                return s;
            }
        }
        throw new IllegalArgumentException("未知的区块状态: " + value);
    }
}
