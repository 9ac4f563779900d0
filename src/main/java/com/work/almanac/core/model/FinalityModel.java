package com.work.almanac.core.model;

import java.util.Locale;

/**
 * 链的终局模型。
 */
public enum FinalityModel {
    /**
     * 区块先 confirmed，随后按 safe / justified / finalized 逐级推进（如 PoS 账户链）。
     */
    PROGRESSIVE,
    /**
     * 区块一经出块即终局（BFT 链）。
     */
    INSTANT;

    public static FinalityModel fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("finalityModel 不能为空");
        }
        return FinalityModel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
