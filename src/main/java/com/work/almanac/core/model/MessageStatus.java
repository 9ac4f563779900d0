package com.work.almanac.core.model;

import java.util.Locale;

/**
 * 跨链消息状态。COMPLETED / TIMED_OUT 为终态；FAILED 在重试额度用尽前可回到 PROCESSING。
 */
public enum MessageStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    TIMED_OUT("timed_out");

    private final String value;

    MessageStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT;
    }

    public static MessageStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status 不能为空");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (MessageStatus s : values()) {
            if (s.value.equals(v)) {
                return s;
            }
        }
        throw new IllegalArgumentException("未知的消息状态: " + value);
    }
}
