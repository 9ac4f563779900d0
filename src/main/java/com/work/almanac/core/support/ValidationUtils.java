package com.work.almanac.core.support;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑。
 */
public final class ValidationUtils {

    /**
     * chainId 合法字符集与长度限制：字母、数字以及少量分隔符，长度 1~64。
     * 冒号不允许出现，因为它是 processor id / keyed 存储 key 的分隔符。
     */
    private static final Pattern CHAIN_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]{1,64}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    public static long requirePositive(long value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return value;
    }

    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    public static String requireValidChainId(String chainId) {
        requireNonEmpty(chainId, "chainId");
        if (!CHAIN_ID_PATTERN.matcher(chainId).matches()) {
            throw new IllegalArgumentException("chainId 非法，只允许 1~64 位的字母、数字、'.'、'_'、'-'");
        }
        return chainId;
    }
}
