package com.work.almanac.core.store.redis;

/**
 * keyed 后端的 key 布局。高度编码为 16 位定长十六进制，保证字典序与数值序一致。
 *
 * <pre>
 * almanac:blocks:{chain}                  ZSET  member=高度 score=高度
 * almanac:block:{chain}:{height}          HASH  hash / parent / ts
 * almanac:block-events:{chain}:{height}   SET   eventId
 * almanac:event:{eventId}                 STRING 事件 JSON
 * almanac:finality:{chain}                HASH  层级 -&gt; 该层级覆盖到的最高高度
 * almanac:cursor:{chain}                  STRING 已观测高度
 * almanac:state:{kind}:{id}               ZSET  member=高度 score=高度
 * almanac:state-data:{kind}:{id}          HASH  高度 -&gt; 状态 JSON
 * almanac:state-index:{chain}             SET   kind|id
 * </pre>
 */
public final class RedisKeys {

    private static final String PREFIX = "almanac:";

    private RedisKeys() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String height(long height) {
        return String.format("%016x", height);
    }

    public static long parseHeight(String encoded) {
        return Long.parseUnsignedLong(encoded, 16);
    }

    public static String blocks(String chain) {
        return PREFIX + "blocks:" + chain;
    }

    public static String block(String chain, long height) {
        return PREFIX + "block:" + chain + ":" + height(height);
    }

    public static String blockEvents(String chain, long height) {
        return PREFIX + "block-events:" + chain + ":" + height(height);
    }

    public static String event(String eventId) {
        return PREFIX + "event:" + eventId;
    }

    public static String finality(String chain) {
        return PREFIX + "finality:" + chain;
    }

    public static String cursor(String chain) {
        return PREFIX + "cursor:" + chain;
    }

    public static String state(String kind, String id) {
        return PREFIX + "state:" + kind + ":" + id;
    }

    public static String stateData(String kind, String id) {
        return PREFIX + "state-data:" + kind + ":" + id;
    }

    public static String stateIndex(String chain) {
        return PREFIX + "state-index:" + chain;
    }

    public static String stateIndexMember(String kind, String id) {
        return kind + "|" + id;
    }
}
