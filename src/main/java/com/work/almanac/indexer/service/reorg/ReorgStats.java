package com.work.almanac.indexer.service.reorg;

import java.util.Map;

/**
 * 单条链的 reorg 统计。
 */
public final class ReorgStats {

    private final String chain;
    private final long total;
    private final long maxDepth;
    private final long blocksRetracted;
    private final long eventsRetracted;

    public ReorgStats(String chain, long total, long maxDepth, long blocksRetracted, long eventsRetracted) {
        this.chain = chain;
        this.total = total;
        this.maxDepth = maxDepth;
        this.blocksRetracted = blocksRetracted;
        this.eventsRetracted = eventsRetracted;
    }

    static ReorgStats fromRow(String chain, Map<String, Object> row) {
        if (row == null) {
            return new ReorgStats(chain, 0, 0, 0, 0);
        }
        return new ReorgStats(chain, num(row.get("total")), num(row.get("max_depth")),
                num(row.get("blocks")), num(row.get("events")));
    }

    private static long num(Object v) {
        return v instanceof Number ? ((Number) v).longValue() : 0L;
    }

    public String getChain() {
        return chain;
    }

    public long getTotal() {
        return total;
    }

    public long getMaxDepth() {
        return maxDepth;
    }

    public long getBlocksRetracted() {
        return blocksRetracted;
    }

    public long getEventsRetracted() {
        return eventsRetracted;
    }
}
