package com.work.almanac.core.store;

import com.work.almanac.core.model.BlockStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.work.almanac.core.support.ValidationUtils.requireNonEmpty;

/**
 * 事件查询条件。结果按 (blockNumber, eventId) 升序返回。
 */
public final class EventFilter {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 10_000;

    private final String chain;
    private final Long fromHeight;
    private final Long toHeight;
    private final List<String> eventTypes;
    private final BlockStatus minStatus;
    private final int limit;
    private final int offset;

    private EventFilter(Builder b) {
        this.chain = requireNonEmpty(b.chain, "chain");
        this.fromHeight = b.fromHeight;
        this.toHeight = b.toHeight;
        this.eventTypes = Collections.unmodifiableList(new ArrayList<>(b.eventTypes));
        this.minStatus = b.minStatus;
        this.limit = Math.max(1, Math.min(MAX_LIMIT, b.limit));
        this.offset = Math.max(0, b.offset);
        if (fromHeight != null && toHeight != null && fromHeight > toHeight) {
            throw new IllegalArgumentException("fromHeight 不能大于 toHeight");
        }
    }

    public static Builder forChain(String chain) {
        return new Builder(chain);
    }

    public String getChain() {
        return chain;
    }

    public Long getFromHeight() {
        return fromHeight;
    }

    public Long getToHeight() {
        return toHeight;
    }

    public List<String> getEventTypes() {
        return eventTypes;
    }

    public BlockStatus getMinStatus() {
        return minStatus;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    public boolean matchesHeight(long height) {
        return (fromHeight == null || height >= fromHeight) && (toHeight == null || height <= toHeight);
    }

    public boolean matchesType(String eventType) {
        return eventTypes.isEmpty() || eventTypes.contains(eventType);
    }

    public static final class Builder {
        private final String chain;
        private Long fromHeight;
        private Long toHeight;
        private final List<String> eventTypes = new ArrayList<>();
        private BlockStatus minStatus;
        private int limit = DEFAULT_LIMIT;
        private int offset;

        private Builder(String chain) {
            this.chain = chain;
        }

        public Builder fromHeight(Long fromHeight) {
            this.fromHeight = fromHeight;
            return this;
        }

        public Builder toHeight(Long toHeight) {
            this.toHeight = toHeight;
            return this;
        }

        public Builder range(long from, long to) {
            this.fromHeight = from;
            this.toHeight = to;
            return this;
        }

        public Builder eventTypes(List<String> types) {
            if (types != null) {
                this.eventTypes.addAll(types);
            }
            return this;
        }

        public Builder minStatus(BlockStatus minStatus) {
            this.minStatus = minStatus;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public EventFilter build() {
            return new EventFilter(this);
        }
    }
}
