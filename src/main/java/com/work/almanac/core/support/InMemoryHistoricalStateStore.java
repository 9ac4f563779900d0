package com.work.almanac.core.support;

import com.work.almanac.core.model.EntityStateVersion;
import com.work.almanac.core.model.HistoricalState;
import com.work.almanac.core.store.BlockEventStore;
import com.work.almanac.core.store.HistoricalStateStore;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 纯内存的 keyed 历史状态实现；已观测高度取自同一 keyed 后端的区块游标。
 */
public class InMemoryHistoricalStateStore implements HistoricalStateStore {

    private final BlockEventStore observedBlocks;
    private final Map<String, NavigableMap<Long, EntityStateVersion>> versions = new ConcurrentHashMap<>();

    public InMemoryHistoricalStateStore(BlockEventStore observedBlocks) {
        this.observedBlocks = observedBlocks;
    }

    @Override
    public boolean putVersions(String chain, List<EntityStateVersion> list) {
        long observed = observedBlocks.getCursor(chain).orElse(-1L);
        for (EntityStateVersion v : list) {
            if (v.getBlockNumber() > observed) {
                return false;
            }
        }
        for (EntityStateVersion v : list) {
            NavigableMap<Long, EntityStateVersion> m = versions.computeIfAbsent(key(v.getEntityKind(), v.getEntityId()), k -> new TreeMap<>());
            synchronized (m) {
                m.put(v.getBlockNumber(), v);
            }
        }
        return true;
    }

    @Override
    public Optional<HistoricalState> findAsOf(String chain, String entityKind, String entityId, long height) {
        NavigableMap<Long, EntityStateVersion> m = versions.get(key(entityKind, entityId));
        if (m == null) {
            return Optional.empty();
        }
        Map.Entry<Long, EntityStateVersion> e;
        synchronized (m) {
            e = m.floorEntry(height);
        }
        if (e == null) {
            return Optional.empty();
        }
        OptionalLong observed = observedBlocks.getCursor(chain);
        return Optional.of(new HistoricalState(e.getValue(), height, observed.orElse(-1L)));
    }

    @Override
    public int retractFromHeight(String chain, long height) {
        int removed = 0;
        for (NavigableMap<Long, EntityStateVersion> m : versions.values()) {
            synchronized (m) {
                int before = m.size();
                m.tailMap(height, true).values().removeIf(v -> chain.equals(v.getChain()));
                removed += before - m.size();
            }
        }
        return removed;
    }

    private static String key(String kind, String id) {
        return kind + ":" + id;
    }
}
