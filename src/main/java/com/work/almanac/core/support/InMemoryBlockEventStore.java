package com.work.almanac.core.support;

import com.work.almanac.core.exception.StorageWriteException;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.EntityStateVersion;
import com.work.almanac.core.model.FinalityPromotion;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.model.RetractionResult;
import com.work.almanac.core.store.EventFilter;
import com.work.almanac.core.store.RelationalStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.almanac.core.support.ValidationUtils.requireNonEmpty;
import static com.work.almanac.core.support.ValidationUtils.requireNonNull;

/**
 * 纯内存实现，语义与 PostgresBlockEventStore 一致，方便在没有 Postgres 的环境下演示与测试。
 * 注意：该实现不具备跨进程一致性；每条链一把锁，写入/撤回在锁内整体生效。
 */
public class InMemoryBlockEventStore implements RelationalStore {

    private final Map<String, ChainData> chains = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<Long, EntityStateVersion>> stateHistory = new ConcurrentHashMap<>();

    private static final class ChainData {
        final NavigableMap<Long, Block> blocks = new TreeMap<>();
        final NavigableMap<Long, Map<String, ChainEvent>> events = new TreeMap<>();
        Long cursor;
    }

    private ChainData data(String chain) {
        return chains.computeIfAbsent(chain, key -> new ChainData());
    }

    @Override
    public void putBlocksAndEvents(IngestionBatch batch) {
        requireNonNull(batch, "batch");
        ChainData d = data(batch.getChain());
        synchronized (d) {
            // 先校验，保证失败时不留下半个 batch
            for (Block b : batch.getBlocks()) {
                Block existing = d.blocks.get(b.getNumber());
                if (existing != null && !existing.getHash().equals(b.getHash())) {
                    throw new StorageWriteException("conflicting block chain=" + b.getChain() + " height=" + b.getNumber()
                            + " stored=" + existing.getHash() + " incoming=" + b.getHash());
                }
            }
            for (Block b : batch.getBlocks()) {
                Block existing = d.blocks.get(b.getNumber());
                if (existing == null) {
                    d.blocks.put(b.getNumber(), b);
                } else if (existing.getStatus().isBelow(b.getStatus())) {
                    d.blocks.put(b.getNumber(), existing.withStatus(b.getStatus()));
                }
            }
            for (ChainEvent e : batch.getEvents()) {
                d.events.computeIfAbsent(e.getBlockNumber(), k -> new TreeMap<>()).putIfAbsent(e.getEventId(), e);
            }
            for (FinalityPromotion p : batch.getPromotions()) {
                promoteLocked(d, p);
            }
            d.cursor = batch.getCursorHeight();
        }
    }

    @Override
    public RetractionResult retractFromHeight(String chain, long height) {
        requireNonEmpty(chain, "chain");
        ChainData d = data(chain);
        int blocks;
        int events = 0;
        synchronized (d) {
            NavigableMap<Long, Block> tailBlocks = d.blocks.tailMap(height, true);
            blocks = tailBlocks.size();
            tailBlocks.clear();
            NavigableMap<Long, Map<String, ChainEvent>> tailEvents = d.events.tailMap(height, true);
            for (Map<String, ChainEvent> m : tailEvents.values()) {
                events += m.size();
            }
            tailEvents.clear();
            if (d.cursor != null && d.cursor >= height) {
                d.cursor = height - 1;
            }
            for (NavigableMap<Long, EntityStateVersion> versions : stateHistory.values()) {
                synchronized (versions) {
                    versions.tailMap(height, true).values().removeIf(v -> chain.equals(v.getChain()));
                }
            }
        }
        return new RetractionResult(height, blocks, events);
    }

    @Override
    public int promoteStatus(String chain, FinalityPromotion promotion) {
        ChainData d = data(chain);
        synchronized (d) {
            return promoteLocked(d, promotion);
        }
    }

    private int promoteLocked(ChainData d, FinalityPromotion p) {
        int n = 0;
        for (Map.Entry<Long, Block> entry : d.blocks.headMap(p.getUpToHeight(), true).entrySet()) {
            if (entry.getValue().getStatus().isBelow(p.getTarget())) {
                entry.setValue(entry.getValue().withStatus(p.getTarget()));
                n++;
            }
        }
        return n;
    }

    @Override
    public OptionalLong getLatestBlock(String chain, BlockStatus minStatus) {
        BlockStatus min = minStatus == null ? BlockStatus.PENDING : minStatus;
        ChainData d = data(chain);
        synchronized (d) {
            for (Block b : d.blocks.descendingMap().values()) {
                if (b.getStatus().isAtLeast(min)) {
                    return OptionalLong.of(b.getNumber());
                }
            }
        }
        return OptionalLong.empty();
    }

    @Override
    public OptionalLong getEarliestBlock(String chain) {
        ChainData d = data(chain);
        synchronized (d) {
            return d.blocks.isEmpty() ? OptionalLong.empty() : OptionalLong.of(d.blocks.firstKey());
        }
    }

    @Override
    public Optional<Block> getBlock(String chain, long height) {
        ChainData d = data(chain);
        synchronized (d) {
            return Optional.ofNullable(d.blocks.get(height));
        }
    }

    @Override
    public List<Block> getBlocks(String chain, long fromHeight, long toHeight) {
        ChainData d = data(chain);
        synchronized (d) {
            if (fromHeight > toHeight) {
                return new ArrayList<>();
            }
            return new ArrayList<>(d.blocks.subMap(fromHeight, true, toHeight, true).values());
        }
    }

    @Override
    public List<ChainEvent> getEvents(EventFilter filter) {
        ChainData d = data(filter.getChain());
        List<ChainEvent> matched = new ArrayList<>();
        synchronized (d) {
            for (Map.Entry<Long, Map<String, ChainEvent>> entry : d.events.entrySet()) {
                long h = entry.getKey();
                if (!filter.matchesHeight(h)) {
                    continue;
                }
                if (filter.getMinStatus() != null) {
                    Block b = d.blocks.get(h);
                    if (b == null || !b.getStatus().isAtLeast(filter.getMinStatus())) {
                        continue;
                    }
                }
                for (ChainEvent e : entry.getValue().values()) {
                    if (filter.matchesType(e.getEventType())) {
                        matched.add(e);
                    }
                }
            }
        }
        matched.sort(Comparator.comparingLong(ChainEvent::getBlockNumber).thenComparing(ChainEvent::getEventId));
        int from = Math.min(filter.getOffset(), matched.size());
        int to = Math.min(from + filter.getLimit(), matched.size());
        return new ArrayList<>(matched.subList(from, to));
    }

    @Override
    public OptionalLong getCursor(String chain) {
        ChainData d = data(chain);
        synchronized (d) {
            return d.cursor == null ? OptionalLong.empty() : OptionalLong.of(d.cursor);
        }
    }

    @Override
    public void record(EntityStateVersion version) {
        NavigableMap<Long, EntityStateVersion> versions =
                stateHistory.computeIfAbsent(version.getEntityKind() + ":" + version.getEntityId(), k -> new TreeMap<>());
        synchronized (versions) {
            versions.put(version.getBlockNumber(), version);
        }
    }

    @Override
    public List<EntityStateVersion> listByChainRange(String chain, long fromHeight, long toHeight) {
        List<EntityStateVersion> out = new ArrayList<>();
        for (NavigableMap<Long, EntityStateVersion> versions : stateHistory.values()) {
            synchronized (versions) {
                for (EntityStateVersion v : versions.subMap(fromHeight, true, toHeight, true).values()) {
                    if (chain.equals(v.getChain())) {
                        out.add(v);
                    }
                }
            }
        }
        out.sort(Comparator.comparingLong(EntityStateVersion::getBlockNumber)
                .thenComparing(EntityStateVersion::getEntityKind)
                .thenComparing(EntityStateVersion::getEntityId));
        return out;
    }

    @Override
    public Optional<EntityStateVersion> findLatestAtOrBelow(String entityKind, String entityId, long height) {
        NavigableMap<Long, EntityStateVersion> versions = stateHistory.get(entityKind + ":" + entityId);
        if (versions == null) {
            return Optional.empty();
        }
        synchronized (versions) {
            Map.Entry<Long, EntityStateVersion> e = versions.floorEntry(height);
            return e == null ? Optional.empty() : Optional.of(e.getValue());
        }
    }
}
