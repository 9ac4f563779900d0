package com.work.almanac.core.store.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.almanac.core.exception.IndexerException;
import com.work.almanac.core.exception.StorageWriteException;
import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.FinalityPromotion;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.model.RetractionResult;
import com.work.almanac.core.store.BlockEventStore;
import com.work.almanac.core.store.EventFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Consumer;

import static com.work.almanac.core.support.ValidationUtils.requireNonEmpty;
import static com.work.almanac.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 Redis 的 keyed 区块/事件存储（key 布局见 {@link RedisKeys}）。
 *
 * 读放在事务外，写统一放进一次 MULTI/EXEC，读者看不到半个 batch。
 * 同一条链的写入由 DualBlockEventStore 串行化，这里不再加锁。
 */
public class RedisBlockEventStore implements BlockEventStore {

    private static final Logger log = LoggerFactory.getLogger(RedisBlockEventStore.class);

    private static final String F_HASH = "hash";
    private static final String F_PARENT = "parent";
    private static final String F_TS = "ts";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisBlockEventStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public void putBlocksAndEvents(IngestionBatch batch) {
        requireNonNull(batch, "batch");
        String chain = batch.getChain();
        try {
            for (Block b : batch.getBlocks()) {
                Object stored = redisTemplate.opsForHash().get(RedisKeys.block(chain, b.getNumber()), F_HASH);
                if (stored != null && !b.getHash().equals(stored)) {
                    throw new StorageWriteException("conflicting keyed block chain=" + chain + " height=" + b.getNumber()
                            + " stored=" + stored + " incoming=" + b.getHash());
                }
            }
            KeyedFinalityWatermarks marks = loadWatermarks(chain);
            for (Block b : batch.getBlocks()) {
                if (b.getStatus() != BlockStatus.PENDING) {
                    marks.raise(b.getStatus(), b.getNumber());
                }
            }
            for (FinalityPromotion p : batch.getPromotions()) {
                marks.raise(p.getTarget(), p.getUpToHeight());
            }
            Map<String, String> eventJson = new LinkedHashMap<>();
            for (ChainEvent e : batch.getEvents()) {
                eventJson.put(e.getEventId(), toJson(e));
            }

            runAtomically(ops -> {
                for (Block b : batch.getBlocks()) {
                    ops.opsForZSet().add(RedisKeys.blocks(chain), RedisKeys.height(b.getNumber()), b.getNumber());
                    Map<String, String> fields = new HashMap<>();
                    fields.put(F_HASH, b.getHash());
                    fields.put(F_PARENT, b.getParentHash() == null ? "" : b.getParentHash());
                    fields.put(F_TS, String.valueOf(b.getTimestamp()));
                    ops.opsForHash().putAll(RedisKeys.block(chain, b.getNumber()), fields);
                }
                for (ChainEvent e : batch.getEvents()) {
                    ops.opsForValue().set(RedisKeys.event(e.getEventId()), eventJson.get(e.getEventId()));
                    ops.opsForSet().add(RedisKeys.blockEvents(chain, e.getBlockNumber()), e.getEventId());
                }
                Map<String, String> wm = marks.toHash();
                if (!wm.isEmpty()) {
                    ops.opsForHash().putAll(RedisKeys.finality(chain), wm);
                }
                ops.opsForValue().set(RedisKeys.cursor(chain), String.valueOf(batch.getCursorHeight()));
            });
        } catch (DataAccessException e) {
            throw new StorageWriteException("keyed write failed chain=" + chain + " batch=" + batch, e);
        }
    }

    @Override
    public RetractionResult retractFromHeight(String chain, long height) {
        requireNonEmpty(chain, "chain");
        try {
            Set<String> members = redisTemplate.opsForZSet().rangeByScore(RedisKeys.blocks(chain), height, Double.POSITIVE_INFINITY);
            List<Long> heights = new ArrayList<>();
            if (members != null) {
                for (String m : members) {
                    heights.add(RedisKeys.parseHeight(m));
                }
            }
            Map<Long, Set<String>> eventsByHeight = new HashMap<>();
            int events = 0;
            for (Long h : heights) {
                Set<String> ids = redisTemplate.opsForSet().members(RedisKeys.blockEvents(chain, h));
                if (ids != null && !ids.isEmpty()) {
                    eventsByHeight.put(h, ids);
                    events += ids.size();
                }
            }
            KeyedFinalityWatermarks marks = loadWatermarks(chain);
            boolean marksChanged = marks.truncate(height);
            String cursor = redisTemplate.opsForValue().get(RedisKeys.cursor(chain));
            boolean rewindCursor = cursor != null && Long.parseLong(cursor) >= height;

            runAtomically(ops -> {
                for (Long h : heights) {
                    Set<String> ids = eventsByHeight.get(h);
                    if (ids != null) {
                        for (String id : ids) {
                            ops.delete(RedisKeys.event(id));
                        }
                    }
                    ops.delete(RedisKeys.blockEvents(chain, h));
                    ops.delete(RedisKeys.block(chain, h));
                }
                ops.opsForZSet().removeRangeByScore(RedisKeys.blocks(chain), height, Double.POSITIVE_INFINITY);
                if (marksChanged) {
                    ops.opsForHash().putAll(RedisKeys.finality(chain), marks.toHash());
                }
                if (rewindCursor) {
                    ops.opsForValue().set(RedisKeys.cursor(chain), String.valueOf(height - 1));
                }
            });
            RetractionResult result = new RetractionResult(height, heights.size(), events);
            log.info("keyed retract chain={} fromHeight={} result={}", chain, height, result);
            return result;
        } catch (DataAccessException e) {
            throw new StorageWriteException("keyed retract failed chain=" + chain + " fromHeight=" + height, e);
        }
    }

    @Override
    public int promoteStatus(String chain, FinalityPromotion promotion) {
        try {
            KeyedFinalityWatermarks marks = loadWatermarks(chain);
            OptionalLong latest = latestHeight(chain);
            if (!latest.isPresent()) {
                return 0;
            }
            long upTo = Math.min(promotion.getUpToHeight(), latest.getAsLong());
            if (!marks.raise(promotion.getTarget(), upTo)) {
                return 0;
            }
            redisTemplate.opsForHash().putAll(RedisKeys.finality(chain), marks.toHash());
            return 1;
        } catch (DataAccessException e) {
            throw new StorageWriteException("keyed promote failed chain=" + chain + " promotion=" + promotion, e);
        }
    }

    @Override
    public OptionalLong getLatestBlock(String chain, BlockStatus minStatus) {
        OptionalLong latest = latestHeight(chain);
        if (!latest.isPresent() || minStatus == null || minStatus == BlockStatus.PENDING) {
            return latest;
        }
        return loadWatermarks(chain).latestAtLeast(minStatus, latest.getAsLong());
    }

    @Override
    public OptionalLong getEarliestBlock(String chain) {
        Set<String> first = redisTemplate.opsForZSet().range(RedisKeys.blocks(chain), 0, 0);
        if (first == null || first.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(RedisKeys.parseHeight(first.iterator().next()));
    }

    @Override
    public Optional<Block> getBlock(String chain, long height) {
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(RedisKeys.block(chain, height));
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toBlock(chain, height, fields, loadWatermarks(chain)));
    }

    @Override
    public List<Block> getBlocks(String chain, long fromHeight, long toHeight) {
        List<Block> out = new ArrayList<>();
        if (fromHeight > toHeight) {
            return out;
        }
        Set<String> members = redisTemplate.opsForZSet().rangeByScore(RedisKeys.blocks(chain), fromHeight, toHeight);
        if (members == null) {
            return out;
        }
        KeyedFinalityWatermarks marks = loadWatermarks(chain);
        for (String m : members) {
            long h = RedisKeys.parseHeight(m);
            Map<Object, Object> fields = redisTemplate.opsForHash().entries(RedisKeys.block(chain, h));
            if (fields != null && !fields.isEmpty()) {
                out.add(toBlock(chain, h, fields, marks));
            }
        }
        return out;
    }

    @Override
    public List<ChainEvent> getEvents(EventFilter filter) {
        double min = filter.getFromHeight() == null ? Double.NEGATIVE_INFINITY : filter.getFromHeight();
        double max = filter.getToHeight() == null ? Double.POSITIVE_INFINITY : filter.getToHeight();
        Set<String> members = redisTemplate.opsForZSet().rangeByScore(RedisKeys.blocks(filter.getChain()), min, max);
        List<ChainEvent> matched = new ArrayList<>();
        if (members == null) {
            return matched;
        }
        KeyedFinalityWatermarks marks = filter.getMinStatus() == null ? null : loadWatermarks(filter.getChain());
        int needed = filter.getOffset() + filter.getLimit();
        for (String m : members) {
            long h = RedisKeys.parseHeight(m);
            if (marks != null && !marks.statusAt(h).isAtLeast(filter.getMinStatus())) {
                continue;
            }
            Set<String> ids = redisTemplate.opsForSet().members(RedisKeys.blockEvents(filter.getChain(), h));
            if (ids == null || ids.isEmpty()) {
                continue;
            }
            List<ChainEvent> inBlock = new ArrayList<>();
            for (String id : ids) {
                String json = redisTemplate.opsForValue().get(RedisKeys.event(id));
                if (json == null) {
                    continue;
                }
                ChainEvent e = fromJson(json);
                if (filter.matchesType(e.getEventType())) {
                    inBlock.add(e);
                }
            }
            inBlock.sort(Comparator.comparing(ChainEvent::getEventId));
            matched.addAll(inBlock);
            if (matched.size() >= needed) {
                break;
            }
        }
        int from = Math.min(filter.getOffset(), matched.size());
        int to = Math.min(from + filter.getLimit(), matched.size());
        return new ArrayList<>(matched.subList(from, to));
    }

    @Override
    public OptionalLong getCursor(String chain) {
        String v = redisTemplate.opsForValue().get(RedisKeys.cursor(chain));
        return v == null ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(v));
    }

    private OptionalLong latestHeight(String chain) {
        Set<String> last = redisTemplate.opsForZSet().reverseRange(RedisKeys.blocks(chain), 0, 0);
        if (last == null || last.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(RedisKeys.parseHeight(last.iterator().next()));
    }

    private KeyedFinalityWatermarks loadWatermarks(String chain) {
        return KeyedFinalityWatermarks.fromHash(redisTemplate.opsForHash().entries(RedisKeys.finality(chain)));
    }

    private void runAtomically(Consumer<RedisOperations<String, String>> writes) {
        redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                // 回调期间连接绑定在当前线程，经 redisTemplate 发出的命令与 operations 同属一个 MULTI
                operations.multi();
                writes.accept(redisTemplate);
                return operations.exec();
            }
        });
    }

    private static Block toBlock(String chain, long height, Map<Object, Object> fields, KeyedFinalityWatermarks marks) {
        String parent = (String) fields.get(F_PARENT);
        Object ts = fields.get(F_TS);
        return new Block(chain, height, (String) fields.get(F_HASH),
                parent == null || parent.isEmpty() ? null : parent,
                ts == null ? 0L : Long.parseLong(ts.toString()),
                marks.statusAt(height));
    }

    private String toJson(ChainEvent e) {
        KeyedEventRecord r = new KeyedEventRecord();
        r.setEventId(e.getEventId());
        r.setChain(e.getChain());
        r.setBlockNumber(e.getBlockNumber());
        r.setBlockHash(e.getBlockHash());
        r.setTxHash(e.getTxHash());
        r.setTimestamp(e.getTimestamp());
        r.setEventType(e.getEventType());
        r.setRawData(e.getRawData());
        try {
            return objectMapper.writeValueAsString(r);
        } catch (JsonProcessingException ex) {
            throw new IndexerException("序列化事件失败 eventId=" + e.getEventId(), ex);
        }
    }

    private ChainEvent fromJson(String json) {
        try {
            KeyedEventRecord r = objectMapper.readValue(json, KeyedEventRecord.class);
            return new ChainEvent(r.getEventId(), r.getChain(), r.getBlockNumber(), r.getBlockHash(), r.getTxHash(),
                    r.getTimestamp(), r.getEventType(), r.getRawData());
        } catch (JsonProcessingException ex) {
            throw new IndexerException("反序列化事件失败", ex);
        }
    }
}
