package com.work.almanac.core.store.redis;

import com.work.almanac.core.exception.StorageWriteException;
import com.work.almanac.core.model.EntityStateVersion;
import com.work.almanac.core.model.HistoricalState;
import com.work.almanac.core.store.BlockEventStore;
import com.work.almanac.core.store.HistoricalStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 基于 Redis 的历史状态存储：每个实体一个按高度打分的 ZSET，"截至高度 N 的状态" 是一次逆序范围扫描。
 *
 * 已观测高度取自 keyed 区块游标（{@link RedisBlockEventStore#getCursor(String)}），
 * 超出已观测高度的版本一律拒绝写入，由 KeyedStoreReconciler 在区块追上后重放。
 */
public class RedisHistoricalStateStore implements HistoricalStateStore {

    private static final Logger log = LoggerFactory.getLogger(RedisHistoricalStateStore.class);

    private final StringRedisTemplate redisTemplate;
    private final BlockEventStore keyedBlocks;

    public RedisHistoricalStateStore(StringRedisTemplate redisTemplate, BlockEventStore keyedBlocks) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.keyedBlocks = Objects.requireNonNull(keyedBlocks, "keyedBlocks");
    }

    @Override
    public boolean putVersions(String chain, List<EntityStateVersion> versions) {
        if (versions == null || versions.isEmpty()) {
            return true;
        }
        long observed = keyedBlocks.getCursor(chain).orElse(-1L);
        for (EntityStateVersion v : versions) {
            if (v.getBlockNumber() > observed) {
                log.debug("keyed state version ahead of observed height chain={} version={} observed={}", chain, v, observed);
                return false;
            }
        }
        try {
            redisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                    // 回调期间连接绑定在当前线程，经 redisTemplate 发出的命令与 operations 同属一个 MULTI
                    RedisOperations<String, String> ops = redisTemplate;
                    operations.multi();
                    for (EntityStateVersion v : versions) {
                        String h = RedisKeys.height(v.getBlockNumber());
                        ops.opsForZSet().add(RedisKeys.state(v.getEntityKind(), v.getEntityId()), h, v.getBlockNumber());
                        ops.opsForHash().put(RedisKeys.stateData(v.getEntityKind(), v.getEntityId()), h, v.getStateJson());
                        ops.opsForSet().add(RedisKeys.stateIndex(chain), RedisKeys.stateIndexMember(v.getEntityKind(), v.getEntityId()));
                    }
                    return operations.exec();
                }
            });
            return true;
        } catch (DataAccessException e) {
            throw new StorageWriteException("keyed state write failed chain=" + chain, e);
        }
    }

    @Override
    public Optional<HistoricalState> findAsOf(String chain, String entityKind, String entityId, long height) {
        Set<String> hit = redisTemplate.opsForZSet()
                .reverseRangeByScore(RedisKeys.state(entityKind, entityId), Double.NEGATIVE_INFINITY, height, 0, 1);
        if (hit == null || hit.isEmpty()) {
            return Optional.empty();
        }
        String encoded = hit.iterator().next();
        Object json = redisTemplate.opsForHash().get(RedisKeys.stateData(entityKind, entityId), encoded);
        if (json == null) {
            return Optional.empty();
        }
        EntityStateVersion v = new EntityStateVersion(entityKind, entityId, chain, RedisKeys.parseHeight(encoded), json.toString());
        long observed = keyedBlocks.getCursor(chain).orElse(-1L);
        return Optional.of(new HistoricalState(v, height, observed));
    }

    @Override
    public int retractFromHeight(String chain, long height) {
        try {
            Set<String> index = redisTemplate.opsForSet().members(RedisKeys.stateIndex(chain));
            if (index == null || index.isEmpty()) {
                return 0;
            }
            Map<String, List<String>> doomed = new LinkedHashMap<>();
            int total = 0;
            for (String member : index) {
                int sep = member.indexOf('|');
                String kind = member.substring(0, sep);
                String id = member.substring(sep + 1);
                Set<String> heights = redisTemplate.opsForZSet()
                        .rangeByScore(RedisKeys.state(kind, id), height, Double.POSITIVE_INFINITY);
                if (heights != null && !heights.isEmpty()) {
                    doomed.put(member, new ArrayList<>(heights));
                    total += heights.size();
                }
            }
            if (doomed.isEmpty()) {
                return 0;
            }
            redisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                    // 回调期间连接绑定在当前线程，经 redisTemplate 发出的命令与 operations 同属一个 MULTI
                    RedisOperations<String, String> ops = redisTemplate;
                    operations.multi();
                    for (Map.Entry<String, List<String>> e : doomed.entrySet()) {
                        int sep = e.getKey().indexOf('|');
                        String kind = e.getKey().substring(0, sep);
                        String id = e.getKey().substring(sep + 1);
                        ops.opsForZSet().removeRangeByScore(RedisKeys.state(kind, id), height, Double.POSITIVE_INFINITY);
                        ops.opsForHash().delete(RedisKeys.stateData(kind, id), e.getValue().toArray());
                    }
                    return operations.exec();
                }
            });
            log.info("keyed state retract chain={} fromHeight={} versions={}", chain, height, total);
            return total;
        } catch (DataAccessException e) {
            throw new StorageWriteException("keyed state retract failed chain=" + chain + " fromHeight=" + height, e);
        }
    }
}
