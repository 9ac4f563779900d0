package com.work.almanac.core.store.redis;

import com.work.almanac.core.model.EntityStateVersion;
import com.work.almanac.core.model.HistoricalState;
import com.work.almanac.core.store.BlockEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class RedisHistoricalStateStoreTest {

    private StringRedisTemplate redis;
    private ZSetOperations<String, String> zset;
    private HashOperations<String, Object, Object> hash;
    private BlockEventStore keyedBlocks;
    private RedisHistoricalStateStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        redis = mock(StringRedisTemplate.class);
        zset = mock(ZSetOperations.class);
        hash = mock(HashOperations.class);
        when(redis.opsForZSet()).thenReturn(zset);
        doReturn(hash).when(redis).opsForHash();
        keyedBlocks = mock(BlockEventStore.class);
        when(keyedBlocks.getCursor("eth")).thenReturn(OptionalLong.of(100));
        store = new RedisHistoricalStateStore(redis, keyedBlocks);
    }

    @Test
    public void versions_beyond_observed_height_are_rejected() {
        boolean ok = store.putVersions("eth", Collections.singletonList(
                new EntityStateVersion("processor", "eth:0xp", "eth", 101, "{}")));

        assertFalse(ok);
        verify(redis, never()).execute(any(SessionCallback.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void versions_within_observed_height_are_written_in_one_transaction() {
        SetOperations<String, String> sets = mock(SetOperations.class);
        when(redis.opsForSet()).thenReturn(sets);
        when(redis.execute(any(SessionCallback.class))).thenAnswer(inv -> {
            SessionCallback<?> callback = inv.getArgument(0);
            return callback.execute(redis);
        });

        boolean ok = store.putVersions("eth", Collections.singletonList(
                new EntityStateVersion("processor", "eth:0xp", "eth", 90, "{}")));

        assertTrue(ok);
        verify(redis, times(1)).execute(any(SessionCallback.class));
        InOrder order = inOrder(redis, zset, hash, sets);
        order.verify(redis).multi();
        order.verify(zset).add(RedisKeys.state("processor", "eth:0xp"), RedisKeys.height(90), 90);
        order.verify(hash).put(RedisKeys.stateData("processor", "eth:0xp"), RedisKeys.height(90), "{}");
        order.verify(sets).add(RedisKeys.stateIndex("eth"), RedisKeys.stateIndexMember("processor", "eth:0xp"));
        order.verify(redis).exec();
    }

    @Test
    public void lookup_returns_latest_version_at_or_below_height() {
        Set<String> hit = new LinkedHashSet<>(Collections.singletonList(RedisKeys.height(42)));
        when(zset.reverseRangeByScore(RedisKeys.state("processor", "eth:0xp"), Double.NEGATIVE_INFINITY, 150, 0, 1)).thenReturn(hit);
        when(hash.get(RedisKeys.stateData("processor", "eth:0xp"), RedisKeys.height(42))).thenReturn("{\"owner\":\"0xo\"}");

        Optional<HistoricalState> s = store.findAsOf("eth", "processor", "eth:0xp", 150);

        assertTrue(s.isPresent());
        assertEquals(42, s.get().getReflectedHeight());
        assertEquals(100, s.get().getObservedHeight());
        assertTrue(s.get().isPossiblyStale());
        assertEquals("{\"owner\":\"0xo\"}", s.get().getVersion().getStateJson());
    }

    @Test
    public void lookup_before_first_version_is_empty() {
        when(zset.reverseRangeByScore(anyString(), anyDouble(), anyDouble(), anyLong(), anyLong())).thenReturn(Collections.emptySet());

        assertFalse(store.findAsOf("eth", "processor", "eth:0xp", 5).isPresent());
    }

    @Test
    public void retract_without_indexed_entities_is_noop() {
        @SuppressWarnings("unchecked")
        SetOperations<String, String> sets = mock(SetOperations.class);
        when(redis.opsForSet()).thenReturn(sets);
        when(sets.members(RedisKeys.stateIndex("eth"))).thenReturn(Collections.emptySet());

        assertEquals(0, store.retractFromHeight("eth", 10));
        verify(redis, never()).execute(any(SessionCallback.class));
    }
}
