package com.work.almanac.indexer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.almanac.core.repository.impl.PostgresBlockEventStore;
import com.work.almanac.core.store.DualBlockEventStore;
import com.work.almanac.core.store.KeyedStoreReconciler;
import com.work.almanac.core.store.redis.RedisBlockEventStore;
import com.work.almanac.core.store.redis.RedisHistoricalStateStore;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 存储装配：PostgreSQL 为事实来源，Redis 为 keyed 后端（indexer.keyed.enabled=false 时只用关系型）。
 */
@Configuration
@MapperScan("com.work.almanac.core.repository.mapper")
public class StoreConfiguration {

    @Bean
    @Primary
    public DualBlockEventStore blockEventStore(PostgresBlockEventStore relational,
                                               ObjectProvider<StringRedisTemplate> redisTemplate,
                                               ObjectMapper objectMapper,
                                               IndexerProperties props) {
        if (!props.getKeyed().isEnabled()) {
            return DualBlockEventStore.relationalOnly(relational);
        }
        StringRedisTemplate redis = redisTemplate.getObject();
        RedisBlockEventStore keyedBlocks = new RedisBlockEventStore(redis, objectMapper);
        return new DualBlockEventStore(relational, keyedBlocks, new RedisHistoricalStateStore(redis, keyedBlocks));
    }

    @Bean
    @ConditionalOnProperty(prefix = "indexer.keyed", name = "enabled", havingValue = "true", matchIfMissing = true)
    public KeyedStoreReconciler keyedStoreReconciler(DualBlockEventStore store, IndexerProperties props) {
        return new KeyedStoreReconciler(store, props.enabledChainIds(), props.getKeyed().getReconcileBatchSize());
    }
}
