package com.work.almanac.indexer.service.message;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.almanac.core.model.ProcessorPolicy;
import com.work.almanac.core.repository.entity.ProcessorEntity;
import com.work.almanac.core.store.MessageRepository;
import com.work.almanac.indexer.config.IndexerProperties;
import org.springframework.stereotype.Component;

/**
 * 处理器的生效策略（处理器自身配置覆盖默认值）与暂停状态。
 *
 * 处理器行通过 Caffeine 做进程内缓存，生命周期事件落库后立即 invalidate。
 * 未知处理器不缓存，下次仍回源。
 */
@Component
public class ProcessorPolicyResolver {

    private final MessageRepository repository;
    private final ProcessorPolicy defaults;
    private final Cache<String, ProcessorEntity> cache;

    public ProcessorPolicyResolver(MessageRepository repository, IndexerProperties props) {
        this.repository = repository;
        IndexerProperties.Messages m = props.getMessages();
        this.defaults = new ProcessorPolicy(null, m.getDefaultTimeoutBlocks(),
                m.getDefaultRetryIntervalBlocks(), m.getDefaultMaxRetryCount());
        this.cache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(m.getProcessorCacheTtl())
                .build();
    }

    public ProcessorEntity processor(String processorId) {
        if (processorId == null) {
            return null;
        }
        ProcessorEntity p = cache.get(processorId, repository::findProcessor);
        return p == null ? null : p.copy();
    }

    public ProcessorPolicy policyFor(String processorId) {
        ProcessorEntity p = processor(processorId);
        return p == null ? defaults : defaults.merge(p.policy());
    }

    public boolean isPaused(String processorId) {
        ProcessorEntity p = processor(processorId);
        return p != null && p.isPausedNow();
    }

    public void invalidate(String processorId) {
        cache.invalidate(processorId);
    }

    public ProcessorPolicy defaults() {
        return defaults;
    }
}
