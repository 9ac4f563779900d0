package com.work.almanac.indexer.service.message;

import com.work.almanac.core.model.ProcessorPolicy;
import com.work.almanac.core.repository.entity.ProcessorMessageEntity;
import com.work.almanac.core.store.BlockEventStore;
import com.work.almanac.core.store.MessageRepository;
import com.work.almanac.indexer.config.IndexerProperties;
import com.work.almanac.indexer.service.ingest.IngestionListener;
import com.work.almanac.indexer.support.metrics.IndexerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 消息超时扫描：current(sourceChain) - createdAtBlock &gt; messageTimeoutBlocks 的非终态消息置为 timed_out。
 *
 * 每个 batch 提交后对该链扫描一次，另有定时全量扫描兜底。
 * 强制迁移是条件更新（只对非终态生效），与并发的 completed 竞争时以先提交者为准。
 */
@Service
public class MessageTimeoutSweeper implements IngestionListener {

    private static final Logger log = LoggerFactory.getLogger(MessageTimeoutSweeper.class);

    private final BlockEventStore store;
    private final MessageRepository repository;
    private final ProcessorPolicyResolver policies;
    private final IndexerProperties props;
    private final IndexerMetrics metrics;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MessageTimeoutSweeper(BlockEventStore store,
                                 MessageRepository repository,
                                 ProcessorPolicyResolver policies,
                                 IndexerProperties props,
                                 IndexerMetrics metrics) {
        this.store = store;
        this.repository = repository;
        this.policies = policies;
        this.props = props;
        this.metrics = metrics;
    }

    @Override
    public void onBatchCommitted(String chain, long cursorHeight) {
        sweepChain(chain);
    }

    @Scheduled(fixedDelayString = "${indexer.messages.sweep-interval:PT5S}")
    public void sweepAll() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            for (String chain : props.enabledChainIds()) {
                try {
                    sweepChain(chain);
                } catch (Exception e) {
                    log.warn("timeout sweep error chain={} err={}", chain, e.toString());
                }
            }
        } finally {
            running.set(false);
        }
    }

    /**
     * 扫描源链为 sourceChain 的非终态消息，返回本轮超时的条数。
     */
    public int sweepChain(String sourceChain) {
        OptionalLong current = store.getCursor(sourceChain);
        if (!current.isPresent()) {
            return 0;
        }
        long height = current.getAsLong();
        int limit = Math.max(1, props.getMessages().getSweepBatchSize());
        int timedOut = 0;
        String afterId = "";
        while (true) {
            List<ProcessorMessageEntity> page = repository.listNonTerminalBySource(sourceChain, afterId, limit);
            for (ProcessorMessageEntity m : page) {
                if (isExpired(m, height) && timeOut(m, height)) {
                    timedOut++;
                }
            }
            if (page.size() < limit) {
                break;
            }
            afterId = page.get(page.size() - 1).getId();
        }
        if (timedOut > 0) {
            log.info("messages timed out chain={} height={} count={}", sourceChain, height, timedOut);
        }
        return timedOut;
    }

    private boolean isExpired(ProcessorMessageEntity m, long currentHeight) {
        ProcessorPolicy policy = policies.policyFor(m.getProcessorId());
        Long timeout = policy.getMessageTimeoutBlocks();
        if (timeout == null || m.getCreatedAtBlock() == null) {
            return false;
        }
        return currentHeight - m.getCreatedAtBlock() > timeout;
    }

    private boolean timeOut(ProcessorMessageEntity m, long currentHeight) {
        String reason = "timed out: " + (currentHeight - m.getCreatedAtBlock()) + " blocks since submission at " + m.getCreatedAtBlock();
        boolean ok = repository.markTimedOut(m.getId(), currentHeight, reason);
        if (ok) {
            metrics.messageTransition(m.getStatus(), "timed_out");
            log.info("message timed out id={} status={} createdAt={} current={}", m.getId(), m.getStatus(), m.getCreatedAtBlock(), currentHeight);
        }
        return ok;
    }
}
