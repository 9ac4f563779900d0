package com.work.almanac.indexer.service.ingest;

import com.work.almanac.core.store.BlockEventStore;
import com.work.almanac.indexer.chain.ChainAdapterRegistry;
import com.work.almanac.indexer.config.IndexerProperties;
import com.work.almanac.indexer.service.finality.FinalityTracker;
import com.work.almanac.indexer.service.message.MessageDeliveryEngine;
import com.work.almanac.indexer.service.message.MessageTimeoutSweeper;
import com.work.almanac.indexer.service.reorg.ReorgRecoveryService;
import com.work.almanac.indexer.support.metrics.IndexerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 每条启用的链一个 {@link ChainIngestionOrchestrator}，随应用启动/停止。
 *
 * batch 提交后先让投递引擎追平事件，再对该链做超时扫描。
 */
@Component
public class IngestionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(IngestionSupervisor.class);

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final Map<String, ChainIngestionOrchestrator> orchestrators = new LinkedHashMap<>();

    public IngestionSupervisor(IndexerProperties props,
                               ChainAdapterRegistry adapters,
                               BlockEventStore store,
                               FinalityTracker finality,
                               ReorgRecoveryService reorg,
                               MessageDeliveryEngine engine,
                               MessageTimeoutSweeper sweeper,
                               IndexerMetrics metrics) {
        List<IngestionListener> listeners = Arrays.asList(engine, sweeper);
        for (IndexerProperties.ChainProperties c : props.enabledChains()) {
            orchestrators.put(c.getId(), new ChainIngestionOrchestrator(c, adapters.get(c.getId()), store,
                    finality, reorg, listeners, props, metrics));
        }
    }

    @PostConstruct
    public void start() {
        for (ChainIngestionOrchestrator o : orchestrators.values()) {
            o.start();
        }
        log.info("ingestion supervisor started chains={}", orchestrators.keySet());
    }

    @PreDestroy
    public void stop() {
        for (ChainIngestionOrchestrator o : orchestrators.values()) {
            o.stop(STOP_TIMEOUT);
        }
    }

    public List<ChainSyncState> states() {
        List<ChainSyncState> out = new ArrayList<>();
        for (ChainIngestionOrchestrator o : orchestrators.values()) {
            out.add(o.state());
        }
        return out;
    }

    public Optional<ChainSyncState> state(String chain) {
        ChainIngestionOrchestrator o = orchestrators.get(chain);
        return o == null ? Optional.empty() : Optional.of(o.state());
    }

    public boolean pause(String chain) {
        ChainIngestionOrchestrator o = orchestrators.get(chain);
        if (o == null) {
            return false;
        }
        o.pause();
        return true;
    }

    public boolean resume(String chain) {
        ChainIngestionOrchestrator o = orchestrators.get(chain);
        if (o == null) {
            return false;
        }
        o.resume();
        return true;
    }

    public boolean restart(String chain) {
        ChainIngestionOrchestrator o = orchestrators.get(chain);
        if (o == null) {
            return false;
        }
        o.restart();
        return true;
    }
}
