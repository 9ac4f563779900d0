package com.work.almanac.indexer.config;

import com.work.almanac.indexer.chain.ChainAdapterRegistry;
import com.work.almanac.indexer.chain.MockChainAdapter;
import com.work.almanac.indexer.chain.web3j.Web3jChainAdapter;
import com.work.almanac.indexer.support.metrics.IndexerMetrics;
import com.work.almanac.indexer.support.metrics.NoopIndexerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * 索引器装配：配置项、指标端口、各链适配器。
 */
@Configuration
@EnableConfigurationProperties(IndexerProperties.class)
public class IndexerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(IndexerConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(IndexerMetrics.class)
    public IndexerMetrics indexerMetrics() {
        return new NoopIndexerMetrics();
    }

    /**
     * 按 indexer.chains[*].mode 为每条启用的链创建适配器：
     * mock 为内存模拟链（每次查询链头出一个块），web3j 走 EVM JSON-RPC。
     * 其他链（如 BFT 链 RPC）可自行声明 ChainAdapterRegistry Bean 覆盖。
     */
    @Bean
    @ConditionalOnMissingBean(ChainAdapterRegistry.class)
    public ChainAdapterRegistry chainAdapterRegistry(IndexerProperties props) {
        ChainAdapterRegistry registry = new ChainAdapterRegistry();
        for (IndexerProperties.ChainProperties c : props.enabledChains()) {
            String mode = c.getMode() == null ? "mock" : c.getMode().trim().toLowerCase();
            switch (mode) {
                case "mock":
                    MockChainAdapter mock = new MockChainAdapter(c.getId());
                    mock.setAutoMine(true);
                    registry.register(mock);
                    break;
                case "web3j":
                    if (c.getRpcUrl() == null || c.getRpcUrl().trim().isEmpty()) {
                        throw new IllegalStateException("indexer.chains[" + c.getId() + "].rpc-url is required for mode=web3j");
                    }
                    Web3j web3j = Web3j.build(new HttpService(c.getRpcUrl()));
                    registry.register(new Web3jChainAdapter(c.getId(), web3j, c.getContractAddresses()));
                    break;
                default:
                    throw new IllegalStateException("unknown chain adapter mode=" + c.getMode() + " chain=" + c.getId());
            }
            log.info("chain adapter configured chain={} mode={} model={}", c.getId(), mode, c.getFinalityModel());
        }
        return registry;
    }
}
