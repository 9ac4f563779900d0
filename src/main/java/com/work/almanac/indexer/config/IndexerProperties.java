package com.work.almanac.indexer.config;

import com.work.almanac.core.model.ChainDescriptor;
import com.work.almanac.core.model.FinalityModel;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 索引器配置项（indexer.*）。
 */
@ConfigurationProperties(prefix = "indexer")
public class IndexerProperties {

    /**
     * 被索引的链，每条链一个独立的摄取循环。
     */
    private List<ChainProperties> chains = new ArrayList<>();

    /**
     * 单个周期内链适配器临时错误的最大重试次数，超过后放弃本周期（游标不变）。
     */
    private int fetchMaxAttempts = 5;

    /**
     * 链适配器重试退避的基础间隔。
     */
    private Duration fetchBackoffBase = Duration.ofSeconds(1);

    /**
     * 链适配器重试退避的上限。
     */
    private Duration fetchBackoffMax = Duration.ofSeconds(30);

    private Reorg reorg = new Reorg();

    private Messages messages = new Messages();

    private Keyed keyed = new Keyed();

    public List<ChainProperties> getChains() {
        return chains;
    }

    public void setChains(List<ChainProperties> chains) {
        this.chains = chains;
    }

    public int getFetchMaxAttempts() {
        return fetchMaxAttempts;
    }

    public void setFetchMaxAttempts(int fetchMaxAttempts) {
        this.fetchMaxAttempts = fetchMaxAttempts;
    }

    public Duration getFetchBackoffBase() {
        return fetchBackoffBase;
    }

    public void setFetchBackoffBase(Duration fetchBackoffBase) {
        this.fetchBackoffBase = fetchBackoffBase;
    }

    public Duration getFetchBackoffMax() {
        return fetchBackoffMax;
    }

    public void setFetchBackoffMax(Duration fetchBackoffMax) {
        this.fetchBackoffMax = fetchBackoffMax;
    }

    public Reorg getReorg() {
        return reorg;
    }

    public void setReorg(Reorg reorg) {
        this.reorg = reorg;
    }

    public Messages getMessages() {
        return messages;
    }

    public void setMessages(Messages messages) {
        this.messages = messages;
    }

    public Keyed getKeyed() {
        return keyed;
    }

    public void setKeyed(Keyed keyed) {
        this.keyed = keyed;
    }

    public List<ChainProperties> enabledChains() {
        List<ChainProperties> out = new ArrayList<>();
        for (ChainProperties c : chains) {
            if (c.isEnabled()) {
                out.add(c);
            }
        }
        return out;
    }

    public List<String> enabledChainIds() {
        List<String> out = new ArrayList<>();
        for (ChainProperties c : enabledChains()) {
            out.add(c.getId());
        }
        return out;
    }

    public ChainProperties findChain(String id) {
        for (ChainProperties c : chains) {
            if (c.getId() != null && c.getId().equals(id)) {
                return c;
            }
        }
        return null;
    }

    /**
     * 单条链的配置。
     */
    public static class ChainProperties {

        private String id;

        /**
         * progressive / instant。
         */
        private String finalityModel = "progressive";

        /**
         * progressive 链无外部终局信号时，head - height &gt;= confirmationDepth 即视为 finalized。
         */
        private long confirmationDepth = 12;

        /**
         * 链适配器：mock（内存模拟链）/ web3j（EVM JSON-RPC）。
         */
        private String mode = "mock";

        private String rpcUrl;

        /**
         * 只拉取这些合约地址的日志；为空表示不过滤。
         */
        private List<String> contractAddresses = new ArrayList<>();

        private int batchSize = 100;

        private Duration pollingInterval = Duration.ofSeconds(1);

        /**
         * 存储中没有游标时的起始高度。
         */
        private long startHeight = 0;

        private boolean enabled = true;

        public ChainDescriptor toDescriptor() {
            return new ChainDescriptor(id, FinalityModel.fromValue(finalityModel), confirmationDepth);
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getFinalityModel() {
            return finalityModel;
        }

        public void setFinalityModel(String finalityModel) {
            this.finalityModel = finalityModel;
        }

        public long getConfirmationDepth() {
            return confirmationDepth;
        }

        public void setConfirmationDepth(long confirmationDepth) {
            this.confirmationDepth = confirmationDepth;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getRpcUrl() {
            return rpcUrl;
        }

        public void setRpcUrl(String rpcUrl) {
            this.rpcUrl = rpcUrl;
        }

        public List<String> getContractAddresses() {
            return contractAddresses;
        }

        public void setContractAddresses(List<String> contractAddresses) {
            this.contractAddresses = contractAddresses;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getPollingInterval() {
            return pollingInterval;
        }

        public void setPollingInterval(Duration pollingInterval) {
            this.pollingInterval = pollingInterval;
        }

        public long getStartHeight() {
            return startHeight;
        }

        public void setStartHeight(long startHeight) {
            this.startHeight = startHeight;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Reorg {

        /**
         * 回溯寻找公共祖先的最大深度，超过即视为不可恢复。
         */
        private int maxDepth = 100;

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }
    }

    public static class Messages {

        /**
         * 定时超时扫描周期（每个 batch 之后也会对该链扫描一次）。
         */
        private Duration sweepInterval = Duration.ofSeconds(5);

        private int sweepBatchSize = 200;

        /**
         * 引擎每次从存储拉取事件的页大小。
         */
        private int eventPageSize = 500;

        /**
         * 处理器未配置（或尚未被索引到）时使用的默认策略；为空表示不超时。
         */
        private Long defaultTimeoutBlocks;

        private long defaultRetryIntervalBlocks = 10;

        private int defaultMaxRetryCount = 3;

        /**
         * 处理器策略的进程内缓存有效期。
         */
        private Duration processorCacheTtl = Duration.ofSeconds(30);

        /**
         * 链上事件类型 -&gt; 处理器事件种类（ProcessorEventKind 名称）的额外映射，
         * 未配置的类型按小写种类名识别（如 message_submitted）。
         */
        private Map<String, String> eventTypes = new LinkedHashMap<>();

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public int getSweepBatchSize() {
            return sweepBatchSize;
        }

        public void setSweepBatchSize(int sweepBatchSize) {
            this.sweepBatchSize = sweepBatchSize;
        }

        public int getEventPageSize() {
            return eventPageSize;
        }

        public void setEventPageSize(int eventPageSize) {
            this.eventPageSize = eventPageSize;
        }

        public Long getDefaultTimeoutBlocks() {
            return defaultTimeoutBlocks;
        }

        public void setDefaultTimeoutBlocks(Long defaultTimeoutBlocks) {
            this.defaultTimeoutBlocks = defaultTimeoutBlocks;
        }

        public long getDefaultRetryIntervalBlocks() {
            return defaultRetryIntervalBlocks;
        }

        public void setDefaultRetryIntervalBlocks(long defaultRetryIntervalBlocks) {
            this.defaultRetryIntervalBlocks = defaultRetryIntervalBlocks;
        }

        public int getDefaultMaxRetryCount() {
            return defaultMaxRetryCount;
        }

        public void setDefaultMaxRetryCount(int defaultMaxRetryCount) {
            this.defaultMaxRetryCount = defaultMaxRetryCount;
        }

        public Duration getProcessorCacheTtl() {
            return processorCacheTtl;
        }

        public void setProcessorCacheTtl(Duration processorCacheTtl) {
            this.processorCacheTtl = processorCacheTtl;
        }

        public Map<String, String> getEventTypes() {
            return eventTypes;
        }

        public void setEventTypes(Map<String, String> eventTypes) {
            this.eventTypes = eventTypes;
        }
    }

    public static class Keyed {

        private boolean enabled = true;

        private Duration reconcileInterval = Duration.ofSeconds(10);

        private int reconcileBatchSize = 200;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getReconcileInterval() {
            return reconcileInterval;
        }

        public void setReconcileInterval(Duration reconcileInterval) {
            this.reconcileInterval = reconcileInterval;
        }

        public int getReconcileBatchSize() {
            return reconcileBatchSize;
        }

        public void setReconcileBatchSize(int reconcileBatchSize) {
            this.reconcileBatchSize = reconcileBatchSize;
        }
    }
}
