package com.work.almanac.indexer.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；平台侧可通过自定义 Bean 接入具体实现。
 */
public interface IndexerMetrics {

    default void batchIndexed(String chain, int blocks, int events) {
    }

    default void fetchRetry(String chain, int attempt) {
    }

    default void storageWriteFailed(String chain) {
    }

    default void reorgRecovered(String chain, int depth) {
    }

    default void chainHalted(String chain, String reason) {
    }

    default void finalityPromoted(String chain, String tier, int blocks) {
    }

    default void messageTransition(String from, String to) {
    }

    default void messagePolicyViolation(String reason) {
    }

    default void keyedLagging(String chain, long lagBlocks) {
    }
}
