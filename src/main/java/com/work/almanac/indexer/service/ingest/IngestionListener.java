package com.work.almanac.indexer.service.ingest;

/**
 * 摄取结果的观察者。回调发生在存储写入提交之后，回调失败不影响摄取本身。
 */
public interface IngestionListener {

    /**
     * 一批区块已提交，链游标推进到 cursorHeight。
     */
    void onBatchCommitted(String chain, long cursorHeight);

    /**
     * reorg 恢复已撤回 ancestorHeight 之上的全部数据。
     */
    default void onRetracted(String chain, long ancestorHeight) {
    }
}
