package com.work.almanac.core.store;

import com.work.almanac.core.model.Block;
import com.work.almanac.core.model.BlockStatus;
import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.FinalityPromotion;
import com.work.almanac.core.model.IngestionBatch;
import com.work.almanac.core.model.RetractionResult;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 区块/事件存储的后端无关契约。
 *
 * <p>不变量：</p>
 * <ul>
 *     <li>写入与撤回对读者是原子的，读者看不到半个 batch</li>
 *     <li>按 (chain, blockNumber) / eventId 幂等，重复写入同一 batch 无副作用</li>
 *     <li>区块状态只升不降</li>
 * </ul>
 */
public interface BlockEventStore {

    /**
     * 原子写入区块、事件、终局提升并推进游标。
     */
    void putBlocksAndEvents(IngestionBatch batch);

    /**
     * 原子删除 height 及以上的区块与事件；若游标 &gt;= height 则重置为 height - 1。
     */
    RetractionResult retractFromHeight(String chain, long height);

    /**
     * 对已存储区块应用终局提升（只升不降），返回实际被提升的区块数。
     */
    int promoteStatus(String chain, FinalityPromotion promotion);

    /**
     * 状态不低于 minStatus 的最高区块高度。
     */
    OptionalLong getLatestBlock(String chain, BlockStatus minStatus);

    OptionalLong getEarliestBlock(String chain);

    Optional<Block> getBlock(String chain, long height);

    /**
     * [fromHeight, toHeight] 内的区块，按高度升序。
     */
    List<Block> getBlocks(String chain, long fromHeight, long toHeight);

    List<ChainEvent> getEvents(EventFilter filter);

    /**
     * 最后一个已索引高度。
     */
    OptionalLong getCursor(String chain);
}
