package com.work.almanac.core.chain;

import com.work.almanac.core.model.FinalitySignals;

import java.util.List;
import java.util.Optional;

/**
 * 单条链的读取能力抽象，每条被索引的链一个实例。
 *
 * <p>实现约定：</p>
 * <ul>
 *     <li>临时错误（超时、限流、节点不可用）抛出 {@link com.work.almanac.core.exception.TransientFetchException}</li>
 *     <li>{@link #fetchBlocks(long, long)} 按高度升序返回闭区间内节点当前认为规范的区块</li>
 *     <li>不支持外部终局信号的链返回 {@link Optional#empty()}，由确认深度兜底</li>
 * </ul>
 */
public interface ChainAdapter {

    /**
     * 该适配器服务的链 id。
     */
    String chainId();

    /**
     * 拉取 [fromHeight, toHeight] 的区块与事件。
     */
    List<FetchedBlock> fetchBlocks(long fromHeight, long toHeight);

    /**
     * 当前链头高度。
     */
    long currentHead();

    /**
     * 外部终局信号（可选能力）。
     */
    default Optional<FinalitySignals> finalitySignals() {
        return Optional.empty();
    }
}
