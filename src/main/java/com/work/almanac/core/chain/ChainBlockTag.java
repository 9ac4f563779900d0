package com.work.almanac.core.chain;

import com.work.almanac.core.model.BlockStatus;

/**
 * 节点通过区块 tag 上报的终局层级。适配器按 tag 查询区块高度，拼成 {@link com.work.almanac.core.model.FinalitySignals}。
 *
 * <p>节点不认识某个 tag 时该层级视为未上报，由 {@link ChainAdapter} 实现决定是否整体退回确认深度。</p>
 */
public enum ChainBlockTag {
    SAFE("safe", BlockStatus.SAFE),
    FINALIZED("finalized", BlockStatus.FINALIZED);

    private final String value;
    private final BlockStatus tier;

    ChainBlockTag(String value, BlockStatus tier) {
        this.value = value;
        this.tier = tier;
    }

    public String getValue() {
        return value;
    }

    public BlockStatus getTier() {
        return tier;
    }
}
