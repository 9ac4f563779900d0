package com.work.almanac.core.repository.entity;

import com.baomidou.mybatisplus.annotation.TableName;

/**
 * 区块表实体，主键 (chain, block_number)。
 */
@TableName("blocks")
public class BlockEntity {

    private String chain;

    private Long blockNumber;

    private String blockHash;

    private String parentHash;

    /**
     * 区块时间（秒）。
     */
    private Long timestamp;

    /**
     * pending / confirmed / safe / justified / finalized。
     */
    private String status;

    public String getChain() {
        return chain;
    }

    public void setChain(String chain) {
        this.chain = chain;
    }

    public Long getBlockNumber() {
        return blockNumber;
    }

    public void setBlockNumber(Long blockNumber) {
        this.blockNumber = blockNumber;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public void setBlockHash(String blockHash) {
        this.blockHash = blockHash;
    }

    public String getParentHash() {
        return parentHash;
    }

    public void setParentHash(String parentHash) {
        this.parentHash = parentHash;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Long timestamp) {
        this.timestamp = timestamp;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
