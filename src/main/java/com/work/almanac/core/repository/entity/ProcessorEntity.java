package com.work.almanac.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.work.almanac.core.model.ProcessorPolicy;

/**
 * 跨链消息处理器，id = chain:contractAddress。策略字段为空表示使用默认值。
 */
@TableName("processors")
public class ProcessorEntity {

    @TableId(type = IdType.INPUT)
    private String id;

    private String chain;

    private String contractAddress;

    private String owner;

    private Long maxGasPerMessage;

    private Long messageTimeoutBlocks;

    private Long retryIntervalBlocks;

    private Integer maxRetryCount;

    private Boolean paused;

    private Long createdAtBlock;

    private String createdAtTx;

    private Long lastUpdatedBlock;

    private String lastUpdatedTx;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getChain() {
        return chain;
    }

    public void setChain(String chain) {
        this.chain = chain;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public void setContractAddress(String contractAddress) {
        this.contractAddress = contractAddress;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public Long getMaxGasPerMessage() {
        return maxGasPerMessage;
    }

    public void setMaxGasPerMessage(Long maxGasPerMessage) {
        this.maxGasPerMessage = maxGasPerMessage;
    }

    public Long getMessageTimeoutBlocks() {
        return messageTimeoutBlocks;
    }

    public void setMessageTimeoutBlocks(Long messageTimeoutBlocks) {
        this.messageTimeoutBlocks = messageTimeoutBlocks;
    }

    public Long getRetryIntervalBlocks() {
        return retryIntervalBlocks;
    }

    public void setRetryIntervalBlocks(Long retryIntervalBlocks) {
        this.retryIntervalBlocks = retryIntervalBlocks;
    }

    public Integer getMaxRetryCount() {
        return maxRetryCount;
    }

    public void setMaxRetryCount(Integer maxRetryCount) {
        this.maxRetryCount = maxRetryCount;
    }

    public Boolean getPaused() {
        return paused;
    }

    public void setPaused(Boolean paused) {
        this.paused = paused;
    }

    public Long getCreatedAtBlock() {
        return createdAtBlock;
    }

    public void setCreatedAtBlock(Long createdAtBlock) {
        this.createdAtBlock = createdAtBlock;
    }

    public String getCreatedAtTx() {
        return createdAtTx;
    }

    public void setCreatedAtTx(String createdAtTx) {
        this.createdAtTx = createdAtTx;
    }

    public Long getLastUpdatedBlock() {
        return lastUpdatedBlock;
    }

    public void setLastUpdatedBlock(Long lastUpdatedBlock) {
        this.lastUpdatedBlock = lastUpdatedBlock;
    }

    public String getLastUpdatedTx() {
        return lastUpdatedTx;
    }

    public void setLastUpdatedTx(String lastUpdatedTx) {
        this.lastUpdatedTx = lastUpdatedTx;
    }

    public ProcessorPolicy policy() {
        return new ProcessorPolicy(maxGasPerMessage, messageTimeoutBlocks, retryIntervalBlocks, maxRetryCount);
    }

    public boolean isPausedNow() {
        return Boolean.TRUE.equals(paused);
    }

    public ProcessorEntity copy() {
        ProcessorEntity c = new ProcessorEntity();
        c.id = id;
        c.chain = chain;
        c.contractAddress = contractAddress;
        c.owner = owner;
        c.maxGasPerMessage = maxGasPerMessage;
        c.messageTimeoutBlocks = messageTimeoutBlocks;
        c.retryIntervalBlocks = retryIntervalBlocks;
        c.maxRetryCount = maxRetryCount;
        c.paused = paused;
        c.createdAtBlock = createdAtBlock;
        c.createdAtTx = createdAtTx;
        c.lastUpdatedBlock = lastUpdatedBlock;
        c.lastUpdatedTx = lastUpdatedTx;
        return c;
    }
}
