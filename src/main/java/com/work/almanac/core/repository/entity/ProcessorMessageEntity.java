package com.work.almanac.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.work.almanac.core.model.MessageStatus;

import java.time.Instant;

/**
 * 跨链消息。只由 MessageDeliveryEngine / MessageTimeoutSweeper 修改，从不删除。
 */
@TableName("processor_messages")
public class ProcessorMessageEntity {

    @TableId(type = IdType.INPUT)
    private String id;

    private String processorId;

    private String sourceChain;

    private String targetChain;

    private String sender;

    private String payload;

    /**
     * pending / processing / completed / failed / timed_out。
     */
    private String status;

    /**
     * 源链上的提交高度，超时按源链高度计算。
     */
    private Long createdAtBlock;

    private String createdAtTx;

    private Long lastUpdatedBlock;

    private Long processedAtBlock;

    private String processedAtTx;

    private Integer retryCount;

    /**
     * 目标链上允许重试的最早高度；终态或重试额度用尽时为空。
     */
    private Long nextRetryBlock;

    private Long gasUsed;

    private String error;

    private Instant createdAt;

    private Instant updatedAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getProcessorId() {
        return processorId;
    }

    public void setProcessorId(String processorId) {
        this.processorId = processorId;
    }

    public String getSourceChain() {
        return sourceChain;
    }

    public void setSourceChain(String sourceChain) {
        this.sourceChain = sourceChain;
    }

    public String getTargetChain() {
        return targetChain;
    }

    public void setTargetChain(String targetChain) {
        this.targetChain = targetChain;
    }

    public String getSender() {
        return sender;
    }

    public void setSender(String sender) {
        this.sender = sender;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
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

    public Long getProcessedAtBlock() {
        return processedAtBlock;
    }

    public void setProcessedAtBlock(Long processedAtBlock) {
        this.processedAtBlock = processedAtBlock;
    }

    public String getProcessedAtTx() {
        return processedAtTx;
    }

    public void setProcessedAtTx(String processedAtTx) {
        this.processedAtTx = processedAtTx;
    }

    public Integer getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(Integer retryCount) {
        this.retryCount = retryCount;
    }

    public Long getNextRetryBlock() {
        return nextRetryBlock;
    }

    public void setNextRetryBlock(Long nextRetryBlock) {
        this.nextRetryBlock = nextRetryBlock;
    }

    public Long getGasUsed() {
        return gasUsed;
    }

    public void setGasUsed(Long gasUsed) {
        this.gasUsed = gasUsed;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public MessageStatus statusEnum() {
        return MessageStatus.fromValue(status);
    }

    public ProcessorMessageEntity copy() {
        ProcessorMessageEntity c = new ProcessorMessageEntity();
        c.id = id;
        c.processorId = processorId;
        c.sourceChain = sourceChain;
        c.targetChain = targetChain;
        c.sender = sender;
        c.payload = payload;
        c.status = status;
        c.createdAtBlock = createdAtBlock;
        c.createdAtTx = createdAtTx;
        c.lastUpdatedBlock = lastUpdatedBlock;
        c.processedAtBlock = processedAtBlock;
        c.processedAtTx = processedAtTx;
        c.retryCount = retryCount;
        c.nextRetryBlock = nextRetryBlock;
        c.gasUsed = gasUsed;
        c.error = error;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }
}
