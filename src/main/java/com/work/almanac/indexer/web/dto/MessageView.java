package com.work.almanac.indexer.web.dto;

import java.time.Instant;

/**
 * relayer 轮询用的消息视图。
 */
public class MessageView {

    private String id;
    private String processorId;
    private String sourceChain;
    private String targetChain;
    private String sender;
    private String payload;
    private String status;
    private Long createdAtBlock;
    private String createdAtTx;
    private Long lastUpdatedBlock;
    private Long processedAtBlock;
    private String processedAtTx;
    private Integer retryCount;
    private Long nextRetryBlock;
    private Long gasUsed;
    private String error;
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

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
