package com.work.almanac.indexer.service.message;

import com.work.almanac.core.model.ChainEvent;
import com.work.almanac.core.model.ProcessorPolicy;

/**
 * 解码后的处理器事件。字段按种类可选，source 为原始链上事件。
 */
public class ProcessorEvent {

    private final ProcessorEventKind kind;
    private final ChainEvent source;

    private String processorAddress;
    private String messageId;
    private String targetChain;
    private String sender;
    private String payload;
    private String owner;
    private Long gasUsed;
    private String error;
    private ProcessorPolicy policy = ProcessorPolicy.empty();
    private Boolean paused;

    public ProcessorEvent(ProcessorEventKind kind, ChainEvent source) {
        this.kind = kind;
        this.source = source;
    }

    /**
     * 处理器 id：所在链 + 合约地址。
     */
    public static String processorId(String chain, String address) {
        return chain + ":" + address;
    }

    public String processorId() {
        return processorId(source.getChain(), processorAddress);
    }

    public ProcessorEventKind getKind() {
        return kind;
    }

    public ChainEvent getSource() {
        return source;
    }

    public String getChain() {
        return source.getChain();
    }

    public long getBlockNumber() {
        return source.getBlockNumber();
    }

    public String getTxHash() {
        return source.getTxHash();
    }

    public String getProcessorAddress() {
        return processorAddress;
    }

    public void setProcessorAddress(String processorAddress) {
        this.processorAddress = processorAddress;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
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

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
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

    public ProcessorPolicy getPolicy() {
        return policy;
    }

    public void setPolicy(ProcessorPolicy policy) {
        this.policy = policy == null ? ProcessorPolicy.empty() : policy;
    }

    public Boolean getPaused() {
        return paused;
    }

    public void setPaused(Boolean paused) {
        this.paused = paused;
    }

    @Override
    public String toString() {
        return "ProcessorEvent{" + kind + " event=" + source.getEventId() + " block=" + source.getBlockNumber()
                + (messageId != null ? " message=" + messageId : "")
                + (processorAddress != null ? " processor=" + processorAddress : "") + "}";
    }
}
