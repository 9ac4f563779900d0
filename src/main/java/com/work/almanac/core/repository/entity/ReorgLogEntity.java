package com.work.almanac.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * reorg 恢复记录。
 */
@TableName("reorg_log")
public class ReorgLogEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String chain;

    /**
     * 发现 parentHash 不连续的高度。
     */
    private Long detectedAt;

    private Long ancestorHeight;

    private Integer depth;

    private Integer blocksRetracted;

    private Integer eventsRetracted;

    private Instant createdAt;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getChain() {
        return chain;
    }

    public void setChain(String chain) {
        this.chain = chain;
    }

    public Long getDetectedAt() {
        return detectedAt;
    }

    public void setDetectedAt(Long detectedAt) {
        this.detectedAt = detectedAt;
    }

    public Long getAncestorHeight() {
        return ancestorHeight;
    }

    public void setAncestorHeight(Long ancestorHeight) {
        this.ancestorHeight = ancestorHeight;
    }

    public Integer getDepth() {
        return depth;
    }

    public void setDepth(Integer depth) {
        this.depth = depth;
    }

    public Integer getBlocksRetracted() {
        return blocksRetracted;
    }

    public void setBlocksRetracted(Integer blocksRetracted) {
        this.blocksRetracted = blocksRetracted;
    }

    public Integer getEventsRetracted() {
        return eventsRetracted;
    }

    public void setEventsRetracted(Integer eventsRetracted) {
        this.eventsRetracted = eventsRetracted;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
