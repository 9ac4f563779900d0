package com.work.almanac.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("chain_cursor")
public class ChainCursorEntity {

    @TableId(type = IdType.INPUT)
    private String chain;

    private Long lastIndexedHeight;

    private Instant updatedAt;

    public String getChain() {
        return chain;
    }

    public void setChain(String chain) {
        this.chain = chain;
    }

    public Long getLastIndexedHeight() {
        return lastIndexedHeight;
    }

    public void setLastIndexedHeight(Long lastIndexedHeight) {
        this.lastIndexedHeight = lastIndexedHeight;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
