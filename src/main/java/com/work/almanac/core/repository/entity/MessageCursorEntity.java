package com.work.almanac.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("message_cursor")
public class MessageCursorEntity {

    @TableId(type = IdType.INPUT)
    private String chain;

    private Long lastAppliedHeight;

    private Instant updatedAt;

    public String getChain() {
        return chain;
    }

    public void setChain(String chain) {
        this.chain = chain;
    }

    public Long getLastAppliedHeight() {
        return lastAppliedHeight;
    }

    public void setLastAppliedHeight(Long lastAppliedHeight) {
        this.lastAppliedHeight = lastAppliedHeight;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
