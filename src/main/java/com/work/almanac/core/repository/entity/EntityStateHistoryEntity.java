package com.work.almanac.core.repository.entity;

import com.baomidou.mybatisplus.annotation.TableName;

/**
 * 实体状态版本表实体，(entity_kind, entity_id, block_number) 唯一。
 */
@TableName("entity_state_history")
public class EntityStateHistoryEntity {

    private String entityKind;

    private String entityId;

    private String chain;

    private Long blockNumber;

    /**
     * 以 json 字符串形式读写，由 SQL 侧 CAST 为 jsonb。
     */
    private String stateJson;

    public String getEntityKind() {
        return entityKind;
    }

    public void setEntityKind(String entityKind) {
        this.entityKind = entityKind;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

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

    public String getStateJson() {
        return stateJson;
    }

    public void setStateJson(String stateJson) {
        this.stateJson = stateJson;
    }
}
