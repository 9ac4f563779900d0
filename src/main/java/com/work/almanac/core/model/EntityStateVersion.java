package com.work.almanac.core.model;

import static com.work.almanac.core.support.ValidationUtils.requireNonEmpty;
import static com.work.almanac.core.support.ValidationUtils.requireNonNegative;

/**
 * 某个实体在某个区块高度上的状态快照（JSON），(kind, id, height) 唯一。
 */
public final class EntityStateVersion {

    private final String entityKind;
    private final String entityId;
    private final String chain;
    private final long blockNumber;
    private final String stateJson;

    public EntityStateVersion(String entityKind, String entityId, String chain, long blockNumber, String stateJson) {
        this.entityKind = requireNonEmpty(entityKind, "entityKind");
        this.entityId = requireNonEmpty(entityId, "entityId");
        this.chain = requireNonEmpty(chain, "chain");
        this.blockNumber = requireNonNegative(blockNumber, "blockNumber");
        this.stateJson = requireNonEmpty(stateJson, "stateJson");
    }

    public String getEntityKind() {
        return entityKind;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getChain() {
        return chain;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public String getStateJson() {
        return stateJson;
    }

    @Override
    public String toString() {
        return "EntityStateVersion{" + entityKind + ":" + entityId + "@" + chain + "#" + blockNumber + "}";
    }
}
