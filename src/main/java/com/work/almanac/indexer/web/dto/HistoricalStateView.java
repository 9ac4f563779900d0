package com.work.almanac.indexer.web.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 截至某高度的实体状态；observedHeight &lt; requestedHeight 时结果可能滞后。
 */
public class HistoricalStateView {

    private String entityKind;
    private String entityId;
    private String chain;
    private long requestedHeight;
    private long reflectedHeight;
    private long observedHeight;
    private boolean possiblyStale;
    private JsonNode state;

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

    public long getRequestedHeight() {
        return requestedHeight;
    }

    public void setRequestedHeight(long requestedHeight) {
        this.requestedHeight = requestedHeight;
    }

    public long getReflectedHeight() {
        return reflectedHeight;
    }

    public void setReflectedHeight(long reflectedHeight) {
        this.reflectedHeight = reflectedHeight;
    }

    public long getObservedHeight() {
        return observedHeight;
    }

    public void setObservedHeight(long observedHeight) {
        this.observedHeight = observedHeight;
    }

    public boolean isPossiblyStale() {
        return possiblyStale;
    }

    public void setPossiblyStale(boolean possiblyStale) {
        this.possiblyStale = possiblyStale;
    }

    public JsonNode getState() {
        return state;
    }

    public void setState(JsonNode state) {
        this.state = state;
    }
}
