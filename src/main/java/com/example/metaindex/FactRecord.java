package com.example.metaindex;

public interface FactRecord {
    String getObjectId();
    Long getToolId();

    default FactKey key() {
        return new FactKey(getObjectId(), getToolId());
    }
}
