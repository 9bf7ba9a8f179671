package com.example.metaindex;

/**
 * One fact to write: the object it describes, the tool that produced it and its payload.
 */
public record FactEntry<P>(String objectId, Long toolId, P payload) {

    public FactKey key() {
        return new FactKey(objectId, toolId);
    }
}
