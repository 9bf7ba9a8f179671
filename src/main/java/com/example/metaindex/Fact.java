package com.example.metaindex;

/**
 * A stored fact, with its tool resolved.
 */
public record Fact<P>(String objectId, IndexerTool tool, P payload) {

    public Long toolId() {
        return tool == null ? null : tool.getId();
    }
}
