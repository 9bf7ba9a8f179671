package com.example.metaindex;

/**
 * A fact entry references a tool (or object) the store does not know about.
 */
public class ReferentialIntegrityException extends IndexerException {

    private final String objectId;
    private final Long toolId;

    public ReferentialIntegrityException(String objectId, Long toolId, String message) {
        super(message);
        this.objectId = objectId;
        this.toolId = toolId;
    }

    public String getObjectId() { return objectId; }
    public Long getToolId() { return toolId; }
}
