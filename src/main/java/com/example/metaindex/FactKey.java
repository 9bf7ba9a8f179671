package com.example.metaindex;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * Composite key of every fact table: (object id, tool id).
 */
public class FactKey implements Serializable, Comparable<FactKey> {

    private static final Comparator<FactKey> ORDER = Comparator
            .comparing(FactKey::getObjectId)
            .thenComparing(FactKey::getToolId);

    private String objectId;
    private Long toolId;

    public FactKey() {}

    public FactKey(String objectId, Long toolId) {
        this.objectId = objectId;
        this.toolId = toolId;
    }

    public String getObjectId() { return objectId; }
    public void setObjectId(String objectId) { this.objectId = objectId; }
    public Long getToolId() { return toolId; }
    public void setToolId(Long toolId) { this.toolId = toolId; }

    @Override
    public int compareTo(FactKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FactKey)) return false;
        FactKey k = (FactKey) o;
        return Objects.equals(objectId, k.objectId) && Objects.equals(toolId, k.toolId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(objectId, toolId);
    }

    @Override
    public String toString() {
        return objectId + "/" + toolId;
    }
}
