package com.example.metaindex;

import jakarta.persistence.*;

/**
 * Metadata translated from one file (package.json, pom.xml, ...), keyed by the file's hash
 * and the translator tool.
 */
@Entity
@IdClass(FactKey.class)
@Table(name = "content_metadata")
public class ContentMetadataRecord implements FactRecord {

    @Id
    @Column(name = "id", length = 64)
    private String objectId;

    @Id
    @Column(name = "indexer_configuration_id")
    private Long toolId;

    @Lob
    @Column(name = "metadata", columnDefinition = "CLOB", nullable = false)
    private String metadata;

    public ContentMetadataRecord() {}

    public ContentMetadataRecord(String objectId, Long toolId) {
        this.objectId = objectId;
        this.toolId = toolId;
    }

    @Override
    public String getObjectId() { return objectId; }
    @Override
    public Long getToolId() { return toolId; }
    public String getMetadata() { return metadata; }
    public void setMetadata(String metadata) { this.metadata = metadata; }
}
