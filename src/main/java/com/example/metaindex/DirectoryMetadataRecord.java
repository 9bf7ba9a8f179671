package com.example.metaindex;

import jakarta.persistence.*;

@Entity
@IdClass(FactKey.class)
@Table(name = "directory_intrinsic_metadata")
public class DirectoryMetadataRecord implements FactRecord {

    @Id
    @Column(name = "id", length = 64)
    private String objectId;

    @Id
    @Column(name = "indexer_configuration_id")
    private Long toolId;

    @Lob
    @Column(name = "metadata", columnDefinition = "CLOB", nullable = false)
    private String metadata;

    // type of metadata files used to obtain this metadata (eg. pkg-info, npm)
    @Column(name = "mappings", nullable = false, length = 1024)
    private String mappings;

    public DirectoryMetadataRecord() {}

    public DirectoryMetadataRecord(String objectId, Long toolId) {
        this.objectId = objectId;
        this.toolId = toolId;
    }

    @Override
    public String getObjectId() { return objectId; }
    @Override
    public Long getToolId() { return toolId; }
    public String getMetadata() { return metadata; }
    public void setMetadata(String metadata) { this.metadata = metadata; }
    public String getMappings() { return mappings; }
    public void setMappings(String mappings) { this.mappings = mappings; }
}
