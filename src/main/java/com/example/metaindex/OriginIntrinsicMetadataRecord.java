package com.example.metaindex;

import jakarta.persistence.*;

@Entity
@IdClass(FactKey.class)
@Table(name = "origin_intrinsic_metadata")
public class OriginIntrinsicMetadataRecord implements OriginMetadataRecord {

    // origin url
    @Id
    @Column(name = "id", length = 2048)
    private String objectId;

    @Id
    @Column(name = "indexer_configuration_id")
    private Long toolId;

    @Lob
    @Column(name = "metadata", columnDefinition = "CLOB", nullable = false)
    private String metadata;

    @Column(name = "mappings", nullable = false, length = 1024)
    private String mappings;

    // directory this metadata was copied from
    @Column(name = "from_directory", length = 64)
    private String fromDirectory;

    @Column(name = "metadata_search_vector", length = 1000000)
    private String searchVector;

    public OriginIntrinsicMetadataRecord() {}

    public OriginIntrinsicMetadataRecord(String objectId, Long toolId) {
        this.objectId = objectId;
        this.toolId = toolId;
    }

    @Override
    public String getObjectId() { return objectId; }
    @Override
    public Long getToolId() { return toolId; }
    @Override
    public String getMetadata() { return metadata; }
    @Override
    public void setMetadata(String metadata) { this.metadata = metadata; }
    @Override
    public String getMappings() { return mappings; }
    @Override
    public void setMappings(String mappings) { this.mappings = mappings; }
    @Override
    public String getSearchVector() { return searchVector; }
    @Override
    public void setSearchVector(String searchVector) { this.searchVector = searchVector; }
    @Override
    public String getProvenance() { return fromDirectory; }
    @Override
    public void setProvenance(String provenance) { this.fromDirectory = provenance; }
}
