package com.example.metaindex;

import jakarta.persistence.*;

import java.util.Set;
import java.util.TreeSet;

@Entity
@IdClass(FactKey.class)
@Table(name = "content_fossology_license")
public class ContentLicenseRecord implements FactRecord {

    @Id
    @Column(name = "id", length = 64)
    private String objectId;

    @Id
    @Column(name = "indexer_configuration_id")
    private Long toolId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "content_fossology_license_ids", joinColumns = {
            @JoinColumn(name = "id", referencedColumnName = "id"),
            @JoinColumn(name = "indexer_configuration_id", referencedColumnName = "indexer_configuration_id")
    })
    @Column(name = "license_id", nullable = false)
    private Set<Integer> licenseIds = new TreeSet<>();

    public ContentLicenseRecord() {}

    public ContentLicenseRecord(String objectId, Long toolId) {
        this.objectId = objectId;
        this.toolId = toolId;
    }

    @Override
    public String getObjectId() { return objectId; }
    @Override
    public Long getToolId() { return toolId; }
    public Set<Integer> getLicenseIds() { return licenseIds; }

    public void replaceLicenseIds(Set<Integer> ids) {
        licenseIds.clear();
        licenseIds.addAll(ids);
    }
}
