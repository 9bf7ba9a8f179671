package com.example.metaindex;

import jakarta.persistence.*;

@Entity
@IdClass(FactKey.class)
@Table(name = "content_mimetype")
public class ContentMimetypeRecord implements FactRecord {

    @Id
    @Column(name = "id", length = 64)
    private String objectId;

    @Id
    @Column(name = "indexer_configuration_id")
    private Long toolId;

    @Column(name = "mimetype", nullable = false)
    private String mimetype;

    @Column(name = "encoding", nullable = false)
    private String encoding;

    public ContentMimetypeRecord() {}

    public ContentMimetypeRecord(String objectId, Long toolId) {
        this.objectId = objectId;
        this.toolId = toolId;
    }

    @Override
    public String getObjectId() { return objectId; }
    @Override
    public Long getToolId() { return toolId; }
    public String getMimetype() { return mimetype; }
    public void setMimetype(String mimetype) { this.mimetype = mimetype; }
    public String getEncoding() { return encoding; }
    public void setEncoding(String encoding) { this.encoding = encoding; }
}
