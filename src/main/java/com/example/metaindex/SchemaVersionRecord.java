package com.example.metaindex;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(name = "dbversion")
public class SchemaVersionRecord {

    @Id
    @Column(name = "version")
    private Integer version;

    @Column(name = "release_date", nullable = false)
    private Instant release;

    @Column(name = "description", length = 1024)
    private String description;

    public SchemaVersionRecord() {}

    public SchemaVersionRecord(Integer version, Instant release, String description) {
        this.version = version;
        this.release = release;
        this.description = description;
    }

    public Integer getVersion() { return version; }
    public Instant getRelease() { return release; }
    public String getDescription() { return description; }
}
