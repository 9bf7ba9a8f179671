package com.example.metaindex;

import jakarta.persistence.*;

@Entity
@Table(name = "indexer_configuration", uniqueConstraints = {
        @UniqueConstraint(name = "indexer_configuration_uniq",
                columnNames = {"tool_name", "tool_version", "configuration_hash"})
})
public class IndexerTool {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tool_name", nullable = false)
    private String name;

    @Column(name = "tool_version", nullable = false)
    private String version;

    // canonical JSON (sorted keys)
    @Lob
    @Column(name = "tool_configuration", columnDefinition = "CLOB")
    private String configuration;

    @Column(name = "configuration_hash", nullable = false, length = 40)
    private String configurationHash;

    public IndexerTool() {}

    public IndexerTool(String name, String version, String configuration) {
        this.name = name;
        this.version = version;
        this.configuration = configuration;
        this.configurationHash = CanonicalJson.sha1Hex(configuration);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getName() { return name; }
    public String getVersion() { return version; }
    public String getConfiguration() { return configuration; }
    public String getConfigurationHash() { return configurationHash; }

    @Override
    public String toString() {
        return name + "@" + version + "#" + id;
    }
}
