package com.example.metaindex;

import java.util.Map;

/**
 * A (name, version, configuration) triple, the natural key of a tool.
 */
public record ToolSpec(String name, String version, Map<String, Object> configuration) {

    public ToolSpec {
        configuration = configuration == null ? Map.of() : configuration;
    }

    public String canonicalConfiguration() {
        return CanonicalJson.write(configuration);
    }
}
