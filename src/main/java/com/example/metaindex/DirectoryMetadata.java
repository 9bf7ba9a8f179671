package com.example.metaindex;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Intrinsic metadata aggregated over the metadata files of one directory, with the tags of
 * the mappings that contributed to it. An empty document with no mappings means the
 * directory was processed and nothing was found.
 */
public record DirectoryMetadata(ObjectNode metadata, List<String> mappings) {

    public DirectoryMetadata {
        metadata = metadata == null ? CanonicalJson.mapper().createObjectNode() : metadata;
        mappings = mappings == null ? List.of() : List.copyOf(mappings);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return metadata.isEmpty() && mappings.isEmpty();
    }
}
