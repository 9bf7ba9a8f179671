package com.example.metaindex;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Origin-level metadata and the lower-level object it was copied from: a directory id for
 * intrinsic metadata, a raw extrinsic metadata id for extrinsic metadata.
 */
public record OriginMetadata(ObjectNode metadata, List<String> mappings, String from) {

    public OriginMetadata {
        metadata = metadata == null ? CanonicalJson.mapper().createObjectNode() : metadata;
        mappings = mappings == null ? List.of() : List.copyOf(mappings);
    }
}
