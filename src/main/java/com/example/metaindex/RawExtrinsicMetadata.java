package com.example.metaindex;

/**
 * Metadata about an origin published outside of its source tree, as received from the
 * archive: {@code target} is the origin url and {@code format} the declared format of
 * {@code metadata}.
 */
public record RawExtrinsicMetadata(String id, String target, MetadataAuthority authority, String format, byte[] metadata) {}
