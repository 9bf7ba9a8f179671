package com.example.metaindex;

/**
 * Who published a piece of extrinsic metadata: a forge ({@code type = "forge"}), a package
 * registry ({@code "registry"}) or a deposit client ({@code "deposit_client"}).
 */
public record MetadataAuthority(String type, String url) {}
