package com.example.metaindex;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.*;

/**
 * Copies lower-level metadata into origin-keyed facts, where it becomes searchable.
 */
@Slf4j
@Service
public class OriginMetadataAggregator {

    private final DirectoryMetadataFactStore directoryFacts;
    private final OriginIntrinsicMetadataFactStore intrinsicFacts;
    private final OriginExtrinsicMetadataFactStore extrinsicFacts;
    // origin host -> authority hosts allowed to describe it besides the origin's own host
    private final Map<String, Set<String>> trusted;

    public OriginMetadataAggregator(DirectoryMetadataFactStore directoryFacts, OriginIntrinsicMetadataFactStore intrinsicFacts,
                                    OriginExtrinsicMetadataFactStore extrinsicFacts, Environment env) {
        this.directoryFacts = directoryFacts;
        this.intrinsicFacts = intrinsicFacts;
        this.extrinsicFacts = extrinsicFacts;
        this.trusted = parseTrusted(env.getProperty("indexer.extrinsic.trusted-authorities", ""));
    }

    public OriginMetadata aggregateIntrinsic(String originUrl, String directoryId, long toolId) {
        Fact<DirectoryMetadata> dir = directoryFacts.get(directoryId, toolId)
                .orElseThrow(() -> new IndexerException("no directory metadata for " + directoryId + " from tool " + toolId));
        OriginMetadata payload = new OriginMetadata(dir.payload().metadata(), dir.payload().mappings(), directoryId);
        intrinsicFacts.add(List.of(new FactEntry<>(originUrl, toolId, payload)), ConflictPolicy.OVERWRITE);
        return payload;
    }

    /**
     * Stores extrinsic metadata for an origin, unless its authority is not entitled to describe
     * that origin, in which case the record is dropped.
     */
    public Optional<OriginMetadata> aggregateExtrinsic(String originUrl, String remoteMetadataId, ObjectNode document,
                                                       List<String> mappings, MetadataAuthority authority, long toolId) {
        try {
            checkAuthority(originUrl, authority);
        } catch (AuthorityMismatchException e) {
            log.info("dropping extrinsic metadata {}: {}", remoteMetadataId, e.getMessage());
            return Optional.empty();
        }
        OriginMetadata payload = new OriginMetadata(document, mappings, remoteMetadataId);
        extrinsicFacts.add(List.of(new FactEntry<>(originUrl, toolId, payload)), ConflictPolicy.OVERWRITE);
        return Optional.of(payload);
    }

    public boolean authorityMatches(String originUrl, MetadataAuthority authority) {
        try {
            checkAuthority(originUrl, authority);
            return true;
        } catch (AuthorityMismatchException e) {
            return false;
        }
    }

    /**
     * The authority must be the origin's forge (same host) or a package repository trusted for
     * the origin's host.
     */
    void checkAuthority(String originUrl, MetadataAuthority authority) {
        String authorityUrl = authority == null ? null : authority.url();
        String originHost = host(originUrl);
        String authorityHost = host(authorityUrl);
        if (originHost == null || authorityHost == null) throw new AuthorityMismatchException(originUrl, authorityUrl);
        if (originHost.equals(authorityHost)) return;
        if (trusted.getOrDefault(originHost, Set.of()).contains(authorityHost)) return;
        throw new AuthorityMismatchException(originUrl, authorityUrl);
    }

    static String host(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            String h = URI.create(url.trim()).getHost();
            return h == null ? null : h.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    // "pypi.org=pypi.org,www.npmjs.com=registry.npmjs.org": origin host = authority host
    private static Map<String, Set<String>> parseTrusted(String property) {
        Map<String, Set<String>> out = new HashMap<>();
        for (String pair : property.split(",")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) continue;
            String origin = pair.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String auth = pair.substring(eq + 1).trim().toLowerCase(Locale.ROOT);
            if (!origin.isEmpty() && !auth.isEmpty()) out.computeIfAbsent(origin, k -> new HashSet<>()).add(auth);
        }
        return out;
    }
}
