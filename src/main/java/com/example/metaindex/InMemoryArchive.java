package com.example.metaindex;

import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Archive graph and object storage held in memory. Fed by {@link LocalTreeLoader} or by
 * tests; any other backend plugs in through the two ports.
 */
@Component
public class InMemoryArchive implements ArchiveGraph, ObjectStorage {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();
    private final Map<String, List<ArchiveModels.DirectoryEntry>> directories = new ConcurrentHashMap<>();
    private final Map<String, ArchiveModels.Revision> revisions = new ConcurrentHashMap<>();
    private final Map<String, ArchiveModels.Snapshot> latestSnapshots = new ConcurrentHashMap<>();

    public void putBlob(String id, byte[] data) {
        blobs.put(id, data.clone());
    }

    public void putDirectory(String id, List<ArchiveModels.DirectoryEntry> entries) {
        directories.put(id, List.copyOf(entries));
    }

    public void putRevision(ArchiveModels.Revision revision) {
        revisions.put(revision.id(), revision);
    }

    /** replaces the latest snapshot of the origin */
    public void putSnapshot(String originUrl, ArchiveModels.Snapshot snapshot) {
        latestSnapshots.put(originUrl, snapshot);
    }

    @Override
    public Set<String> listOrigins() {
        return new TreeSet<>(latestSnapshots.keySet());
    }

    @Override
    public List<ArchiveModels.DirectoryEntry> getDirectoryEntries(String directoryId) {
        return directories.getOrDefault(directoryId, List.of());
    }

    @Override
    public Optional<ArchiveModels.Revision> getRevision(String revisionId) {
        return Optional.ofNullable(revisions.get(revisionId));
    }

    @Override
    public Optional<ArchiveModels.Snapshot> getLatestSnapshot(String originUrl) {
        return Optional.ofNullable(latestSnapshots.get(originUrl));
    }

    @Override
    public Optional<byte[]> getBlob(String contentId) {
        byte[] b = blobs.get(contentId);
        return b == null ? Optional.empty() : Optional.of(b.clone());
    }
}
