package com.example.metaindex;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface ArchiveGraph {

    /** entries of one directory, empty when the directory is unknown */
    List<ArchiveModels.DirectoryEntry> getDirectoryEntries(String directoryId);

    Optional<ArchiveModels.Revision> getRevision(String revisionId);

    Optional<ArchiveModels.Snapshot> getLatestSnapshot(String originUrl);

    /** urls of the origins that have at least one snapshot */
    Set<String> listOrigins();
}
