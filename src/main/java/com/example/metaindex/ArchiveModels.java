package com.example.metaindex;

import java.util.Map;

/**
 * Read-only view of the archive objects the pipeline walks. Ids are lowercase hex SHA-1.
 */
public final class ArchiveModels {

    private ArchiveModels() {}

    public enum EntryType { FILE, DIR, REV }

    public enum TargetType { ALIAS, REVISION, DIRECTORY, RELEASE, CONTENT }

    /** one entry of a directory listing; {@code target} is a blob id for files */
    public record DirectoryEntry(String name, EntryType type, String target) {}

    public record Revision(String id, String directory) {}

    /** branch names are raw names such as {@code HEAD}, {@code refs/heads/main} or a tarball file name */
    public record SnapshotBranch(String target, TargetType targetType) {}

    public record Snapshot(String id, Map<String, SnapshotBranch> branches) {}
}
