package com.example.metaindex;

/**
 * The head of an origin: the branch chosen in its latest snapshot and the root directory it
 * leads to. {@code revisionId} is null when the branch points at a directory directly.
 */
public record ResolvedHead(String originUrl, String snapshotId, String branchName, String revisionId, String directoryId) {}
