package com.example.metaindex;

import java.time.Instant;

/**
 * Observable state of one origin indexing run.
 */
public record IndexingRun(String runId, String originUrl, IndexingStage stage, String directoryId, String error,
                          Instant startedAt, Instant updatedAt) {

    IndexingRun moveTo(IndexingStage next, String objectId, String error) {
        return new IndexingRun(runId, originUrl, next, objectId != null ? objectId : directoryId, error, startedAt, Instant.now());
    }
}
