package com.example.metaindex;

/**
 * One unit of scheduled work: run the stage after {@code stage} for a run.
 * <p>
 * {@code objectId} and {@code toolId} name the object the stage works on (the head directory
 * and the detector tool once the head is resolved). {@code headOfOrigin} tells the
 * aggregation stage that the directory is the head of {@code originUrl}, so its metadata is
 * attributed to the origin. {@code attempt} counts deliveries of the same work.
 */
public record IndexingTask(String runId, IndexingStage stage, String originUrl, String objectId, Long toolId,
                           boolean headOfOrigin, int attempt) {

    public static IndexingTask start(String runId, String originUrl) {
        return new IndexingTask(runId, IndexingStage.PENDING, originUrl, null, null, false, 1);
    }

    public IndexingTask advance(String objectId, Long toolId, boolean headOfOrigin) {
        IndexingStage next = IndexingStateMachine.next(stage, IndexingStateMachine.Outcome.SUCCEEDED);
        return new IndexingTask(runId, next, originUrl, objectId, toolId, headOfOrigin, 1);
    }

    public IndexingTask retry() {
        return new IndexingTask(runId, stage, originUrl, objectId, toolId, headOfOrigin, attempt + 1);
    }
}
