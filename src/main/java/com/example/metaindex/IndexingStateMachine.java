package com.example.metaindex;

/**
 * Transitions of an origin indexing run. Pure: the next stage depends only on the current
 * stage and the outcome of the work done in it.
 * <pre>
 * PENDING -> HEAD_RESOLVED -> DIRECTORY_INDEXED -> ORIGIN_AGGREGATED -> DONE
 *    \____________\_________________\____________________\__________-> FAILED
 * </pre>
 * Terminal stages have no successor; a later trigger starts a new run from PENDING.
 */
public final class IndexingStateMachine {

    public enum Outcome { SUCCEEDED, FAILED }

    private IndexingStateMachine() {}

    public static IndexingStage next(IndexingStage stage, Outcome outcome) {
        if (stage.isTerminal()) throw new IllegalStateException("no transition out of terminal stage " + stage);
        if (outcome == Outcome.FAILED) return IndexingStage.FAILED;
        return switch (stage) {
            case PENDING -> IndexingStage.HEAD_RESOLVED;
            case HEAD_RESOLVED -> IndexingStage.DIRECTORY_INDEXED;
            case DIRECTORY_INDEXED -> IndexingStage.ORIGIN_AGGREGATED;
            case ORIGIN_AGGREGATED -> IndexingStage.DONE;
            default -> throw new IllegalStateException("unexpected stage " + stage);
        };
    }
}
