package com.example.metaindex;

/**
 * Transport of indexing tasks. Delivery is at least once: a task may run more than once, and
 * every stage is an idempotent upsert so duplicates are harmless.
 */
public interface StageScheduler {

    void schedule(IndexingTask task, StageWorker worker);

    interface StageWorker {

        /** runs the task; transient data-access failures propagate for a retry */
        void run(IndexingTask task);

        /** the transport stopped retrying the task */
        void giveUp(IndexingTask task, RuntimeException cause);
    }
}
