package com.example.metaindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chains the pipeline stages of origin indexing runs. Each delivered task performs the work
 * of one stage, records the transition and schedules the next stage; data-shape errors end
 * the run in {@link IndexingStage#FAILED}.
 */
@Slf4j
@Service
public class IndexingDispatcher implements StageScheduler.StageWorker {

    private final HeadResolver heads;
    private final DirectoryMetadataExtractor extractor;
    private final OriginMetadataAggregator aggregator;
    private final PipelineTools tools;
    private final StageScheduler scheduler;
    private final IndexingRunRegistry runs;

    public IndexingDispatcher(HeadResolver heads, DirectoryMetadataExtractor extractor, OriginMetadataAggregator aggregator,
                              PipelineTools tools, StageScheduler scheduler, IndexingRunRegistry runs) {
        this.heads = heads;
        this.extractor = extractor;
        this.aggregator = aggregator;
        this.tools = tools;
        this.scheduler = scheduler;
        this.runs = runs;
    }

    /** starts a new run for the origin, whatever the state of its previous runs */
    public IndexingRun submit(String originUrl) {
        IndexingRun run = runs.start(originUrl);
        log.info("run {} started for {}", run.runId(), originUrl);
        scheduler.schedule(IndexingTask.start(run.runId(), originUrl), this);
        return run;
    }

    @Override
    public void run(IndexingTask task) {
        if (task.stage().isTerminal()) return;
        IndexingTask next;
        try {
            next = perform(task);
        } catch (IndexerException e) {
            log.warn("stage={} origin={} object={} tool={}: {}", task.stage(), task.originUrl(), task.objectId(), task.toolId(), e.getMessage());
            fail(task, e.getMessage());
            return;
        }
        if (!runs.advance(task.runId(), task.stage(), next.stage(), next.objectId(), null)) {
            log.debug("run {}: duplicate delivery of stage {}", task.runId(), task.stage());
            return;
        }
        if (next.stage().isTerminal()) {
            log.info("run {} for {} done", task.runId(), task.originUrl());
        } else {
            scheduler.schedule(next, this);
        }
    }

    @Override
    public void giveUp(IndexingTask task, RuntimeException cause) {
        fail(task, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    private IndexingTask perform(IndexingTask task) {
        switch (task.stage()) {
            case PENDING: {
                ResolvedHead head = heads.resolve(task.originUrl());
                return task.advance(head.directoryId(), tools.detector().getId(), true);
            }
            case HEAD_RESOLVED:
                extractor.extract(task.objectId());
                return task.advance(task.objectId(), task.toolId(), task.headOfOrigin());
            case DIRECTORY_INDEXED:
                if (task.headOfOrigin()) aggregator.aggregateIntrinsic(task.originUrl(), task.objectId(), task.toolId());
                return task.advance(task.objectId(), task.toolId(), task.headOfOrigin());
            case ORIGIN_AGGREGATED:
                return task.advance(task.objectId(), task.toolId(), task.headOfOrigin());
            default:
                throw new IllegalStateException("no work for stage " + task.stage());
        }
    }

    private void fail(IndexingTask task, String error) {
        IndexingStage failed = IndexingStateMachine.next(task.stage(), IndexingStateMachine.Outcome.FAILED);
        runs.advance(task.runId(), task.stage(), failed, null, error);
    }
}
