package com.example.metaindex;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.TransientDataAccessResourceException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

public class IndexingDispatcherTest {

    private HeadResolver heads;
    private DirectoryMetadataExtractor extractor;
    private OriginMetadataAggregator aggregator;
    private PipelineTools tools;
    private IndexingRunRegistry runs;
    private QueueScheduler scheduler;
    private IndexingDispatcher dispatcher;

    // runs tasks one by one, on demand, on the calling thread
    static class QueueScheduler implements StageScheduler {
        final Deque<IndexingTask> queue = new ArrayDeque<>();
        StageWorker worker;

        @Override
        public void schedule(IndexingTask task, StageWorker worker) {
            this.worker = worker;
            queue.add(task);
        }

        void drain() {
            while (!queue.isEmpty()) worker.run(queue.poll());
        }
    }

    @BeforeEach
    public void setUp() {
        heads = mock(HeadResolver.class);
        extractor = mock(DirectoryMetadataExtractor.class);
        aggregator = mock(OriginMetadataAggregator.class);
        tools = mock(PipelineTools.class);
        IndexerTool detector = new IndexerTool("metadata-detector", "1.0.0", "{}");
        detector.setId(9L);
        when(tools.detector()).thenReturn(detector);
        runs = new IndexingRunRegistry();
        scheduler = new QueueScheduler();
        dispatcher = new IndexingDispatcher(heads, extractor, aggregator, tools, scheduler, runs);
    }

    @Test
    public void aRunWalksEveryStageToDone() {
        String origin = "https://example.org/repo.git";
        when(heads.resolve(origin)).thenReturn(new ResolvedHead(origin, "snp", "HEAD", "rev", "D"));

        IndexingRun run = dispatcher.submit(origin);
        scheduler.drain();

        IndexingRun done = runs.get(run.runId()).orElseThrow();
        assertThat(done.stage()).isEqualTo(IndexingStage.DONE);
        assertThat(done.directoryId()).isEqualTo("D");
        verify(extractor).extract("D");
        verify(aggregator).aggregateIntrinsic(origin, "D", 9L);
    }

    @Test
    public void dataErrorsFailTheRun() {
        String origin = "https://example.org/empty.git";
        when(heads.resolve(origin)).thenThrow(new NoCanonicalBranchException(origin, "no snapshot"));

        IndexingRun run = dispatcher.submit(origin);
        scheduler.drain();

        IndexingRun failed = runs.get(run.runId()).orElseThrow();
        assertThat(failed.stage()).isEqualTo(IndexingStage.FAILED);
        assertThat(failed.error()).contains("no snapshot");
        verifyNoInteractions(extractor, aggregator);
    }

    @Test
    public void duplicateDeliveriesAreIgnored() {
        String origin = "https://example.org/dup.git";
        when(heads.resolve(origin)).thenReturn(new ResolvedHead(origin, "snp", "HEAD", null, "D"));
        IndexingRun run = dispatcher.submit(origin);
        IndexingTask first = scheduler.queue.peek();
        scheduler.drain();

        // the PENDING task arrives again after the run finished
        dispatcher.run(first);
        assertThat(scheduler.queue).isEmpty();
        assertThat(runs.get(run.runId()).orElseThrow().stage()).isEqualTo(IndexingStage.DONE);
        verify(extractor, times(1)).extract("D");
    }

    @Test
    public void givingUpMarksTheRunFailed() {
        IndexingRun run = runs.start("https://example.org/x");
        IndexingTask task = new IndexingTask(run.runId(), IndexingStage.PENDING, run.originUrl(), null, null, false, 3);

        dispatcher.giveUp(task, new TransientDataAccessResourceException("database locked"));

        IndexingRun failed = runs.get(run.runId()).orElseThrow();
        assertThat(failed.stage()).isEqualTo(IndexingStage.FAILED);
        assertThat(failed.error()).contains("database locked");
    }

    @Test
    public void resubmittingStartsANewRun() {
        String origin = "https://example.org/again.git";
        when(heads.resolve(origin)).thenReturn(new ResolvedHead(origin, "snp", "HEAD", null, "D"));
        dispatcher.submit(origin);
        scheduler.drain();
        dispatcher.submit(origin);
        scheduler.drain();

        List<IndexingRun> all = runs.forOrigin(origin);
        assertThat(all).hasSize(2);
        assertThat(all).allMatch(r -> r.stage() == IndexingStage.DONE);
    }
}
