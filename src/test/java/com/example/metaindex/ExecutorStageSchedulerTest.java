package com.example.metaindex;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.mock.env.MockEnvironment;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class ExecutorStageSchedulerTest {

    private ExecutorStageScheduler scheduler;

    @BeforeEach
    public void setUp() {
        scheduler = new ExecutorStageScheduler(new MockEnvironment()
                .withProperty("indexer.scheduler.threads", "2")
                .withProperty("indexer.scheduler.max-attempts", "3")
                .withProperty("indexer.scheduler.retry-delay-ms", "10"));
    }

    @AfterEach
    public void tearDown() {
        scheduler.shutdown();
    }

    @Test
    public void transientFailuresAreRetriedThenSucceed() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> attempts = new CopyOnWriteArrayList<>();
        List<IndexingTask> givenUp = new CopyOnWriteArrayList<>();

        scheduler.schedule(IndexingTask.start("r1", "https://example.org/x"), new StageScheduler.StageWorker() {
            @Override
            public void run(IndexingTask task) {
                attempts.add(task.attempt());
                if (calls.incrementAndGet() < 3) throw new TransientDataAccessResourceException("busy");
            }

            @Override
            public void giveUp(IndexingTask task, RuntimeException cause) {
                givenUp.add(task);
            }
        });

        waitIdle();
        assertThat(attempts).containsExactly(1, 2, 3);
        assertThat(givenUp).isEmpty();
    }

    @Test
    public void givesUpAfterMaxAttempts() throws Exception {
        List<IndexingTask> givenUp = new CopyOnWriteArrayList<>();
        scheduler.schedule(IndexingTask.start("r2", "https://example.org/y"), new StageScheduler.StageWorker() {
            @Override
            public void run(IndexingTask task) {
                throw new TransientDataAccessResourceException("still busy");
            }

            @Override
            public void giveUp(IndexingTask task, RuntimeException cause) {
                givenUp.add(task);
            }
        });

        waitIdle();
        assertThat(givenUp).hasSize(1);
        assertThat(givenUp.get(0).attempt()).isEqualTo(3);
    }

    @Test
    public void otherFailuresAreNotRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<RuntimeException> causes = new CopyOnWriteArrayList<>();
        scheduler.schedule(IndexingTask.start("r3", "https://example.org/z"), new StageScheduler.StageWorker() {
            @Override
            public void run(IndexingTask task) {
                calls.incrementAndGet();
                throw new IllegalStateException("bug");
            }

            @Override
            public void giveUp(IndexingTask task, RuntimeException cause) {
                causes.add(cause);
            }
        });

        waitIdle();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(causes).singleElement().isInstanceOf(IllegalStateException.class);
    }

    private void waitIdle() throws InterruptedException {
        for (int i = 0; i < 100 && scheduler.inFlight() > 0; i++) TimeUnit.MILLISECONDS.sleep(20);
        assertThat(scheduler.inFlight()).isZero();
    }
}
