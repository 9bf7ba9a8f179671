package com.example.metaindex;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process transport on a fixed worker pool. Tasks failing with a transient data-access
 * error are delivered again after a delay, up to {@code indexer.scheduler.max-attempts}
 * deliveries; any other failure ends the task.
 */
@Slf4j
@Component
public class ExecutorStageScheduler implements StageScheduler {

    private final ScheduledExecutorService executor;
    private final int maxAttempts;
    private final long retryDelayMillis;
    private final AtomicInteger inFlight = new AtomicInteger();

    public ExecutorStageScheduler(Environment env) {
        int threads = Integer.parseInt(env.getProperty("indexer.scheduler.threads", "4"));
        this.maxAttempts = Integer.parseInt(env.getProperty("indexer.scheduler.max-attempts", "3"));
        this.retryDelayMillis = Long.parseLong(env.getProperty("indexer.scheduler.retry-delay-ms", "200"));
        AtomicInteger n = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "indexing-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void schedule(IndexingTask task, StageWorker worker) {
        inFlight.incrementAndGet();
        executor.execute(() -> deliver(task, worker));
    }

    /** tasks scheduled and not finished yet, retries included */
    public int inFlight() {
        return inFlight.get();
    }

    private void deliver(IndexingTask task, StageWorker worker) {
        try {
            worker.run(task);
        } catch (TransientDataAccessException | RecoverableDataAccessException e) {
            if (task.attempt() < maxAttempts) {
                log.info("run {} stage {} attempt {} failed transiently, retrying: {}", task.runId(), task.stage(), task.attempt(), e.getMessage());
                inFlight.incrementAndGet();
                executor.schedule(() -> deliver(task.retry(), worker), retryDelayMillis * task.attempt(), TimeUnit.MILLISECONDS);
            } else {
                log.error("run {} stage {} gave up after {} attempts", task.runId(), task.stage(), task.attempt(), e);
                worker.giveUp(task, e);
            }
        } catch (RuntimeException e) {
            log.error("run {} stage {} failed", task.runId(), task.stage(), e);
            worker.giveUp(task, e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
