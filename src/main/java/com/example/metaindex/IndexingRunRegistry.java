package com.example.metaindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory record of indexing runs. Stage changes are compare-and-set on the current stage,
 * so a task delivered twice cannot move a run backwards or advance it twice.
 * <p>
 * Once more than {@code indexer.runs.retain} runs are held, finished runs (DONE or FAILED)
 * are forgotten, oldest finish first. Runs still in flight are never evicted.
 */
@Slf4j
@Component
public class IndexingRunRegistry {

    static final int DEFAULT_RETAIN = 10_000;

    private final Map<String, IndexingRun> runs = new ConcurrentHashMap<>();
    private final Queue<String> finished = new ConcurrentLinkedQueue<>();
    private final int retain;

    @Autowired
    public IndexingRunRegistry(Environment env) {
        this(Integer.parseInt(env.getProperty("indexer.runs.retain", String.valueOf(DEFAULT_RETAIN))));
    }

    public IndexingRunRegistry(int retain) {
        if (retain < 0) throw new IllegalArgumentException("indexer.runs.retain must not be negative");
        this.retain = retain;
    }

    public IndexingRunRegistry() {
        this(DEFAULT_RETAIN);
    }

    public IndexingRun start(String originUrl) {
        Instant now = Instant.now();
        IndexingRun run = new IndexingRun(UUID.randomUUID().toString(), originUrl, IndexingStage.PENDING, null, null, now, now);
        runs.put(run.runId(), run);
        evict();
        return run;
    }

    /**
     * Moves the run from {@code from} to {@code to}. Returns false, changing nothing, when the
     * run is unknown or no longer in {@code from}.
     */
    public boolean advance(String runId, IndexingStage from, IndexingStage to, String objectId, String error) {
        AtomicBoolean moved = new AtomicBoolean(false);
        runs.computeIfPresent(runId, (k, r) -> {
            if (r.stage() != from) return r;
            moved.set(true);
            return r.moveTo(to, objectId, error);
        });
        if (moved.get() && to.isTerminal()) {
            finished.add(runId);
            evict();
        }
        return moved.get();
    }

    public int size() {
        return runs.size();
    }

    private synchronized void evict() {
        int evicted = 0;
        while (runs.size() > retain) {
            String runId = finished.poll();
            if (runId == null) break;
            if (runs.remove(runId) != null) evicted++;
        }
        if (evicted > 0) log.debug("forgot {} finished runs, {} held", evicted, runs.size());
    }

    public Optional<IndexingRun> get(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public List<IndexingRun> forOrigin(String originUrl) {
        List<IndexingRun> out = new ArrayList<>();
        for (IndexingRun r : runs.values()) if (r.originUrl().equals(originUrl)) out.add(r);
        out.sort(Comparator.comparing(IndexingRun::startedAt));
        return out;
    }

    public Map<IndexingStage, Long> countByStage() {
        Map<IndexingStage, Long> out = new EnumMap<>(IndexingStage.class);
        for (IndexingRun r : runs.values()) out.merge(r.stage(), 1L, Long::sum);
        return out;
    }
}
