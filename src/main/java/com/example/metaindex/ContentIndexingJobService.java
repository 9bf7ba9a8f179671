package com.example.metaindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background job running content indexers over every blob reachable from a directory.
 * One job at a time; it can be paused, resumed and cancelled between batches.
 */
@Slf4j
@Service
public class ContentIndexingJobService {

    private final ArchiveGraph graph;
    private final Map<String, ContentIndexer<?>> indexers = new TreeMap<>();
    private final int batchSize;

    // single worker thread so a job does not compete with the indexing pipeline for the database
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "content-job-thread");
        t.setDaemon(true);
        return t;
    });

    private volatile String currentJobId = null;
    private volatile String rootDirectory = null;
    private volatile List<String> selected = List.of();
    private volatile Instant startedAt = null;
    private volatile Instant finishedAt = null;
    private final AtomicInteger totalContents = new AtomicInteger(0);
    private final AtomicInteger processedContents = new AtomicInteger(0);
    private final AtomicInteger written = new AtomicInteger(0);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile Future<?> currentFuture = null;

    public ContentIndexingJobService(ArchiveGraph graph, List<ContentIndexer<?>> indexers, Environment env) {
        this.graph = graph;
        for (ContentIndexer<?> i : indexers) this.indexers.put(i.name(), i);
        this.batchSize = Math.max(1, Integer.parseInt(env.getProperty("indexer.content-job.batch-size", "50")));
    }

    public Set<String> indexerNames() {
        return indexers.keySet();
    }

    /**
     * Starts a job over the tree under {@code directoryId}. Returns the id of the running job
     * instead when one is still running.
     *
     * @param names indexers to run, all of them when empty
     */
    public synchronized String startJob(String directoryId, List<String> names, ConflictPolicy policy) {
        if (currentJobId != null && currentFuture != null && !currentFuture.isDone()) {
            return currentJobId;
        }
        List<ContentIndexer<?>> chosen = new ArrayList<>();
        if (names == null || names.isEmpty()) {
            chosen.addAll(indexers.values());
        } else {
            for (String n : names) {
                ContentIndexer<?> i = indexers.get(n);
                if (i == null) throw new IllegalArgumentException("unknown content indexer: " + n + " (known: " + indexers.keySet() + ")");
                chosen.add(i);
            }
        }

        this.currentJobId = UUID.randomUUID().toString();
        this.rootDirectory = directoryId;
        this.selected = chosen.stream().map(ContentIndexer::name).toList();
        this.startedAt = Instant.now();
        this.finishedAt = null;
        this.processedContents.set(0);
        this.written.set(0);
        this.paused.set(false);
        this.cancelled.set(false);

        List<String> contents = reachableContents(directoryId);
        this.totalContents.set(contents.size());
        String jobId = currentJobId;

        this.currentFuture = executor.submit(() -> {
            log.info("Content job {} started on {}, contents={}, indexers={}", jobId, directoryId, contents.size(), selected);
            try {
                for (int from = 0; from < contents.size(); from += batchSize) {
                    if (cancelled.get()) {
                        log.info("Content job {} cancelled.", jobId);
                        break;
                    }
                    while (paused.get() && !cancelled.get()) {
                        try {
                            Thread.sleep(200);
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            return;
                        }
                    }
                    List<String> batch = contents.subList(from, Math.min(from + batchSize, contents.size()));
                    for (ContentIndexer<?> indexer : chosen) {
                        try {
                            written.addAndGet(indexer.index(batch, policy).affected());
                        } catch (RuntimeException e) {
                            log.warn("Content job {}: {} failed on a batch of {}: {}", jobId, indexer.name(), batch.size(), e.getMessage());
                        }
                    }
                    processedContents.addAndGet(batch.size());
                }
            } finally {
                finishedAt = Instant.now();
                log.info("Content job {} finished. processed={}/{} written={}", jobId, processedContents.get(), totalContents.get(), written.get());
            }
        });
        return jobId;
    }

    public synchronized boolean pause() {
        if (currentJobId == null) return false;
        paused.set(true);
        return true;
    }

    public synchronized boolean resume() {
        if (currentJobId == null) return false;
        paused.set(false);
        return true;
    }

    public synchronized boolean cancel() {
        if (currentJobId == null) return false;
        cancelled.set(true);
        if (currentFuture != null) currentFuture.cancel(true);
        return true;
    }

    public Map<String, Object> status() {
        Map<String, Object> out = new HashMap<>();
        out.put("jobId", currentJobId);
        out.put("directory", rootDirectory);
        out.put("indexers", selected);
        out.put("startedAt", startedAt == null ? null : startedAt.toString());
        out.put("finishedAt", finishedAt == null ? null : finishedAt.toString());
        out.put("totalContents", totalContents.get());
        out.put("processedContents", processedContents.get());
        out.put("written", written.get());
        out.put("paused", paused.get());
        out.put("cancelled", cancelled.get());
        out.put("running", currentFuture != null && !currentFuture.isDone());
        return out;
    }

    /** distinct blob ids under the directory, in walk order */
    List<String> reachableContents(String directoryId) {
        LinkedHashSet<String> contents = new LinkedHashSet<>();
        Set<String> seenDirs = new HashSet<>();
        Deque<String> todo = new ArrayDeque<>();
        todo.add(directoryId);
        while (!todo.isEmpty()) {
            String dir = todo.poll();
            if (!seenDirs.add(dir)) continue;
            for (ArchiveModels.DirectoryEntry e : graph.getDirectoryEntries(dir)) {
                if (e.type() == ArchiveModels.EntryType.FILE) contents.add(e.target());
                else if (e.type() == ArchiveModels.EntryType.DIR) todo.add(e.target());
            }
        }
        return new ArrayList<>(contents);
    }
}
