package com.example.metaindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for origin update events: every origin gets a fresh indexing run.
 */
@Slf4j
@Service
public class OriginIndexingService {

    private final IndexingDispatcher dispatcher;
    private final IndexingRunRegistry runs;

    public OriginIndexingService(IndexingDispatcher dispatcher, IndexingRunRegistry runs) {
        this.dispatcher = dispatcher;
        this.runs = runs;
    }

    public List<IndexingRun> indexOrigins(List<String> originUrls) {
        List<IndexingRun> out = new ArrayList<>();
        for (String url : new LinkedHashSet<>(originUrls)) {
            if (url == null || url.isBlank()) continue;
            out.add(dispatcher.submit(url.trim()));
        }
        log.info("scheduled {} origin(s) for indexing", out.size());
        return out;
    }

    public Optional<IndexingRun> run(String runId) {
        return runs.get(runId);
    }

    public List<IndexingRun> runsFor(String originUrl) {
        return runs.forOrigin(originUrl);
    }
}
