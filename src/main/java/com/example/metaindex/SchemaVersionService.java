package com.example.metaindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Tracks the version of the derived data in {@code dbversion}. Versions only move forward:
 * a database written by a newer release is refused. Moving past a version listed in
 * {@code indexer.schema.requires-reindex} triggers a reindex of the origins, since facts
 * written under the older version are not comparable with new ones.
 */
@Slf4j
@Service
public class SchemaVersionService {

    public static final int CURRENT_VERSION = 3;

    private final SchemaVersionRepository repo;
    private final ReindexService reindex;
    private final int codeVersion;
    private final String description;
    private final Set<Integer> requiresReindex;

    public SchemaVersionService(SchemaVersionRepository repo, ReindexService reindex, Environment env) {
        this.repo = repo;
        this.reindex = reindex;
        this.codeVersion = Integer.parseInt(env.getProperty("indexer.schema.version", String.valueOf(CURRENT_VERSION)));
        this.description = env.getProperty("indexer.schema.description", "metadata indexer schema v" + codeVersion);
        Set<Integer> versions = new TreeSet<>();
        for (String v : env.getProperty("indexer.schema.requires-reindex", "").split(",")) {
            if (!v.isBlank()) versions.add(Integer.parseInt(v.trim()));
        }
        this.requiresReindex = Collections.unmodifiableSet(versions);
    }

    public record SchemaStatus(Integer previous, int current, boolean reindexRequested) {}

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        SchemaStatus s = upgrade();
        log.info("schema version {} (was {}){}", s.current(), s.previous(), s.reindexRequested() ? ", reindex requested" : "");
    }

    public synchronized SchemaStatus upgrade() {
        Optional<Integer> stored = storedVersion();
        if (stored.isPresent() && stored.get() > codeVersion) {
            throw new IllegalStateException("database schema version " + stored.get()
                    + " is newer than this release (" + codeVersion + "); refusing to downgrade");
        }
        if (stored.isPresent() && stored.get() == codeVersion) {
            return new SchemaStatus(stored.get(), codeVersion, false);
        }
        repo.save(new SchemaVersionRecord(codeVersion, Instant.now(), description));
        boolean reindexNeeded = false;
        if (stored.isPresent()) {
            for (int v : requiresReindex) {
                if (v > stored.get() && v <= codeVersion) reindexNeeded = true;
            }
        }
        if (reindexNeeded) reindex.reindexOrigins();
        return new SchemaStatus(stored.orElse(null), codeVersion, reindexNeeded);
    }

    public Optional<Integer> storedVersion() {
        return repo.findTopByOrderByVersionDesc().map(SchemaVersionRecord::getVersion);
    }

    public int codeVersion() {
        return codeVersion;
    }

    public List<SchemaVersionRecord> history() {
        return repo.findAllByOrderByVersionAsc();
    }
}
