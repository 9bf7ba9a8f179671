package com.example.metaindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A tool computing one kind of content fact from raw blob bytes.
 * <p>
 * Under {@link ConflictPolicy#SKIP} only blobs without a fact from this tool are fetched and
 * computed. A blob that cannot be fetched or processed is logged and left out of the batch.
 */
public abstract class ContentIndexer<P> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final FactStore<?, P> store;
    private final ObjectStorage storage;
    private final ToolRegistry registry;
    private volatile IndexerTool tool;

    protected ContentIndexer(FactStore<?, P> store, ObjectStorage storage, ToolRegistry registry) {
        this.store = store;
        this.storage = storage;
        this.registry = registry;
    }

    /** name used to select the indexer in content jobs */
    public abstract String name();

    public abstract ToolSpec toolSpec();

    /** the fact for one blob; empty to store nothing */
    protected abstract Optional<P> compute(String contentId, byte[] data) throws Exception;

    public IndexerTool tool() {
        IndexerTool t = tool;
        if (t == null) {
            t = registry.register(toolSpec());
            tool = t;
        }
        return t;
    }

    public AddSummary index(Collection<String> contentIds, ConflictPolicy policy) {
        Long toolId = tool().getId();
        Collection<String> todo = policy == ConflictPolicy.SKIP ? store.missing(contentIds, toolId) : new LinkedHashSet<>(contentIds);
        List<FactEntry<P>> entries = new ArrayList<>();
        for (String id : todo) {
            Optional<byte[]> data = storage.getBlob(id);
            if (data.isEmpty()) {
                log.warn("stage={} object={} tool={}: blob not found", name(), id, toolId);
                continue;
            }
            try {
                compute(id, data.get()).ifPresent(p -> entries.add(new FactEntry<>(id, toolId, p)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("stage={} interrupted at object={}", name(), id);
                break;
            } catch (Exception e) {
                log.warn("stage={} object={} tool={}: {}", name(), id, toolId, e.getMessage());
            }
        }
        return store.add(entries, policy);
    }
}
