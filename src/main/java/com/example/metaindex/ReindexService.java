package com.example.metaindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Recomputes the directory and origin metadata of a tool from scratch: its derived facts are
 * deleted, then every known origin gets a new run from PENDING. Content facts are kept, they
 * are keyed by translator tool and stay valid.
 */
@Slf4j
@Service
public class ReindexService {

    private final DirectoryMetadataFactStore directoryFacts;
    private final OriginIntrinsicMetadataFactStore intrinsicFacts;
    private final OriginIndexingService indexing;
    private final ArchiveGraph graph;
    private final PipelineTools tools;

    public ReindexService(DirectoryMetadataFactStore directoryFacts, OriginIntrinsicMetadataFactStore intrinsicFacts,
                          OriginIndexingService indexing, ArchiveGraph graph, PipelineTools tools) {
        this.directoryFacts = directoryFacts;
        this.intrinsicFacts = intrinsicFacts;
        this.indexing = indexing;
        this.graph = graph;
        this.tools = tools;
    }

    public record ReindexReport(long toolId, int directoriesDeleted, int originsDeleted, List<IndexingRun> runs) {}

    /** reindex with the current metadata detector */
    public ReindexReport reindexOrigins() {
        return reindexOrigins(tools.detector());
    }

    public ReindexReport reindexOrigins(IndexerTool tool) {
        Long toolId = tool.getId();
        List<String> origins = intrinsicFacts.objectIdsForTool(toolId);
        List<String> directories = directoryFacts.objectIdsForTool(toolId);

        int originsDeleted = intrinsicFacts.delete(origins, toolId);
        int directoriesDeleted = directoryFacts.delete(directories, toolId);

        Set<String> known = new TreeSet<>(origins);
        known.addAll(graph.listOrigins());
        List<IndexingRun> runs = indexing.indexOrigins(new ArrayList<>(known));
        log.info("reindex with tool {}: deleted {} directory and {} origin facts, scheduled {} origins",
                toolId, directoriesDeleted, originsDeleted, runs.size());
        return new ReindexReport(toolId, directoriesDeleted, originsDeleted, runs);
    }
}
