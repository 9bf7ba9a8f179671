package com.example.metaindex;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.*;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    @Autowired
    private OriginIndexingService originIndexingService;

    @Autowired
    private ExtrinsicMetadataIndexer extrinsicMetadataIndexer;

    @Autowired
    private LocalTreeLoader localTreeLoader;

    @Autowired
    private ContentIndexingJobService contentJobs;

    @Autowired
    private ReindexService reindexService;

    @Autowired
    private SchemaVersionService schemaVersionService;

    @Autowired
    private IndexingRunRegistry runs;

    @PostMapping("/index/origins")
    public List<IndexingRun> indexOrigins(@RequestBody ApiModels.IndexOriginsRequest request) {
        List<String> origins = request.getOrigins() == null ? List.of() : request.getOrigins();
        return originIndexingService.indexOrigins(origins);
    }

    @GetMapping("/index/runs/{id}")
    public IndexingRun run(@PathVariable("id") String id) {
        return originIndexingService.run(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "no run " + id));
    }

    @GetMapping("/index/runs")
    public Object runs(@RequestParam(name = "origin", required = false) String origin) {
        if (origin != null) return originIndexingService.runsFor(origin);
        return runs.countByStage();
    }

    /**
     * Index one raw extrinsic record. The metadata document is posted as JSON and handed to the
     * translator as its UTF-8 bytes.
     */
    @PostMapping("/extrinsic")
    public Object extrinsic(@RequestBody ApiModels.ExtrinsicRequest request) {
        byte[] raw = request.getMetadata() == null ? new byte[0]
                : request.getMetadata().toString().getBytes(StandardCharsets.UTF_8);
        RawExtrinsicMetadata record = new RawExtrinsicMetadata(request.getId(), request.getTarget(),
                request.getAuthority(), request.getFormat(), raw);
        Optional<OriginMetadata> written = extrinsicMetadataIndexer.index(record);
        if (written.isPresent()) return written.get();
        return Collections.singletonMap("message", "nothing written for " + request.getId());
    }

    @PostMapping("/local-tree")
    public Map<String, Object> loadLocalTree(@RequestParam(name = "path") String path,
                                             @RequestParam(name = "index", defaultValue = "true") boolean index) {
        LocalTreeLoader.LoadedTree tree;
        try {
            tree = localTreeLoader.load(Path.of(path));
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "cannot load " + path + ": " + e.getMessage(), e);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tree", tree);
        if (index) out.put("runs", originIndexingService.indexOrigins(List.of(tree.originUrl())));
        return out;
    }

    @PostMapping("/content-job/start")
    public Object startContentJob(@RequestParam(name = "directory") String directory,
                                  @RequestParam(name = "indexers", required = false) List<String> indexers,
                                  @RequestParam(name = "policy", required = false) String policy) {
        String jobId = contentJobs.startJob(directory, indexers == null ? List.of() : indexers, ConflictPolicy.fromString(policy));
        return Collections.singletonMap("jobId", jobId);
    }

    @PostMapping("/content-job/pause")
    public String pauseContentJob() {
        return contentJobs.pause() ? "paused" : "no-job";
    }

    @PostMapping("/content-job/resume")
    public String resumeContentJob() {
        return contentJobs.resume() ? "resumed" : "no-job";
    }

    @PostMapping("/content-job/cancel")
    public String cancelContentJob() {
        return contentJobs.cancel() ? "cancelled" : "no-job";
    }

    @GetMapping("/content-job/status")
    public Map<String, Object> contentJobStatus() {
        return contentJobs.status();
    }

    @PostMapping("/reindex")
    public ReindexService.ReindexReport reindex() {
        return reindexService.reindexOrigins();
    }

    @GetMapping("/schema")
    public Map<String, Object> schema() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("stored", schemaVersionService.storedVersion().orElse(null));
        out.put("code", schemaVersionService.codeVersion());
        out.put("history", schemaVersionService.history());
        return out;
    }
}
