package com.example.metaindex;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tools the metadata pipeline attributes its facts to. Each translator variant is its own
 * tool, so a change in one crosswalk only invalidates that variant's content facts.
 */
@Component
public class PipelineTools {

    private final ToolRegistry registry;
    private final MetadataFileRegistry files;
    private final String translatorVersion;
    private final String detectorVersion;
    private final Map<String, IndexerTool> cache = new ConcurrentHashMap<>();

    public PipelineTools(ToolRegistry registry, MetadataFileRegistry files, Environment env) {
        this.registry = registry;
        this.files = files;
        this.translatorVersion = env.getProperty("indexer.translator.version", "1.0.0");
        this.detectorVersion = env.getProperty("indexer.detector.version", "1.0.0");
    }

    public ToolSpec translatorSpec(Ecosystem ecosystem) {
        return new ToolSpec("metadata-translator", translatorVersion, Map.of("context", ecosystem.tag()));
    }

    /** directory facts and the intrinsic origin facts copied from them */
    public ToolSpec detectorSpec() {
        return new ToolSpec("metadata-detector", detectorVersion, Map.of("type", "local", "context", files.tags()));
    }

    public ToolSpec extrinsicSpec() {
        List<String> tags = new ArrayList<>();
        for (Ecosystem e : Ecosystem.extrinsic()) tags.add(e.tag());
        return new ToolSpec("extrinsic-metadata-translator", translatorVersion, Map.of("context", tags));
    }

    public IndexerTool translator(Ecosystem ecosystem) {
        return resolve(translatorSpec(ecosystem));
    }

    public IndexerTool detector() {
        return resolve(detectorSpec());
    }

    public IndexerTool extrinsic() {
        return resolve(extrinsicSpec());
    }

    private IndexerTool resolve(ToolSpec spec) {
        return cache.computeIfAbsent(spec.name() + "/" + spec.canonicalConfiguration(), k -> registry.register(spec));
    }
}
