package com.example.metaindex;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.*;

/**
 * Builds the directory fact of one directory from the metadata files it holds directly.
 * <p>
 * Each metadata file goes through the content fact of its (blob, translator) pair, so a file
 * shared by many directories or origins is translated once. Translations of sibling files run
 * on a small pool; merging happens afterwards in file-name order, later files overriding
 * earlier ones on a shared term.
 */
@Slf4j
@Service
public class DirectoryMetadataExtractor {

    private final ArchiveGraph graph;
    private final ObjectStorage storage;
    private final MetadataFileRegistry files;
    private final ContentMetadataTranslator translator;
    private final ContentMetadataFactStore contentFacts;
    private final DirectoryMetadataFactStore directoryFacts;
    private final PipelineTools tools;

    private final ExecutorService executor;

    public DirectoryMetadataExtractor(ArchiveGraph graph, ObjectStorage storage, MetadataFileRegistry files,
                                      ContentMetadataTranslator translator, ContentMetadataFactStore contentFacts,
                                      DirectoryMetadataFactStore directoryFacts, PipelineTools tools, Environment env) {
        this.graph = graph;
        this.storage = storage;
        this.files = files;
        this.translator = translator;
        this.contentFacts = contentFacts;
        this.directoryFacts = directoryFacts;
        this.tools = tools;
        int threads = Integer.parseInt(env.getProperty("indexer.extractor.threads", "4"));
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "metadata-translator");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public DirectoryMetadata extract(String directoryId) {
        IndexerTool detector = tools.detector();
        List<ArchiveModels.DirectoryEntry> matches = new ArrayList<>();
        for (ArchiveModels.DirectoryEntry e : graph.getDirectoryEntries(directoryId)) {
            if (e.type() == ArchiveModels.EntryType.FILE && files.lookup(e.name()).isPresent()) matches.add(e);
        }
        matches.sort(Comparator.comparing(ArchiveModels.DirectoryEntry::name));

        List<Future<Optional<ObjectNode>>> pending = new ArrayList<>(matches.size());
        for (ArchiveModels.DirectoryEntry e : matches) {
            Ecosystem eco = files.lookup(e.name()).orElseThrow();
            pending.add(executor.submit(() -> contentMetadata(e.target(), eco)));
        }

        ObjectNode merged = JsonNodeFactory.instance.objectNode();
        LinkedHashSet<String> mappings = new LinkedHashSet<>();
        for (int i = 0; i < matches.size(); i++) {
            Optional<ObjectNode> doc = await(pending.get(i));
            if (doc.isEmpty() || doc.get().isEmpty()) continue;
            merged.setAll(doc.get());
            mappings.add(files.lookup(matches.get(i).name()).orElseThrow().tag());
        }

        DirectoryMetadata result = new DirectoryMetadata(merged, new ArrayList<>(mappings));
        directoryFacts.add(List.of(new FactEntry<>(directoryId, detector.getId(), result)), ConflictPolicy.OVERWRITE);
        log.debug("directory {}: {} metadata file(s), mappings={}", directoryId, matches.size(), result.mappings());
        return result;
    }

    /**
     * The translated metadata of one blob, from its content fact when there is one. Empty when
     * the blob is missing or cannot be translated.
     */
    Optional<ObjectNode> contentMetadata(String blobId, Ecosystem ecosystem) {
        Long toolId = tools.translator(ecosystem).getId();
        Optional<Fact<ObjectNode>> known = contentFacts.get(blobId, toolId);
        if (known.isPresent()) return Optional.of(known.get().payload());

        Optional<byte[]> raw = storage.getBlob(blobId);
        if (raw.isEmpty()) {
            log.warn("stage=translate object={} tool={}: blob not found in object storage", blobId, toolId);
            return Optional.empty();
        }
        ObjectNode doc;
        try {
            doc = translator.translate(raw.get(), ecosystem);
        } catch (MetadataParseException | UnsupportedFormatException e) {
            log.warn("stage=translate object={} tool={}: {}", blobId, toolId, e.getMessage());
            return Optional.empty();
        }
        contentFacts.add(List.of(new FactEntry<>(blobId, toolId, doc)), ConflictPolicy.SKIP);
        return Optional.of(doc);
    }

    private static <T> T await(Future<T> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while translating metadata files");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException(cause);
        }
    }
}
