package com.example.metaindex;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.*;

/**
 * Bulk access to every fact kind: {@code mimetype, license, ctags, content-metadata,
 * directory-metadata, origin-intrinsic-metadata, origin-extrinsic-metadata}.
 */
@RestController
@RequestMapping("/api/facts")
public class FactController {

    private static final Logger log = LoggerFactory.getLogger(FactController.class);

    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};
    private static final TypeReference<List<CtagsSymbol>> SYMBOLS = new TypeReference<>() {};

    private final Map<String, FactStore<?, ?>> stores = new TreeMap<>();
    private final ObjectMapper mapper;

    public FactController(List<FactStore<?, ?>> stores, ObjectMapper mapper) {
        for (FactStore<?, ?> s : stores) this.stores.put(s.kind(), s);
        this.mapper = mapper;
    }

    @PostMapping("/{kind}")
    public AddSummary add(@PathVariable("kind") String kind,
                          @RequestParam(name = "policy", required = false) String policy,
                          @RequestBody List<ApiModels.FactEntryRequest> entries) {
        FactStore<?, ?> store = store(kind);
        List<FactEntry<Object>> converted = new ArrayList<>(entries.size());
        for (ApiModels.FactEntryRequest e : entries) {
            converted.add(new FactEntry<>(e.getId(), e.getToolId(), convert(kind, e.getPayload())));
        }
        AddSummary summary = addAll(store, converted, ConflictPolicy.fromString(policy));
        log.info("{}: {} entries, affected={}, rejected={}", kind, entries.size(), summary.affected(), summary.rejected().size());
        return summary;
    }

    @PostMapping("/{kind}/get")
    public List<ApiModels.FactView> get(@PathVariable("kind") String kind, @RequestBody ApiModels.FactQuery query) {
        List<ApiModels.FactView> out = new ArrayList<>();
        for (Fact<?> f : store(kind).get(query.getIds(), query.getToolIds())) out.add(ApiModels.FactView.of(f));
        return out;
    }

    @PostMapping("/{kind}/missing")
    public List<String> missing(@PathVariable("kind") String kind, @RequestBody ApiModels.MissingQuery query) {
        if (query.getToolId() == null) throw new IllegalArgumentException("toolId is required");
        return store(kind).missing(query.getIds(), query.getToolId());
    }

    private FactStore<?, ?> store(String kind) {
        FactStore<?, ?> s = stores.get(kind);
        if (s == null) throw new ResponseStatusException(HttpStatus.NOT_FOUND, "unknown fact kind " + kind + ", expected one of " + stores.keySet());
        return s;
    }

    // payloads are validated by the store; a null payload is rejected there, not here
    private Object convert(String kind, JsonNode payload) {
        if (payload == null || payload.isNull()) return null;
        try {
            return switch (kind) {
                case "mimetype" -> mapper.treeToValue(payload, Mimetype.class);
                case "license" -> mapper.convertValue(payload, STRINGS);
                case "ctags" -> mapper.convertValue(payload, SYMBOLS);
                case "content-metadata" -> requireObject(payload);
                case "directory-metadata" -> mapper.treeToValue(payload, DirectoryMetadata.class);
                case "origin-intrinsic-metadata", "origin-extrinsic-metadata" -> mapper.treeToValue(payload, OriginMetadata.class);
                default -> throw new ResponseStatusException(HttpStatus.NOT_FOUND, "unknown fact kind " + kind);
            };
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new IllegalArgumentException("malformed " + kind + " payload: " + e.getOriginalMessage(), e);
        }
    }

    private static ObjectNode requireObject(JsonNode payload) {
        if (!payload.isObject()) throw new IllegalArgumentException("metadata payload must be a JSON object");
        return (ObjectNode) payload;
    }

    @SuppressWarnings("unchecked")
    private static <P> AddSummary addAll(FactStore<?, P> store, List<FactEntry<Object>> entries, ConflictPolicy policy) {
        return store.add((List<FactEntry<P>>) (List<?>) entries, policy);
    }
}
