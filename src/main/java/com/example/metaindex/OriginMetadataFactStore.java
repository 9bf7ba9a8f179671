package com.example.metaindex;

import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.*;

/**
 * Origin-keyed metadata facts with full-text and producer search.
 * <p>
 * The search vector is always derived from the metadata being written, inside the write
 * itself, so a stored row never carries a vector of an older document.
 */
public abstract class OriginMetadataFactStore<R extends OriginMetadataRecord> extends FactStore<R, OriginMetadata> {

    private final OriginMetadataRepository<R> repo;

    protected OriginMetadataFactStore(OriginMetadataRepository<R> repo, ToolRegistry tools,
                                      PlatformTransactionManager transactionManager, int maxAttempts) {
        super(repo, tools, transactionManager, maxAttempts);
        this.repo = repo;
    }

    @Override
    protected void writePayload(R record, OriginMetadata payload) {
        record.setMetadata(CanonicalJson.write(payload.metadata()));
        record.setMappings(Mappings.join(payload.mappings()));
        record.setProvenance(payload.from());
        record.setSearchVector(SearchVector.of(payload.metadata()).toStoredForm());
    }

    @Override
    protected OriginMetadata readPayload(R record) {
        return new OriginMetadata(CanonicalJson.readObject(record.getMetadata()),
                Mappings.split(record.getMappings()), record.getProvenance());
    }

    /**
     * Origins whose metadata contains every term of {@code query}, best match first (ties
     * broken by origin url).
     */
    public List<Fact<OriginMetadata>> searchFulltext(String query, int limit) {
        List<String> terms = new ArrayList<>(new LinkedHashSet<>(SearchVector.tokenize(query)));
        if (terms.isEmpty() || limit <= 0) return List.of();
        // the longest term is usually the most selective one
        String probe = terms.stream().max(Comparator.comparingInt(String::length)).orElseThrow();

        List<Map.Entry<R, Double>> ranked = new ArrayList<>();
        for (R r : repo.findBySearchVectorContaining(SearchVector.needle(probe))) {
            SearchVector v = SearchVector.parse(r.getSearchVector());
            if (v.matchesAll(terms)) ranked.add(new AbstractMap.SimpleEntry<>(r, v.rank(terms)));
        }
        ranked.sort(Comparator.<Map.Entry<R, Double>>comparingDouble(Map.Entry::getValue).reversed()
                .thenComparing(e -> e.getKey().key()));

        List<R> top = new ArrayList<>();
        for (Map.Entry<R, Double> e : ranked) {
            if (top.size() >= limit) break;
            top.add(e.getKey());
        }
        Map<FactKey, Fact<OriginMetadata>> byKey = new HashMap<>();
        for (Fact<OriginMetadata> f : toFacts(top)) byKey.put(new FactKey(f.objectId(), f.toolId()), f);
        List<Fact<OriginMetadata>> out = new ArrayList<>(top.size());
        for (R r : top) out.add(byKey.get(r.key()));
        return out;
    }

    /**
     * Origins produced by the given mappings and/or tools, paged by origin url. A page never
     * splits the facts of one origin.
     *
     * @param pageToken the {@code nextPageToken} of the previous page, or empty for the first
     */
    public ProducerPage searchByProducer(List<String> mappings, List<Long> toolIds, String pageToken, int limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
        String cursor = pageToken == null ? "" : pageToken;
        Set<String> wantedMappings = mappings == null ? Set.of() : new HashSet<>(mappings);
        Set<Long> wantedTools = toolIds == null ? Set.of() : new HashSet<>(toolIds);

        List<Fact<OriginMetadata>> out = new ArrayList<>();
        Set<String> origins = new LinkedHashSet<>();
        int batch = Math.max(limit, 100);
        while (origins.size() < limit) {
            List<String> ids = repo.findObjectIdsAfter(cursor, PageRequest.of(0, batch));
            if (ids.isEmpty()) {
                return new ProducerPage(out, new ArrayList<>(origins), null);
            }
            for (Fact<OriginMetadata> f : get(ids)) {
                if (!wantedTools.isEmpty() && !wantedTools.contains(f.toolId())) continue;
                if (!wantedMappings.isEmpty() && Collections.disjoint(wantedMappings, f.payload().mappings())) continue;
                if (!origins.contains(f.objectId()) && origins.size() >= limit) break;
                origins.add(f.objectId());
                out.add(f);
            }
            cursor = origins.size() >= limit ? lastOf(origins) : ids.get(ids.size() - 1);
            if (ids.size() < batch && origins.size() < limit) {
                return new ProducerPage(out, new ArrayList<>(origins), null);
            }
        }
        return new ProducerPage(out, new ArrayList<>(origins), cursor);
    }

    public MetadataStats stats() {
        Set<String> total = new HashSet<>();
        Set<String> nonEmpty = new HashSet<>();
        Map<String, Set<String>> perMapping = new TreeMap<>();
        for (R r : repo.findAll()) {
            total.add(r.getObjectId());
            if (!CanonicalJson.readObject(r.getMetadata()).isEmpty()) nonEmpty.add(r.getObjectId());
            for (String m : Mappings.split(r.getMappings())) {
                perMapping.computeIfAbsent(m, k -> new HashSet<>()).add(r.getObjectId());
            }
        }
        Map<String, Long> counts = new TreeMap<>();
        perMapping.forEach((m, s) -> counts.put(m, (long) s.size()));
        return new MetadataStats(total.size(), nonEmpty.size(), counts);
    }

    private static String lastOf(Set<String> s) {
        String last = null;
        for (String x : s) last = x;
        return last;
    }

    public record ProducerPage(List<Fact<OriginMetadata>> origins, List<String> originIds, String nextPageToken) {}

    public record MetadataStats(long total, long nonEmpty, Map<String, Long> perMapping) {}
}
