package com.example.metaindex;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Full-text vector of a metadata document, built with a "simple" tokenizer: every scalar
 * value of the document is lower-cased and split on non alphanumeric characters, and no
 * stopword is removed, so identifiers and proper nouns are indexed as they are.
 * <p>
 * Stored form is {@code " term:count term:count "}, terms sorted, which allows a term lookup
 * with a plain {@code LIKE '% term:%'}.
 * <p>
 * A vector holds at most {@link #MAX_TERMS} distinct terms so that its stored form fits the
 * search column. Terms of {@link #PRIORITY_FIELDS} are never dropped; past the limit the
 * least frequent of the other terms go first.
 */
@Slf4j
public final class SearchVector {

    static final int MAX_TERMS = 12_000;
    static final Set<String> PRIORITY_FIELDS = Set.of("name", "author", "keywords");
    static final int MAX_TERM_LENGTH = 64;

    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final SortedMap<String, Integer> counts;

    private SearchVector(SortedMap<String, Integer> counts) {
        this.counts = counts;
    }

    public static SearchVector of(JsonNode document) {
        SortedMap<String, Integer> counts = new TreeMap<>();
        Set<String> priority = new HashSet<>();
        if (document != null) {
            collect(document, counts);
            if (document.isObject()) {
                for (String field : PRIORITY_FIELDS) {
                    JsonNode v = document.get(field);
                    if (v != null) collectTerms(v, priority);
                }
            }
        }
        if (counts.size() > MAX_TERMS) evict(counts, priority);
        return new SearchVector(counts);
    }

    private static void evict(SortedMap<String, Integer> counts, Set<String> priority) {
        List<String> candidates = new ArrayList<>();
        for (String t : counts.keySet()) if (!priority.contains(t)) candidates.add(t);
        candidates.sort(Comparator.<String>comparingInt(counts::get).thenComparing(Comparator.reverseOrder()));
        int excess = counts.size() - MAX_TERMS;
        for (int i = 0; i < excess && i < candidates.size(); i++) counts.remove(candidates.get(i));
        log.warn("search vector over {} terms, dropped {} infrequent term(s)", MAX_TERMS, Math.min(excess, candidates.size()));
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String t : SEPARATORS.split(text.toLowerCase(Locale.ROOT))) {
            if (t.isEmpty() || t.length() > MAX_TERM_LENGTH) continue;
            out.add(t);
        }
        return out;
    }

    public static SearchVector parse(String stored) {
        SortedMap<String, Integer> counts = new TreeMap<>();
        if (stored != null) {
            for (String part : stored.trim().split(" ")) {
                int colon = part.lastIndexOf(':');
                if (colon <= 0) continue;
                try {
                    counts.put(part.substring(0, colon), Integer.parseInt(part.substring(colon + 1)));
                } catch (NumberFormatException e) {
                    throw new IllegalStateException("malformed search vector entry: " + part, e);
                }
            }
        }
        return new SearchVector(counts);
    }

    /** the substring a stored vector contains when it holds {@code term} */
    static String needle(String term) {
        return " " + term + ":";
    }

    public String toStoredForm() {
        StringBuilder sb = new StringBuilder(" ");
        counts.forEach((term, n) -> sb.append(term).append(':').append(n).append(' '));
        return sb.toString();
    }

    public boolean contains(String term) {
        return counts.containsKey(term);
    }

    public boolean matchesAll(Collection<String> terms) {
        if (terms.isEmpty()) return false;
        for (String t : terms) if (!counts.containsKey(t)) return false;
        return true;
    }

    /**
     * Relevance of this vector for the query terms: occurrences of the terms, normalized by
     * the document length so that short documents naming a term rank above long ones that
     * mention it in passing.
     */
    public double rank(Collection<String> terms) {
        int hits = 0;
        for (String t : terms) hits += counts.getOrDefault(t, 0);
        if (hits == 0) return 0.0;
        int total = 0;
        for (int n : counts.values()) total += n;
        return hits / (1.0 + Math.log(1 + total));
    }

    public Set<String> terms() {
        return Collections.unmodifiableSet(counts.keySet());
    }

    private static void collect(JsonNode node, Map<String, Integer> counts) {
        if (node.isValueNode()) {
            if (!node.isNull()) for (String t : tokenize(node.asText())) counts.merge(t, 1, Integer::sum);
        } else if (node.isContainerNode()) {
            node.forEach(child -> collect(child, counts));
        }
    }

    private static void collectTerms(JsonNode node, Set<String> terms) {
        if (node.isValueNode()) {
            if (!node.isNull()) terms.addAll(tokenize(node.asText()));
        } else if (node.isContainerNode()) {
            node.forEach(child -> collectTerms(child, terms));
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SearchVector && ((SearchVector) o).counts.equals(counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return toStoredForm().trim();
    }
}
