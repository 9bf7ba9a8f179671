package com.example.metaindex;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * File name to ecosystem lookup used when walking a directory. Built once from
 * {@code indexer.metadata.mappings} (default: every intrinsic ecosystem) and never modified.
 * <p>
 * Exact names ({@code package.json}) are tried first, case included, then suffix patterns
 * ({@code *.nuspec}) in declaration order.
 */
@Component
public class MetadataFileRegistry {

    private final Map<String, Ecosystem> byFilename;
    private final List<Ecosystem> patterns;

    @Autowired
    public MetadataFileRegistry(Environment env) {
        this(enabled(env.getProperty("indexer.metadata.mappings", "")));
    }

    public MetadataFileRegistry(Collection<Ecosystem> ecosystems) {
        Map<String, Ecosystem> m = new TreeMap<>();
        List<Ecosystem> p = new ArrayList<>();
        for (Ecosystem e : ecosystems) {
            if (!e.isIntrinsic()) throw new IllegalArgumentException(e.tag() + " is not detected from files");
            if (e.isPattern()) {
                if (!p.contains(e)) p.add(e);
            } else {
                m.put(e.filename(), e);
            }
        }
        this.byFilename = Collections.unmodifiableMap(m);
        this.patterns = List.copyOf(p);
    }

    public Optional<Ecosystem> lookup(String filename) {
        Ecosystem exact = byFilename.get(filename);
        if (exact != null) return Optional.of(exact);
        for (Ecosystem e : patterns) if (e.matches(filename)) return Optional.of(e);
        return Optional.empty();
    }

    public List<String> tags() {
        List<String> out = new ArrayList<>();
        for (Ecosystem e : byFilename.values()) out.add(e.tag());
        for (Ecosystem e : patterns) out.add(e.tag());
        Collections.sort(out);
        return out;
    }

    private static List<Ecosystem> enabled(String property) {
        if (property == null || property.isBlank()) return Ecosystem.intrinsic();
        List<Ecosystem> out = new ArrayList<>();
        for (String tag : property.split(",")) {
            if (!tag.isBlank()) out.add(Ecosystem.byTag(tag.trim()));
        }
        return out;
    }
}
