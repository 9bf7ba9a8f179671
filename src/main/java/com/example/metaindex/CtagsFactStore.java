package com.example.metaindex;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.*;

@Service
public class CtagsFactStore extends FactStore<ContentCtagsRecord, List<CtagsSymbol>> {

    private static final TypeReference<List<CtagsSymbol>> SYMBOLS = new TypeReference<>() {};

    private final ContentCtagsRepository repo;
    private final ObjectMapper mapper;

    public CtagsFactStore(ContentCtagsRepository repo, ToolRegistry tools, ObjectMapper mapper,
                          PlatformTransactionManager transactionManager, Environment env) {
        super(repo, tools, transactionManager, Integer.parseInt(env.getProperty("indexer.store.max-attempts", "5")));
        this.repo = repo;
        this.mapper = mapper;
    }

    @Override
    public String kind() {
        return "ctags";
    }

    @Override
    protected ContentCtagsRecord newRecord(String objectId, Long toolId) {
        return new ContentCtagsRecord(objectId, toolId);
    }

    @Override
    protected void writePayload(ContentCtagsRecord record, List<CtagsSymbol> payload) {
        try {
            record.setSymbols(mapper.writeValueAsString(payload));
        } catch (Exception e) {
            throw new IllegalArgumentException("ctags payload is not serializable", e);
        }
        Set<String> names = new TreeSet<>();
        for (CtagsSymbol s : payload) if (s.name() != null && !s.name().isBlank()) names.add(s.name());
        record.setSymbolIndex(names.isEmpty() ? " " : " " + String.join(" ", names) + " ");
    }

    @Override
    protected List<CtagsSymbol> readPayload(ContentCtagsRecord record) {
        if (record.getSymbols() == null) return List.of();
        try {
            return mapper.readValue(record.getSymbols(), SYMBOLS);
        } catch (Exception e) {
            throw new IllegalStateException("stored ctags for " + record.getObjectId() + " are malformed", e);
        }
    }

    /**
     * Contents defining a symbol with exactly this name, at most {@code limit} of them.
     */
    public List<Fact<List<CtagsSymbol>>> searchSymbol(String name, int limit) {
        if (name == null || name.isBlank() || name.contains(" ")) return List.of();
        List<Fact<List<CtagsSymbol>>> out = new ArrayList<>();
        for (Fact<List<CtagsSymbol>> f : toFacts(repo.findBySymbolIndexContaining(" " + name + " "))) {
            List<CtagsSymbol> matching = new ArrayList<>();
            for (CtagsSymbol s : f.payload()) if (name.equals(s.name())) matching.add(s);
            out.add(new Fact<>(f.objectId(), f.tool(), matching));
            if (out.size() >= limit) break;
        }
        return out;
    }
}
