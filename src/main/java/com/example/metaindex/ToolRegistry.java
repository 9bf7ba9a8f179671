package com.example.metaindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;

/**
 * Assigns stable ids to (name, version, configuration) triples.
 * <p>
 * Registration is insert-if-absent followed by a re-read. Two workers registering the same
 * triple at once race on the unique constraint of {@code indexer_configuration}; the loser's
 * transaction fails and is retried, and the retry reads the winner's row.
 */
@Service
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final ToolRepository repo;
    private final TransactionTemplate tx;
    private final int maxAttempts;

    public ToolRegistry(ToolRepository repo, PlatformTransactionManager transactionManager, Environment env) {
        this.repo = repo;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.maxAttempts = Integer.parseInt(env.getProperty("indexer.store.max-attempts", "5"));
    }

    public long register(String name, String version, Map<String, Object> configuration) {
        return register(new ToolSpec(name, version, configuration)).getId();
    }

    public IndexerTool register(ToolSpec spec) {
        if (spec.name() == null || spec.name().isBlank() || spec.version() == null || spec.version().isBlank()) {
            throw new IllegalArgumentException("tool name and version are required");
        }
        String configuration = spec.canonicalConfiguration();
        String hash = CanonicalJson.sha1Hex(configuration);
        DataAccessException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                IndexerTool tool = tx.execute(status -> repo
                        .findByNameAndVersionAndConfigurationHash(spec.name(), spec.version(), hash)
                        .orElseGet(() -> repo.saveAndFlush(new IndexerTool(spec.name(), spec.version(), configuration))));
                if (tool != null) return tool;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                log.debug("concurrent registration of {}@{} (attempt {}): {}", spec.name(), spec.version(), attempt, e.getMessage());
                last = e;
            }
        }
        Optional<IndexerTool> winner = repo.findByNameAndVersionAndConfigurationHash(spec.name(), spec.version(), hash);
        if (winner.isPresent()) return winner.get();
        throw last != null ? last : new IllegalStateException("could not register tool " + spec.name());
    }

    /**
     * Registers many tools at once. Inserts happen in natural-key order so that two bulk
     * calls with overlapping tools never wait on each other in opposite orders; the result
     * follows the order of {@code specs}.
     */
    public List<IndexerTool> registerAll(List<ToolSpec> specs) {
        Map<String, IndexerTool> byKey = new HashMap<>();
        specs.stream()
                .sorted(Comparator.comparing(ToolRegistry::naturalKey))
                .forEach(s -> byKey.computeIfAbsent(naturalKey(s), k -> register(s)));
        List<IndexerTool> out = new ArrayList<>(specs.size());
        for (ToolSpec s : specs) out.add(byKey.get(naturalKey(s)));
        return out;
    }

    public Optional<IndexerTool> get(ToolSpec spec) {
        String hash = CanonicalJson.sha1Hex(spec.canonicalConfiguration());
        return repo.findByNameAndVersionAndConfigurationHash(spec.name(), spec.version(), hash);
    }

    public Optional<IndexerTool> findById(long id) {
        return repo.findById(id);
    }

    public Map<Long, IndexerTool> findAllById(Collection<Long> ids) {
        Map<Long, IndexerTool> out = new HashMap<>();
        for (IndexerTool t : repo.findAllById(new HashSet<>(ids))) out.put(t.getId(), t);
        return out;
    }

    private static String naturalKey(ToolSpec s) {
        return s.name() + '\u0000' + s.version() + '\u0000' + s.canonicalConfiguration();
    }
}
