package com.example.metaindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;

/**
 * Storage of one kind of derived fact, keyed by (object id, tool id).
 * <p>
 * Writes are bulk upserts. Every batch is validated against the tool registry first, then
 * put in a stable order (object id, tool id, canonical payload) and written in one
 * transaction. The order serves two purposes: overlapping batches lock rows in the same
 * sequence, and when a batch carries the same key twice the winner does not depend on the
 * caller's ordering (first in order under {@link ConflictPolicy#SKIP}, last under
 * {@link ConflictPolicy#OVERWRITE}).
 *
 * @param <R> the JPA record type
 * @param <P> the payload exposed to callers
 */
public abstract class FactStore<R extends FactRecord, P> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final FactRepository<R> repo;
    protected final ToolRegistry tools;
    protected final TransactionTemplate tx;
    private final int maxAttempts;

    protected FactStore(FactRepository<R> repo, ToolRegistry tools, PlatformTransactionManager transactionManager, int maxAttempts) {
        this.repo = repo;
        this.tools = tools;
        this.tx = new TransactionTemplate(transactionManager);
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /** short name of the fact kind, used in logs and on the REST surface */
    public abstract String kind();

    protected abstract R newRecord(String objectId, Long toolId);

    protected abstract void writePayload(R record, P payload);

    protected abstract P readPayload(R record);

    /** runs before the write transaction, with the entries that will be written */
    protected void beforeWrite(List<FactEntry<P>> entries) {
    }

    /** rejects a malformed payload by throwing {@link ReferentialIntegrityException} */
    protected void validatePayload(String objectId, Long toolId, P payload) {
    }

    public AddSummary add(List<FactEntry<P>> entries, ConflictPolicy policy) {
        if (entries == null || entries.isEmpty()) return new AddSummary(0, List.of());
        List<AddSummary.Rejected> rejected = new ArrayList<>();
        List<FactEntry<P>> valid = validate(entries, rejected);
        List<FactEntry<P>> winners = designate(valid, policy);
        if (winners.isEmpty()) return new AddSummary(0, rejected);

        beforeWrite(winners);
        DataAccessException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Integer affected = tx.execute(status -> write(winners, policy));
                log.debug("{}: wrote {} of {} entries (policy={})", kind(), affected, entries.size(), policy);
                return new AddSummary(affected == null ? 0 : affected, rejected);
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                // a concurrent batch inserted one of our keys first; the retry sees its row
                log.debug("{}: write conflict on attempt {}: {}", kind(), attempt, e.getMessage());
                last = e;
            }
        }
        throw last;
    }

    public List<Fact<P>> get(Collection<String> objectIds) {
        return get(objectIds, null);
    }

    public List<Fact<P>> get(Collection<String> objectIds, Collection<Long> toolIds) {
        if (objectIds == null || objectIds.isEmpty()) return List.of();
        List<R> found = toolIds == null || toolIds.isEmpty()
                ? repo.findByObjectIdIn(new HashSet<>(objectIds))
                : repo.findByObjectIdInAndToolIdIn(new HashSet<>(objectIds), new HashSet<>(toolIds));
        return toFacts(found);
    }

    public Optional<Fact<P>> get(String objectId, Long toolId) {
        return repo.findById(new FactKey(objectId, toolId)).map(r -> toFacts(List.of(r)).get(0));
    }

    public boolean exists(String objectId, Long toolId) {
        return repo.existsById(new FactKey(objectId, toolId));
    }

    /**
     * Object ids among {@code objectIds} that have no fact from the given tool yet.
     */
    public List<String> missing(Collection<String> objectIds, Long toolId) {
        if (objectIds == null || objectIds.isEmpty()) return List.of();
        Set<String> present = new HashSet<>();
        for (R r : repo.findByObjectIdInAndToolIdIn(new HashSet<>(objectIds), List.of(toolId))) {
            present.add(r.getObjectId());
        }
        List<String> out = new ArrayList<>();
        for (String id : new LinkedHashSet<>(objectIds)) if (!present.contains(id)) out.add(id);
        return out;
    }

    public int delete(Collection<String> objectIds, Long toolId) {
        if (objectIds == null || objectIds.isEmpty()) return 0;
        Long n = tx.execute(status -> repo.deleteByObjectIdInAndToolId(new HashSet<>(objectIds), toolId));
        return n == null ? 0 : n.intValue();
    }

    public List<String> objectIdsForTool(Long toolId) {
        List<String> out = new ArrayList<>();
        for (R r : repo.findByToolId(toolId)) out.add(r.getObjectId());
        return out;
    }

    protected List<Fact<P>> toFacts(List<R> records) {
        Set<Long> toolIds = new HashSet<>();
        for (R r : records) toolIds.add(r.getToolId());
        Map<Long, IndexerTool> byId = tools.findAllById(toolIds);
        List<Fact<P>> out = new ArrayList<>(records.size());
        records.stream()
                .sorted(Comparator.comparing(FactRecord::key))
                .forEach(r -> out.add(new Fact<>(r.getObjectId(), byId.get(r.getToolId()), readPayload(r))));
        return out;
    }

    private List<FactEntry<P>> validate(List<FactEntry<P>> entries, List<AddSummary.Rejected> rejected) {
        Set<Long> toolIds = new HashSet<>();
        for (FactEntry<P> e : entries) if (e != null && e.toolId() != null) toolIds.add(e.toolId());
        Set<Long> known = tools.findAllById(toolIds).keySet();

        List<FactEntry<P>> valid = new ArrayList<>(entries.size());
        for (FactEntry<P> e : entries) {
            try {
                checkEntry(e, known);
                valid.add(e);
            } catch (ReferentialIntegrityException ex) {
                log.warn("{}: rejected entry {}/{}: {}", kind(), ex.getObjectId(), ex.getToolId(), ex.getMessage());
                rejected.add(AddSummary.Rejected.of(ex));
            }
        }
        return valid;
    }

    private void checkEntry(FactEntry<P> e, Set<Long> knownTools) {
        if (e == null) throw new ReferentialIntegrityException(null, null, "null entry");
        if (e.objectId() == null || e.objectId().isBlank()) {
            throw new ReferentialIntegrityException(e.objectId(), e.toolId(), "missing object id");
        }
        if (e.toolId() == null || !knownTools.contains(e.toolId())) {
            throw new ReferentialIntegrityException(e.objectId(), e.toolId(), "unknown tool id " + e.toolId());
        }
        if (e.payload() == null) {
            throw new ReferentialIntegrityException(e.objectId(), e.toolId(), "missing payload");
        }
        validatePayload(e.objectId(), e.toolId(), e.payload());
    }

    private List<FactEntry<P>> designate(List<FactEntry<P>> entries, ConflictPolicy policy) {
        List<Map.Entry<String, FactEntry<P>>> keyed = new ArrayList<>(entries.size());
        for (FactEntry<P> e : entries) keyed.add(new AbstractMap.SimpleEntry<>(CanonicalJson.write(e.payload()), e));
        keyed.sort(Comparator.<Map.Entry<String, FactEntry<P>>, FactKey>comparing(m -> m.getValue().key())
                .thenComparing(m -> m.getKey()));

        Map<FactKey, FactEntry<P>> winners = new LinkedHashMap<>();
        for (Map.Entry<String, FactEntry<P>> m : keyed) {
            FactEntry<P> e = m.getValue();
            if (policy == ConflictPolicy.SKIP) winners.putIfAbsent(e.key(), e);
            else winners.put(e.key(), e);
        }
        return new ArrayList<>(winners.values());
    }

    private int write(List<FactEntry<P>> winners, ConflictPolicy policy) {
        int affected = 0;
        for (FactEntry<P> e : winners) {
            Optional<R> existing = repo.findById(e.key());
            if (existing.isPresent()) {
                if (policy == ConflictPolicy.SKIP) continue;
                writePayload(existing.get(), e.payload());
                repo.save(existing.get());
            } else {
                R r = newRecord(e.objectId(), e.toolId());
                writePayload(r, e.payload());
                repo.save(r);
            }
            affected++;
        }
        repo.flush();
        return affected;
    }
}
