package com.example.metaindex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;

/**
 * Maps license names to small integer ids. Unknown names are inserted on first sight; two
 * workers seeing the same new name race on the unique name constraint and the loser
 * re-reads.
 */
@Slf4j
@Service
public class LicenseDictionary {

    private final LicenseRepository repo;
    private final TransactionTemplate tx;
    private final int maxAttempts;

    public LicenseDictionary(LicenseRepository repo, PlatformTransactionManager transactionManager, Environment env) {
        this.repo = repo;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.maxAttempts = Integer.parseInt(env.getProperty("indexer.store.max-attempts", "5"));
    }

    /**
     * Ids for every name, inserting the names not seen before.
     */
    public Map<String, Integer> resolve(Collection<String> names) {
        SortedSet<String> wanted = new TreeSet<>(names);
        Map<String, Integer> out = new HashMap<>();
        for (LicenseRecord r : repo.findByNameIn(wanted)) out.put(r.getName(), r.getId());
        for (String name : wanted) {
            if (!out.containsKey(name)) out.put(name, insertIfAbsent(name));
        }
        return out;
    }

    /**
     * Ids of names already in the dictionary; unknown names are left out.
     */
    public Map<String, Integer> lookup(Collection<String> names) {
        Map<String, Integer> out = new HashMap<>();
        for (LicenseRecord r : repo.findByNameIn(new HashSet<>(names))) out.put(r.getName(), r.getId());
        return out;
    }

    public Map<Integer, String> names(Collection<Integer> ids) {
        Map<Integer, String> out = new HashMap<>();
        for (LicenseRecord r : repo.findAllById(new HashSet<>(ids))) out.put(r.getId(), r.getName());
        return out;
    }

    private Integer insertIfAbsent(String name) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Integer id = tx.execute(status -> repo.findByName(name)
                        .orElseGet(() -> repo.saveAndFlush(new LicenseRecord(name)))
                        .getId());
                if (id != null) return id;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                log.debug("license {} inserted concurrently (attempt {})", name, attempt);
            }
        }
        return repo.findByName(name)
                .map(LicenseRecord::getId)
                .orElseThrow(() -> new IllegalStateException("could not insert license " + name));
    }
}
