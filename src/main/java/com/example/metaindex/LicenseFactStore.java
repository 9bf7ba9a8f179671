package com.example.metaindex;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.*;

/**
 * Content license facts. The payload is the set of detected license names; the stored row
 * only references dictionary ids, so names are resolved (and new ones inserted) before the
 * fact transaction starts.
 */
@Service
public class LicenseFactStore extends FactStore<ContentLicenseRecord, List<String>> {

    static final int MAX_NAME_LENGTH = 512;

    private final LicenseDictionary dictionary;

    public LicenseFactStore(ContentLicenseRepository repo, ToolRegistry tools, LicenseDictionary dictionary,
                            PlatformTransactionManager transactionManager, Environment env) {
        super(repo, tools, transactionManager, Integer.parseInt(env.getProperty("indexer.store.max-attempts", "5")));
        this.dictionary = dictionary;
    }

    @Override
    public String kind() {
        return "license";
    }

    @Override
    protected void validatePayload(String objectId, Long toolId, List<String> payload) {
        for (String name : payload) {
            if (name == null || name.isBlank()) {
                throw new ReferentialIntegrityException(objectId, toolId, "blank license name");
            }
            if (name.length() > MAX_NAME_LENGTH) {
                throw new ReferentialIntegrityException(objectId, toolId, "license name longer than " + MAX_NAME_LENGTH);
            }
        }
    }

    @Override
    protected void beforeWrite(List<FactEntry<List<String>>> entries) {
        Set<String> names = new TreeSet<>();
        for (FactEntry<List<String>> e : entries) names.addAll(e.payload());
        if (!names.isEmpty()) dictionary.resolve(names);
    }

    @Override
    protected ContentLicenseRecord newRecord(String objectId, Long toolId) {
        return new ContentLicenseRecord(objectId, toolId);
    }

    @Override
    protected void writePayload(ContentLicenseRecord record, List<String> payload) {
        Map<String, Integer> ids = dictionary.lookup(payload);
        Set<Integer> resolved = new TreeSet<>();
        for (String name : payload) {
            Integer id = ids.get(name);
            if (id == null) throw new IllegalStateException("license " + name + " missing from dictionary");
            resolved.add(id);
        }
        record.replaceLicenseIds(resolved);
    }

    @Override
    protected List<String> readPayload(ContentLicenseRecord record) {
        Map<Integer, String> names = dictionary.names(record.getLicenseIds());
        List<String> out = new ArrayList<>(names.values());
        Collections.sort(out);
        return out;
    }
}
