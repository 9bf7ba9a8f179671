package com.example.metaindex;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;

@Service
public class DirectoryMetadataFactStore extends FactStore<DirectoryMetadataRecord, DirectoryMetadata> {

    public DirectoryMetadataFactStore(DirectoryMetadataRepository repo, ToolRegistry tools,
                                      PlatformTransactionManager transactionManager, Environment env) {
        super(repo, tools, transactionManager, Integer.parseInt(env.getProperty("indexer.store.max-attempts", "5")));
    }

    @Override
    public String kind() {
        return "directory-metadata";
    }

    @Override
    protected DirectoryMetadataRecord newRecord(String objectId, Long toolId) {
        return new DirectoryMetadataRecord(objectId, toolId);
    }

    @Override
    protected void writePayload(DirectoryMetadataRecord record, DirectoryMetadata payload) {
        record.setMetadata(CanonicalJson.write(payload.metadata()));
        record.setMappings(Mappings.join(payload.mappings()));
    }

    @Override
    protected DirectoryMetadata readPayload(DirectoryMetadataRecord record) {
        return new DirectoryMetadata(CanonicalJson.readObject(record.getMetadata()), Mappings.split(record.getMappings()));
    }
}
