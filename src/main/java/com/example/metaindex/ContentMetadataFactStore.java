package com.example.metaindex;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;

@Service
public class ContentMetadataFactStore extends FactStore<ContentMetadataRecord, ObjectNode> {

    public ContentMetadataFactStore(ContentMetadataRepository repo, ToolRegistry tools,
                                    PlatformTransactionManager transactionManager, Environment env) {
        super(repo, tools, transactionManager, Integer.parseInt(env.getProperty("indexer.store.max-attempts", "5")));
    }

    @Override
    public String kind() {
        return "content-metadata";
    }

    @Override
    protected ContentMetadataRecord newRecord(String objectId, Long toolId) {
        return new ContentMetadataRecord(objectId, toolId);
    }

    @Override
    protected void writePayload(ContentMetadataRecord record, ObjectNode payload) {
        record.setMetadata(CanonicalJson.write(payload));
    }

    @Override
    protected ObjectNode readPayload(ContentMetadataRecord record) {
        return CanonicalJson.readObject(record.getMetadata());
    }
}
