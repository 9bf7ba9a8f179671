package com.example.metaindex;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;

@Service
public class OriginExtrinsicMetadataFactStore extends OriginMetadataFactStore<OriginExtrinsicMetadataRecord> {

    public OriginExtrinsicMetadataFactStore(OriginExtrinsicMetadataRepository repo, ToolRegistry tools,
                                            PlatformTransactionManager transactionManager, Environment env) {
        super(repo, tools, transactionManager, Integer.parseInt(env.getProperty("indexer.store.max-attempts", "5")));
    }

    @Override
    public String kind() {
        return "origin-extrinsic-metadata";
    }

    @Override
    protected OriginExtrinsicMetadataRecord newRecord(String objectId, Long toolId) {
        return new OriginExtrinsicMetadataRecord(objectId, toolId);
    }
}
