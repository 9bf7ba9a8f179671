package com.example.metaindex;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;

@Service
public class OriginIntrinsicMetadataFactStore extends OriginMetadataFactStore<OriginIntrinsicMetadataRecord> {

    public OriginIntrinsicMetadataFactStore(OriginIntrinsicMetadataRepository repo, ToolRegistry tools,
                                            PlatformTransactionManager transactionManager, Environment env) {
        super(repo, tools, transactionManager, Integer.parseInt(env.getProperty("indexer.store.max-attempts", "5")));
    }

    @Override
    public String kind() {
        return "origin-intrinsic-metadata";
    }

    @Override
    protected OriginIntrinsicMetadataRecord newRecord(String objectId, Long toolId) {
        return new OriginIntrinsicMetadataRecord(objectId, toolId);
    }
}
