package com.example.metaindex;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;

@Service
public class MimetypeFactStore extends FactStore<ContentMimetypeRecord, Mimetype> {

    public MimetypeFactStore(ContentMimetypeRepository repo, ToolRegistry tools,
                             PlatformTransactionManager transactionManager, Environment env) {
        super(repo, tools, transactionManager, Integer.parseInt(env.getProperty("indexer.store.max-attempts", "5")));
    }

    @Override
    public String kind() {
        return "mimetype";
    }

    @Override
    protected ContentMimetypeRecord newRecord(String objectId, Long toolId) {
        return new ContentMimetypeRecord(objectId, toolId);
    }

    @Override
    protected void writePayload(ContentMimetypeRecord record, Mimetype payload) {
        record.setMimetype(payload.mimetype());
        record.setEncoding(payload.encoding());
    }

    @Override
    protected Mimetype readPayload(ContentMimetypeRecord record) {
        return new Mimetype(record.getMimetype(), record.getEncoding());
    }
}
