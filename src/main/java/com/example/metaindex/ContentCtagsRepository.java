package com.example.metaindex;

import java.util.List;

public interface ContentCtagsRepository extends FactRepository<ContentCtagsRecord> {
    List<ContentCtagsRecord> findBySymbolIndexContaining(String needle);
}
