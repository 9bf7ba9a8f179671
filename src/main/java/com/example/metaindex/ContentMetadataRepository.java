package com.example.metaindex;

public interface ContentMetadataRepository extends FactRepository<ContentMetadataRecord> {
}
