package com.example.metaindex;

public interface DirectoryMetadataRepository extends FactRepository<DirectoryMetadataRecord> {
}
