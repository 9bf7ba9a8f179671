package com.example.metaindex;

public interface ContentMimetypeRepository extends FactRepository<ContentMimetypeRecord> {
}
