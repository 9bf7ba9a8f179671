package com.example.metaindex;

public enum IndexingStage {
    PENDING,
    HEAD_RESOLVED,
    DIRECTORY_INDEXED,
    ORIGIN_AGGREGATED,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
