package com.example.metaindex;

public class NoCanonicalBranchException extends IndexerException {

    private final String originUrl;

    public NoCanonicalBranchException(String originUrl, String reason) {
        super("no canonical branch for " + originUrl + ": " + reason);
        this.originUrl = originUrl;
    }

    public String getOriginUrl() { return originUrl; }
}
