package com.example.metaindex;

/**
 * Extrinsic metadata whose declared authority is not the origin's own forge or package
 * repository. Expected and frequent: callers log it and drop the record.
 */
public class AuthorityMismatchException extends IndexerException {

    public AuthorityMismatchException(String originUrl, String authorityUrl) {
        super("authority " + authorityUrl + " does not match origin " + originUrl);
    }
}
