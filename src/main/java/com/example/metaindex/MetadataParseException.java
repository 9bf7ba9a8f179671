package com.example.metaindex;

public class MetadataParseException extends IndexerException {

    public MetadataParseException(String message) {
        super(message);
    }

    public MetadataParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
