package com.example.metaindex;

public class UnsupportedFormatException extends IndexerException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
