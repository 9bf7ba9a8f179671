package com.example.metaindex;

public record Mimetype(String mimetype, String encoding) {
}
