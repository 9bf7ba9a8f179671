package com.example.metaindex;

public record CtagsSymbol(String name, String kind, int line, String lang) {
}
