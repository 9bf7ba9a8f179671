package com.example.metaindex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Column form of a mappings list: comma separated, order preserved, no duplicates.
 */
final class Mappings {

    private Mappings() {}

    static String join(List<String> mappings) {
        if (mappings == null || mappings.isEmpty()) return "";
        return String.join(",", new LinkedHashSet<>(mappings));
    }

    static List<String> split(String column) {
        if (column == null || column.isBlank()) return List.of();
        return new ArrayList<>(new LinkedHashSet<>(Arrays.asList(column.split(","))));
    }
}
