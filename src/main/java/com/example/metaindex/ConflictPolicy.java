package com.example.metaindex;

import java.util.Locale;

public enum ConflictPolicy {
    /** keep the stored fact, drop the new one */
    SKIP,
    /** replace the stored fact */
    OVERWRITE;

    public static ConflictPolicy fromString(String s) {
        if (s == null || s.isBlank()) return SKIP;
        String v = s.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "skip":
            case "ignore-dups":
                return SKIP;
            case "overwrite":
            case "update-dups":
                return OVERWRITE;
            default:
                throw new IllegalArgumentException("unknown conflict policy: " + s);
        }
    }
}
