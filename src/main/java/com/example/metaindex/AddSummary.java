package com.example.metaindex;

import java.util.List;

/**
 * Outcome of a bulk fact write: how many rows were written and which entries were refused.
 */
public record AddSummary(int affected, List<Rejected> rejected) {

    public AddSummary {
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public record Rejected(String objectId, Long toolId, String reason) {
        static Rejected of(ReferentialIntegrityException e) {
            return new Rejected(e.getObjectId(), e.getToolId(), e.getMessage());
        }
    }
}
