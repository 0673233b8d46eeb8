package com.prospectenhancer.enhancement.parser;

import java.util.List;

/**
 * Model classification: the primary (highest-confidence valid) code plus up to three candidates.
 */
public record NaicsClassification(String code, String description, double confidence, List<NaicsCandidate> candidates) {

    public static NaicsClassification none() {
        return new NaicsClassification(null, null, 0.0, List.of());
    }

    public static NaicsClassification of(List<NaicsCandidate> candidates) {
        if (candidates.isEmpty()) {
            return none();
        }
        NaicsCandidate primary = candidates.get(0);
        return new NaicsClassification(primary.code(), primary.description(), primary.confidence(), List.copyOf(candidates));
    }

    public boolean hasCode() {
        return code != null;
    }
}
