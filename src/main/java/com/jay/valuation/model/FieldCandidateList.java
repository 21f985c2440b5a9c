package com.jay.valuation.model;

import java.util.List;

/**
 * Priority-ordered label patterns for one logical quantity. The first entry is the
 * most authoritative label; resolution stops at the first one with a value.
 */
public record FieldCandidateList(List<String> labels) {

    public FieldCandidateList {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("Candidate list must not be empty");
        }
        labels = List.copyOf(labels);
    }

    public static FieldCandidateList of(String... labels) {
        return new FieldCandidateList(List.of(labels));
    }
}
