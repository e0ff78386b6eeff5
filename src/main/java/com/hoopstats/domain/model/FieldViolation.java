package com.hoopstats.domain.model;

/**
 * A single rule a field failed. {@code observed} is the raw text the source reported.
 */
public record FieldViolation(String field, String rule, String observed) {

    @Override
    public String toString() {
        return field + " violates " + rule + " (observed: " + observed + ")";
    }
}
