package com.hoopstats.application.validation;

import java.util.List;

/**
 * Declared expectations for one statistic.
 *
 * @param required whether a record without the field is rejected
 * @param type     expected type
 * @param min      inclusive lower bound for numeric fields, null for none
 * @param max      inclusive upper bound for numeric fields, null for none
 * @param domain   allowed values for enum fields, upper case
 */
public record FieldRule(boolean required, FieldType type, Double min, Double max, List<String> domain) {

    public FieldRule {
        domain = domain != null ? List.copyOf(domain) : List.of();
    }

    public static FieldRule numeric(boolean required, double min, double max) {
        return new FieldRule(required, FieldType.NUMERIC, min, max, List.of());
    }

    public static FieldRule integer(boolean required, int min, int max) {
        return new FieldRule(required, FieldType.INTEGER, (double) min, (double) max, List.of());
    }

    public static FieldRule text(boolean required) {
        return new FieldRule(required, FieldType.STRING, null, null, List.of());
    }

    public static FieldRule oneOf(boolean required, List<String> domain) {
        return new FieldRule(required, FieldType.ENUM, null, null, domain);
    }

    public String rangeLabel() {
        return "range[" + (min != null ? min : "-inf") + "," + (max != null ? max : "+inf") + "]";
    }
}
