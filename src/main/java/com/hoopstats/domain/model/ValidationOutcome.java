package com.hoopstats.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of validating one raw record.
 *
 * <p>{@code values} holds the typed surviving fields ({@link Double} for numbers,
 * {@link String} for text and enum names). {@code repairedValues} lists the fields that were
 * clamped to null; their substituted value is always absent.</p>
 */
public final class ValidationOutcome {

    private final RawRecord record;
    private final ValidationStatus status;
    private final List<FieldViolation> violations;
    private final Map<String, Object> values;
    private final Map<String, Object> repairedValues;
    private final Team team;

    public ValidationOutcome(RawRecord record,
                             ValidationStatus status,
                             List<FieldViolation> violations,
                             Map<String, Object> values,
                             Map<String, Object> repairedValues,
                             Team team) {
        this.record = record;
        this.status = status;
        this.violations = List.copyOf(violations);
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
        // TreeMap tolerates the null substitutes, Map.copyOf would not
        this.repairedValues = Collections.unmodifiableMap(new TreeMap<>(repairedValues));
        this.team = team;
    }

    public static ValidationOutcome rejected(RawRecord record, List<FieldViolation> violations) {
        return new ValidationOutcome(record, ValidationStatus.REJECTED, violations, Map.of(), Map.of(), null);
    }

    public RawRecord getRecord() {
        return record;
    }

    public ValidationStatus getStatus() {
        return status;
    }

    public boolean isUsable() {
        return status != ValidationStatus.REJECTED;
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public Map<String, Object> getRepairedValues() {
        return repairedValues;
    }

    /**
     * Team resolved from the raw entity key, null for rejected records.
     */
    public Team getTeam() {
        return team;
    }

    public String getSourceId() {
        return record.getSourceId();
    }
}
