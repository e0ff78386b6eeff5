package com.hoopstats.application.reconcile;

import java.util.Map;

/**
 * A field whose sources disagreed beyond tolerance. The selected value was still committed.
 */
public record FieldConflict(
    String entityId,
    String field,
    String selectedSource,
    Object selectedValue,
    Map<String, Object> candidates
) {

    public String describe() {
        return "Field " + field + " of " + entityId + ": selected " + selectedValue
            + " from " + selectedSource + ", candidates " + candidates;
    }
}
