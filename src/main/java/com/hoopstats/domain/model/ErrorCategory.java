package com.hoopstats.domain.model;

/**
 * Kinds of problems aggregated on a collection run.
 */
public enum ErrorCategory {
    TRANSIENT,
    RATE_LIMITED,
    PERMANENT,
    PARSE_ERROR,
    RETRIES_EXHAUSTED,
    SOURCE_UNAVAILABLE,
    VALIDATION_REJECTION,
    RECONCILIATION_CONFLICT,
    ENTITY_AMBIGUITY,
    COMMIT_CONFLICT,
    STORE_FAILURE,
    DEADLINE,
    CANCELLED,
    NO_DATA
}
