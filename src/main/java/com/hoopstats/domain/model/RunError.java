package com.hoopstats.domain.model;

import java.time.Instant;

/**
 * One entry of a run's aggregate error list. {@code sourceId}, {@code entityId} and
 * {@code field} are null when they do not apply.
 */
public record RunError(
    ErrorCategory category,
    String sourceId,
    String entityId,
    String field,
    String message,
    Instant at
) {

    public static RunError ofSource(ErrorCategory category, String sourceId, String message, Instant at) {
        return new RunError(category, sourceId, null, null, message, at);
    }

    public static RunError ofRun(ErrorCategory category, String message, Instant at) {
        return new RunError(category, null, null, null, message, at);
    }
}
