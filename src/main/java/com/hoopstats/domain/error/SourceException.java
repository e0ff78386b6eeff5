package com.hoopstats.domain.error;

import com.hoopstats.domain.model.ErrorCategory;

/**
 * Failure of one source request, classified so the coordinator can decide between
 * retrying and skipping the scope unit.
 */
public abstract class SourceException extends Exception {

    private final String sourceId;

    protected SourceException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    protected SourceException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }

    public abstract ErrorCategory getCategory();

    /**
     * Whether the backoff policy applies. Permanent and parse failures skip the unit instead.
     */
    public boolean isRetryable() {
        return false;
    }
}
