package com.hoopstats.domain.error;

import com.hoopstats.domain.model.ErrorCategory;

/**
 * Network failure, timeout or 5xx answer. Retried with backoff.
 */
public class TransientSourceException extends SourceException {

    public TransientSourceException(String sourceId, String message) {
        super(sourceId, message);
    }

    public TransientSourceException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.TRANSIENT;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
