package com.hoopstats.domain.error;

import com.hoopstats.domain.model.ErrorCategory;

/**
 * The scope unit cannot be served (404, unsupported season, ...). Skipped, not retried.
 */
public class PermanentSourceException extends SourceException {

    public PermanentSourceException(String sourceId, String message) {
        super(sourceId, message);
    }

    public PermanentSourceException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.PERMANENT;
    }
}
