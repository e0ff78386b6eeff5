package com.hoopstats.domain.error;

import com.hoopstats.domain.model.ErrorCategory;

/**
 * The payload arrived but did not have the expected shape. Skipped, not retried.
 */
public class SourceParseException extends SourceException {

    public SourceParseException(String sourceId, String message) {
        super(sourceId, message);
    }

    public SourceParseException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.PARSE_ERROR;
    }
}
