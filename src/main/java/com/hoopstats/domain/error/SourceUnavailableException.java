package com.hoopstats.domain.error;

import com.hoopstats.domain.model.ErrorCategory;

/**
 * The source's circuit is open; no request was attempted. Ends the source for the run.
 */
public class SourceUnavailableException extends SourceException {

    public SourceUnavailableException(String sourceId, String message) {
        super(sourceId, message);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.SOURCE_UNAVAILABLE;
    }
}
