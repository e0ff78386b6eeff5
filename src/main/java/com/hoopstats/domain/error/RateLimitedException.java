package com.hoopstats.domain.error;

import com.hoopstats.domain.model.ErrorCategory;

import java.time.Duration;
import java.util.Optional;

/**
 * The source asked us to slow down (HTTP 429 or similar). Retried like a transient failure,
 * waiting the server-suggested delay when one was sent.
 */
public class RateLimitedException extends SourceException {

    private final Duration retryAfter;

    public RateLimitedException(String sourceId, String message, Duration retryAfter) {
        super(sourceId, message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.RATE_LIMITED;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
