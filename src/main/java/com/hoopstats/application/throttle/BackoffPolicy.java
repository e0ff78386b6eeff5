package com.hoopstats.application.throttle;

import com.hoopstats.domain.error.RateLimitedException;
import com.hoopstats.domain.error.SourceException;

import java.time.Duration;

/**
 * Exponential retry delays: {@code min(base * factor^attempt, cap)}.
 *
 * <p>{@code attempt} is the zero-based index of the retry about to happen, so with the
 * defaults the waits are 5s, 10s and 20s before the unit is given up.</p>
 */
public class BackoffPolicy {

    public static final Duration DEFAULT_BASE = Duration.ofSeconds(5);
    public static final double DEFAULT_FACTOR = 2.0;
    public static final Duration DEFAULT_CAP = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_RETRIES = 3;

    private final Duration base;
    private final double factor;
    private final Duration cap;
    private final int maxRetries;

    public BackoffPolicy(Duration base, double factor, Duration cap, int maxRetries) {
        if (base.isNegative() || cap.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("Backoff factor must be >= 1, got " + factor);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        this.base = base;
        this.factor = factor;
        this.cap = cap;
        this.maxRetries = maxRetries;
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BASE, DEFAULT_FACTOR, DEFAULT_CAP, DEFAULT_MAX_RETRIES);
    }

    public Duration nextRetryDelay(int attempt) {
        double millis = base.toMillis() * Math.pow(factor, attempt);
        if (millis >= cap.toMillis()) {
            return cap;
        }
        return Duration.ofMillis(Math.round(millis));
    }

    /**
     * Delay before retrying after {@code failure}; honours a server-suggested delay up to the cap.
     */
    public Duration delayFor(SourceException failure, int attempt) {
        if (failure instanceof RateLimitedException rateLimited && rateLimited.getRetryAfter().isPresent()) {
            Duration retryAfter = rateLimited.getRetryAfter().get();
            return retryAfter.compareTo(cap) > 0 ? cap : retryAfter;
        }
        return nextRetryDelay(attempt);
    }

    /**
     * @param retriesDone retries already performed for the current unit
     */
    public boolean canRetry(int retriesDone) {
        return retriesDone < maxRetries;
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
