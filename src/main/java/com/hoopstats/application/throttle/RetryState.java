package com.hoopstats.application.throttle;

import java.time.Duration;
import java.time.Instant;

/**
 * Retry bookkeeping of one scope unit: how many retries were used and when the next
 * attempt becomes eligible.
 */
public class RetryState {

    private int retries;
    private Instant nextEligibleAt;

    public RetryState(Instant now) {
        this.nextEligibleAt = now;
    }

    public int getRetries() {
        return retries;
    }

    public Instant getNextEligibleAt() {
        return nextEligibleAt;
    }

    /**
     * Schedules the next attempt {@code delay} after {@code now}.
     */
    public void scheduleRetry(Instant now, Duration delay) {
        retries++;
        nextEligibleAt = now.plus(delay);
    }

    /**
     * Time left until the next attempt is eligible, never negative.
     */
    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, nextEligibleAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
