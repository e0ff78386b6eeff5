package com.hoopstats.application.throttle;

import java.time.Duration;

/**
 * Answer of the rate limiter to one request slot.
 */
public record Acquisition(Kind kind, Duration delay) {

    public enum Kind {
        GRANTED,
        WAIT,
        UNAVAILABLE
    }

    private static final Acquisition GRANTED = new Acquisition(Kind.GRANTED, Duration.ZERO);
    private static final Acquisition UNAVAILABLE = new Acquisition(Kind.UNAVAILABLE, Duration.ZERO);

    public static Acquisition granted() {
        return GRANTED;
    }

    public static Acquisition waitFor(Duration delay) {
        return new Acquisition(Kind.WAIT, delay);
    }

    public static Acquisition unavailable() {
        return UNAVAILABLE;
    }

    public boolean isGranted() {
        return kind == Kind.GRANTED;
    }
}
