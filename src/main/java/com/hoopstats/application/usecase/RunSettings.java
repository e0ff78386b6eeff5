package com.hoopstats.application.usecase;

import java.time.Duration;

/**
 * @param timeout overall deadline of one run, measured from its start
 */
public record RunSettings(Duration timeout) {

    public static RunSettings defaults() {
        return new RunSettings(Duration.ofMinutes(30));
    }
}
