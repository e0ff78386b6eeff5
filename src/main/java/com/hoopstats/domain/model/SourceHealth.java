package com.hoopstats.domain.model;

import java.time.Instant;

/**
 * Snapshot of a source's recent reliability, as exposed to operators and persisted
 * best-effort. The live, lock-guarded state is kept by the health registry.
 */
public class SourceHealth {

    private String sourceId;

    /** Success ratio over the trailing window, 1.0 when no invocation was recorded yet. */
    private double successRate = 1.0;

    private int samples;

    private int consecutiveFailures;

    private Instant lastSuccess;

    private Instant lastFailure;

    /** True while acquisitions short-circuit. */
    private boolean circuitOpen;

    /** When an open circuit lets a trial request through again. */
    private Instant openUntil;

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public double getSuccessRate() {
        return successRate;
    }

    public void setSuccessRate(double successRate) {
        this.successRate = successRate;
    }

    public int getSamples() {
        return samples;
    }

    public void setSamples(int samples) {
        this.samples = samples;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    public Instant getLastSuccess() {
        return lastSuccess;
    }

    public void setLastSuccess(Instant lastSuccess) {
        this.lastSuccess = lastSuccess;
    }

    public Instant getLastFailure() {
        return lastFailure;
    }

    public void setLastFailure(Instant lastFailure) {
        this.lastFailure = lastFailure;
    }

    public boolean isCircuitOpen() {
        return circuitOpen;
    }

    public void setCircuitOpen(boolean circuitOpen) {
        this.circuitOpen = circuitOpen;
    }

    public Instant getOpenUntil() {
        return openUntil;
    }

    public void setOpenUntil(Instant openUntil) {
        this.openUntil = openUntil;
    }
}
