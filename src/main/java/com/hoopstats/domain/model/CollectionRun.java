package com.hoopstats.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Telemetry of one collection run.
 *
 * <p>Only the run coordinator mutates a run; source tasks of the same run update their own
 * status entries concurrently, hence the concurrent collections. Once {@code outcome} is set
 * the run is terminal and never reopened.</p>
 */
public class CollectionRun {

    private String runId;

    private CollectionScope scope;

    private Instant startedAt;

    private Instant finishedAt;

    private CollectionStatus status = CollectionStatus.PENDING;

    /** Per-source status, keyed by source id. */
    private Map<String, CollectionStatus> sourceStatuses = new ConcurrentSkipListMap<>();

    private List<RunError> errors = new CopyOnWriteArrayList<>();

    /** Null while the run is in flight. */
    private RunOutcome outcome;

    /** Canonical version of the season the run started from. */
    private long baseVersion;

    /** Version written by the commit, null when nothing was committed. */
    private Long committedVersion;

    private boolean cancelRequested;

    private final AtomicInteger rawRecords = new AtomicInteger();
    private final AtomicInteger acceptedRecords = new AtomicInteger();
    private final AtomicInteger repairedRecords = new AtomicInteger();
    private final AtomicInteger rejectedRecords = new AtomicInteger();

    private int canonicalRecords;

    public CollectionRun() {
    }

    public CollectionRun(String runId, CollectionScope scope, Instant startedAt) {
        this.runId = runId;
        this.scope = scope;
        this.startedAt = startedAt;
    }

    public void addError(RunError error) {
        errors.add(error);
    }

    public void markSource(String sourceId, CollectionStatus sourceStatus) {
        sourceStatuses.put(sourceId, sourceStatus);
    }

    /**
     * Records the status a source reached on its own. A source the run has already failed stays
     * FAILED, so a late finish cannot revive one whose records were left out.
     *
     * @return the status now stored for the source
     */
    public CollectionStatus completeSource(String sourceId, CollectionStatus sourceStatus) {
        return sourceStatuses.compute(sourceId,
            (id, current) -> current == CollectionStatus.FAILED ? current : sourceStatus);
    }

    public CollectionStatus sourceStatus(String sourceId) {
        return sourceStatuses.get(sourceId);
    }

    public boolean isTerminal() {
        return outcome != null;
    }

    public void countRecord(ValidationStatus validation) {
        rawRecords.incrementAndGet();
        switch (validation) {
            case ACCEPTED -> acceptedRecords.incrementAndGet();
            case REPAIRED -> repairedRecords.incrementAndGet();
            case REJECTED -> rejectedRecords.incrementAndGet();
        }
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public CollectionScope getScope() {
        return scope;
    }

    public void setScope(CollectionScope scope) {
        this.scope = scope;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public CollectionStatus getStatus() {
        return status;
    }

    public void setStatus(CollectionStatus status) {
        this.status = status;
    }

    public Map<String, CollectionStatus> getSourceStatuses() {
        return sourceStatuses;
    }

    public void setSourceStatuses(Map<String, CollectionStatus> sourceStatuses) {
        this.sourceStatuses = new ConcurrentSkipListMap<>(sourceStatuses);
    }

    public List<RunError> getErrors() {
        return errors;
    }

    public void setErrors(List<RunError> errors) {
        this.errors = new CopyOnWriteArrayList<>(errors != null ? errors : new ArrayList<>());
    }

    public RunOutcome getOutcome() {
        return outcome;
    }

    public void setOutcome(RunOutcome outcome) {
        this.outcome = outcome;
    }

    public long getBaseVersion() {
        return baseVersion;
    }

    public void setBaseVersion(long baseVersion) {
        this.baseVersion = baseVersion;
    }

    public Long getCommittedVersion() {
        return committedVersion;
    }

    public void setCommittedVersion(Long committedVersion) {
        this.committedVersion = committedVersion;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void setCancelRequested(boolean cancelRequested) {
        this.cancelRequested = cancelRequested;
    }

    public int getRawRecords() {
        return rawRecords.get();
    }

    public void setRawRecords(int rawRecords) {
        this.rawRecords.set(rawRecords);
    }

    public int getAcceptedRecords() {
        return acceptedRecords.get();
    }

    public void setAcceptedRecords(int acceptedRecords) {
        this.acceptedRecords.set(acceptedRecords);
    }

    public int getRepairedRecords() {
        return repairedRecords.get();
    }

    public void setRepairedRecords(int repairedRecords) {
        this.repairedRecords.set(repairedRecords);
    }

    public int getRejectedRecords() {
        return rejectedRecords.get();
    }

    public void setRejectedRecords(int rejectedRecords) {
        this.rejectedRecords.set(rejectedRecords);
    }

    public int getCanonicalRecords() {
        return canonicalRecords;
    }

    public void setCanonicalRecords(int canonicalRecords) {
        this.canonicalRecords = canonicalRecords;
    }
}
