package com.hoopstats.domain.error;

/**
 * Another run committed to the same season after this run read its base version.
 */
public class CommitConflictException extends Exception {

    private final int season;
    private final long expectedVersion;
    private final long actualVersion;

    public CommitConflictException(int season, long expectedVersion, long actualVersion) {
        super("Season " + season + " is at version " + actualVersion + ", commit expected base " + expectedVersion);
        this.season = season;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public int getSeason() {
        return season;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
