package com.hoopstats.domain.model;

/**
 * Status of a collection run and of each source within it.
 */
public enum CollectionStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    PARTIAL;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == PARTIAL;
    }
}
