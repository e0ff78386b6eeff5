package com.hoopstats.domain.model;

public enum RunOutcome {
    COMMITTED,
    ABORTED
}
