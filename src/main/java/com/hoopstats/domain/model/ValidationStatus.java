package com.hoopstats.domain.model;

public enum ValidationStatus {
    ACCEPTED,
    REPAIRED,
    REJECTED
}
