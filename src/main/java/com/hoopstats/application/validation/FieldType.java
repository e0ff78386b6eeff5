package com.hoopstats.application.validation;

public enum FieldType {
    NUMERIC,
    /** Counts such as games played; fractional values are invalid. */
    INTEGER,
    STRING,
    ENUM
}
