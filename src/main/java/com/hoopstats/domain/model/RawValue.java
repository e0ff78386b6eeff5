package com.hoopstats.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Untyped value as reported by a source, before validation.
 *
 * <p>Sources disagree on shapes (HTML cell text, JSON numbers, CSV strings), so the value is
 * kept as a tagged union and only resolved to a typed value by the validator.</p>
 */
public final class RawValue {

    public enum Kind {
        STRING,
        NUMBER,
        NULL,
        UNKNOWN
    }

    private static final RawValue NULL_VALUE = new RawValue(Kind.NULL, null);

    private final Kind kind;
    private final Object value;

    private RawValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static RawValue ofString(String text) {
        return text == null ? NULL_VALUE : new RawValue(Kind.STRING, text);
    }

    public static RawValue ofNumber(BigDecimal number) {
        return number == null ? NULL_VALUE : new RawValue(Kind.NUMBER, number);
    }

    public static RawValue ofNumber(double number) {
        return new RawValue(Kind.NUMBER, BigDecimal.valueOf(number));
    }

    public static RawValue ofNull() {
        return NULL_VALUE;
    }

    /**
     * Wraps a value whose shape could not be classified (nested JSON, arrays, ...).
     */
    public static RawValue unknown(Object raw) {
        return new RawValue(Kind.UNKNOWN, raw == null ? null : raw.toString());
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * True when the value is null or a string with no visible characters.
     */
    public boolean isBlank() {
        return kind == Kind.NULL || (kind == Kind.STRING && ((String) value).trim().isEmpty());
    }

    public BigDecimal asNumber() {
        return kind == Kind.NUMBER ? (BigDecimal) value : null;
    }

    public String asText() {
        if (value == null) {
            return null;
        }
        return kind == Kind.NUMBER ? ((BigDecimal) value).toPlainString() : value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawValue other)) {
            return false;
        }
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.NULL ? "null" : kind.name().toLowerCase() + ":" + value;
    }
}
