package com.hoopstats.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Player positions. Hybrid labels such as {@code SF-PF} or {@code Guard-Forward} resolve to
 * their first component.
 */
public enum Position {
    PG,
    SG,
    SF,
    PF,
    C,
    G,
    F;

    public static Optional<Position> resolve(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String first = label.trim().split("[-/ ,]+")[0].toUpperCase(Locale.ROOT);
        switch (first) {
            case "GUARD":
                return Optional.of(G);
            case "FORWARD":
                return Optional.of(F);
            case "CENTER":
            case "CENTRE":
                return Optional.of(C);
            default:
                break;
        }
        for (Position position : values()) {
            if (position.name().equals(first)) {
                return Optional.of(position);
            }
        }
        return Optional.empty();
    }
}
