package com.hoopstats.application.reconcile;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configured ranking of sources. A lower precedence number wins; equal numbers are ordered by
 * configuration order.
 */
public class SourcePrecedence {

    /** Precedence of sources that are not configured. */
    public static final int UNRANKED = 1000;

    private final Map<String, Integer> precedence = new LinkedHashMap<>();
    private final Map<String, Integer> order = new LinkedHashMap<>();

    /**
     * @param ranked source ids with their precedence, in configuration order
     */
    public SourcePrecedence(List<Map.Entry<String, Integer>> ranked) {
        int index = 0;
        for (Map.Entry<String, Integer> entry : ranked) {
            if (entry.getValue() == null || entry.getValue() < 1) {
                throw new IllegalArgumentException("Precedence of " + entry.getKey() + " must be >= 1");
            }
            precedence.put(entry.getKey(), entry.getValue());
            order.put(entry.getKey(), index++);
        }
    }

    public int precedenceOf(String sourceId) {
        return precedence.getOrDefault(sourceId, UNRANKED);
    }

    public int configOrder(String sourceId) {
        return order.getOrDefault(sourceId, Integer.MAX_VALUE);
    }

    /**
     * Weight a source contributes to confidence scores.
     */
    public double weight(String sourceId) {
        return 1.0 / precedenceOf(sourceId);
    }

    public Comparator<String> comparator() {
        return Comparator.<String>comparingInt(this::precedenceOf)
            .thenComparingInt(this::configOrder)
            .thenComparing(Comparator.naturalOrder());
    }
}
