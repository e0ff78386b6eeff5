package com.hoopstats.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconciled value of one statistic with its provenance.
 */
public class CanonicalField {

    /** Typed value: a number for stats, the enum name for team/position, text otherwise. */
    private Object value;

    /** Source whose value was selected. */
    private String source;

    /** Deterministic support score in [0, 1], 4 decimals. */
    private double confidence;

    /** True when another source disagreed beyond tolerance. */
    private boolean conflicted;

    /** Every source that reported this field, in precedence order. */
    private List<String> contributors = new ArrayList<>();

    public CanonicalField() {
    }

    public CanonicalField(Object value, String source, double confidence, boolean conflicted, List<String> contributors) {
        this.value = value;
        this.source = source;
        this.confidence = confidence;
        this.conflicted = conflicted;
        this.contributors = new ArrayList<>(contributors);
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public boolean isConflicted() {
        return conflicted;
    }

    public void setConflicted(boolean conflicted) {
        this.conflicted = conflicted;
    }

    public List<String> getContributors() {
        return contributors;
    }

    public void setContributors(List<String> contributors) {
        this.contributors = contributors;
    }
}
