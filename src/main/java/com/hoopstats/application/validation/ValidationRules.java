package com.hoopstats.application.validation;

import com.hoopstats.domain.model.Position;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Field rules plus the tolerance for invalid required fields.
 *
 * <p>Field names follow the Basketball Reference per-game table ({@code g}, {@code mp},
 * {@code pts}, {@code fg_pct}, ...); adapters map their own column names onto them.</p>
 */
public class ValidationRules {

    public static final double DEFAULT_MAX_INVALID_REQUIRED_FRACTION = 0.5;

    private final Map<String, FieldRule> rules;
    private final double maxInvalidRequiredFraction;

    public ValidationRules(Map<String, FieldRule> rules, double maxInvalidRequiredFraction) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        this.maxInvalidRequiredFraction = maxInvalidRequiredFraction;
    }

    /**
     * Plausible per-game ranges for a regular season.
     */
    public static ValidationRules defaults() {
        Map<String, FieldRule> rules = new LinkedHashMap<>();
        rules.put("g", FieldRule.integer(true, 0, 84));
        rules.put("gs", FieldRule.integer(false, 0, 84));
        rules.put("mp", FieldRule.numeric(true, 0, 48));
        rules.put("pts", FieldRule.numeric(true, 0, 60));
        rules.put("age", FieldRule.integer(false, 17, 45));
        rules.put("pos", FieldRule.oneOf(false,
            Arrays.stream(Position.values()).map(Enum::name).collect(Collectors.toList())));
        for (String made : new String[] {"fg", "fg3", "fg2", "ft"}) {
            rules.put(made, FieldRule.numeric(false, 0, 30));
            rules.put(made + "a", FieldRule.numeric(false, 0, 50));
            rules.put(made + "_pct", FieldRule.numeric(false, 0, 1));
        }
        rules.put("efg_pct", FieldRule.numeric(false, 0, 1.5));
        rules.put("orb", FieldRule.numeric(false, 0, 10));
        rules.put("drb", FieldRule.numeric(false, 0, 20));
        rules.put("trb", FieldRule.numeric(false, 0, 30));
        rules.put("ast", FieldRule.numeric(false, 0, 20));
        rules.put("stl", FieldRule.numeric(false, 0, 6));
        rules.put("blk", FieldRule.numeric(false, 0, 8));
        rules.put("tov", FieldRule.numeric(false, 0, 10));
        rules.put("pf", FieldRule.numeric(false, 0, 6));
        return new ValidationRules(rules, DEFAULT_MAX_INVALID_REQUIRED_FRACTION);
    }

    /**
     * Defaults overlaid with the given rules.
     */
    public static ValidationRules defaultsWith(Map<String, FieldRule> overrides, double maxInvalidRequiredFraction) {
        Map<String, FieldRule> merged = new LinkedHashMap<>(defaults().getRules());
        merged.putAll(overrides);
        return new ValidationRules(merged, maxInvalidRequiredFraction);
    }

    public Map<String, FieldRule> getRules() {
        return rules;
    }

    public FieldRule rule(String field) {
        return rules.get(field);
    }

    public double getMaxInvalidRequiredFraction() {
        return maxInvalidRequiredFraction;
    }

    public long requiredCount() {
        return rules.values().stream().filter(FieldRule::required).count();
    }
}
