package com.hoopstats.application.reconcile;

import com.hoopstats.domain.model.CanonicalField;
import com.hoopstats.domain.model.CanonicalRecord;
import com.hoopstats.domain.model.EntityKey;
import com.hoopstats.domain.model.Position;
import com.hoopstats.domain.model.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges the validated records of one entity into a canonical record.
 *
 * <p>For each field the highest-precedence source that reported it wins. Among sources of equal
 * precedence the value closest to the median of all candidates wins, then configuration order.
 * A field is flagged conflicted when any candidate is further than the field's tolerance from the
 * selected value (or unequal, for text); the record is still produced.</p>
 *
 * <p>Confidence is {@code agreeingWeight / totalWeight * (1 - 0.5^agreeingSources)} with source
 * weight {@code 1/precedence}, rounded to 4 decimals. The merge reads nothing but its arguments,
 * so identical input gives an identical record.</p>
 */
public class Reconciler {

    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    static final String TEAM_FIELD = "team";
    static final String POSITION_FIELD = "pos";

    private final SourcePrecedence precedence;
    private final Map<String, Double> tolerances;
    private final double defaultTolerance;

    public Reconciler(SourcePrecedence precedence, Map<String, Double> tolerances, double defaultTolerance) {
        this.precedence = precedence;
        this.tolerances = Map.copyOf(tolerances);
        this.defaultTolerance = defaultTolerance;
    }

    public MergeResult merge(EntityKey key, List<ValidationOutcome> records) {
        if (records.isEmpty()) {
            throw new IllegalArgumentException("No records to merge for " + key);
        }
        if (records.stream().anyMatch(r -> !r.isUsable())) {
            throw new IllegalArgumentException("Rejected records cannot be merged into " + key);
        }

        // one line per source, the one on the key's team first
        Map<String, ValidationOutcome> bySource = new TreeMap<>(precedence.comparator());
        records.stream()
            .sorted(Comparator.comparing((ValidationOutcome r) -> r.getTeam() == key.team() ? 0 : 1)
                .thenComparing(r -> r.getRecord().getEntityKey().name()))
            .forEach(r -> bySource.putIfAbsent(r.getSourceId(), r));

        TreeSet<String> fieldNames = new TreeSet<>();
        bySource.values().forEach(r -> fieldNames.addAll(r.getValues().keySet()));

        Map<String, CanonicalField> fields = new TreeMap<>();
        List<FieldConflict> conflicts = new ArrayList<>();
        for (String field : fieldNames) {
            Map<String, Object> candidates = new LinkedHashMap<>();
            for (Map.Entry<String, ValidationOutcome> entry : bySource.entrySet()) {
                Object value = entry.getValue().getValues().get(field);
                if (value != null) {
                    candidates.put(entry.getKey(), value);
                }
            }
            if (!candidates.isEmpty()) {
                fields.put(field, reconcileField(key, field, candidates, conflicts));
            }
        }

        // team as reported by each source; a folded line shows up as a conflict here
        Map<String, Object> teamCandidates = new LinkedHashMap<>();
        bySource.forEach((source, r) -> teamCandidates.put(source, r.getTeam().name()));
        // the resolved team wins, credited to the best source that actually reported it
        String teamSource = teamCandidates.entrySet().stream()
            .filter(candidate -> key.team().name().equals(candidate.getValue()))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElseGet(() -> select(teamCandidates));
        fields.put(TEAM_FIELD, score(key, TEAM_FIELD, teamCandidates, teamSource, conflicts));

        ValidationOutcome top = bySource.values().iterator().next();
        CanonicalRecord record = new CanonicalRecord();
        record.setEntityId(key.id());
        record.setNormalizedName(key.normalizedName());
        record.setDisplayName(top.getRecord().getEntityKey().name().trim());
        record.setTeam(key.team());
        record.setSeason(key.season());
        CanonicalField position = fields.get(POSITION_FIELD);
        if (position != null) {
            record.setPosition(Position.resolve(String.valueOf(position.getValue())).orElse(null));
        }
        record.setFields(fields);
        record.setSources(new ArrayList<>(new TreeSet<>(bySource.keySet())));

        if (!conflicts.isEmpty()) {
            logger.info("{} has {} conflicted fields", key, conflicts.size());
        }
        return new MergeResult(record, conflicts);
    }

    /**
     * @param candidates source to value, in precedence order
     */
    CanonicalField reconcileField(EntityKey key, String field, Map<String, Object> candidates, List<FieldConflict> conflicts) {
        return score(key, field, candidates, select(candidates), conflicts);
    }

    private String select(Map<String, Object> candidates) {
        List<String> sources = new ArrayList<>(candidates.keySet());
        boolean numeric = isNumeric(candidates);

        int topPrecedence = precedence.precedenceOf(sources.get(0));
        List<String> tier = sources.stream()
            .filter(s -> precedence.precedenceOf(s) == topPrecedence)
            .toList();

        String selected = tier.get(0);
        if (tier.size() > 1 && numeric) {
            double median = median(candidates.values());
            double best = Double.MAX_VALUE;
            for (String source : tier) {
                double distance = Math.abs(((Number) candidates.get(source)).doubleValue() - median);
                if (distance < best) {
                    best = distance;
                    selected = source;
                }
            }
        }
        return selected;
    }

    private CanonicalField score(EntityKey key, String field, Map<String, Object> candidates, String selected,
                                 List<FieldConflict> conflicts) {
        List<String> sources = new ArrayList<>(candidates.keySet());
        boolean numeric = isNumeric(candidates);
        Object selectedValue = candidates.get(selected);

        double tolerance = tolerances.getOrDefault(field, defaultTolerance);
        double agreeingWeight = 0.0;
        double totalWeight = 0.0;
        int agreeing = 0;
        boolean conflicted = false;
        for (String source : sources) {
            double weight = precedence.weight(source);
            totalWeight += weight;
            if (agrees(selectedValue, candidates.get(source), numeric, tolerance)) {
                agreeingWeight += weight;
                agreeing++;
            } else {
                conflicted = true;
            }
        }
        double confidence = round4(agreeingWeight / totalWeight * (1.0 - Math.pow(0.5, agreeing)));

        if (conflicted) {
            conflicts.add(new FieldConflict(key.id(), field, selected, selectedValue, new LinkedHashMap<>(candidates)));
        }
        return new CanonicalField(selectedValue, selected, confidence, conflicted, sources);
    }

    private static boolean isNumeric(Map<String, Object> candidates) {
        return candidates.values().stream().allMatch(v -> v instanceof Number);
    }

    private static boolean agrees(Object selected, Object other, boolean numeric, double tolerance) {
        if (numeric) {
            double diff = Math.abs(((Number) selected).doubleValue() - ((Number) other).doubleValue());
            // compare on 9 decimals so 28.2 - 27.7 sits exactly on a 0.5 tolerance
            return round(diff, 9) <= tolerance;
        }
        return Objects.equals(selected, other);
    }

    static double median(Iterable<Object> values) {
        List<Double> sorted = new ArrayList<>();
        values.forEach(v -> sorted.add(((Number) v).doubleValue()));
        sorted.sort(Comparator.naturalOrder());
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    private static double round4(double value) {
        return round(value, 4);
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
