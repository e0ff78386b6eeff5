package com.hoopstats.application.reconcile;

import com.hoopstats.domain.model.EntityKey;
import com.hoopstats.domain.model.ErrorCategory;
import com.hoopstats.domain.model.RawEntityKey;
import com.hoopstats.domain.model.RunError;
import com.hoopstats.domain.model.Team;
import com.hoopstats.domain.model.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Groups validated records of all sources into entity keys.
 *
 * <p>Deterministic and free of I/O: the same input, in any order, yields the same groups.</p>
 *
 * Flow:
 * 1) Cluster names per season: identical normalized names, plus abbreviated names that match
 *    exactly one full name ({@link EntityMatchScorer})
 * 2) Within a cluster, count how many sources report each team
 * 3) A unique most-reported team is the player's team; a source that reports only another team
 *    is folded into it, a source that reports both keeps the other line as a separate stint
 * 4) A tie between teams cannot be resolved: each team becomes its own key and an
 *    {@link ErrorCategory#ENTITY_AMBIGUITY} error is recorded
 */
public class EntityResolver {

    private static final Logger logger = LoggerFactory.getLogger(EntityResolver.class);

    private static final Comparator<ValidationOutcome> INPUT_ORDER = Comparator
        .comparing(ValidationOutcome::getSourceId)
        .thenComparing(o -> NameNormalizer.normalize(o.getRecord().getEntityKey().name()))
        .thenComparing(o -> o.getTeam().name())
        .thenComparing(o -> o.getRecord().getEntityKey().name());

    /**
     * @param groups      records per entity key, sorted by key id
     * @param ambiguities unresolvable team disagreements
     */
    public record Resolution(Map<EntityKey, List<ValidationOutcome>> groups, List<RunError> ambiguities) {
    }

    public Resolution resolve(List<ValidationOutcome> outcomes, Instant now) {
        List<ValidationOutcome> usable = outcomes.stream()
            .filter(ValidationOutcome::isUsable)
            .sorted(INPUT_ORDER)
            .toList();

        Map<EntityKey, List<ValidationOutcome>> groups = new TreeMap<>(Comparator.comparing(EntityKey::id));
        List<RunError> ambiguities = new ArrayList<>();

        Map<Integer, List<ValidationOutcome>> bySeason = usable.stream()
            .collect(Collectors.groupingBy(o -> o.getRecord().getEntityKey().season(), TreeMap::new, Collectors.toList()));

        for (Map.Entry<Integer, List<ValidationOutcome>> seasonEntry : bySeason.entrySet()) {
            int season = seasonEntry.getKey();
            Map<String, List<ValidationOutcome>> clusters = clusterByName(seasonEntry.getValue());
            for (Map.Entry<String, List<ValidationOutcome>> cluster : clusters.entrySet()) {
                assignTeams(cluster.getKey(), season, cluster.getValue(), groups, ambiguities, now);
            }
        }
        return new Resolution(groups, ambiguities);
    }

    /**
     * Maps every record to its cluster's representative name.
     */
    Map<String, List<ValidationOutcome>> clusterByName(List<ValidationOutcome> seasonRecords) {
        Map<String, List<ValidationOutcome>> byName = new TreeMap<>();
        Map<String, RawEntityKey> sampleKey = new HashMap<>();
        for (ValidationOutcome outcome : seasonRecords) {
            String name = NameNormalizer.normalize(outcome.getRecord().getEntityKey().name());
            byName.computeIfAbsent(name, n -> new ArrayList<>()).add(outcome);
            sampleKey.putIfAbsent(name, outcome.getRecord().getEntityKey());
        }

        Map<String, String> representative = new HashMap<>();
        for (String name : byName.keySet()) {
            List<String> fuller = byName.keySet().stream()
                .filter(other -> !other.equals(name) && other.length() > name.length())
                .filter(other -> EntityMatchScorer.samePlayer(
                    new RawEntityKey(name, null, 0), new RawEntityKey(other, null, 0)))
                .toList();
            if (fuller.size() == 1) {
                representative.put(name, fuller.get(0));
            } else if (fuller.size() > 1) {
                logger.info("Name {} matches {} players, kept as its own entity", name, fuller.size());
            }
        }

        Map<String, List<ValidationOutcome>> clusters = new TreeMap<>();
        for (Map.Entry<String, List<ValidationOutcome>> entry : byName.entrySet()) {
            String target = representative.getOrDefault(entry.getKey(), entry.getKey());
            // do not chain: the representative of a representative is ignored
            clusters.computeIfAbsent(target, n -> new ArrayList<>()).addAll(entry.getValue());
        }
        return clusters;
    }

    private void assignTeams(String name,
                             int season,
                             List<ValidationOutcome> records,
                             Map<EntityKey, List<ValidationOutcome>> groups,
                             List<RunError> ambiguities,
                             Instant now) {
        Map<Team, Set<String>> sourcesByTeam = new TreeMap<>();
        Map<String, List<ValidationOutcome>> bySource = new LinkedHashMap<>();
        for (ValidationOutcome record : records) {
            sourcesByTeam.computeIfAbsent(record.getTeam(), t -> new TreeSet<>()).add(record.getSourceId());
            bySource.computeIfAbsent(record.getSourceId(), s -> new ArrayList<>()).add(record);
        }

        if (sourcesByTeam.size() == 1) {
            Team team = sourcesByTeam.keySet().iterator().next();
            groups.computeIfAbsent(new EntityKey(name, team, season), k -> new ArrayList<>()).addAll(records);
            return;
        }

        int most = sourcesByTeam.values().stream().mapToInt(Set::size).max().orElse(0);
        List<Team> leaders = sourcesByTeam.entrySet().stream()
            .filter(e -> e.getValue().size() == most)
            .map(Map.Entry::getKey)
            .toList();

        if (leaders.size() > 1) {
            String message = "Player " + name + " (" + season + ") reported for " + sourcesByTeam
                + " with no majority team; kept as separate entities";
            logger.warn(message);
            for (Team team : leaders) {
                ambiguities.add(new RunError(ErrorCategory.ENTITY_AMBIGUITY, null,
                    new EntityKey(name, team, season).id(), "team", message, now));
            }
            for (ValidationOutcome record : records) {
                groups.computeIfAbsent(new EntityKey(name, record.getTeam(), season), k -> new ArrayList<>()).add(record);
            }
            return;
        }

        Team majority = leaders.get(0);
        for (Map.Entry<String, List<ValidationOutcome>> entry : bySource.entrySet()) {
            List<ValidationOutcome> sourceRecords = entry.getValue();
            boolean reportsMajority = sourceRecords.stream().anyMatch(r -> r.getTeam() == majority);
            for (ValidationOutcome record : sourceRecords) {
                Team team;
                if (record.getTeam() == majority) {
                    team = majority;
                } else if (!reportsMajority && sourceRecords.size() == 1) {
                    // the source disagrees on the team, the other sources outvote it
                    team = majority;
                    logger.debug("Folded {} line of {} from {} into {}", record.getTeam(), name, entry.getKey(), majority);
                } else {
                    // separate stint (traded player) or a source listing several teams
                    team = record.getTeam();
                }
                groups.computeIfAbsent(new EntityKey(name, team, season), k -> new ArrayList<>()).add(record);
            }
        }
    }
}
