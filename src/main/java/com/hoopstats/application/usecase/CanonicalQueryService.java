package com.hoopstats.application.usecase;

import com.hoopstats.application.reconcile.NameNormalizer;
import com.hoopstats.application.throttle.SourceHealthRegistry;
import com.hoopstats.domain.model.CanonicalQuery;
import com.hoopstats.domain.model.CanonicalRecord;
import com.hoopstats.domain.model.CollectionRun;
import com.hoopstats.domain.model.SourceHealth;
import com.hoopstats.domain.ports.CanonicalStore;
import com.hoopstats.domain.ports.TelemetryRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only access to the canonical dataset and run telemetry for analytics and presentation.
 */
public class CanonicalQueryService {

    private final CanonicalStore store;
    private final TelemetryRepository telemetry;
    private final SourceHealthRegistry health;
    private final CollectionRunCoordinator coordinator;

    public CanonicalQueryService(CanonicalStore store,
                                 TelemetryRepository telemetry,
                                 SourceHealthRegistry health,
                                 CollectionRunCoordinator coordinator) {
        this.store = store;
        this.telemetry = telemetry;
        this.health = health;
        this.coordinator = coordinator;
    }

    public List<CanonicalRecord> getCanonicalRecords(CanonicalQuery query) {
        Set<String> players = query.players() == null ? Set.of()
            : query.players().stream().map(NameNormalizer::normalize).collect(Collectors.toSet());

        return store.query(query.season(), query.runId()).stream()
            .filter(r -> query.team() == null || r.getTeam() == query.team())
            .filter(r -> query.position() == null || r.getPosition() == query.position())
            .filter(r -> players.isEmpty() || players.contains(r.getNormalizedName()))
            .filter(r -> atLeast(r.number("g"), query.minGames()))
            .filter(r -> atLeast(r.number("mp"), query.minMinutes()))
            .toList();
    }

    public Optional<CanonicalRecord> getLatest(String entityId) {
        return store.findLatest(entityId);
    }

    public List<CanonicalRecord> getHistory(String entityId) {
        return store.history(entityId);
    }

    public Optional<CollectionRun> getRunStatus(String runId) {
        return coordinator.getRunStatus(runId);
    }

    public List<CollectionRun> listRecentRuns(int limit) {
        return telemetry.findRecentRuns(limit);
    }

    /**
     * Live health of this process, falling back to the persisted snapshot for sources that have
     * not been invoked since start.
     */
    public List<SourceHealth> listSourceHealth() {
        Map<String, SourceHealth> merged = new TreeMap<>(telemetry.findSourceHealth().stream()
            .collect(Collectors.toMap(SourceHealth::getSourceId, Function.identity(), (a, b) -> b)));
        health.snapshotAll().forEach(h -> merged.put(h.getSourceId(), h));
        return merged.values().stream()
            .sorted(Comparator.comparing(SourceHealth::getSourceId))
            .toList();
    }

    private static boolean atLeast(Double value, Double threshold) {
        if (threshold == null) {
            return true;
        }
        return value != null && value >= threshold;
    }
}
