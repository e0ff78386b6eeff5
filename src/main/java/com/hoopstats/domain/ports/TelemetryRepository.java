package com.hoopstats.domain.ports;

import com.hoopstats.domain.model.CollectionRun;
import com.hoopstats.domain.model.SourceHealth;

import java.util.List;
import java.util.Optional;

/**
 * Port for run history and source health snapshots.
 */
public interface TelemetryRepository {

    void saveRun(CollectionRun run);

    Optional<CollectionRun> findRun(String runId);

    /**
     * Most recent runs first.
     */
    List<CollectionRun> findRecentRuns(int limit);

    void saveSourceHealth(List<SourceHealth> health);

    List<SourceHealth> findSourceHealth();
}
