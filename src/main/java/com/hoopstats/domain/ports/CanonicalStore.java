package com.hoopstats.domain.ports;

import com.hoopstats.domain.error.CommitConflictException;
import com.hoopstats.domain.model.CanonicalRecord;

import java.util.List;
import java.util.Optional;

/**
 * Port for the versioned canonical dataset.
 */
public interface CanonicalStore {

    /**
     * Latest committed version of a season, 0 when nothing was committed yet.
     */
    long currentVersion(int season);

    /**
     * Writes all records of a run as the next version of the season, or nothing at all.
     *
     * @param baseVersion version the run read before collecting
     * @return the committed version
     * @throws CommitConflictException when the season moved past {@code baseVersion}
     */
    long commit(String runId, int season, long baseVersion, List<CanonicalRecord> records)
        throws CommitConflictException;

    /**
     * Latest committed record per entity of a season, sorted by entity id.
     *
     * @param snapshotRunId when not null, the records committed by that run instead
     */
    List<CanonicalRecord> query(int season, String snapshotRunId);

    Optional<CanonicalRecord> findLatest(String entityId);

    /**
     * Every committed version of an entity, oldest first.
     */
    List<CanonicalRecord> history(String entityId);
}
