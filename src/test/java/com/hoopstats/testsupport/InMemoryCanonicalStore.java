package com.hoopstats.testsupport;

import com.hoopstats.domain.error.CommitConflictException;
import com.hoopstats.domain.model.CanonicalRecord;
import com.hoopstats.domain.ports.CanonicalStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * CanonicalStore kept in memory with the same visibility rules as the Mongo store: only records
 * of committed runs are read, latest version per entity.
 */
public class InMemoryCanonicalStore implements CanonicalStore {

    private final Map<Integer, TreeMap<Long, String>> commits = new HashMap<>();
    private final List<CanonicalRecord> records = new ArrayList<>();
    private int competingCommits;
    private int commitCalls;

    /**
     * Makes the next {@code count} commits race against (and lose to) another writer.
     */
    public synchronized void competeWithNextCommits(int count) {
        this.competingCommits = count;
    }

    public synchronized int getCommitCalls() {
        return commitCalls;
    }

    @Override
    public synchronized long currentVersion(int season) {
        TreeMap<Long, String> seasonCommits = commits.get(season);
        return seasonCommits == null || seasonCommits.isEmpty() ? 0L : seasonCommits.lastKey();
    }

    @Override
    public synchronized long commit(String runId, int season, long baseVersion, List<CanonicalRecord> incoming)
            throws CommitConflictException {
        commitCalls++;
        if (competingCommits > 0) {
            competingCommits--;
            long competitor = currentVersion(season) + 1;
            commits.computeIfAbsent(season, s -> new TreeMap<>()).put(competitor, "competitor-" + competitor);
        }
        long current = currentVersion(season);
        if (current != baseVersion) {
            throw new CommitConflictException(season, baseVersion, current);
        }
        long version = baseVersion + 1;
        Instant committedAt = Instant.parse("2024-04-15T10:00:00Z").plusSeconds(version);
        for (CanonicalRecord record : incoming) {
            CanonicalRecord stamped = record.content();
            stamped.setRunId(runId);
            stamped.setVersion(version);
            stamped.setCommittedAt(committedAt);
            records.add(stamped);
        }
        commits.computeIfAbsent(season, s -> new TreeMap<>()).put(version, runId);
        return version;
    }

    @Override
    public synchronized List<CanonicalRecord> query(int season, String snapshotRunId) {
        Map<String, CanonicalRecord> latest = new LinkedHashMap<>();
        records.stream()
            .filter(r -> r.getSeason() == season)
            .filter(r -> snapshotRunId == null || snapshotRunId.equals(r.getRunId()))
            .sorted(Comparator.comparing(CanonicalRecord::getEntityId)
                .thenComparing(CanonicalRecord::getVersion, Comparator.reverseOrder()))
            .forEach(r -> latest.putIfAbsent(r.getEntityId(), r));
        return new ArrayList<>(latest.values());
    }

    @Override
    public synchronized Optional<CanonicalRecord> findLatest(String entityId) {
        List<CanonicalRecord> versions = history(entityId);
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    @Override
    public synchronized List<CanonicalRecord> history(String entityId) {
        return records.stream()
            .filter(r -> r.getEntityId().equals(entityId))
            .sorted(Comparator.comparing(CanonicalRecord::getVersion))
            .toList();
    }
}
