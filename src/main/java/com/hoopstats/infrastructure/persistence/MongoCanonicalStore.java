package com.hoopstats.infrastructure.persistence;

import com.hoopstats.domain.error.CommitConflictException;
import com.hoopstats.domain.model.CanonicalRecord;
import com.hoopstats.domain.ports.CanonicalStore;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB implementation of CanonicalStore.
 *
 * Commit protocol:
 * 1) Check the season's latest commit marker against the run's base version
 * 2) Insert the run's records stamped with (runId, version); they stay invisible until step 3
 * 3) Insert the commit marker; the unique (season, version) index lets exactly one concurrent
 *    writer win
 * 4) A losing writer deletes its records and reports a conflict
 *
 * Readers only see records whose runId has a commit marker, so a crash between 2 and 3 leaves
 * no visible partial version.
 */
@Repository
public class MongoCanonicalStore implements CanonicalStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoCanonicalStore.class);
    private static final int BATCH_SIZE = 100;

    static final String RECORDS_COLLECTION = "canonical_records";
    static final String COMMITS_COLLECTION = "canonical_commits";

    private final MongoClient mongoClient;
    private final String databaseName;
    private final Clock clock;

    public MongoCanonicalStore(MongoClient mongoClient,
                               @Value("${mongodb.database:hoopstats}") String databaseName,
                               Clock clock) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.clock = clock;

        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            commits().createIndex(
                Indexes.compoundIndex(Indexes.ascending("season"), Indexes.descending("version")),
                new IndexOptions().unique(true)
            );
            commits().createIndex(Indexes.ascending("runId"), new IndexOptions().unique(true));

            records().createIndex(Indexes.compoundIndex(
                Indexes.ascending("season"), Indexes.ascending("runId")));
            records().createIndex(Indexes.compoundIndex(
                Indexes.ascending("entityId"), Indexes.descending("version")));

            logger.info("MongoDB indexes initialized for {} and {}", RECORDS_COLLECTION, COMMITS_COLLECTION);
        } catch (Exception e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    private MongoCollection<Document> records() {
        return mongoClient.getDatabase(databaseName).getCollection(RECORDS_COLLECTION);
    }

    private MongoCollection<Document> commits() {
        return mongoClient.getDatabase(databaseName).getCollection(COMMITS_COLLECTION);
    }

    @Override
    public long currentVersion(int season) {
        Document latest = commits().find(Filters.eq("season", season))
            .sort(Sorts.descending("version"))
            .first();
        return latest != null ? latest.get("version", Number.class).longValue() : 0L;
    }

    @Override
    public long commit(String runId, int season, long baseVersion, List<CanonicalRecord> records)
            throws CommitConflictException {
        long current = currentVersion(season);
        if (current != baseVersion) {
            throw new CommitConflictException(season, baseVersion, current);
        }

        long version = baseVersion + 1;
        Instant committedAt = clock.instant();

        List<Document> documents = new ArrayList<>(records.size());
        for (CanonicalRecord record : records) {
            CanonicalRecord stamped = record.content();
            stamped.setRunId(runId);
            stamped.setVersion(version);
            stamped.setCommittedAt(committedAt);
            documents.add(MongoDocuments.toDocument(stamped));
        }
        for (int i = 0; i < documents.size(); i += BATCH_SIZE) {
            records().insertMany(documents.subList(i, Math.min(i + BATCH_SIZE, documents.size())));
        }

        Document marker = new Document("season", season)
            .append("version", version)
            .append("runId", runId)
            .append("recordCount", records.size())
            .append("committedAt", committedAt.toString());
        try {
            commits().insertOne(marker);
        } catch (MongoWriteException e) {
            records().deleteMany(Filters.eq("runId", runId));
            if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                logger.warn("Run {} lost the race for season {} version {}", runId, season, version);
                throw new CommitConflictException(season, baseVersion, currentVersion(season));
            }
            throw e;
        } catch (RuntimeException e) {
            records().deleteMany(Filters.eq("runId", runId));
            throw e;
        }

        logger.info("Committed {} records for season {} as version {} (run {})",
            records.size(), season, version, runId);
        return version;
    }

    @Override
    public List<CanonicalRecord> query(int season, String snapshotRunId) {
        if (snapshotRunId != null) {
            if (commits().find(Filters.eq("runId", snapshotRunId)).first() == null) {
                return List.of();
            }
            List<CanonicalRecord> snapshot = new ArrayList<>();
            records().find(Filters.and(Filters.eq("season", season), Filters.eq("runId", snapshotRunId)))
                .sort(Sorts.ascending("entityId"))
                .forEach(doc -> snapshot.add(MongoDocuments.fromDocument(doc, CanonicalRecord.class)));
            return snapshot;
        }

        Set<String> committedRuns = new HashSet<>();
        commits().find(Filters.eq("season", season))
            .forEach(doc -> committedRuns.add(doc.getString("runId")));
        if (committedRuns.isEmpty()) {
            return List.of();
        }

        // Latest version first, so the first record seen per entity wins
        Map<String, CanonicalRecord> latest = new LinkedHashMap<>();
        records().find(Filters.and(Filters.eq("season", season), Filters.in("runId", committedRuns)))
            .sort(Sorts.orderBy(Sorts.ascending("entityId"), Sorts.descending("version")))
            .forEach(doc -> {
                String entityId = doc.getString("entityId");
                if (!latest.containsKey(entityId)) {
                    latest.put(entityId, MongoDocuments.fromDocument(doc, CanonicalRecord.class));
                }
            });
        return new ArrayList<>(latest.values());
    }

    @Override
    public Optional<CanonicalRecord> findLatest(String entityId) {
        List<CanonicalRecord> versions = history(entityId);
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    @Override
    public List<CanonicalRecord> history(String entityId) {
        List<CanonicalRecord> candidates = new ArrayList<>();
        records().find(Filters.eq("entityId", entityId))
            .sort(Sorts.ascending("version"))
            .forEach(doc -> candidates.add(MongoDocuments.fromDocument(doc, CanonicalRecord.class)));
        if (candidates.isEmpty()) {
            return candidates;
        }

        Set<String> runIds = new HashSet<>();
        candidates.forEach(record -> runIds.add(record.getRunId()));
        Set<String> committedRuns = new HashSet<>();
        commits().find(Filters.in("runId", runIds))
            .forEach(doc -> committedRuns.add(doc.getString("runId")));

        candidates.removeIf(record -> !committedRuns.contains(record.getRunId()));
        return candidates;
    }
}
