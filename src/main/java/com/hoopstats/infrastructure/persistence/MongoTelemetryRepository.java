package com.hoopstats.infrastructure.persistence;

import com.hoopstats.domain.model.CollectionRun;
import com.hoopstats.domain.model.SourceHealth;
import com.hoopstats.domain.ports.TelemetryRepository;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.BulkWriteOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOneModel;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.WriteModel;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of TelemetryRepository. Runs and health snapshots are upserted by id;
 * a failed write is logged and never fails the run it describes.
 */
@Repository
public class MongoTelemetryRepository implements TelemetryRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoTelemetryRepository.class);

    static final String RUNS_COLLECTION = "collection_runs";
    static final String HEALTH_COLLECTION = "source_health";

    private final MongoClient mongoClient;
    private final String databaseName;

    public MongoTelemetryRepository(MongoClient mongoClient,
                                    @Value("${mongodb.database:hoopstats}") String databaseName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;

        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            runs().createIndex(Indexes.ascending("runId"), new IndexOptions().unique(true));
            runs().createIndex(Indexes.descending("startedAtEpochMs"));
            health().createIndex(Indexes.ascending("sourceId"), new IndexOptions().unique(true));
            logger.info("MongoDB indexes initialized for {} and {}", RUNS_COLLECTION, HEALTH_COLLECTION);
        } catch (Exception e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    private MongoCollection<Document> runs() {
        return mongoClient.getDatabase(databaseName).getCollection(RUNS_COLLECTION);
    }

    private MongoCollection<Document> health() {
        return mongoClient.getDatabase(databaseName).getCollection(HEALTH_COLLECTION);
    }

    @Override
    public void saveRun(CollectionRun run) {
        try {
            Document doc = MongoDocuments.toDocument(run);
            // ISO strings do not sort by time when fractions differ in length
            doc.put("startedAtEpochMs", run.getStartedAt() != null ? run.getStartedAt().toEpochMilli() : 0L);
            runs().replaceOne(Filters.eq("runId", run.getRunId()), doc, new ReplaceOptions().upsert(true));
        } catch (Exception e) {
            logger.error("Failed to save run {}", run.getRunId(), e);
        }
    }

    @Override
    public Optional<CollectionRun> findRun(String runId) {
        Document doc = runs().find(Filters.eq("runId", runId)).first();
        return doc != null ? Optional.of(MongoDocuments.fromDocument(doc, CollectionRun.class)) : Optional.empty();
    }

    @Override
    public List<CollectionRun> findRecentRuns(int limit) {
        List<CollectionRun> result = new ArrayList<>();
        runs().find()
            .sort(Sorts.descending("startedAtEpochMs"))
            .limit(limit)
            .forEach(doc -> result.add(MongoDocuments.fromDocument(doc, CollectionRun.class)));
        return result;
    }

    @Override
    public void saveSourceHealth(List<SourceHealth> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return;
        }
        List<WriteModel<Document>> bulkWrites = new ArrayList<>();
        for (SourceHealth snapshot : snapshots) {
            bulkWrites.add(new ReplaceOneModel<>(
                Filters.eq("sourceId", snapshot.getSourceId()),
                MongoDocuments.toDocument(snapshot),
                new ReplaceOptions().upsert(true)
            ));
        }
        try {
            health().bulkWrite(bulkWrites, new BulkWriteOptions().ordered(false));
        } catch (Exception e) {
            logger.error("Failed to save source health", e);
        }
    }

    @Override
    public List<SourceHealth> findSourceHealth() {
        List<SourceHealth> result = new ArrayList<>();
        health().find()
            .sort(Sorts.ascending("sourceId"))
            .forEach(doc -> result.add(MongoDocuments.fromDocument(doc, SourceHealth.class)));
        return result;
    }
}
