package com.hoopstats.application.usecase;

import com.hoopstats.application.reconcile.EntityResolver;
import com.hoopstats.application.reconcile.FieldConflict;
import com.hoopstats.application.reconcile.MergeResult;
import com.hoopstats.application.reconcile.NameNormalizer;
import com.hoopstats.application.reconcile.Reconciler;
import com.hoopstats.application.throttle.SourceHealthRegistry;
import com.hoopstats.domain.error.CommitConflictException;
import com.hoopstats.domain.model.CanonicalRecord;
import com.hoopstats.domain.model.CollectionRun;
import com.hoopstats.domain.model.CollectionScope;
import com.hoopstats.domain.model.CollectionStatus;
import com.hoopstats.domain.model.EntityKey;
import com.hoopstats.domain.model.ErrorCategory;
import com.hoopstats.domain.model.RunError;
import com.hoopstats.domain.model.RunOutcome;
import com.hoopstats.domain.model.ValidationOutcome;
import com.hoopstats.domain.ports.CanonicalStore;
import com.hoopstats.domain.ports.SourceAdapter;
import com.hoopstats.domain.ports.TelemetryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Orchestrates collection runs: every source in parallel, then entity resolution, merge and a
 * single commit.
 *
 * <p>Run states: {@code PENDING -> RUNNING -> SUCCEEDED | PARTIAL | FAILED}. A run commits when
 * at least one source produced usable records; it never commits after a cancellation or when no
 * source produced anything. Reconciliation starts only once every source is terminal, either by
 * finishing or by being marked failed at the deadline; results of sources still in flight at the
 * deadline are never read.</p>
 */
public class CollectionRunCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(CollectionRunCoordinator.class);

    private final Map<String, SourceAdapter> adapters;
    private final SourceCollector collector;
    private final EntityResolver resolver;
    private final Reconciler reconciler;
    private final CanonicalStore store;
    private final TelemetryRepository telemetry;
    private final SourceHealthRegistry health;
    private final RunSettings settings;
    private final Clock clock;
    private final ExecutorService runExecutor;
    private final ExecutorService sourceExecutor;
    private final Map<String, RunHandle> activeRuns = new ConcurrentHashMap<>();

    public CollectionRunCoordinator(List<SourceAdapter> adapters,
                                    SourceCollector collector,
                                    EntityResolver resolver,
                                    Reconciler reconciler,
                                    CanonicalStore store,
                                    TelemetryRepository telemetry,
                                    SourceHealthRegistry health,
                                    RunSettings settings,
                                    Clock clock) {
        this.adapters = new LinkedHashMap<>();
        for (SourceAdapter adapter : adapters) {
            this.adapters.put(adapter.getSourceId(), adapter);
        }
        this.collector = collector;
        this.resolver = resolver;
        this.reconciler = reconciler;
        this.store = store;
        this.telemetry = telemetry;
        this.health = health;
        this.settings = settings;
        this.clock = clock;
        this.runExecutor = Executors.newCachedThreadPool();
        // Using fixed thread pool as virtual threads are only available in Java 21+
        this.sourceExecutor = Executors.newFixedThreadPool(Math.max(adapters.size() * 2, 4));
    }

    /**
     * Starts a run in the background and returns its id immediately.
     *
     * @throws IllegalArgumentException when the scope names an unknown source or no season
     */
    public String startRun(CollectionScope scope) {
        List<SourceAdapter> selected = selectAdapters(scope);
        String runId = UUID.randomUUID().toString();
        CollectionRun run = new CollectionRun(runId, scope, clock.instant());
        selected.forEach(adapter -> run.markSource(adapter.getSourceId(), CollectionStatus.PENDING));

        RunHandle handle = new RunHandle(run);
        activeRuns.put(runId, handle);
        logger.info("Run {} scheduled for {} with sources {}", runId, scope,
            selected.stream().map(SourceAdapter::getSourceId).toList());

        CompletableFuture.runAsync(() -> execute(handle, selected), runExecutor)
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    logger.error("Run {} crashed", runId, error);
                }
                activeRuns.remove(runId);
                handle.done.complete(run);
            });
        return runId;
    }

    /**
     * Requests cancellation. In-flight units finish, no further unit starts, nothing is committed.
     *
     * @return false when the run is unknown or already finished
     */
    public boolean cancelRun(String runId) {
        RunHandle handle = activeRuns.get(runId);
        if (handle == null || handle.run.isTerminal()) {
            return false;
        }
        logger.info("Cancellation requested for run {}", runId);
        handle.run.setCancelRequested(true);
        handle.cancelled.set(true);
        handle.cancelSignal.complete(null);
        return true;
    }

    public Optional<CollectionRun> getRunStatus(String runId) {
        RunHandle handle = activeRuns.get(runId);
        if (handle != null) {
            return Optional.of(handle.run);
        }
        return telemetry.findRun(runId);
    }

    /**
     * Blocks until the run is terminal or the timeout elapses.
     */
    public Optional<CollectionRun> awaitCompletion(String runId, Duration timeout) throws InterruptedException {
        RunHandle handle = activeRuns.get(runId);
        if (handle == null) {
            return telemetry.findRun(runId);
        }
        try {
            return Optional.of(handle.done.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.of(handle.run);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId + " failed unexpectedly", e.getCause());
        }
    }

    public List<String> getSourceIds() {
        return new ArrayList<>(adapters.keySet());
    }

    public void shutdown() {
        runExecutor.shutdownNow();
        sourceExecutor.shutdownNow();
    }

    private List<SourceAdapter> selectAdapters(CollectionScope scope) {
        if (scope == null || scope.getSeason() <= 0) {
            throw new IllegalArgumentException("A collection scope needs a season");
        }
        if (scope.getSources() == null || scope.getSources().isEmpty()) {
            return new ArrayList<>(adapters.values());
        }
        List<SourceAdapter> selected = new ArrayList<>();
        for (String sourceId : scope.getSources()) {
            SourceAdapter adapter = adapters.get(sourceId);
            if (adapter == null) {
                throw new IllegalArgumentException("Unknown source: " + sourceId);
            }
            selected.add(adapter);
        }
        return selected;
    }

    private void execute(RunHandle handle, List<SourceAdapter> selected) {
        CollectionRun run = handle.run;
        try {
            run.setStatus(CollectionStatus.RUNNING);
            run.setBaseVersion(store.currentVersion(run.getScope().getSeason()));
            saveRun(run);

            List<SourceResult> results = collectAll(handle, selected);

            if (handle.cancelled.get()) {
                run.getSourceStatuses().forEach((sourceId, status) -> {
                    if (!status.isTerminal()) {
                        run.markSource(sourceId, CollectionStatus.FAILED);
                    }
                });
                run.addError(RunError.ofRun(ErrorCategory.CANCELLED, "Run cancelled before commit", clock.instant()));
                finish(run, CollectionStatus.FAILED, RunOutcome.ABORTED);
                return;
            }

            List<ValidationOutcome> usable = results.stream()
                .filter(SourceResult::contributes)
                .flatMap(r -> r.outcomes().stream())
                .toList();
            if (usable.isEmpty()) {
                run.addError(RunError.ofRun(ErrorCategory.NO_DATA, "No source produced usable records", clock.instant()));
                finish(run, CollectionStatus.FAILED, RunOutcome.ABORTED);
                return;
            }

            boolean allSucceeded = results.stream().allMatch(r -> r.status() == CollectionStatus.SUCCEEDED);
            List<CanonicalRecord> records = reconcile(run, usable);
            commit(run, records, allSucceeded ? CollectionStatus.SUCCEEDED : CollectionStatus.PARTIAL);

        } catch (RuntimeException e) {
            logger.error("Run {} failed", run.getRunId(), e);
            run.addError(RunError.ofRun(ErrorCategory.STORE_FAILURE, String.valueOf(e.getMessage()), clock.instant()));
            finish(run, CollectionStatus.FAILED, RunOutcome.ABORTED);
        } finally {
            persistHealth();
        }
    }

    /**
     * Runs every source and waits until each is terminal, the deadline passes or the run is cancelled.
     */
    private List<SourceResult> collectAll(RunHandle handle, List<SourceAdapter> selected) {
        CollectionRun run = handle.run;
        Map<String, CompletableFuture<SourceResult>> futures = new LinkedHashMap<>();
        for (SourceAdapter adapter : selected) {
            String sourceId = adapter.getSourceId();
            futures.put(sourceId, CompletableFuture.supplyAsync(() -> {
                run.markSource(sourceId, CollectionStatus.RUNNING);
                SourceResult result = collector.collect(adapter, run.getScope(), run,
                    () -> handle.cancelled.get() || handle.deadlinePassed.get());
                // a source the deadline already failed keeps its FAILED status
                if (!handle.cancelled.get()) {
                    run.completeSource(sourceId, result.status());
                }
                return result;
            }, sourceExecutor).exceptionally(error -> {
                logger.error("Run {}: source {} crashed", run.getRunId(), sourceId, error);
                run.addError(RunError.ofSource(ErrorCategory.TRANSIENT, sourceId, String.valueOf(error.getMessage()), clock.instant()));
                run.markSource(sourceId, CollectionStatus.FAILED);
                return new SourceResult(sourceId, CollectionStatus.FAILED, List.of());
            }));
        }

        CompletableFuture<Void> allDone = CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]));
        Duration remaining = Duration.between(clock.instant(), run.getStartedAt().plus(settings.timeout()));
        try {
            CompletableFuture.anyOf(allDone, handle.cancelSignal)
                .get(Math.max(remaining.toMillis(), 0), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            handle.deadlinePassed.set(true);
            logger.warn("Run {} reached its deadline of {}", run.getRunId(), settings.timeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.cancelled.set(true);
        } catch (ExecutionException e) {
            logger.error("Run {}: waiting for sources failed", run.getRunId(), e);
        }

        List<SourceResult> results = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<SourceResult>> entry : futures.entrySet()) {
            CompletableFuture<SourceResult> future = entry.getValue();
            if (future.isDone() && !handle.cancelled.get()) {
                results.add(future.join());
            } else if (!handle.cancelled.get()) {
                // still fetching at the deadline: its partial state is never read
                run.markSource(entry.getKey(), CollectionStatus.FAILED);
                run.addError(RunError.ofSource(ErrorCategory.DEADLINE, entry.getKey(),
                    "Source did not finish before the run deadline", clock.instant()));
                results.add(new SourceResult(entry.getKey(), CollectionStatus.FAILED, List.of()));
            }
        }
        return results;
    }

    private List<CanonicalRecord> reconcile(CollectionRun run, List<ValidationOutcome> usable) {
        EntityResolver.Resolution resolution = resolver.resolve(usable, clock.instant());
        resolution.ambiguities().forEach(run::addError);

        Set<String> requested = run.getScope().getEntities() == null ? Set.of()
            : run.getScope().getEntities().stream().map(NameNormalizer::normalize).collect(Collectors.toSet());

        List<CanonicalRecord> records = new ArrayList<>();
        for (Map.Entry<EntityKey, List<ValidationOutcome>> group : resolution.groups().entrySet()) {
            if (!requested.isEmpty() && !requested.contains(group.getKey().normalizedName())) {
                continue;
            }
            MergeResult merged = reconciler.merge(group.getKey(), group.getValue());
            for (FieldConflict conflict : merged.conflicts()) {
                run.addError(new RunError(ErrorCategory.RECONCILIATION_CONFLICT, conflict.selectedSource(),
                    conflict.entityId(), conflict.field(), conflict.describe(), clock.instant()));
            }
            records.add(merged.record());
        }
        logger.info("Run {} reconciled {} usable records into {} canonical records",
            run.getRunId(), usable.size(), records.size());
        return records;
    }

    private void commit(CollectionRun run, List<CanonicalRecord> records, CollectionStatus status) {
        int season = run.getScope().getSeason();
        run.setCanonicalRecords(records.size());
        try {
            long version;
            try {
                version = store.commit(run.getRunId(), season, run.getBaseVersion(), records);
            } catch (CommitConflictException conflict) {
                logger.warn("Run {}: {}; retrying against the latest version", run.getRunId(), conflict.getMessage());
                run.addError(RunError.ofRun(ErrorCategory.COMMIT_CONFLICT, conflict.getMessage(), clock.instant()));
                run.setBaseVersion(store.currentVersion(season));
                version = store.commit(run.getRunId(), season, run.getBaseVersion(), records);
            }
            run.setCommittedVersion(version);
            logger.info("Run {} committed {} records as version {} of season {}",
                run.getRunId(), records.size(), version, season);
            finish(run, status, RunOutcome.COMMITTED);
        } catch (CommitConflictException conflict) {
            logger.error("Run {}: commit conflict persisted: {}", run.getRunId(), conflict.getMessage());
            run.addError(RunError.ofRun(ErrorCategory.COMMIT_CONFLICT, conflict.getMessage(), clock.instant()));
            finish(run, CollectionStatus.FAILED, RunOutcome.ABORTED);
        }
    }

    private void finish(CollectionRun run, CollectionStatus status, RunOutcome outcome) {
        run.setFinishedAt(clock.instant());
        run.setStatus(status);
        run.setOutcome(outcome);
        logger.info("Run {} finished: status={}, outcome={}, sources={}, errors={}",
            run.getRunId(), status, outcome, run.getSourceStatuses(), run.getErrors().size());
        saveRun(run);
    }

    private void saveRun(CollectionRun run) {
        try {
            telemetry.saveRun(run);
        } catch (RuntimeException e) {
            logger.error("Could not persist run {}", run.getRunId(), e);
        }
    }

    private void persistHealth() {
        try {
            telemetry.saveSourceHealth(health.snapshotAll());
        } catch (RuntimeException e) {
            logger.warn("Could not persist source health: {}", e.getMessage());
        }
    }

    private static final class RunHandle {
        private final CollectionRun run;
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final AtomicBoolean deadlinePassed = new AtomicBoolean();
        private final CompletableFuture<Void> cancelSignal = new CompletableFuture<>();
        private final CompletableFuture<CollectionRun> done = new CompletableFuture<>();

        private RunHandle(CollectionRun run) {
            this.run = run;
        }
    }
}
