package com.hoopstats.application.usecase;

import com.hoopstats.application.reconcile.EntityResolver;
import com.hoopstats.application.reconcile.Reconciler;
import com.hoopstats.application.reconcile.SourcePrecedence;
import com.hoopstats.application.throttle.BackoffPolicy;
import com.hoopstats.application.throttle.SourceHealthRegistry;
import com.hoopstats.application.validation.RecordValidator;
import com.hoopstats.application.validation.ValidationRules;
import com.hoopstats.domain.error.PermanentSourceException;
import com.hoopstats.domain.error.RateLimitedException;
import com.hoopstats.domain.error.TransientSourceException;
import com.hoopstats.domain.model.CanonicalRecord;
import com.hoopstats.domain.model.CollectionRun;
import com.hoopstats.domain.model.CollectionScope;
import com.hoopstats.domain.model.CollectionStatus;
import com.hoopstats.domain.model.ErrorCategory;
import com.hoopstats.domain.model.RawRecord;
import com.hoopstats.domain.model.RunError;
import com.hoopstats.domain.model.RunOutcome;
import com.hoopstats.domain.ports.SourceAdapter;
import com.hoopstats.testsupport.FakeSourceAdapter;
import com.hoopstats.testsupport.InMemoryCanonicalStore;
import com.hoopstats.testsupport.InMemoryTelemetryRepository;
import com.hoopstats.testsupport.MutableClock;
import com.hoopstats.testsupport.RecordingSleeper;
import com.hoopstats.testsupport.TestRecords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CollectionRunCoordinator, with in-memory ports and scripted sources.
 */
class CollectionRunCoordinatorTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private SourceHealthRegistry health;
    private InMemoryCanonicalStore store;
    private InMemoryTelemetryRepository telemetry;
    private final List<CollectionRunCoordinator> coordinators = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-04-15T09:00:00Z");
        sleeper = new RecordingSleeper(clock);
        health = new SourceHealthRegistry(SourceHealthRegistry.Settings.defaults(), clock);
        store = new InMemoryCanonicalStore();
        telemetry = new InMemoryTelemetryRepository();
    }

    @AfterEach
    void tearDown() {
        coordinators.forEach(CollectionRunCoordinator::shutdown);
    }

    /**
     * Sources rank in the order given: the first has precedence 1.
     */
    private CollectionRunCoordinator coordinator(RunSettings settings, SourceAdapter... adapters) {
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>();
        for (int i = 0; i < adapters.length; i++) {
            ranked.add(new AbstractMap.SimpleEntry<>(adapters[i].getSourceId(), i + 1));
        }
        SourceCollector collector = new SourceCollector(new RecordValidator(ValidationRules.defaults()),
            health, BackoffPolicy.defaults(), clock, sleeper);
        Reconciler reconciler = new Reconciler(new SourcePrecedence(ranked), Map.of("pts", 0.5), 0.1);
        CollectionRunCoordinator coordinator = new CollectionRunCoordinator(List.of(adapters), collector,
            new EntityResolver(), reconciler, store, telemetry, health, settings, clock);
        coordinators.add(coordinator);
        return coordinator;
    }

    private CollectionRunCoordinator coordinator(SourceAdapter... adapters) {
        return coordinator(RunSettings.defaults(), adapters);
    }

    private static RawRecord lebron(String source, double pts) {
        return TestRecords.line(source, "LeBron James", "LAL", Map.of("pts", pts));
    }

    private static RawRecord curry(String source, double pts) {
        return TestRecords.line(source, "Stephen Curry", "GSW", Map.of("pts", pts));
    }

    private CollectionRun runToCompletion(CollectionRunCoordinator coordinator, CollectionScope scope) throws Exception {
        String runId = coordinator.startRun(scope);
        CollectionRun run = coordinator.awaitCompletion(runId, WAIT).orElseThrow();
        assertTrue(run.isTerminal(), "run did not finish in time");
        return run;
    }

    private static boolean hasError(CollectionRun run, ErrorCategory category, String sourceId) {
        return run.getErrors().stream()
            .anyMatch(e -> e.category() == category && (sourceId == null || sourceId.equals(e.sourceId())));
    }

    @Test
    void testAllSourcesSucceed() throws Exception {
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 25.7), curry("official", 26.4)),
            new FakeSourceAdapter("reference").records(lebron("reference", 25.7), curry("reference", 26.4)));

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        assertEquals(CollectionStatus.SUCCEEDED, run.getStatus());
        assertEquals(RunOutcome.COMMITTED, run.getOutcome());
        assertEquals(1L, run.getCommittedVersion());
        assertEquals(CollectionStatus.SUCCEEDED, run.sourceStatus("official"));
        assertEquals(CollectionStatus.SUCCEEDED, run.sourceStatus("reference"));
        assertEquals(4, run.getAcceptedRecords());
        assertEquals(2, run.getCanonicalRecords());
        assertNotNull(run.getFinishedAt());

        List<CanonicalRecord> records = store.query(2024, null);
        assertEquals(2, records.size());
        assertEquals(List.of("official", "reference"), records.get(0).getSources());
        assertEquals(run.getRunId(), records.get(0).getRunId());
        assertEquals(1L, store.currentVersion(2024));
    }

    @Test
    void testFailedSourceMakesRunPartial() throws Exception {
        FakeSourceAdapter broken = new FakeSourceAdapter("reference")
            .unit("season", attempt -> {
                throw new PermanentSourceException("reference", "HTTP 404");
            });
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 25.7)), broken);

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        assertEquals(CollectionStatus.PARTIAL, run.getStatus());
        assertEquals(RunOutcome.COMMITTED, run.getOutcome());
        assertEquals(CollectionStatus.FAILED, run.sourceStatus("reference"));
        assertEquals(1, broken.attempts("season"));
        assertTrue(hasError(run, ErrorCategory.PERMANENT, "reference"));
        assertEquals(List.of("official"), store.query(2024, null).get(0).getSources());
    }

    @Test
    void testSkippedUnitMakesSourcePartial() throws Exception {
        FakeSourceAdapter halfBroken = new FakeSourceAdapter("official")
            .unit("regular", attempt -> List.of(lebron("official", 25.7)).iterator())
            .unit("playoffs", attempt -> {
                throw new PermanentSourceException("official", "HTTP 400");
            });
        CollectionRunCoordinator coordinator = coordinator(halfBroken);

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        assertEquals(CollectionStatus.PARTIAL, run.sourceStatus("official"));
        assertEquals(CollectionStatus.PARTIAL, run.getStatus());
        assertEquals(RunOutcome.COMMITTED, run.getOutcome());
    }

    @Test
    void testNothingIsCommittedWhenEverySourceFails() throws Exception {
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").unit("season", attempt -> {
                throw new PermanentSourceException("official", "HTTP 403");
            }),
            new FakeSourceAdapter("reference").unit("season", attempt -> {
                throw new PermanentSourceException("reference", "HTTP 404");
            }));

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        assertEquals(CollectionStatus.FAILED, run.getStatus());
        assertEquals(RunOutcome.ABORTED, run.getOutcome());
        assertNull(run.getCommittedVersion());
        assertTrue(hasError(run, ErrorCategory.NO_DATA, null));
        assertEquals(0L, store.currentVersion(2024));
        assertEquals(0, store.getCommitCalls());
    }

    @Test
    void testTransientFailuresBackOffThenGiveUp() throws Exception {
        FakeSourceAdapter flaky = new FakeSourceAdapter("reference").unit("season", attempt -> {
            throw new TransientSourceException("reference", "HTTP 503");
        });
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 25.7)), flaky);

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(20)),
            sleeper.getWaits());
        assertEquals(4, flaky.attempts("season"));
        assertEquals(CollectionStatus.FAILED, run.sourceStatus("reference"));
        assertTrue(hasError(run, ErrorCategory.RETRIES_EXHAUSTED, "reference"));
        assertEquals(CollectionStatus.PARTIAL, run.getStatus());
        assertEquals(4, health.snapshot("reference").getConsecutiveFailures());
    }

    @Test
    void testTransientFailureRecoversOnRetry() throws Exception {
        FakeSourceAdapter flaky = new FakeSourceAdapter("official").unit("season", attempt -> {
            if (attempt < 3) {
                throw new TransientSourceException("official", "connection reset");
            }
            return List.of(lebron("official", 25.7)).iterator();
        });
        CollectionRunCoordinator coordinator = coordinator(flaky);

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(10)), sleeper.getWaits());
        assertEquals(CollectionStatus.SUCCEEDED, run.getStatus());
        assertEquals(0, health.snapshot("official").getConsecutiveFailures());
    }

    @Test
    void testRateLimitHonoursRetryAfter() throws Exception {
        FakeSourceAdapter limited = new FakeSourceAdapter("official").unit("season", attempt -> {
            if (attempt == 1) {
                throw new RateLimitedException("official", "HTTP 429", Duration.ofSeconds(42));
            }
            return List.of(lebron("official", 25.7)).iterator();
        });
        CollectionRunCoordinator coordinator = coordinator(limited);

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        assertEquals(List.of(Duration.ofSeconds(42)), sleeper.getWaits());
        assertEquals(CollectionStatus.SUCCEEDED, run.getStatus());
        assertTrue(hasError(run, ErrorCategory.RATE_LIMITED, "official"));
    }

    @Test
    void testRerunWithSameInputIsIdempotent() throws Exception {
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 28.2), curry("official", 26.4)),
            new FakeSourceAdapter("reference").records(lebron("reference", 24.0), curry("reference", 26.4)));

        CollectionRun first = runToCompletion(coordinator, CollectionScope.season(2024));
        CollectionRun second = runToCompletion(coordinator, CollectionScope.season(2024));

        assertEquals(1L, first.getCommittedVersion());
        assertEquals(2L, second.getCommittedVersion());
        List<CanonicalRecord> v1 = store.query(2024, first.getRunId());
        List<CanonicalRecord> v2 = store.query(2024, second.getRunId());
        assertEquals(v1.size(), v2.size());
        for (int i = 0; i < v1.size(); i++) {
            assertEquals(v1.get(i).fingerprint(), v2.get(i).fingerprint());
        }
        assertEquals(2, store.history(v1.get(0).getEntityId()).size());
    }

    @Test
    void testRejectedRecordsNeverContribute() throws Exception {
        Map<String, Object> noPoints = new HashMap<>();
        noPoints.put("pts", null);
        noPoints.put("ast", 12.0);
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 25.7)),
            new FakeSourceAdapter("reference").records(TestRecords.line("reference", "LeBron James", "LAL", noPoints)));

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        assertEquals(1, run.getRejectedRecords());
        assertTrue(hasError(run, ErrorCategory.VALIDATION_REJECTION, "reference"));
        CanonicalRecord lebron = store.query(2024, null).get(0);
        assertEquals(List.of("official"), lebron.getSources());
        assertFalse(lebron.getFields().containsKey("ast"));
    }

    @Test
    void testConflictsAreRecordedAndRecordStillCommitted() throws Exception {
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 28.2)),
            new FakeSourceAdapter("reference").records(lebron("reference", 24.0)));

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        RunError conflict = run.getErrors().stream()
            .filter(e -> e.category() == ErrorCategory.RECONCILIATION_CONFLICT)
            .findFirst()
            .orElseThrow();
        assertEquals("pts", conflict.field());
        assertEquals("2024:LAL:LEBRON_JAMES", conflict.entityId());
        assertEquals(CollectionStatus.SUCCEEDED, run.getStatus());
        assertEquals(28.2, store.query(2024, null).get(0).number("pts"));
    }

    @Test
    void testEntitySubset() throws Exception {
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 25.7), curry("official", 26.4)));

        CollectionRun run = runToCompletion(coordinator,
            new CollectionScope(2024, List.of("lebron james"), List.of()));

        List<CanonicalRecord> records = store.query(2024, null);
        assertEquals(1, records.size());
        assertEquals("LEBRON_JAMES", records.get(0).getNormalizedName());
        assertEquals(1, run.getCanonicalRecords());
    }

    @Test
    void testSourceSubset() throws Exception {
        FakeSourceAdapter reference = new FakeSourceAdapter("reference").records(lebron("reference", 25.0));
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 25.7)), reference);

        CollectionRun run = runToCompletion(coordinator,
            new CollectionScope(2024, List.of(), List.of("reference")));

        assertEquals(Map.of("reference", CollectionStatus.SUCCEEDED), Map.copyOf(run.getSourceStatuses()));
        assertEquals(25.0, store.query(2024, null).get(0).number("pts"));
    }

    @Test
    void testCommitConflictIsRetriedOnce() throws Exception {
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 25.7)));
        store.competeWithNextCommits(1);

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        assertEquals(RunOutcome.COMMITTED, run.getOutcome());
        assertEquals(2L, run.getCommittedVersion());
        assertTrue(hasError(run, ErrorCategory.COMMIT_CONFLICT, null));
        assertEquals(2, store.getCommitCalls());
    }

    @Test
    void testPersistentCommitConflictFailsRun() throws Exception {
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 25.7)));
        store.competeWithNextCommits(2);

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        assertEquals(CollectionStatus.FAILED, run.getStatus());
        assertEquals(RunOutcome.ABORTED, run.getOutcome());
        assertNull(run.getCommittedVersion());
        assertTrue(store.query(2024, null).isEmpty());
    }

    @Test
    void testCancelledRunCommitsNothing() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeSourceAdapter slow = new FakeSourceAdapter("reference").unit("season", attempt -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(lebron("reference", 25.0)).iterator();
        });
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 25.7)), slow);

        try {
            String runId = coordinator.startRun(CollectionScope.season(2024));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertTrue(coordinator.cancelRun(runId));

            CollectionRun run = coordinator.awaitCompletion(runId, WAIT).orElseThrow();
            assertEquals(CollectionStatus.FAILED, run.getStatus());
            assertEquals(RunOutcome.ABORTED, run.getOutcome());
            assertTrue(run.isCancelRequested());
            assertTrue(hasError(run, ErrorCategory.CANCELLED, null));
            assertEquals(CollectionStatus.FAILED, run.sourceStatus("reference"));
            assertEquals(0, store.getCommitCalls());
            assertFalse(coordinator.cancelRun(runId));
        } finally {
            release.countDown();
        }
    }

    @Test
    void testDeadlineFailsSlowSource() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        FakeSourceAdapter slow = new FakeSourceAdapter("reference").unit("season", attempt -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(lebron("reference", 25.0)).iterator();
        });
        CollectionRunCoordinator coordinator = coordinator(new RunSettings(Duration.ofMillis(300)),
            new FakeSourceAdapter("official").records(lebron("official", 25.7)), slow);

        try {
            CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

            assertEquals(CollectionStatus.FAILED, run.sourceStatus("reference"));
            assertEquals(CollectionStatus.SUCCEEDED, run.sourceStatus("official"));
            assertTrue(hasError(run, ErrorCategory.DEADLINE, "reference"));
            assertEquals(CollectionStatus.PARTIAL, run.getStatus());
            assertEquals(List.of("official"), store.query(2024, null).get(0).getSources());
        } finally {
            release.countDown();
        }
    }

    @Test
    void testInvalidScopeIsRejected() {
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 25.7)));

        assertThrows(IllegalArgumentException.class, () -> coordinator.startRun(CollectionScope.season(0)));
        assertThrows(IllegalArgumentException.class,
            () -> coordinator.startRun(new CollectionScope(2024, List.of(), List.of("unknown"))));
    }

    @Test
    void testRunIsPersistedAndHealthSaved() throws Exception {
        CollectionRunCoordinator coordinator = coordinator(
            new FakeSourceAdapter("official").records(lebron("official", 25.7)));

        CollectionRun run = runToCompletion(coordinator, CollectionScope.season(2024));

        assertSame(run, telemetry.findRun(run.getRunId()).orElseThrow());
        assertEquals(run, coordinator.getRunStatus(run.getRunId()).orElseThrow());
        assertEquals(List.of("official"), telemetry.findSourceHealth().stream().map(h -> h.getSourceId()).toList());
    }
}
