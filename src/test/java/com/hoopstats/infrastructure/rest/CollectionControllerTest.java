package com.hoopstats.infrastructure.rest;

import com.hoopstats.application.reconcile.EntityResolver;
import com.hoopstats.application.reconcile.Reconciler;
import com.hoopstats.application.reconcile.SourcePrecedence;
import com.hoopstats.application.throttle.BackoffPolicy;
import com.hoopstats.application.throttle.SourceHealthRegistry;
import com.hoopstats.application.usecase.CanonicalQueryService;
import com.hoopstats.application.usecase.CollectionRunCoordinator;
import com.hoopstats.application.usecase.RunSettings;
import com.hoopstats.application.usecase.SourceCollector;
import com.hoopstats.application.validation.RecordValidator;
import com.hoopstats.application.validation.ValidationRules;
import com.hoopstats.domain.model.CollectionRun;
import com.hoopstats.domain.model.CollectionScope;
import com.hoopstats.testsupport.FakeSourceAdapter;
import com.hoopstats.testsupport.InMemoryCanonicalStore;
import com.hoopstats.testsupport.InMemoryTelemetryRepository;
import com.hoopstats.testsupport.MutableClock;
import com.hoopstats.testsupport.RecordingSleeper;
import com.hoopstats.testsupport.TestRecords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CollectionController.
 */
class CollectionControllerTest {

    private CollectionRunCoordinator coordinator;
    private CollectionController controller;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2024-04-15T09:00:00Z");
        SourceHealthRegistry health = new SourceHealthRegistry(SourceHealthRegistry.Settings.defaults(), clock);
        InMemoryCanonicalStore store = new InMemoryCanonicalStore();
        InMemoryTelemetryRepository telemetry = new InMemoryTelemetryRepository();
        SourceCollector collector = new SourceCollector(new RecordValidator(ValidationRules.defaults()),
            health, BackoffPolicy.defaults(), clock, new RecordingSleeper(clock));
        Reconciler reconciler = new Reconciler(
            new SourcePrecedence(List.of(Map.entry("official", 1))), Map.of(), 0.1);
        FakeSourceAdapter official = new FakeSourceAdapter("official")
            .records(TestRecords.line("official", "LeBron James", "LAL", Map.of()));

        coordinator = new CollectionRunCoordinator(List.of(official), collector, new EntityResolver(),
            reconciler, store, telemetry, health, RunSettings.defaults(), clock);
        controller = new CollectionController(coordinator,
            new CanonicalQueryService(store, telemetry, health, coordinator));
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    @Test
    void testStartRunAccepted() throws Exception {
        ResponseEntity<Map<String, String>> response = controller.startRun(CollectionScope.season(2024));

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        String runId = response.getBody().get("runId");
        assertNotNull(runId);

        CollectionRun run = coordinator.awaitCompletion(runId, Duration.ofSeconds(10)).orElseThrow();
        assertTrue(run.isTerminal());
        assertEquals(HttpStatus.OK, controller.getRun(runId).getStatusCode());
        assertEquals(1, controller.listRuns(20).size());
    }

    @Test
    void testStartRunRejectsInvalidScope() {
        ResponseEntity<Map<String, String>> response = controller.startRun(
            new CollectionScope(2024, List.of(), List.of("nowhere")));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Unknown source: nowhere", response.getBody().get("error"));
    }

    @Test
    void testCancelUnknownRun() {
        assertEquals(HttpStatus.NOT_FOUND, controller.cancelRun("missing").getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, controller.getRun("missing").getStatusCode());
    }

    @Test
    void testCancelFinishedRunConflicts() throws Exception {
        String runId = controller.startRun(CollectionScope.season(2024)).getBody().get("runId");
        coordinator.awaitCompletion(runId, Duration.ofSeconds(10));

        assertEquals(HttpStatus.CONFLICT, controller.cancelRun(runId).getStatusCode());
    }

    @Test
    void testListRunsClampsLimit() {
        assertTrue(controller.listRuns(0).isEmpty());
        assertTrue(controller.listRuns(10_000).isEmpty());
    }
}
