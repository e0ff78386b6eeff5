package com.hoopstats.infrastructure.scheduling;

import com.hoopstats.application.reconcile.EntityResolver;
import com.hoopstats.application.reconcile.Reconciler;
import com.hoopstats.application.reconcile.SourcePrecedence;
import com.hoopstats.application.throttle.BackoffPolicy;
import com.hoopstats.application.throttle.SourceHealthRegistry;
import com.hoopstats.application.usecase.CollectionRunCoordinator;
import com.hoopstats.application.usecase.RunSettings;
import com.hoopstats.application.usecase.SourceCollector;
import com.hoopstats.application.validation.RecordValidator;
import com.hoopstats.application.validation.ValidationRules;
import com.hoopstats.domain.model.CollectionRun;
import com.hoopstats.infrastructure.config.PipelineProperties;
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
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScheduledCollectionTrigger.
 */
class ScheduledCollectionTriggerTest {

    private InMemoryTelemetryRepository telemetry;
    private CollectionRunCoordinator coordinator;
    private PipelineProperties properties;
    private ScheduledCollectionTrigger trigger;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2024-04-15T09:00:00Z");
        SourceHealthRegistry health = new SourceHealthRegistry(SourceHealthRegistry.Settings.defaults(), clock);
        SourceCollector collector = new SourceCollector(new RecordValidator(ValidationRules.defaults()),
            health, BackoffPolicy.defaults(), clock, new RecordingSleeper(clock));
        Reconciler reconciler = new Reconciler(
            new SourcePrecedence(List.of(Map.entry("official", 1))), Map.of(), 0.1);
        FakeSourceAdapter official = new FakeSourceAdapter("official")
            .records(TestRecords.line("official", "LeBron James", "LAL", Map.of()));

        telemetry = new InMemoryTelemetryRepository();
        coordinator = new CollectionRunCoordinator(List.of(official), collector, new EntityResolver(), reconciler,
            new InMemoryCanonicalStore(), telemetry, health, RunSettings.defaults(), clock);
        properties = new PipelineProperties();
        trigger = new ScheduledCollectionTrigger(coordinator, properties);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    private int seasonOf(String runId) throws Exception {
        CollectionRun run = coordinator.awaitCompletion(runId, Duration.ofSeconds(10)).orElseThrow();
        return run.getScope().getSeason();
    }

    @Test
    void testStartsOneRunPerSeason() throws Exception {
        List<String> runIds = trigger.startAll(List.of(2023, 2024));

        assertEquals(2, runIds.size());
        assertNotEquals(runIds.get(0), runIds.get(1));
        assertEquals(2023, seasonOf(runIds.get(0)));
        assertEquals(2024, seasonOf(runIds.get(1)));
    }

    @Test
    void testInvalidSeasonIsSkipped() throws Exception {
        List<String> runIds = trigger.startAll(Arrays.asList(0, 2024, -1));

        assertEquals(1, runIds.size());
        assertEquals(2024, seasonOf(runIds.get(0)));
    }

    @Test
    void testNoSeasonsStartsNothing() {
        assertTrue(trigger.startAll(List.of()).isEmpty());
    }

    @Test
    void testTriggerWithoutConfiguredSeasonsIsNoop() {
        properties.getSchedule().setSeasons(List.of());

        trigger.trigger();

        assertTrue(telemetry.findRecentRuns(10).isEmpty());
    }
}
