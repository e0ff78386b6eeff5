package com.hoopstats.infrastructure.rest;

import com.hoopstats.application.throttle.SourceHealthRegistry;
import com.hoopstats.application.usecase.CanonicalQueryService;
import com.hoopstats.domain.model.CanonicalQuery;
import com.hoopstats.domain.model.CanonicalRecord;
import com.hoopstats.domain.model.Position;
import com.hoopstats.domain.model.Team;
import com.hoopstats.infrastructure.export.CanonicalCsvExporter;
import com.hoopstats.testsupport.InMemoryCanonicalStore;
import com.hoopstats.testsupport.InMemoryTelemetryRepository;
import com.hoopstats.testsupport.MutableClock;
import com.hoopstats.testsupport.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CanonicalController.
 */
class CanonicalControllerTest {

    private CanonicalController controller;

    @BeforeEach
    void setUp() throws Exception {
        MutableClock clock = MutableClock.at("2024-04-15T09:00:00Z");
        InMemoryCanonicalStore store = new InMemoryCanonicalStore();
        store.commit("run-1", 2024, 0, List.of(
            TestRecords.canonical("LeBron James", Team.LAL, Position.SF,
                Map.of("g", 55.0, "mp", 35.5, "pts", 25.0), "official")));
        CanonicalQueryService service = new CanonicalQueryService(store, new InMemoryTelemetryRepository(),
            new SourceHealthRegistry(SourceHealthRegistry.Settings.defaults(), clock), null);
        controller = new CanonicalController(service, new CanonicalCsvExporter());
    }

    @Test
    void testToQueryResolvesAliases() {
        CanonicalQuery query = CanonicalController.toQuery(2024, "pho", "SF-PF", null, 50.0, null, "run-9");

        assertEquals(Team.PHX, query.team());
        assertEquals(Position.SF, query.position());
        assertEquals(List.of(), query.players());
        assertEquals(50.0, query.minGames());
        assertNull(query.minMinutes());
        assertEquals("run-9", query.runId());
    }

    @Test
    void testToQueryRejectsUnknownValues() {
        assertThrows(IllegalArgumentException.class,
            () -> CanonicalController.toQuery(2024, "XYZ", null, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> CanonicalController.toQuery(2024, null, "point", null, null, null, null));
    }

    @Test
    void testGetCanonicalRecords() {
        List<CanonicalRecord> records = controller.getCanonicalRecords(2024, "LAL", null, List.of("LeBron James"),
            10.0, null, null);

        assertEquals(1, records.size());
        assertEquals(1L, records.get(0).getVersion());
    }

    @Test
    void testLatestAndHistoryNotFound() {
        assertEquals(HttpStatus.OK, controller.getLatest("2024:LAL:LEBRON_JAMES").getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, controller.getLatest("2024:LAL:NOBODY").getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, controller.getHistory("2024:LAL:NOBODY").getStatusCode());
    }

    @Test
    void testExportReturnsCsvAttachment() {
        ResponseEntity<String> response = controller.export(2024, null);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("attachment; filename=\"canonical_2024.csv\"",
            response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION));
        assertTrue(response.getBody().startsWith("entity_id,player,team,season,pos,version,g,mp,pts,sources\n"));
        assertTrue(response.getBody().contains("LeBron James,LAL,2024,SF,1,55,35.5,25,official"));
    }

    @Test
    void testBadRequestBody() {
        ResponseEntity<Map<String, String>> response =
            controller.badRequest(new IllegalArgumentException("Unknown team: XYZ"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Unknown team: XYZ", response.getBody().get("error"));
    }
}
