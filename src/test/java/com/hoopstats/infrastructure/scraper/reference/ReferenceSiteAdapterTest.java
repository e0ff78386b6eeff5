package com.hoopstats.infrastructure.scraper.reference;

import com.hoopstats.domain.error.SourceParseException;
import com.hoopstats.domain.model.CollectionScope;
import com.hoopstats.domain.model.RawRecord;
import com.hoopstats.domain.model.RawValue;
import com.hoopstats.domain.model.ScopeUnit;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReferenceSiteAdapter page parsing.
 */
class ReferenceSiteAdapterTest {

    private static final Instant FETCHED_AT = Instant.parse("2024-04-15T08:00:00Z");

    private final ReferenceSiteAdapter adapter = new ReferenceSiteAdapter(
        "basketball-reference", "https://www.basketball-reference.com", null, Clock.systemUTC());

    private static String fixture(String name) throws IOException {
        try (InputStream in = ReferenceSiteAdapterTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static List<RawRecord> toList(Iterator<RawRecord> iterator) {
        List<RawRecord> records = new ArrayList<>();
        iterator.forEachRemaining(records::add);
        return records;
    }

    @Test
    void testPlanUnitsOnePagePerSeason() {
        List<ScopeUnit> units = adapter.planUnits(CollectionScope.season(2024));

        assertEquals(1, units.size());
        assertEquals("NBA_2024_per_game", units.get(0).id());
        assertEquals("https://www.basketball-reference.com/leagues/NBA_2024_per_game.html", units.get(0).location());
    }

    @Test
    void testParseSkipsRepeatedHeaderRows() throws Exception {
        List<RawRecord> records = toList(adapter.parse(fixture("reference_per_game_2024.html"), 2024, FETCHED_AT));

        assertEquals(3, records.size());
        assertEquals(List.of("LeBron James", "Stephen Curry", "Nikola Jokić"),
            records.stream().map(r -> r.getEntityKey().name()).toList());
    }

    @Test
    void testParseMapsPerGameColumns() throws Exception {
        RawRecord lebron = toList(adapter.parse(fixture("reference_per_game_2024.html"), 2024, FETCHED_AT)).get(0);

        assertEquals("basketball-reference", lebron.getSourceId());
        assertEquals("LAL", lebron.getEntityKey().team());
        assertEquals(2024, lebron.getEntityKey().season());
        assertEquals(FETCHED_AT, lebron.getFetchedAt());
        assertEquals(RawValue.ofString("25.7"), lebron.field("pts"));
        assertEquals(RawValue.ofString("35.3"), lebron.field("mp"));
        assertEquals(RawValue.ofString("71"), lebron.field("g"));
        assertEquals(RawValue.ofString("SF"), lebron.field("pos"));
        assertNull(lebron.field("player"));
        assertNull(lebron.field("ranker"));
    }

    @Test
    void testEmptyCellBecomesNull() throws Exception {
        RawRecord jokic = toList(adapter.parse(fixture("reference_per_game_2024.html"), 2024, FETCHED_AT)).get(2);

        assertTrue(jokic.field("fg3_pct").isNull());
    }

    @Test
    void testRowWithoutPlayerIsKeptForValidation() throws Exception {
        String html = "<table id=\"per_game_stats\"><tbody>"
            + "<tr><th data-stat=\"ranker\">1</th><td data-stat=\"team_id\">BOS</td>"
            + "<td data-stat=\"pts_per_g\">26.9</td></tr>"
            + "<tr><th data-stat=\"ranker\">2</th><td data-stat=\"player\"></td>"
            + "<td data-stat=\"team_id\">BOS</td><td data-stat=\"pts_per_g\">4.1</td></tr>"
            + "<tr class=\"spacer\"><td colspan=\"3\"></td></tr>"
            + "</tbody></table>";

        List<RawRecord> records = toList(adapter.parse(html, 2024, FETCHED_AT));

        assertEquals(2, records.size());
        assertNull(records.get(0).getEntityKey().name());
        assertNull(records.get(1).getEntityKey().name());
        assertEquals(RawValue.ofString("4.1"), records.get(1).field("pts"));
    }

    @Test
    void testParseFindsTableInsideComment() throws Exception {
        List<RawRecord> records = toList(adapter.parse(fixture("reference_commented_2024.html"), 2024, FETCHED_AT));

        assertEquals(1, records.size());
        RawRecord durant = records.get(0);
        assertEquals("Kevin Durant", durant.getEntityKey().name());
        assertEquals("PHO", durant.getEntityKey().team());
        assertEquals(RawValue.ofString("75"), durant.field("g"));
        assertEquals(RawValue.ofString("75"), durant.field("gs"));
        assertEquals(RawValue.ofString("27.1"), durant.field("pts"));
    }

    @Test
    void testMissingTableIsParseError() {
        SourceParseException error = assertThrows(SourceParseException.class,
            () -> adapter.parse("<html><body><p>Page moved</p></body></html>", 2024, FETCHED_AT));

        assertEquals("basketball-reference", error.getSourceId());
    }
}
