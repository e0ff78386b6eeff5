package com.hoopstats.infrastructure.scraper.official;

import com.fasterxml.jackson.databind.JsonNode;
import com.hoopstats.domain.error.SourceException;
import com.hoopstats.domain.error.SourceParseException;
import com.hoopstats.domain.model.CollectionScope;
import com.hoopstats.domain.model.RawEntityKey;
import com.hoopstats.domain.model.RawRecord;
import com.hoopstats.domain.model.RawValue;
import com.hoopstats.domain.model.ScopeUnit;
import com.hoopstats.domain.ports.SourceAdapter;
import com.hoopstats.infrastructure.scraper.SourceHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.StreamSupport;

/**
 * Adapter for the official league statistics API (leaguedashplayerstats).
 *
 * <p>The API answers a header list plus a row set; columns are mapped onto the per-game field
 * names the validator knows. One unit per season type.</p>
 */
public class OfficialStatsAdapter implements SourceAdapter {

    private static final Logger logger = LoggerFactory.getLogger(OfficialStatsAdapter.class);

    private static final String ENDPOINT = "/stats/leaguedashplayerstats";
    private static final List<String> SEASON_TYPES = List.of("Regular Season");

    private static final Map<String, String> HEADERS = Map.of(
        "accept", "application/json, text/plain, */*",
        "accept-language", "en-US,en;q=0.9",
        "origin", "https://www.nba.com",
        "referer", "https://www.nba.com/",
        "user-agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36"
    );

    private static final Map<String, String> COLUMNS = new LinkedHashMap<>();

    static {
        COLUMNS.put("AGE", "age");
        COLUMNS.put("GP", "g");
        COLUMNS.put("MIN", "mp");
        COLUMNS.put("FGM", "fg");
        COLUMNS.put("FGA", "fga");
        COLUMNS.put("FG_PCT", "fg_pct");
        COLUMNS.put("FG3M", "fg3");
        COLUMNS.put("FG3A", "fg3a");
        COLUMNS.put("FG3_PCT", "fg3_pct");
        COLUMNS.put("FTM", "ft");
        COLUMNS.put("FTA", "fta");
        COLUMNS.put("FT_PCT", "ft_pct");
        COLUMNS.put("OREB", "orb");
        COLUMNS.put("DREB", "drb");
        COLUMNS.put("REB", "trb");
        COLUMNS.put("AST", "ast");
        COLUMNS.put("TOV", "tov");
        COLUMNS.put("STL", "stl");
        COLUMNS.put("BLK", "blk");
        COLUMNS.put("PF", "pf");
        COLUMNS.put("PTS", "pts");
    }

    private final String sourceId;
    private final String baseUrl;
    private final SourceHttpClient http;
    private final Clock clock;

    public OfficialStatsAdapter(String sourceId, String baseUrl, SourceHttpClient http, Clock clock) {
        this.sourceId = sourceId;
        this.baseUrl = baseUrl;
        this.http = http;
        this.clock = clock;
    }

    @Override
    public String getSourceId() {
        return sourceId;
    }

    /**
     * Season 2024 is requested as "2023-24".
     */
    static String seasonLabel(int season) {
        return (season - 1) + "-" + String.format("%02d", season % 100);
    }

    @Override
    public List<ScopeUnit> planUnits(CollectionScope scope) {
        List<ScopeUnit> units = new ArrayList<>();
        for (String seasonType : SEASON_TYPES) {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("Season", seasonLabel(scope.getSeason()));
            params.put("SeasonType", seasonType);
            params.put("PerMode", "PerGame");
            params.put("MeasureType", "Base");
            params.put("LeagueID", "00");
            units.add(new ScopeUnit(seasonLabel(scope.getSeason()) + " " + seasonType,
                SourceHttpClient.withParams(baseUrl + ENDPOINT, params)));
        }
        return units;
    }

    @Override
    public Iterator<RawRecord> fetch(CollectionScope scope, ScopeUnit unit) throws SourceException {
        logger.info("Fetching {} from {}", unit.id(), unit.location());
        JsonNode response = http.getJson(sourceId, unit.location(), HEADERS);
        return parse(response, scope.getSeason(), clock.instant());
    }

    Iterator<RawRecord> parse(JsonNode response, int season, Instant fetchedAt) throws SourceParseException {
        JsonNode resultSets = response.path("resultSets");
        if (!resultSets.isArray() || resultSets.isEmpty()) {
            throw new SourceParseException(sourceId, "Response has no resultSets");
        }
        JsonNode resultSet = resultSets.get(0);
        JsonNode headers = resultSet.path("headers");
        JsonNode rows = resultSet.path("rowSet");
        if (!headers.isArray() || !rows.isArray()) {
            throw new SourceParseException(sourceId, "resultSets[0] lacks headers or rowSet");
        }

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            index.put(headers.get(i).asText(), i);
        }
        if (!index.containsKey("PLAYER_NAME") || !index.containsKey("TEAM_ABBREVIATION")) {
            throw new SourceParseException(sourceId, "Missing PLAYER_NAME or TEAM_ABBREVIATION column");
        }

        return StreamSupport.stream(rows.spliterator(), false)
            .map(row -> toRecord(row, index, season, fetchedAt))
            .iterator();
    }

    private RawRecord toRecord(JsonNode row, Map<String, Integer> index, int season, Instant fetchedAt) {
        Map<String, RawValue> fields = new HashMap<>();
        COLUMNS.forEach((column, field) -> {
            Integer position = index.get(column);
            if (position != null) {
                fields.put(field, toRawValue(row.get(position)));
            }
        });
        String name = row.path(index.get("PLAYER_NAME")).asText(null);
        String team = row.path(index.get("TEAM_ABBREVIATION")).asText(null);
        return new RawRecord(sourceId, new RawEntityKey(name, team, season), fields, fetchedAt);
    }

    static RawValue toRawValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return RawValue.ofNull();
        }
        if (node.isNumber()) {
            return RawValue.ofNumber(node.decimalValue());
        }
        if (node.isTextual()) {
            return RawValue.ofString(node.asText());
        }
        return RawValue.unknown(node);
    }
}
