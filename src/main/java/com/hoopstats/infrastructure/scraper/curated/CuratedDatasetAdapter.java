package com.hoopstats.infrastructure.scraper.curated;

import com.hoopstats.domain.error.PermanentSourceException;
import com.hoopstats.domain.error.SourceException;
import com.hoopstats.domain.error.SourceParseException;
import com.hoopstats.domain.error.TransientSourceException;
import com.hoopstats.domain.model.CollectionScope;
import com.hoopstats.domain.model.RawEntityKey;
import com.hoopstats.domain.model.RawRecord;
import com.hoopstats.domain.model.RawValue;
import com.hoopstats.domain.model.ScopeUnit;
import com.hoopstats.domain.ports.SourceAdapter;
import com.hoopstats.infrastructure.scraper.SourceHttpClient;
import com.opencsv.CSVReaderHeaderAware;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Adapter for curated CSV datasets (one file per season, optionally split in several files).
 *
 * <p>The configured location may hold several comma-separated patterns; {@code {season}} is
 * replaced by the season end year. http(s) locations are downloaded, anything else is resolved
 * as a Spring resource ({@code classpath:}, {@code file:}).</p>
 *
 * <p>A {@code season} column, when present, selects the rows of the requested season
 * ({@code 2024}, {@code 2023-24} and {@code 2023-2024} all name the season ending in 2024).
 * Rows with every cell blank are spacers and skipped; any other row is emitted, even without a
 * player name, so the validator can reject it.</p>
 */
public class CuratedDatasetAdapter implements SourceAdapter {

    private static final Logger logger = LoggerFactory.getLogger(CuratedDatasetAdapter.class);

    private static final Map<String, String> COLUMN_ALIASES = Map.of(
        "tm", "team_id",
        "team", "team_id",
        "team_abbreviation", "team_id",
        "player_name", "player",
        "name", "player"
    );

    private final String sourceId;
    private final String location;
    private final SourceHttpClient http;
    private final ResourceLoader resourceLoader;
    private final Clock clock;

    public CuratedDatasetAdapter(String sourceId, String location, SourceHttpClient http, Clock clock) {
        this(sourceId, location, http, new DefaultResourceLoader(), clock);
    }

    public CuratedDatasetAdapter(String sourceId, String location, SourceHttpClient http,
                                 ResourceLoader resourceLoader, Clock clock) {
        this.sourceId = sourceId;
        this.location = location;
        this.http = http;
        this.resourceLoader = resourceLoader;
        this.clock = clock;
    }

    @Override
    public String getSourceId() {
        return sourceId;
    }

    @Override
    public List<ScopeUnit> planUnits(CollectionScope scope) {
        List<ScopeUnit> units = new ArrayList<>();
        for (String pattern : location.split(",")) {
            String resolved = pattern.trim().replace("{season}", String.valueOf(scope.getSeason()));
            if (!resolved.isEmpty()) {
                units.add(new ScopeUnit(resolved.substring(resolved.lastIndexOf('/') + 1), resolved));
            }
        }
        return units;
    }

    @Override
    public Iterator<RawRecord> fetch(CollectionScope scope, ScopeUnit unit) throws SourceException {
        logger.info("Reading dataset {} from {}", unit.id(), unit.location());
        String content = isRemote(unit.location())
            ? http.getText(sourceId, unit.location(), Map.of("accept", "text/csv, text/plain, */*"))
            : readResource(unit.location());
        return parse(content, scope.getSeason(), clock.instant());
    }

    private static boolean isRemote(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private String readResource(String path) throws SourceException {
        http.awaitPermit(sourceId);
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new PermanentSourceException(sourceId, "Dataset not found: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TransientSourceException(sourceId, "Failed to read dataset " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a whole file up front; a malformed line fails the unit rather than part of it.
     */
    Iterator<RawRecord> parse(String content, int season, Instant fetchedAt) throws SourceParseException {
        List<RawRecord> records = new ArrayList<>();
        int otherSeasons = 0;
        try (CSVReaderHeaderAware reader = new CSVReaderHeaderAware(new StringReader(content))) {
            Map<String, String> row;
            while ((row = reader.readMap()) != null) {
                Map<String, RawValue> fields = toFields(row);
                if (fields.values().stream().allMatch(RawValue::isBlank)) {
                    continue;
                }
                RawValue rowSeason = fields.remove("season");
                if (rowSeason != null && !rowSeason.isBlank() && seasonEndYear(rowSeason.asText()) != season) {
                    otherSeasons++;
                    continue;
                }
                records.add(toRecord(fields, season, fetchedAt));
            }
        } catch (IOException | CsvValidationException e) {
            throw new SourceParseException(sourceId, "Malformed dataset: " + e.getMessage(), e);
        }
        logger.debug("{}: parsed {} rows for season {}, {} rows of other seasons ignored",
            sourceId, records.size(), season, otherSeasons);
        return records.iterator();
    }

    private static Map<String, RawValue> toFields(Map<String, String> row) {
        Map<String, RawValue> fields = new HashMap<>();
        row.forEach((header, value) -> {
            String column = header.trim().toLowerCase(Locale.ROOT);
            column = COLUMN_ALIASES.getOrDefault(column, column);
            String text = value != null ? value.trim() : "";
            fields.put(column, text.isEmpty() ? RawValue.ofNull() : RawValue.ofString(text));
        });
        return fields;
    }

    private RawRecord toRecord(Map<String, RawValue> fields, int season, Instant fetchedAt) {
        RawValue player = fields.remove("player");
        RawValue team = fields.remove("team_id");
        RawEntityKey key = new RawEntityKey(player != null && !player.isBlank() ? player.asText() : null,
            team != null ? team.asText() : null, season);
        return new RawRecord(sourceId, key, fields, fetchedAt);
    }

    /**
     * End year of a season label: {@code 2024}, {@code 2023-24} or {@code 2023-2024}.
     */
    private int seasonEndYear(String label) throws SourceParseException {
        String text = label.trim();
        try {
            int dash = text.indexOf('-');
            if (dash < 0) {
                return Integer.parseInt(text);
            }
            int start = Integer.parseInt(text.substring(0, dash));
            String end = text.substring(dash + 1);
            int endYear = Integer.parseInt(end);
            if (end.length() == 2) {
                // 1999-00 ends in 2000
                int century = start / 100 * 100;
                return century + endYear + (endYear < start % 100 ? 100 : 0);
            }
            return endYear;
        } catch (NumberFormatException e) {
            throw new SourceParseException(sourceId, "Unreadable season '" + label + "'", e);
        }
    }
}
