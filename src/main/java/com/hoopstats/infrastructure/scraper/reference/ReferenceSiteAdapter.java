package com.hoopstats.infrastructure.scraper.reference;

import com.hoopstats.domain.error.SourceException;
import com.hoopstats.domain.error.SourceParseException;
import com.hoopstats.domain.model.CollectionScope;
import com.hoopstats.domain.model.RawEntityKey;
import com.hoopstats.domain.model.RawRecord;
import com.hoopstats.domain.model.RawValue;
import com.hoopstats.domain.model.ScopeUnit;
import com.hoopstats.domain.ports.SourceAdapter;
import com.hoopstats.infrastructure.scraper.SourceHttpClient;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Adapter for Basketball Reference season pages.
 *
 * Flow:
 * 1) One unit per season: /leagues/NBA_{season}_per_game.html
 * 2) Locate table#per_game_stats (also inside HTML comments, where the site hides some tables)
 * 3) Every body row becomes a raw record keyed by its data-stat attributes; repeated header
 *    rows are skipped
 */
public class ReferenceSiteAdapter implements SourceAdapter {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceSiteAdapter.class);

    private static final String TABLE_ID = "per_game_stats";

    private static final Map<String, String> HEADERS = Map.of(
        "accept", "text/html,application/xhtml+xml",
        "accept-language", "en-US,en;q=0.9",
        "user-agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36"
    );

    // The site renamed its data-stat attributes; both generations map to the same fields
    private static final Map<String, String> STAT_ALIASES = Map.of(
        "name_display", "player",
        "team_name_abbr", "team_id",
        "games", "g",
        "games_started", "gs"
    );

    private final String sourceId;
    private final String baseUrl;
    private final SourceHttpClient http;
    private final Clock clock;

    public ReferenceSiteAdapter(String sourceId, String baseUrl, SourceHttpClient http, Clock clock) {
        this.sourceId = sourceId;
        this.baseUrl = baseUrl;
        this.http = http;
        this.clock = clock;
    }

    @Override
    public String getSourceId() {
        return sourceId;
    }

    @Override
    public List<ScopeUnit> planUnits(CollectionScope scope) {
        String page = "NBA_" + scope.getSeason() + "_per_game";
        return List.of(new ScopeUnit(page, baseUrl + "/leagues/" + page + ".html"));
    }

    @Override
    public Iterator<RawRecord> fetch(CollectionScope scope, ScopeUnit unit) throws SourceException {
        logger.info("Fetching {} from {}", unit.id(), unit.location());
        String html = http.getText(sourceId, unit.location(), HEADERS);
        return parse(html, scope.getSeason(), clock.instant());
    }

    /**
     * Parses a season page. Rows are mapped lazily while the caller iterates.
     */
    Iterator<RawRecord> parse(String html, int season, Instant fetchedAt) throws SourceParseException {
        Document document = Jsoup.parse(html);
        Element table = document.selectFirst("table#" + TABLE_ID);
        if (table == null) {
            table = findCommentedTable(document);
        }
        if (table == null) {
            throw new SourceParseException(sourceId, "Could not find stats table for season " + season);
        }

        return table.select("tbody > tr").stream()
            .filter(row -> !row.hasClass("thead") && !row.hasClass("over_header"))
            .map(row -> toRecord(row, season, fetchedAt))
            .filter(Objects::nonNull)
            .iterator();
    }

    private RawRecord toRecord(Element row, int season, Instant fetchedAt) {
        Map<String, RawValue> fields = new HashMap<>();
        for (Element cell : row.select("td[data-stat], th[data-stat]")) {
            String stat = cell.attr("data-stat");
            stat = STAT_ALIASES.getOrDefault(stat, stat);
            if (stat.endsWith("_per_g")) {
                stat = stat.substring(0, stat.length() - "_per_g".length());
            }
            String text = cell.text().trim();
            fields.put(stat, text.isEmpty() ? RawValue.ofNull() : RawValue.ofString(text));
        }
        if (fields.isEmpty()) {
            // spacer row without stat cells
            return null;
        }

        RawValue player = fields.remove("player");
        String name = player != null ? player.asText() : null;
        RawValue team = fields.remove("team_id");
        fields.remove("ranker");
        RawEntityKey key = new RawEntityKey(name != null ? name.replace("*", "").trim() : null,
            team != null ? team.asText() : null, season);
        return new RawRecord(sourceId, key, fields, fetchedAt);
    }

    private Element findCommentedTable(Document document) {
        Element[] found = new Element[1];
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (found[0] == null && node instanceof Comment comment && comment.getData().contains(TABLE_ID)) {
                    found[0] = Jsoup.parse(comment.getData()).selectFirst("table#" + TABLE_ID);
                }
            }

            @Override
            public void tail(Node node, int depth) {
            }
        }, document);
        return found[0];
    }
}
