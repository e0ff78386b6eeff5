package com.hoopstats.infrastructure.rest;

import com.hoopstats.application.usecase.CanonicalQueryService;
import com.hoopstats.domain.model.CanonicalQuery;
import com.hoopstats.domain.model.CanonicalRecord;
import com.hoopstats.domain.model.Position;
import com.hoopstats.domain.model.SourceHealth;
import com.hoopstats.domain.model.Team;
import com.hoopstats.infrastructure.export.CanonicalCsvExporter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.StringWriter;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the canonical dataset and source health.
 */
@RestController
public class CanonicalController {

    private final CanonicalQueryService queryService;
    private final CanonicalCsvExporter exporter;

    public CanonicalController(CanonicalQueryService queryService, CanonicalCsvExporter exporter) {
        this.queryService = queryService;
        this.exporter = exporter;
    }

    /**
     * GET /canonical?season=2024&team=LAL&position=SF&player=LeBron James&minGames=10&minMinutes=15&runId=...
     */
    @GetMapping("/canonical")
    public List<CanonicalRecord> getCanonicalRecords(@RequestParam int season,
                                                     @RequestParam(required = false) String team,
                                                     @RequestParam(required = false) String position,
                                                     @RequestParam(required = false) List<String> player,
                                                     @RequestParam(required = false) Double minGames,
                                                     @RequestParam(required = false) Double minMinutes,
                                                     @RequestParam(required = false) String runId) {
        return queryService.getCanonicalRecords(
            toQuery(season, team, position, player, minGames, minMinutes, runId));
    }

    @GetMapping("/canonical/export")
    public ResponseEntity<String> export(@RequestParam int season,
                                         @RequestParam(required = false) String runId) {
        List<CanonicalRecord> records = queryService.getCanonicalRecords(CanonicalQuery.season(season).withRunId(runId));
        StringWriter out = new StringWriter();
        exporter.write(records, out);
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"canonical_" + season + ".csv\"")
            .contentType(new MediaType("text", "csv"))
            .body(out.toString());
    }

    @GetMapping("/canonical/{entityId}")
    public ResponseEntity<CanonicalRecord> getLatest(@PathVariable String entityId) {
        return queryService.getLatest(entityId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/canonical/{entityId}/history")
    public ResponseEntity<List<CanonicalRecord>> getHistory(@PathVariable String entityId) {
        List<CanonicalRecord> history = queryService.getHistory(entityId);
        return history.isEmpty() ? ResponseEntity.notFound().build() : ResponseEntity.ok(history);
    }

    @GetMapping("/sources/health")
    public List<SourceHealth> listSourceHealth() {
        return queryService.listSourceHealth();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    static CanonicalQuery toQuery(int season, String team, String position, List<String> players,
                                  Double minGames, Double minMinutes, String runId) {
        Team teamFilter = team == null ? null : Team.resolve(team)
            .orElseThrow(() -> new IllegalArgumentException("Unknown team: " + team));
        Position positionFilter = position == null ? null : Position.resolve(position)
            .orElseThrow(() -> new IllegalArgumentException("Unknown position: " + position));
        return new CanonicalQuery(season, teamFilter, positionFilter,
            players != null ? players : List.of(), minGames, minMinutes, runId);
    }
}
