package com.hoopstats.infrastructure.rest;

import com.hoopstats.application.usecase.CanonicalQueryService;
import com.hoopstats.application.usecase.CollectionRunCoordinator;
import com.hoopstats.domain.model.CollectionRun;
import com.hoopstats.domain.model.CollectionScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for collection runs.
 */
@RestController
@RequestMapping("/runs")
public class CollectionController {

    private static final Logger logger = LoggerFactory.getLogger(CollectionController.class);

    private final CollectionRunCoordinator coordinator;
    private final CanonicalQueryService queryService;

    public CollectionController(CollectionRunCoordinator coordinator, CanonicalQueryService queryService) {
        this.coordinator = coordinator;
        this.queryService = queryService;
    }

    /**
     * Starts a collection run in the background.
     *
     * POST /runs {"season": 2024, "entities": [...], "sources": [...]}
     *
     * @return 202 with the run id, 400 for an invalid scope
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startRun(@RequestBody CollectionScope scope) {
        logger.info("Received request to start a run: {}", scope);
        try {
            String runId = coordinator.startRun(scope);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("runId", runId));
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected run request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /runs/{runId}/cancel
     *
     * @return 202 when cancellation was requested, 404 for an unknown run, 409 when already finished
     */
    @PostMapping("/{runId}/cancel")
    public ResponseEntity<Void> cancelRun(@PathVariable String runId) {
        if (coordinator.cancelRun(runId)) {
            return ResponseEntity.accepted().build();
        }
        Optional<CollectionRun> run = queryService.getRunStatus(runId);
        return run.isPresent()
            ? ResponseEntity.status(HttpStatus.CONFLICT).build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping("/{runId}")
    public ResponseEntity<CollectionRun> getRun(@PathVariable String runId) {
        return queryService.getRunStatus(runId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<CollectionRun> listRuns(@RequestParam(defaultValue = "20") int limit) {
        return queryService.listRecentRuns(Math.max(1, Math.min(limit, 200)));
    }
}
