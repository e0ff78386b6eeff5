package com.hoopstats.infrastructure.scheduling;

import com.hoopstats.application.usecase.CollectionRunCoordinator;
import com.hoopstats.domain.model.CollectionScope;
import com.hoopstats.infrastructure.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Starts one run per configured season on the {@code pipeline.schedule.cron} expression.
 * Disabled unless a cron expression is set.
 */
@Component
public class ScheduledCollectionTrigger {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledCollectionTrigger.class);

    private final CollectionRunCoordinator coordinator;
    private final PipelineProperties properties;

    public ScheduledCollectionTrigger(CollectionRunCoordinator coordinator, PipelineProperties properties) {
        this.coordinator = coordinator;
        this.properties = properties;
    }

    @Scheduled(cron = "${pipeline.schedule.cron:-}")
    public void trigger() {
        List<Integer> seasons = properties.getSchedule().getSeasons();
        if (seasons == null || seasons.isEmpty()) {
            logger.warn("Scheduled collection fired but pipeline.schedule.seasons is empty");
            return;
        }
        startAll(seasons);
    }

    List<String> startAll(List<Integer> seasons) {
        List<String> runIds = new ArrayList<>();
        for (Integer season : seasons) {
            try {
                String runId = coordinator.startRun(CollectionScope.season(season));
                logger.info("Scheduled run {} started for season {}", runId, season);
                runIds.add(runId);
            } catch (IllegalArgumentException e) {
                logger.error("Could not schedule season {}: {}", season, e.getMessage());
            }
        }
        return runIds;
    }
}
