package com.hoopstats.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hoopstats.application.reconcile.EntityResolver;
import com.hoopstats.application.reconcile.Reconciler;
import com.hoopstats.application.reconcile.SourcePrecedence;
import com.hoopstats.application.throttle.BackoffPolicy;
import com.hoopstats.application.throttle.Sleeper;
import com.hoopstats.application.throttle.SourceHealthRegistry;
import com.hoopstats.application.throttle.SourceRateLimiter;
import com.hoopstats.application.usecase.CanonicalQueryService;
import com.hoopstats.application.usecase.CollectionRunCoordinator;
import com.hoopstats.application.usecase.RunSettings;
import com.hoopstats.application.usecase.SourceCollector;
import com.hoopstats.application.validation.FieldRule;
import com.hoopstats.application.validation.FieldType;
import com.hoopstats.application.validation.RecordValidator;
import com.hoopstats.application.validation.ValidationRules;
import com.hoopstats.domain.ports.CanonicalStore;
import com.hoopstats.domain.ports.SourceAdapter;
import com.hoopstats.domain.ports.TelemetryRepository;
import com.hoopstats.infrastructure.scraper.SourceHttpClient;
import com.hoopstats.infrastructure.scraper.curated.CuratedDatasetAdapter;
import com.hoopstats.infrastructure.scraper.official.OfficialStatsAdapter;
import com.hoopstats.infrastructure.scraper.reference.ReferenceSiteAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Wires the collection pipeline from {@link PipelineProperties}.
 */
@Configuration
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    static final String TYPE_REFERENCE_SITE = "reference-site";
    static final String TYPE_OFFICIAL_STATS = "official-stats";
    static final String TYPE_CURATED_DATASET = "curated-dataset";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public SourceHealthRegistry sourceHealthRegistry(PipelineProperties properties,
                                                     TelemetryRepository telemetry,
                                                     Clock clock) {
        PipelineProperties.Health health = properties.getHealth();
        SourceHealthRegistry registry = new SourceHealthRegistry(new SourceHealthRegistry.Settings(
            health.getWindow(), health.getMinSamples(), health.getThreshold(), health.getCooldown()), clock);
        try {
            registry.restore(telemetry.findSourceHealth());
        } catch (RuntimeException e) {
            logger.warn("Could not restore source health, starting fresh: {}", e.getMessage());
        }
        return registry;
    }

    @Bean
    public SourceRateLimiter sourceRateLimiter(PipelineProperties properties,
                                               SourceHealthRegistry health,
                                               Clock clock,
                                               Sleeper sleeper) {
        Map<String, SourceRateLimiter.Limits> limits = new LinkedHashMap<>();
        for (PipelineProperties.Source source : enabledSources(properties)) {
            limits.put(source.getId(),
                new SourceRateLimiter.Limits(source.getMaxRequestsPerMinute(), source.getMinDelay()));
        }
        return new SourceRateLimiter(limits, health, clock, sleeper);
    }

    @Bean
    public BackoffPolicy backoffPolicy(PipelineProperties properties) {
        PipelineProperties.Run run = properties.getRun();
        return new BackoffPolicy(run.getBackoff().getBase(), run.getBackoff().getFactor(),
            run.getBackoff().getCap(), run.getMaxRetries());
    }

    @Bean
    public RecordValidator recordValidator(PipelineProperties properties) {
        return new RecordValidator(validationRules(properties.getValidation()));
    }

    @Bean
    public SourcePrecedence sourcePrecedence(PipelineProperties properties) {
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>();
        for (PipelineProperties.Source source : enabledSources(properties)) {
            ranked.add(new AbstractMap.SimpleEntry<>(source.getId(), source.getPrecedence()));
        }
        return new SourcePrecedence(ranked);
    }

    @Bean
    public Reconciler reconciler(SourcePrecedence precedence, PipelineProperties properties) {
        PipelineProperties.Reconciliation reconciliation = properties.getReconciliation();
        return new Reconciler(precedence, reconciliation.getTolerance(), reconciliation.getDefaultTolerance());
    }

    @Bean
    public EntityResolver entityResolver() {
        return new EntityResolver();
    }

    @Bean
    public SourceCollector sourceCollector(RecordValidator validator,
                                           SourceHealthRegistry health,
                                           BackoffPolicy backoff,
                                           Clock clock,
                                           Sleeper sleeper) {
        return new SourceCollector(validator, health, backoff, clock, sleeper);
    }

    @Bean(destroyMethod = "close")
    public SourceHttpClient sourceHttpClient(SourceRateLimiter rateLimiter,
                                             ObjectMapper objectMapper,
                                             PipelineProperties properties) {
        return new SourceHttpClient(rateLimiter, objectMapper, properties.getHttp().getTimeout());
    }

    @Bean
    public List<SourceAdapter> sourceAdapters(PipelineProperties properties, SourceHttpClient http, Clock clock) {
        List<SourceAdapter> adapters = new ArrayList<>();
        for (PipelineProperties.Source source : enabledSources(properties)) {
            adapters.add(createAdapter(source, http, clock));
        }
        logger.info("Configured sources: {}", adapters.stream().map(SourceAdapter::getSourceId).toList());
        return adapters;
    }

    @Bean(destroyMethod = "shutdown")
    public CollectionRunCoordinator collectionRunCoordinator(List<SourceAdapter> sourceAdapters,
                                                             SourceCollector collector,
                                                             EntityResolver resolver,
                                                             Reconciler reconciler,
                                                             CanonicalStore store,
                                                             TelemetryRepository telemetry,
                                                             SourceHealthRegistry health,
                                                             PipelineProperties properties,
                                                             Clock clock) {
        return new CollectionRunCoordinator(sourceAdapters, collector, resolver, reconciler, store, telemetry,
            health, new RunSettings(properties.getRun().getTimeout()), clock);
    }

    @Bean
    public CanonicalQueryService canonicalQueryService(CanonicalStore store,
                                                       TelemetryRepository telemetry,
                                                       SourceHealthRegistry health,
                                                       CollectionRunCoordinator coordinator) {
        return new CanonicalQueryService(store, telemetry, health, coordinator);
    }

    /**
     * Enabled sources in configuration order; ids must be unique.
     */
    static List<PipelineProperties.Source> enabledSources(PipelineProperties properties) {
        List<PipelineProperties.Source> enabled = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (PipelineProperties.Source source : properties.getSources()) {
            if (!source.isEnabled()) {
                continue;
            }
            if (source.getId() == null || source.getId().isBlank()) {
                throw new IllegalStateException("Every pipeline source needs an id");
            }
            if (!seen.add(source.getId())) {
                throw new IllegalStateException("Duplicate pipeline source id: " + source.getId());
            }
            enabled.add(source);
        }
        return enabled;
    }

    static SourceAdapter createAdapter(PipelineProperties.Source source, SourceHttpClient http, Clock clock) {
        String type = source.getType() != null ? source.getType().toLowerCase(Locale.ROOT) : "";
        switch (type) {
            case TYPE_REFERENCE_SITE:
                return new ReferenceSiteAdapter(source.getId(), source.getBaseUrl(), http, clock);
            case TYPE_OFFICIAL_STATS:
                return new OfficialStatsAdapter(source.getId(), source.getBaseUrl(), http, clock);
            case TYPE_CURATED_DATASET:
                return new CuratedDatasetAdapter(source.getId(), source.getLocation(), http, clock);
            default:
                throw new IllegalStateException("Unknown type '" + source.getType() + "' for source " + source.getId());
        }
    }

    static ValidationRules validationRules(PipelineProperties.Validation validation) {
        Map<String, FieldRule> overrides = new LinkedHashMap<>();
        validation.getRules().forEach((field, rule) -> {
            FieldType type = FieldType.valueOf(rule.getType().toUpperCase(Locale.ROOT));
            List<String> domain = rule.getDomain() == null ? List.of()
                : rule.getDomain().stream().map(value -> value.toUpperCase(Locale.ROOT)).toList();
            overrides.put(field, new FieldRule(rule.isRequired(), type, rule.getMin(), rule.getMax(), domain));
        });
        return ValidationRules.defaultsWith(overrides, validation.getMaxInvalidRequiredFraction());
    }
}
