package com.hoopstats.application.throttle;

import com.hoopstats.domain.model.SourceHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling success statistics per source plus the circuit breaker built on them.
 *
 * <p>Every adapter invocation is recorded. When the success rate over the trailing window
 * falls below the threshold (with at least {@code minSamples} results) the circuit opens for
 * {@code cooldown}: {@link #allowRequest(String)} answers false without any network work.
 * After the cool-down exactly one trial request is let through and everyone else is refused
 * until its result closes or re-opens the circuit. A trial that reports nothing within another
 * cool-down is replaced by a new one. Each source's state is guarded by its own monitor.</p>
 */
public class SourceHealthRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SourceHealthRegistry.class);

    /**
     * @param window     number of trailing invocations considered
     * @param minSamples results needed before the circuit may open
     * @param threshold  success rate under which the circuit opens
     * @param cooldown   how long an open circuit rejects requests
     */
    public record Settings(int window, int minSamples, double threshold, Duration cooldown) {

        public static Settings defaults() {
            return new Settings(10, 5, 0.3, Duration.ofMinutes(10));
        }
    }

    private final Settings settings;
    private final Clock clock;
    private final Map<String, HealthState> states = new ConcurrentHashMap<>();

    public SourceHealthRegistry(Settings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public void recordSuccess(String sourceId) {
        HealthState state = state(sourceId);
        synchronized (state) {
            state.record(true, clock.instant());
        }
    }

    public void recordFailure(String sourceId) {
        HealthState state = state(sourceId);
        synchronized (state) {
            state.record(false, clock.instant());
        }
    }

    /**
     * False while the source's circuit is open or its trial request is in flight. A true answer
     * after the cool-down claims the trial, so call this only right before the request is sent.
     */
    public boolean allowRequest(String sourceId) {
        HealthState state = state(sourceId);
        synchronized (state) {
            return state.allow(clock.instant());
        }
    }

    /**
     * Same answer as {@link #allowRequest(String)} without claiming the trial.
     */
    public boolean isAvailable(String sourceId) {
        HealthState state = state(sourceId);
        synchronized (state) {
            return state.permits(clock.instant());
        }
    }

    public SourceHealth snapshot(String sourceId) {
        HealthState state = state(sourceId);
        synchronized (state) {
            return state.toSnapshot();
        }
    }

    public List<SourceHealth> snapshotAll() {
        return states.keySet().stream()
            .sorted()
            .map(this::snapshot)
            .toList();
    }

    /**
     * Seeds the registry from persisted snapshots, e.g. after a restart. The trailing window is
     * approximated from the stored rate and sample count.
     */
    public void restore(List<SourceHealth> snapshots) {
        for (SourceHealth snapshot : snapshots) {
            HealthState state = state(snapshot.getSourceId());
            synchronized (state) {
                state.restore(snapshot);
            }
        }
        logger.info("Restored health of {} sources", snapshots.size());
    }

    private HealthState state(String sourceId) {
        return states.computeIfAbsent(sourceId, HealthState::new);
    }

    private final class HealthState {
        private final String sourceId;
        private final Deque<Boolean> results = new ArrayDeque<>();
        private int consecutiveFailures;
        private Instant lastSuccess;
        private Instant lastFailure;
        private Instant openUntil;
        private Instant trialStartedAt;

        private HealthState(String sourceId) {
            this.sourceId = sourceId;
        }

        void record(boolean success, Instant now) {
            results.addLast(success);
            while (results.size() > settings.window()) {
                results.removeFirst();
            }
            if (success) {
                consecutiveFailures = 0;
                lastSuccess = now;
            } else {
                consecutiveFailures++;
                lastFailure = now;
            }

            if (trialStartedAt != null) {
                trialStartedAt = null;
                if (success) {
                    results.clear();
                    results.addLast(true);
                    logger.info("Circuit for {} closed after successful trial request", sourceId);
                } else {
                    open(now);
                }
                return;
            }
            if (openUntil == null && results.size() >= settings.minSamples() && successRate() < settings.threshold()) {
                open(now);
            }
        }

        boolean permits(Instant now) {
            if (trialStartedAt != null) {
                return !now.isBefore(trialStartedAt.plus(settings.cooldown()));
            }
            return openUntil == null || !now.isBefore(openUntil);
        }

        boolean allow(Instant now) {
            if (!permits(now)) {
                return false;
            }
            if (openUntil != null || trialStartedAt != null) {
                // this caller carries the single trial
                openUntil = null;
                trialStartedAt = now;
            }
            return true;
        }

        private void open(Instant now) {
            openUntil = now.plus(settings.cooldown());
            logger.warn("Circuit for {} opened until {} (success rate {})",
                sourceId, openUntil, String.format("%.2f", successRate()));
        }

        double successRate() {
            if (results.isEmpty()) {
                return 1.0;
            }
            long ok = results.stream().filter(Boolean::booleanValue).count();
            return (double) ok / results.size();
        }

        SourceHealth toSnapshot() {
            SourceHealth health = new SourceHealth();
            health.setSourceId(sourceId);
            health.setSuccessRate(successRate());
            health.setSamples(results.size());
            health.setConsecutiveFailures(consecutiveFailures);
            health.setLastSuccess(lastSuccess);
            health.setLastFailure(lastFailure);
            health.setCircuitOpen(openUntil != null);
            health.setOpenUntil(openUntil);
            return health;
        }

        void restore(SourceHealth snapshot) {
            results.clear();
            int samples = Math.min(snapshot.getSamples(), settings.window());
            long ok = Math.round(snapshot.getSuccessRate() * samples);
            for (int i = 0; i < samples; i++) {
                results.addLast(i < samples - ok ? Boolean.FALSE : Boolean.TRUE);
            }
            consecutiveFailures = snapshot.getConsecutiveFailures();
            lastSuccess = snapshot.getLastSuccess();
            lastFailure = snapshot.getLastFailure();
            openUntil = snapshot.isCircuitOpen() ? snapshot.getOpenUntil() : null;
            trialStartedAt = null;
        }
    }
}
