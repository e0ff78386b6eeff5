package com.hoopstats.application.usecase;

import com.hoopstats.application.throttle.BackoffPolicy;
import com.hoopstats.application.throttle.RetryState;
import com.hoopstats.application.throttle.Sleeper;
import com.hoopstats.application.throttle.SourceHealthRegistry;
import com.hoopstats.application.validation.RecordValidator;
import com.hoopstats.domain.error.SourceException;
import com.hoopstats.domain.error.SourceUnavailableException;
import com.hoopstats.domain.model.CollectionRun;
import com.hoopstats.domain.model.CollectionScope;
import com.hoopstats.domain.model.CollectionStatus;
import com.hoopstats.domain.model.ErrorCategory;
import com.hoopstats.domain.model.RawRecord;
import com.hoopstats.domain.model.RunError;
import com.hoopstats.domain.model.ScopeUnit;
import com.hoopstats.domain.model.ValidationOutcome;
import com.hoopstats.domain.model.ValidationStatus;
import com.hoopstats.domain.ports.SourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Fetch-and-validate loop of one source for one run.
 *
 * <p>Units are fetched sequentially. A unit that fails with a retryable error is fetched again
 * from its start once its {@link RetryState} becomes eligible; records of a failed attempt are
 * discarded. Permanent and parse failures skip the unit. Running out of retries, or an open
 * circuit, fails the whole source. The stop signal is checked before every unit and after every
 * backoff wait, never in the middle of a unit.</p>
 */
public class SourceCollector {

    private static final Logger logger = LoggerFactory.getLogger(SourceCollector.class);

    private final RecordValidator validator;
    private final SourceHealthRegistry health;
    private final BackoffPolicy backoff;
    private final Clock clock;
    private final Sleeper sleeper;

    public SourceCollector(RecordValidator validator,
                           SourceHealthRegistry health,
                           BackoffPolicy backoff,
                           Clock clock,
                           Sleeper sleeper) {
        this.validator = validator;
        this.health = health;
        this.backoff = backoff;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public SourceResult collect(SourceAdapter adapter, CollectionScope scope, CollectionRun run, BooleanSupplier stopRequested) {
        String sourceId = adapter.getSourceId();
        List<ScopeUnit> units = adapter.planUnits(scope);
        logger.info("Run {}: source {} planned {} units", run.getRunId(), sourceId, units.size());

        List<ValidationOutcome> usable = new ArrayList<>();
        int completed = 0;
        int skipped = 0;

        for (ScopeUnit unit : units) {
            if (stopRequested.getAsBoolean()) {
                logger.info("Run {}: source {} stopped before unit {}", run.getRunId(), sourceId, unit.id());
                return new SourceResult(sourceId, CollectionStatus.FAILED, List.of());
            }

            UnitResult result = collectUnit(adapter, scope, unit, run, stopRequested);
            switch (result.state) {
                case DONE:
                    completed++;
                    for (ValidationOutcome outcome : result.outcomes) {
                        recordOutcome(run, outcome);
                        if (outcome.isUsable()) {
                            usable.add(outcome);
                        }
                    }
                    break;
                case SKIPPED:
                    skipped++;
                    break;
                case FAILED:
                default:
                    return new SourceResult(sourceId, CollectionStatus.FAILED, List.of());
            }
        }

        if (skipped == 0) {
            logger.info("Run {}: source {} succeeded with {} usable records", run.getRunId(), sourceId, usable.size());
            return new SourceResult(sourceId, CollectionStatus.SUCCEEDED, usable);
        }
        if (completed == 0) {
            logger.warn("Run {}: source {} skipped all {} units", run.getRunId(), sourceId, skipped);
            return new SourceResult(sourceId, CollectionStatus.FAILED, List.of());
        }
        logger.warn("Run {}: source {} skipped {} of {} units", run.getRunId(), sourceId, skipped, units.size());
        return new SourceResult(sourceId, CollectionStatus.PARTIAL, usable);
    }

    private UnitResult collectUnit(SourceAdapter adapter,
                                   CollectionScope scope,
                                   ScopeUnit unit,
                                   CollectionRun run,
                                   BooleanSupplier stopRequested) {
        String sourceId = adapter.getSourceId();
        RetryState retry = new RetryState(clock.instant());

        while (true) {
            try {
                List<ValidationOutcome> outcomes = new ArrayList<>();
                Iterator<RawRecord> records = adapter.fetch(scope, unit);
                while (records.hasNext()) {
                    outcomes.add(validator.validate(records.next()));
                }
                health.recordSuccess(sourceId);
                logger.debug("Run {}: {} unit {} yielded {} records", run.getRunId(), sourceId, unit.id(), outcomes.size());
                return UnitResult.done(outcomes);

            } catch (SourceUnavailableException e) {
                logger.warn("Run {}: source {} unavailable: {}", run.getRunId(), sourceId, e.getMessage());
                run.addError(RunError.ofSource(ErrorCategory.SOURCE_UNAVAILABLE, sourceId, e.getMessage(), clock.instant()));
                return UnitResult.failed();

            } catch (SourceException e) {
                health.recordFailure(sourceId);
                run.addError(RunError.ofSource(e.getCategory(), sourceId,
                    "Unit " + unit.id() + ": " + e.getMessage(), clock.instant()));

                if (!e.isRetryable()) {
                    logger.warn("Run {}: {} unit {} skipped ({}): {}", run.getRunId(), sourceId, unit.id(), e.getCategory(), e.getMessage());
                    return UnitResult.skipped();
                }
                if (!backoff.canRetry(retry.getRetries())) {
                    String message = "Unit " + unit.id() + " failed after " + retry.getRetries() + " retries";
                    logger.error("Run {}: {} {}", run.getRunId(), sourceId, message);
                    run.addError(RunError.ofSource(ErrorCategory.RETRIES_EXHAUSTED, sourceId, message, clock.instant()));
                    return UnitResult.failed();
                }

                Duration delay = backoff.delayFor(e, retry.getRetries());
                retry.scheduleRetry(clock.instant(), delay);
                logger.info("Run {}: {} unit {} retry {} in {} ms ({})",
                    run.getRunId(), sourceId, unit.id(), retry.getRetries(), delay.toMillis(), e.getCategory());
                try {
                    sleeper.sleep(retry.remaining(clock.instant()));
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    logger.warn("Run {}: {} interrupted during backoff", run.getRunId(), sourceId);
                    return UnitResult.failed();
                }
                if (stopRequested.getAsBoolean()) {
                    return UnitResult.failed();
                }

            } catch (RuntimeException e) {
                // lazy parsing failed mid-stream; the partial unit is discarded
                health.recordFailure(sourceId);
                logger.error("Run {}: {} unit {} could not be read", run.getRunId(), sourceId, unit.id(), e);
                run.addError(RunError.ofSource(ErrorCategory.PARSE_ERROR, sourceId,
                    "Unit " + unit.id() + ": " + e.getMessage(), clock.instant()));
                return UnitResult.skipped();
            }
        }
    }

    private void recordOutcome(CollectionRun run, ValidationOutcome outcome) {
        run.countRecord(outcome.getStatus());
        if (outcome.getStatus() == ValidationStatus.REJECTED) {
            run.addError(new RunError(ErrorCategory.VALIDATION_REJECTION, outcome.getSourceId(), null, null,
                outcome.getRecord().getEntityKey() + " rejected: " + outcome.getViolations(), clock.instant()));
        }
    }

    private enum UnitState {
        DONE,
        SKIPPED,
        FAILED
    }

    private static final class UnitResult {
        private final UnitState state;
        private final List<ValidationOutcome> outcomes;

        private UnitResult(UnitState state, List<ValidationOutcome> outcomes) {
            this.state = state;
            this.outcomes = outcomes;
        }

        static UnitResult done(List<ValidationOutcome> outcomes) {
            return new UnitResult(UnitState.DONE, outcomes);
        }

        static UnitResult skipped() {
            return new UnitResult(UnitState.SKIPPED, List.of());
        }

        static UnitResult failed() {
            return new UnitResult(UnitState.FAILED, List.of());
        }
    }
}
