package com.hoopstats.application.throttle;

import com.hoopstats.domain.error.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Request pacing per source: at most {@code maxRequestsPerMinute} in any sliding minute and at
 * least {@code minDelay} between two requests.
 *
 * <p>{@link #acquire(String)} never blocks; it either grants the slot (and records it), tells the
 * caller how long to wait, or reports the source unavailable when its circuit is open.
 * {@link #awaitPermit(String)} is the blocking loop adapters use. State of each source is guarded
 * by its own monitor and shared by every adapter invocation of that source.</p>
 */
public class SourceRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(SourceRateLimiter.class);
    private static final Duration WINDOW = Duration.ofMinutes(1);

    /**
     * @param maxRequestsPerMinute 0 or less disables the per-minute cap
     * @param minDelay             minimum spacing between two requests
     */
    public record Limits(int maxRequestsPerMinute, Duration minDelay) {

        public static Limits unlimited() {
            return new Limits(0, Duration.ZERO);
        }
    }

    private final Map<String, Limits> limits;
    private final SourceHealthRegistry health;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<String, SlotState> states = new ConcurrentHashMap<>();

    public SourceRateLimiter(Map<String, Limits> limits, SourceHealthRegistry health, Clock clock, Sleeper sleeper) {
        this.limits = Map.copyOf(limits);
        this.health = health;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public Acquisition acquire(String sourceId) {
        if (!health.isAvailable(sourceId)) {
            return Acquisition.unavailable();
        }
        Limits sourceLimits = limits.getOrDefault(sourceId, Limits.unlimited());
        SlotState state = states.computeIfAbsent(sourceId, id -> new SlotState());
        synchronized (state) {
            Instant now = clock.instant();
            Instant earliest = state.earliestNext(sourceLimits, now);
            if (now.isBefore(earliest)) {
                return Acquisition.waitFor(Duration.between(now, earliest));
            }
            // a half-open trial is claimed only by the request that is actually sent
            if (!health.allowRequest(sourceId)) {
                return Acquisition.unavailable();
            }
            state.grant(now);
            return Acquisition.granted();
        }
    }

    /**
     * Blocks until a slot is granted.
     *
     * @throws SourceUnavailableException when the source's circuit is open
     * @throws InterruptedException       when the waiting thread is interrupted
     */
    public void awaitPermit(String sourceId) throws SourceUnavailableException, InterruptedException {
        while (true) {
            Acquisition acquisition = acquire(sourceId);
            switch (acquisition.kind()) {
                case GRANTED:
                    return;
                case UNAVAILABLE:
                    throw new SourceUnavailableException(sourceId, "Circuit open for " + sourceId);
                case WAIT:
                default:
                    logger.debug("Rate limit for {}: waiting {} ms", sourceId, acquisition.delay().toMillis());
                    sleeper.sleep(acquisition.delay());
                    break;
            }
        }
    }

    private static final class SlotState {
        private final Deque<Instant> granted = new ArrayDeque<>();
        private Instant last;

        Instant earliestNext(Limits sourceLimits, Instant now) {
            Instant windowStart = now.minus(WINDOW);
            while (!granted.isEmpty() && !granted.peekFirst().isAfter(windowStart)) {
                granted.removeFirst();
            }
            Instant earliest = now;
            if (last != null && sourceLimits.minDelay() != null) {
                Instant spaced = last.plus(sourceLimits.minDelay());
                if (spaced.isAfter(earliest)) {
                    earliest = spaced;
                }
            }
            int cap = sourceLimits.maxRequestsPerMinute();
            if (cap > 0 && granted.size() >= cap) {
                Instant freed = granted.peekFirst().plus(WINDOW);
                if (freed.isAfter(earliest)) {
                    earliest = freed;
                }
            }
            return earliest;
        }

        void grant(Instant now) {
            granted.addLast(now);
            last = now;
        }
    }
}
