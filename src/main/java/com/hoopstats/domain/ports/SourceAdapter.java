package com.hoopstats.domain.ports;

import com.hoopstats.domain.error.SourceException;
import com.hoopstats.domain.model.CollectionScope;
import com.hoopstats.domain.model.RawRecord;
import com.hoopstats.domain.model.ScopeUnit;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Port for fetching raw player lines from one external source.
 *
 * <p>A fetch is split into scope units. Each unit is fetched as a finite, lazy sequence that
 * cannot be restarted: when a unit fails it is fetched again from its start. Implementations
 * keep no state between invocations other than the injected rate limiter.</p>
 */
public interface SourceAdapter {

    /**
     * Gets the configured id of the source (e.g. "basketball-reference").
     */
    String getSourceId();

    /**
     * Splits the scope into retryable units. Never performs network work.
     */
    List<ScopeUnit> planUnits(CollectionScope scope);

    /**
     * Fetches one unit.
     *
     * @throws SourceException classified failure of the unit
     */
    Iterator<RawRecord> fetch(CollectionScope scope, ScopeUnit unit) throws SourceException;

    /**
     * Lazily chains every unit of the scope. The first failing unit aborts the sequence with
     * an {@link IllegalStateException} wrapping the {@link SourceException}; callers that need
     * per-unit retries use {@link #fetch(CollectionScope, ScopeUnit)} instead.
     */
    default Iterator<RawRecord> fetch(CollectionScope scope) {
        Iterator<ScopeUnit> units = planUnits(scope).iterator();
        return new Iterator<>() {
            private Iterator<RawRecord> current = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!current.hasNext() && units.hasNext()) {
                    ScopeUnit unit = units.next();
                    try {
                        current = SourceAdapter.this.fetch(scope, unit);
                    } catch (SourceException e) {
                        throw new IllegalStateException("Unit " + unit.id() + " of " + getSourceId() + " failed", e);
                    }
                }
                return current.hasNext();
            }

            @Override
            public RawRecord next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return current.next();
            }
        };
    }
}
