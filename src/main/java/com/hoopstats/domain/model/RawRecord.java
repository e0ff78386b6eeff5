package com.hoopstats.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One player line fetched from one source. Immutable once built.
 */
public final class RawRecord {

    private final String sourceId;
    private final RawEntityKey entityKey;
    private final Map<String, RawValue> fields;
    private final Instant fetchedAt;

    public RawRecord(String sourceId, RawEntityKey entityKey, Map<String, RawValue> fields, Instant fetchedAt) {
        this.sourceId = sourceId;
        this.entityKey = entityKey;
        this.fields = Collections.unmodifiableMap(new TreeMap<>(fields));
        this.fetchedAt = fetchedAt;
    }

    public String getSourceId() {
        return sourceId;
    }

    public RawEntityKey getEntityKey() {
        return entityKey;
    }

    public Map<String, RawValue> getFields() {
        return fields;
    }

    /**
     * Returns the raw value of a field, or a NULL raw value when the source did not report it.
     */
    public RawValue field(String name) {
        RawValue value = fields.get(name);
        return value != null ? value : RawValue.ofNull();
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    @Override
    public String toString() {
        return "RawRecord{" + sourceId + ", " + entityKey + ", " + fields.size() + " fields}";
    }
}
