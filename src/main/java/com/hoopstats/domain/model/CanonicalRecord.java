package com.hoopstats.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reconciled player-season line, one per {@link EntityKey} per committed run.
 *
 * <p>The reconciler fills the content; {@code runId}, {@code version} and {@code committedAt}
 * are stamped by the canonical store. A committed version is never edited in place.</p>
 */
public class CanonicalRecord {

    private static final ObjectMapper CANONICAL_JSON = JsonMapper.builder()
        .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .serializationInclusion(JsonInclude.Include.NON_NULL)
        .build();

    /** {@link EntityKey#id()}. */
    private String entityId;

    private String normalizedName;

    /** Player name as the selected source printed it. */
    private String displayName;

    private Team team;

    private int season;

    private Position position;

    /** Statistic name to reconciled value, sorted by name. */
    private Map<String, CanonicalField> fields = new TreeMap<>();

    /** Sources that contributed at least one field, sorted. */
    private List<String> sources = new ArrayList<>();

    private String runId;

    private Long version;

    private Instant committedAt;

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public void setNormalizedName(String normalizedName) {
        this.normalizedName = normalizedName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public Team getTeam() {
        return team;
    }

    public void setTeam(Team team) {
        this.team = team;
    }

    public int getSeason() {
        return season;
    }

    public void setSeason(int season) {
        this.season = season;
    }

    public Position getPosition() {
        return position;
    }

    public void setPosition(Position position) {
        this.position = position;
    }

    public Map<String, CanonicalField> getFields() {
        return fields;
    }

    public void setFields(Map<String, CanonicalField> fields) {
        this.fields = fields != null ? new TreeMap<>(fields) : new TreeMap<>();
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public Instant getCommittedAt() {
        return committedAt;
    }

    public void setCommittedAt(Instant committedAt) {
        this.committedAt = committedAt;
    }

    /**
     * Convenience accessor for a numeric field value, null when absent.
     */
    public Double number(String field) {
        CanonicalField f = fields.get(field);
        if (f == null || !(f.getValue() instanceof Number)) {
            return null;
        }
        return ((Number) f.getValue()).doubleValue();
    }

    /**
     * Copy without the commit stamps.
     */
    public CanonicalRecord content() {
        CanonicalRecord copy = new CanonicalRecord();
        copy.entityId = entityId;
        copy.normalizedName = normalizedName;
        copy.displayName = displayName;
        copy.team = team;
        copy.season = season;
        copy.position = position;
        copy.fields = new TreeMap<>(fields);
        copy.sources = new ArrayList<>(sources);
        return copy;
    }

    /**
     * Deterministic JSON of the content, keys sorted.
     */
    public String toCanonicalJson() {
        try {
            return CANONICAL_JSON.writeValueAsString(content());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize canonical record " + entityId, e);
        }
    }

    /**
     * SHA-256 of {@link #toCanonicalJson()}. Identical validated input yields identical fingerprints.
     */
    public String fingerprint() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(toCanonicalJson().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
