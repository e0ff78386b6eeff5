package com.hoopstats.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * What a collection run was asked to fetch.
 */
public class CollectionScope {

    /** Season end year, e.g. 2024 for 2023-24. */
    private int season;

    /** Player names to restrict the run to. Empty means the whole season. */
    private List<String> entities = new ArrayList<>();

    /** Source ids to use. Empty means every configured source. */
    private List<String> sources = new ArrayList<>();

    public CollectionScope() {
    }

    public CollectionScope(int season, List<String> entities, List<String> sources) {
        this.season = season;
        this.entities = entities != null ? new ArrayList<>(entities) : new ArrayList<>();
        this.sources = sources != null ? new ArrayList<>(sources) : new ArrayList<>();
    }

    public static CollectionScope season(int season) {
        return new CollectionScope(season, List.of(), List.of());
    }

    public int getSeason() {
        return season;
    }

    public void setSeason(int season) {
        this.season = season;
    }

    public List<String> getEntities() {
        return entities;
    }

    public void setEntities(List<String> entities) {
        this.entities = entities;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources;
    }

    @Override
    public String toString() {
        return "season=" + season
            + (entities == null || entities.isEmpty() ? "" : ", entities=" + entities)
            + (sources == null || sources.isEmpty() ? "" : ", sources=" + sources);
    }
}
