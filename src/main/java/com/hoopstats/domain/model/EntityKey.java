package com.hoopstats.domain.model;

/**
 * Canonical identity of a player-season, used to group records across sources.
 *
 * @param normalizedName folded player name, e.g. {@code LUKA_DONCIC}
 * @param team           resolved franchise
 * @param season         season end year, e.g. 2024 for 2023-24
 */
public record EntityKey(String normalizedName, Team team, int season) {

    /**
     * Stable string id, e.g. {@code 2024:LAL:LEBRON_JAMES}.
     */
    public String id() {
        return season + ":" + team.name() + ":" + normalizedName;
    }

    @Override
    public String toString() {
        return id();
    }
}
