package com.hoopstats.domain.model;

import java.util.List;

/**
 * Filters for reading canonical records. Null members do not filter.
 *
 * @param season     required season
 * @param team       only this team
 * @param position   only this position
 * @param players    only these player names (normalized before matching)
 * @param minGames   minimum games played ({@code g})
 * @param minMinutes minimum minutes per game ({@code mp})
 * @param runId      read the snapshot written by this run instead of the latest versions
 */
public record CanonicalQuery(
    int season,
    Team team,
    Position position,
    List<String> players,
    Double minGames,
    Double minMinutes,
    String runId
) {

    public static CanonicalQuery season(int season) {
        return new CanonicalQuery(season, null, null, List.of(), null, null, null);
    }

    public CanonicalQuery withRunId(String snapshotRunId) {
        return new CanonicalQuery(season, team, position, players, minGames, minMinutes, snapshotRunId);
    }
}
