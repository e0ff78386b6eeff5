package com.hoopstats.application.reconcile;

import com.hoopstats.domain.model.RawEntityKey;
import com.hoopstats.domain.model.Team;

import java.util.Optional;

/**
 * Pure scoring of how likely two raw keys denote the same player-season.
 *
 * <p>The score is {@code 0.7 * nameScore + 0.3 * teamScore}, and 0 across seasons. A name score of
 * 1.0 means identical normalized names, {@value #ABBREVIATED_NAME_SCORE} means the same surname with
 * a first name that abbreviates the other ("S Curry" / "Stephen Curry").</p>
 */
public final class EntityMatchScorer {

    public static final double NAME_WEIGHT = 0.7;
    public static final double TEAM_WEIGHT = 0.3;
    public static final double ABBREVIATED_NAME_SCORE = 0.9;

    /** Minimum score for two keys to be treated as the same player, whatever the team. */
    public static final double SAME_PLAYER_THRESHOLD = NAME_WEIGHT * ABBREVIATED_NAME_SCORE;

    private EntityMatchScorer() {
    }

    public static double score(RawEntityKey a, RawEntityKey b) {
        if (a.season() != b.season()) {
            return 0.0;
        }
        double name = nameScore(NameNormalizer.normalize(a.name()), NameNormalizer.normalize(b.name()));
        Optional<Team> teamA = Team.resolve(a.team());
        Optional<Team> teamB = Team.resolve(b.team());
        double team = teamA.isPresent() && teamA.equals(teamB) ? 1.0 : 0.0;
        return NAME_WEIGHT * name + TEAM_WEIGHT * team;
    }

    public static boolean samePlayer(RawEntityKey a, RawEntityKey b) {
        return score(a, b) >= SAME_PLAYER_THRESHOLD;
    }

    /**
     * Compares two already normalized names.
     */
    public static double nameScore(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        String[] tokensA = a.split("_");
        String[] tokensB = b.split("_");
        if (tokensA.length < 2 || tokensB.length < 2) {
            return 0.0;
        }
        if (!tokensA[tokensA.length - 1].equals(tokensB[tokensB.length - 1])) {
            return 0.0;
        }
        String firstA = tokensA[0];
        String firstB = tokensB[0];
        if (firstA.equals(firstB)) {
            // same first and last name, differing middle names
            return ABBREVIATED_NAME_SCORE;
        }
        if (firstA.startsWith(firstB) || firstB.startsWith(firstA)) {
            return ABBREVIATED_NAME_SCORE;
        }
        return 0.0;
    }
}
