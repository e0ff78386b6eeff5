package com.hoopstats.application.reconcile;

import com.hoopstats.domain.model.RawEntityKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EntityMatchScorer.
 */
class EntityMatchScorerTest {

    @Test
    void testIdenticalNameAndTeam() {
        assertEquals(1.0, EntityMatchScorer.score(
            new RawEntityKey("Luka Dončić", "DAL", 2024),
            new RawEntityKey("Luka Doncic", "DAL", 2024)), 1e-9);
    }

    @Test
    void testTeamAliasCountsAsSameTeam() {
        assertEquals(1.0, EntityMatchScorer.score(
            new RawEntityKey("Kevin Durant", "PHO", 2024),
            new RawEntityKey("Kevin Durant", "PHX", 2024)), 1e-9);
    }

    @Test
    void testSameNameOtherTeamIsStillSamePlayer() {
        RawEntityKey a = new RawEntityKey("Dennis Schroder", "TOR", 2024);
        RawEntityKey b = new RawEntityKey("Dennis Schroder", "BRK", 2024);
        assertEquals(0.7, EntityMatchScorer.score(a, b), 1e-9);
        assertTrue(EntityMatchScorer.samePlayer(a, b));
    }

    @Test
    void testAbbreviatedFirstName() {
        assertEquals(EntityMatchScorer.ABBREVIATED_NAME_SCORE,
            EntityMatchScorer.nameScore("S_CURRY", "STEPHEN_CURRY"), 1e-9);
        assertTrue(EntityMatchScorer.samePlayer(
            new RawEntityKey("S. Curry", "GSW", 2024),
            new RawEntityKey("Stephen Curry", "GSW", 2024)));
    }

    @Test
    void testDifferentPlayers() {
        assertEquals(0.0, EntityMatchScorer.nameScore("SETH_CURRY", "STEPHEN_CURRY"), 1e-9);
        assertFalse(EntityMatchScorer.samePlayer(
            new RawEntityKey("Seth Curry", "GSW", 2024),
            new RawEntityKey("Stephen Curry", "GSW", 2024)));
    }

    @Test
    void testDifferentSeasonsNeverMatch() {
        assertEquals(0.0, EntityMatchScorer.score(
            new RawEntityKey("LeBron James", "LAL", 2023),
            new RawEntityKey("LeBron James", "LAL", 2024)), 1e-9);
    }
}
