package com.hoopstats.domain.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * NBA franchise codes used by canonical records.
 *
 * <p>Sources use historical or site-specific abbreviations (Basketball Reference writes
 * {@code BRK}, {@code CHO}, {@code PHO}); {@link #resolve(String)} folds them to one code.
 * {@link #TOT} is the combined line of a player who appeared for several teams in a season.</p>
 */
public enum Team {
    ATL("Atlanta Hawks"),
    BOS("Boston Celtics"),
    BKN("Brooklyn Nets", "BRK", "NJN"),
    CHA("Charlotte Hornets", "CHO", "CHH"),
    CHI("Chicago Bulls"),
    CLE("Cleveland Cavaliers"),
    DAL("Dallas Mavericks"),
    DEN("Denver Nuggets"),
    DET("Detroit Pistons"),
    GSW("Golden State Warriors", "GS"),
    HOU("Houston Rockets"),
    IND("Indiana Pacers"),
    LAC("Los Angeles Clippers"),
    LAL("Los Angeles Lakers"),
    MEM("Memphis Grizzlies"),
    MIA("Miami Heat"),
    MIL("Milwaukee Bucks"),
    MIN("Minnesota Timberwolves"),
    NOP("New Orleans Pelicans", "NOH", "NO"),
    NYK("New York Knicks", "NY"),
    OKC("Oklahoma City Thunder"),
    ORL("Orlando Magic"),
    PHI("Philadelphia 76ers"),
    PHX("Phoenix Suns", "PHO"),
    POR("Portland Trail Blazers"),
    SAC("Sacramento Kings"),
    SAS("San Antonio Spurs", "SA"),
    TOR("Toronto Raptors"),
    UTA("Utah Jazz", "UTAH"),
    WAS("Washington Wizards", "WSH"),
    TOT("Multiple teams", "2TM", "3TM", "4TM");

    private static final Map<String, Team> LOOKUP = new HashMap<>();

    static {
        for (Team team : values()) {
            LOOKUP.put(team.name(), team);
            for (String alias : team.aliases) {
                LOOKUP.put(alias, team);
            }
        }
    }

    private final String displayName;
    private final String[] aliases;

    Team(String displayName, String... aliases) {
        this.displayName = displayName;
        this.aliases = aliases;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a source-reported team code, case-insensitively, including known aliases.
     */
    public static Optional<Team> resolve(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(LOOKUP.get(code.trim().toUpperCase(Locale.ROOT)));
    }
}
