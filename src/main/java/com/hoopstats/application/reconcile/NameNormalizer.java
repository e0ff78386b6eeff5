package com.hoopstats.application.reconcile;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Folds player names into the form used by entity keys.
 */
public final class NameNormalizer {

    private static final Set<String> SUFFIXES = Set.of("JR", "SR", "II", "III", "IV", "V");

    private NameNormalizer() {
    }

    /**
     * Normalizes a player name.
     *
     * Rules:
     * 1. Remove accents (Dončić -> DONCIC)
     * 2. Convert to uppercase
     * 3. Drop apostrophes and periods (D'Angelo -> DANGELO, P.J. -> PJ)
     * 4. Replace remaining non-alphanumerics with underscore, collapsing runs
     * 5. Drop generational suffixes (Jr., Sr., II, III, IV, V)
     */
    public static String normalize(String name) {
        if (name == null || name.trim().isEmpty()) {
            return "";
        }

        String normalized = Normalizer.normalize(name, Normalizer.Form.NFD);
        normalized = normalized.replaceAll("\\p{M}", "");
        normalized = normalized.toUpperCase(Locale.ROOT);
        normalized = normalized.replaceAll("['’.]", "");
        normalized = normalized.replaceAll("[^A-Z0-9]+", "_");
        normalized = normalized.replaceAll("^_+|_+$", "");

        List<String> tokens = new ArrayList<>(Arrays.asList(normalized.split("_")));
        // keep at least one token so "V" alone stays a name
        while (tokens.size() > 1 && SUFFIXES.contains(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
        }
        return String.join("_", tokens);
    }
}
