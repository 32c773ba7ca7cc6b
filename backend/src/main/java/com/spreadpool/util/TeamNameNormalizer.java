package com.spreadpool.util;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Maps provider team names, nicknames and abbreviations to canonical three-letter codes.
 * Conference placeholders used before playoff matchups are set never resolve.
 */
public class TeamNameNormalizer {

    private static final Map<String, String> LOOKUP = new HashMap<>();
    private static final Set<String> CODES = new TreeSet<>();
    private static final Map<String, List<String>> NAMES = new HashMap<>();
    private static final Set<String> PLACEHOLDERS = Set.of("nfc", "afc", "tbd", "tba", "home", "away");
    private static final Set<String> AFC = Set.of(
            "BUF", "MIA", "NE", "NYJ", "BAL", "CIN", "CLE", "PIT",
            "HOU", "IND", "JAX", "TEN", "DEN", "KC", "LV", "LAC");

    static {
        team("ARI", "Arizona Cardinals", "Cardinals", "ARZ");
        team("ATL", "Atlanta Falcons", "Falcons");
        team("BAL", "Baltimore Ravens", "Ravens");
        team("BUF", "Buffalo Bills", "Bills");
        team("CAR", "Carolina Panthers", "Panthers");
        team("CHI", "Chicago Bears", "Bears");
        team("CIN", "Cincinnati Bengals", "Bengals");
        team("CLE", "Cleveland Browns", "Browns");
        team("DAL", "Dallas Cowboys", "Cowboys");
        team("DEN", "Denver Broncos", "Broncos");
        team("DET", "Detroit Lions", "Lions");
        team("GB", "Green Bay Packers", "Packers", "GNB");
        team("HOU", "Houston Texans", "Texans");
        team("IND", "Indianapolis Colts", "Colts");
        team("JAX", "Jacksonville Jaguars", "Jaguars", "JAC");
        team("KC", "Kansas City Chiefs", "Chiefs", "KAN");
        team("LV", "Las Vegas Raiders", "Raiders", "LVR", "OAK");
        team("LAC", "Los Angeles Chargers", "Chargers");
        team("LAR", "Los Angeles Rams", "Rams", "LA");
        team("MIA", "Miami Dolphins", "Dolphins");
        team("MIN", "Minnesota Vikings", "Vikings");
        team("NE", "New England Patriots", "Patriots", "NWE");
        team("NO", "New Orleans Saints", "Saints", "NOR");
        team("NYG", "New York Giants", "Giants");
        team("NYJ", "New York Jets", "Jets");
        team("PHI", "Philadelphia Eagles", "Eagles");
        team("PIT", "Pittsburgh Steelers", "Steelers");
        team("SF", "San Francisco 49ers", "49ers", "SFO");
        team("SEA", "Seattle Seahawks", "Seahawks");
        team("TB", "Tampa Bay Buccaneers", "Buccaneers", "TAM");
        team("TEN", "Tennessee Titans", "Titans");
        team("WSH", "Washington Commanders", "Commanders", "WAS");
    }

    private static void team(String code, String fullName, String nickname, String... aliases) {
        CODES.add(code);
        NAMES.put(code, List.of(code, fullName, nickname));
        LOOKUP.put(normalize(code), code);
        LOOKUP.put(normalize(fullName), code);
        LOOKUP.put(normalize(nickname), code);
        for (String a : aliases) {
            LOOKUP.put(normalize(a), code);
        }
    }

    public static String normalize(String name) {
        if (name == null) return null;
        return name.trim()
                .replaceAll("\\s+", " ")
                .toLowerCase(Locale.ROOT);
    }

    /** Canonical code for a recognized name or abbreviation; empty for placeholders and unknowns. */
    public static Optional<String> toCode(String name) {
        String key = normalize(name);
        if (key == null || key.isEmpty() || PLACEHOLDERS.contains(key)) return Optional.empty();
        return Optional.ofNullable(LOOKUP.get(key));
    }

    public static boolean isPlaceholder(String name) {
        String key = normalize(name);
        return key != null && PLACEHOLDERS.contains(key);
    }

    public static boolean isCanonicalCode(String code) {
        return code != null && CODES.contains(code);
    }

    public static Set<String> codes() {
        return Collections.unmodifiableSet(CODES);
    }

    /** "AFC" or "NFC" for a canonical code, empty otherwise. */
    public static Optional<String> conferenceOf(String code) {
        if (!isCanonicalCode(code)) return Optional.empty();
        return Optional.of(AFC.contains(code) ? "AFC" : "NFC");
    }

    /** True when {@code text} names the team by code, full name or nickname as a whole word. */
    public static boolean mentions(String text, String code) {
        if (text == null || !isCanonicalCode(code)) return false;
        for (String name : NAMES.get(code)) {
            if (Pattern.compile("\\b" + Pattern.quote(name) + "\\b").matcher(text).find()) return true;
        }
        return false;
    }
}
