package com.spreadpool.provider;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Box score of one finished (or running) game as reported by the provider's summary endpoint.
 * Player keys are lower-cased display names; team keys are canonical codes.
 */
public record GameSummary(String eventId,
                          String homeTeam,
                          String awayTeam,
                          boolean completed,
                          Map<String, PlayerLine> players,
                          Map<String, Map<String, String>> teamStats,
                          List<ScoringPlay> scoringPlays,
                          List<DrivePlay> openingDrive,
                          List<DrivePlay> closingDrive) {

    // leading number of "312", "-4", "2-14" (sacks-yards), "3/4" (made/attempted)
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(-?\\d+(?:\\.\\d+)?)");

    public record PlayerLine(String name, String team, Map<String, Map<String, String>> groups) {

        public boolean has(String group) {
            return groups.containsKey(group);
        }

        public Optional<Double> stat(String group, String label) {
            Map<String, String> g = groups.get(group);
            return g == null ? Optional.empty() : leadingNumber(g.get(label));
        }
    }

    public record ScoringPlay(String type, String text, int period, int homeScore, int awayScore) {

        public boolean isTouchdown() {
            return type.toLowerCase(Locale.ROOT).contains("touchdown");
        }
    }

    public record DrivePlay(String type, String text) {}

    /** Exact name first, then the first player whose name contains or is contained in {@code name}. */
    public Optional<PlayerLine> player(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String key = name.trim().toLowerCase(Locale.ROOT);
        PlayerLine exact = players.get(key);
        if (exact != null) return Optional.of(exact);
        return players.entrySet().stream()
                .filter(e -> e.getKey().contains(key) || key.contains(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public Optional<String> opponentOf(String team) {
        if (team == null) return Optional.empty();
        if (team.equals(homeTeam)) return Optional.of(awayTeam);
        if (team.equals(awayTeam)) return Optional.of(homeTeam);
        return Optional.empty();
    }

    /** Sum of a stat over every player of {@code team} (all players when null) who has the group. */
    public double sum(String team, String group, String label) {
        double total = 0;
        for (PlayerLine p : players.values()) {
            if (team != null && !team.equals(p.team())) continue;
            total += p.stat(group, label).orElse(0.0);
        }
        return total;
    }

    public double max(String group, String label) {
        double best = 0;
        for (PlayerLine p : players.values()) {
            best = Math.max(best, p.stat(group, label).orElse(0.0));
        }
        return best;
    }

    /** Leading number of a team statistic such as "4th down efficiency" = "1-3"; 0 when absent. */
    public double teamStat(String team, String label) {
        Map<String, String> stats = teamStats.getOrDefault(team, Map.of());
        for (Map.Entry<String, String> e : stats.entrySet()) {
            if (e.getKey().equalsIgnoreCase(label)) {
                return leadingNumber(e.getValue()).orElse(0.0);
            }
        }
        return 0;
    }

    static Optional<Double> leadingNumber(String raw) {
        if (raw == null) return Optional.empty();
        Matcher m = LEADING_NUMBER.matcher(raw);
        return m.find() ? Optional.of(Double.parseDouble(m.group(1))) : Optional.empty();
    }
}
