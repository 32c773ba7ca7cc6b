package com.spreadpool.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.spreadpool.util.TeamNameNormalizer;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Reads the provider's game summary JSON: {@code header} for teams and status,
 * {@code boxscore.players} and {@code boxscore.teams} for statistics, {@code scoringPlays}
 * and {@code drives.previous}.
 */
@Component
public class GameSummaryParser {

    /**
     * @throws ProviderException permanent, when neither a header nor a box score is present
     */
    public GameSummary parse(String eventId, JsonNode root) {
        if (root == null || !root.isObject() || (!root.has("header") && !root.has("boxscore"))) {
            throw ProviderException.permanentFailure("Unrecognized summary payload for event " + eventId, null, null);
        }
        JsonNode comp = root.path("header").path("competitions").path(0);
        String home = null;
        String away = null;
        for (JsonNode c : comp.path("competitors")) {
            String code = team(c.path("team"));
            if ("home".equalsIgnoreCase(c.path("homeAway").asText())) home = code;
            else away = code;
        }
        JsonNode statusType = comp.path("status").path("type");
        boolean completed = statusType.path("completed").asBoolean(false)
                || "post".equalsIgnoreCase(statusType.path("state").asText());

        return new GameSummary(eventId, home, away, completed,
                players(root.path("boxscore").path("players")),
                teamStats(root.path("boxscore").path("teams")),
                scoringPlays(root.path("scoringPlays")),
                drivePlays(root.path("drives").path("previous"), true),
                drivePlays(root.path("drives").path("previous"), false));
    }

    private static Map<String, GameSummary.PlayerLine> players(JsonNode teams) {
        Map<String, String> teamOf = new LinkedHashMap<>();
        Map<String, Map<String, Map<String, String>>> groups = new LinkedHashMap<>();
        Map<String, String> displayNames = new HashMap<>();
        for (JsonNode teamNode : teams) {
            String team = team(teamNode.path("team"));
            for (JsonNode group : teamNode.path("statistics")) {
                String groupName = group.path("name").asText("");
                List<String> labels = new ArrayList<>();
                group.path("labels").forEach(l -> labels.add(l.asText()));
                for (JsonNode athlete : group.path("athletes")) {
                    String name = athlete.path("athlete").path("displayName").asText("");
                    if (name.isBlank()) continue;
                    String key = name.trim().toLowerCase(Locale.ROOT);
                    JsonNode stats = athlete.path("stats");
                    Map<String, String> values = new LinkedHashMap<>();
                    for (int i = 0; i < labels.size() && i < stats.size(); i++) {
                        values.put(labels.get(i), stats.get(i).asText());
                    }
                    displayNames.putIfAbsent(key, name.trim());
                    teamOf.putIfAbsent(key, team);
                    groups.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(groupName, values);
                }
            }
        }
        Map<String, GameSummary.PlayerLine> out = new LinkedHashMap<>();
        groups.forEach((key, g) -> out.put(key, new GameSummary.PlayerLine(displayNames.get(key), teamOf.get(key), g)));
        return out;
    }

    private static Map<String, Map<String, String>> teamStats(JsonNode teams) {
        Map<String, Map<String, String>> out = new LinkedHashMap<>();
        for (JsonNode teamNode : teams) {
            Map<String, String> stats = new LinkedHashMap<>();
            for (JsonNode stat : teamNode.path("statistics")) {
                stats.put(stat.path("label").asText(""), stat.path("displayValue").asText(""));
            }
            out.put(team(teamNode.path("team")), stats);
        }
        return out;
    }

    private static List<GameSummary.ScoringPlay> scoringPlays(JsonNode plays) {
        List<GameSummary.ScoringPlay> out = new ArrayList<>();
        for (JsonNode p : plays) {
            out.add(new GameSummary.ScoringPlay(
                    p.path("type").path("text").asText(""),
                    p.path("text").asText(""),
                    p.path("period").path("number").asInt(0),
                    p.path("homeScore").asInt(0),
                    p.path("awayScore").asInt(0)));
        }
        return out;
    }

    private static List<GameSummary.DrivePlay> drivePlays(JsonNode drives, boolean first) {
        if (!drives.isArray() || drives.size() == 0) return List.of();
        JsonNode drive = drives.get(first ? 0 : drives.size() - 1);
        List<GameSummary.DrivePlay> out = new ArrayList<>();
        for (JsonNode p : drive.path("plays")) {
            out.add(new GameSummary.DrivePlay(p.path("type").path("text").asText(""), p.path("text").asText("")));
        }
        return out;
    }

    private static String team(JsonNode team) {
        String abbrev = team.path("abbreviation").asText("");
        return TeamNameNormalizer.toCode(abbrev)
                .or(() -> TeamNameNormalizer.toCode(team.path("displayName").asText("")))
                .orElse(abbrev.toUpperCase(Locale.ROOT));
    }
}
