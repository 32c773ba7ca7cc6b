package com.spreadpool.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.spreadpool.model.GameStatus;
import com.spreadpool.service.ClockService;
import com.spreadpool.util.TeamNameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads ESPN-style scoreboard JSON ({@code events[].competitions[0]...}) and turns each
 * event into the canonical schedule, score and odds records.
 */
@Component
public class ScoreboardPayloadParser {
    private static final Logger log = LoggerFactory.getLogger(ScoreboardPayloadParser.class);

    // "PIT -5.5", "LAR -3", "Kansas City -2.5"
    private static final Pattern ODDS_DETAILS = Pattern.compile("^\\s*([A-Za-z][A-Za-z0-9 .'-]*?)\\s*([+-]?\\d+(?:\\.\\d+)?)\\s*$");
    private static final List<String> PICKEM_TOKENS = List.of("even", "pk", "pick", "pick'em", "pickem");

    private final ClockService clockService;

    public ScoreboardPayloadParser(ClockService clockService) {
        this.clockService = clockService;
    }

    /**
     * @throws ProviderException permanent, when the payload has no recognizable events structure
     */
    public List<ScoreboardEvent> parseEvents(JsonNode root) {
        if (root == null || !root.isObject() || !root.path("events").isArray()) {
            throw ProviderException.permanentFailure("Unrecognized scoreboard payload: no events array", null, null);
        }
        List<ScoreboardEvent> out = new ArrayList<>();
        for (JsonNode ev : root.path("events")) {
            ScoreboardEvent parsed = parseEvent(ev);
            if (parsed != null) out.add(parsed);
        }
        return out;
    }

    private ScoreboardEvent parseEvent(JsonNode ev) {
        JsonNode comp = ev.path("competitions").path(0);
        JsonNode home = null;
        JsonNode away = null;
        for (JsonNode c : comp.path("competitors")) {
            String side = text(c.path("homeAway"));
            if ("home".equalsIgnoreCase(side)) home = c;
            else if ("away".equalsIgnoreCase(side)) away = c;
        }
        String id = firstNonBlank(text(ev.path("id")), text(comp.path("id")));
        if (id == null || home == null || away == null) {
            log.warn("Skipping scoreboard event without id or both competitors: {}", text(ev.path("name")));
            return null;
        }
        JsonNode statusType = comp.path("status").path("type");
        if (statusType.isMissingNode()) statusType = ev.path("status").path("type");
        JsonNode completedNode = statusType.path("completed");
        return new ScoreboardEvent(
                id,
                firstNonBlank(text(comp.path("date")), text(ev.path("date"))),
                text(statusType.path("state")),
                completedNode.isBoolean() ? completedNode.asBoolean() : null,
                teamName(home),
                text(home.path("team").path("abbreviation")),
                text(home.path("score")),
                teamName(away),
                text(away.path("team").path("abbreviation")),
                text(away.path("score")),
                text(comp.path("odds").path(0).path("details")));
    }

    public ScheduleRecord toSchedule(ScoreboardEvent ev) {
        Optional<String> home = resolve(ev.homeName(), ev.homeAbbreviation());
        Optional<String> away = resolve(ev.awayName(), ev.awayAbbreviation());
        Instant kickoff = ev.date() == null ? null : clockService.coerceLegacy(ev.date(), ZoneOffset.UTC);
        return new ScheduleRecord(
                ev.id(),
                home.orElse(verbatim(ev.homeName(), ev.homeAbbreviation())),
                away.orElse(verbatim(ev.awayName(), ev.awayAbbreviation())),
                kickoff,
                toStatus(ev.state(), ev.completed()),
                home.isEmpty() || away.isEmpty());
    }

    public ScoreRecord toScore(ScoreboardEvent ev) {
        GameStatus status = toStatus(ev.state(), ev.completed());
        if (status == GameStatus.SCHEDULED) {
            // pre-game payloads report 0-0
            return new ScoreRecord(ev.id(), null, null, status);
        }
        return new ScoreRecord(ev.id(), parseScore(ev.homeScore()), parseScore(ev.awayScore()), status);
    }

    /** Empty when the event carries no line at all. */
    public Optional<OddsRecord> toOdds(ScoreboardEvent ev) {
        String details = ev.oddsDetails();
        if (details == null) return Optional.empty();
        String home = resolve(ev.homeName(), ev.homeAbbreviation()).orElse(verbatim(ev.homeName(), ev.homeAbbreviation()));
        if (PICKEM_TOKENS.contains(details.trim().toLowerCase(Locale.ROOT))) {
            return Optional.of(new OddsRecord(ev.id(), home, BigDecimal.ZERO.setScale(1), details));
        }
        Matcher m = ODDS_DETAILS.matcher(details);
        if (!m.matches()) {
            return Optional.of(new OddsRecord(ev.id(), null, null, details));
        }
        String favorite = favoriteSide(m.group(1).trim(), ev);
        BigDecimal spread = new BigDecimal(m.group(2)).abs();
        if (spread.scale() < 1) spread = spread.setScale(1);
        return Optional.of(new OddsRecord(ev.id(), favorite, spread, details));
    }

    private String favoriteSide(String token, ScoreboardEvent ev) {
        Optional<String> code = TeamNameNormalizer.toCode(token);
        Optional<String> home = resolve(ev.homeName(), ev.homeAbbreviation());
        Optional<String> away = resolve(ev.awayName(), ev.awayAbbreviation());
        if (code.isPresent()) {
            if (code.equals(home) || code.equals(away)) return code.get();
        }
        if (token.equalsIgnoreCase(ev.homeAbbreviation()) || token.equalsIgnoreCase(ev.homeName())) {
            return home.orElse(verbatim(ev.homeName(), ev.homeAbbreviation()));
        }
        if (token.equalsIgnoreCase(ev.awayAbbreviation()) || token.equalsIgnoreCase(ev.awayName())) {
            return away.orElse(verbatim(ev.awayName(), ev.awayAbbreviation()));
        }
        // city only, e.g. "Kansas City -2.5"
        boolean homeCity = startsWithWord(ev.homeName(), token);
        boolean awayCity = startsWithWord(ev.awayName(), token);
        if (homeCity != awayCity) {
            return homeCity
                    ? home.orElse(verbatim(ev.homeName(), ev.homeAbbreviation()))
                    : away.orElse(verbatim(ev.awayName(), ev.awayAbbreviation()));
        }
        return code.orElse(token);
    }

    static GameStatus toStatus(String state, Boolean completed) {
        String s = state == null ? "" : state.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "in":
                return GameStatus.IN_PROGRESS;
            case "post":
                // postponed and suspended games are "post" but not completed
                return Boolean.FALSE.equals(completed) ? GameStatus.SCHEDULED : GameStatus.FINAL;
            default:
                return GameStatus.SCHEDULED;
        }
    }

    private static Optional<String> resolve(String name, String abbreviation) {
        Optional<String> byName = TeamNameNormalizer.toCode(name);
        return byName.isPresent() ? byName : TeamNameNormalizer.toCode(abbreviation);
    }

    private static String verbatim(String name, String abbreviation) {
        String v = firstNonBlank(name, abbreviation);
        return v == null ? "TBD" : v.trim();
    }

    private static boolean startsWithWord(String name, String prefix) {
        if (name == null) return false;
        String n = TeamNameNormalizer.normalize(name);
        String p = TeamNameNormalizer.normalize(prefix);
        return n.startsWith(p + " ");
    }

    private static Integer parseScore(String raw) {
        if (raw == null) return null;
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static String teamName(JsonNode competitor) {
        JsonNode team = competitor.path("team");
        return firstNonBlank(text(team.path("displayName")), text(team.path("name")));
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        String v = node.asText("");
        return v.isBlank() ? null : v;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        if (b != null && !b.isBlank()) return b;
        return null;
    }
}
