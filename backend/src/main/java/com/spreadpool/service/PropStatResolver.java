package com.spreadpool.service;

import com.spreadpool.model.PropBet;
import com.spreadpool.model.PropDomain;
import com.spreadpool.model.PropOutcome;
import com.spreadpool.provider.GameSummary;
import com.spreadpool.util.TeamNameNormalizer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides a proposition from a game's box score by matching its description against the
 * known prop wordings. A numeric stat strictly above the line is the first option
 * (OVER or YES), strictly below is the second; a stat equal to the line, a player
 * missing from the box score, or an unknown wording leaves the prop undecided.
 */
@Component
public class PropStatResolver {

    private static final Pattern PLAYER = Pattern.compile("^([^(]+)\\s*\\([A-Z]{2,3}\\)");
    private static final Pattern LINE = Pattern.compile("(?:Line:\\s*|Over/Under\\s*|>\\s*|Under\\s*)(\\d+\\.?\\d*)");
    private static final Pattern ANY_NUMBER = Pattern.compile("(\\d+\\.\\d+|\\d+)");
    private static final Pattern TD_YARDS = Pattern.compile("(\\d+)\\s*Yd");

    public Optional<PropOutcome> resolve(PropBet prop, GameSummary game) {
        String desc = prop.getDescription();
        if (desc == null || game == null) return Optional.empty();
        PropDomain domain = prop.getDomain();
        Optional<String> player = playerName(desc);
        OptionalDouble line = line(desc);
        boolean hasLine = desc.contains("Line:");

        if (desc.contains("Rushing + Receiving Yards") && hasLine && player.isPresent() && line.isPresent()) {
            Optional<GameSummary.PlayerLine> p = game.player(player.get());
            if (p.isPresent()) {
                double total = p.get().stat("rushing", "YDS").orElse(0.0) + p.get().stat("receiving", "YDS").orElse(0.0);
                return compare(domain, total, line.getAsDouble());
            }
            return Optional.empty();
        }
        Optional<PropOutcome> playerStat = playerStat(desc, hasLine, player, line, game, domain);
        if (playerStat.isPresent()) return playerStat;

        if (desc.contains("Longest Field Goal")) {
            OptionalDouble fgLine = line.isPresent() ? line : number(desc);
            if (fgLine.isPresent()) return compare(domain, game.max("kicking", "LONG"), fgLine.getAsDouble());
        }
        if (desc.contains("Defense") && desc.contains("Sacks") && hasLine && line.isPresent()) {
            Optional<PropOutcome> sacks = teamSacks(desc, game, domain, line.getAsDouble());
            if (sacks.isPresent()) return sacks;
        }
        if (desc.contains("Defensive") && desc.contains("Special Teams") && desc.contains("TD")) {
            boolean found = game.scoringPlays().stream().anyMatch(p -> {
                String type = p.type().toLowerCase(Locale.ROOT);
                return type.contains("interception") || type.contains("fumble") || type.contains("punt") || type.contains("kick");
            });
            return fact(domain, found);
        }
        if (desc.contains("Anytime Touchdown") && player.isPresent()) {
            Optional<GameSummary.PlayerLine> p = game.player(player.get());
            if (p.isEmpty()) return Optional.empty();
            double tds = p.get().stat("rushing", "TD").orElse(0.0) + p.get().stat("receiving", "TD").orElse(0.0);
            return fact(domain, tds > 0);
        }
        if (desc.contains("Rushing TD") && desc.contains("Will he score") && player.isPresent()) {
            Optional<GameSummary.PlayerLine> p = game.player(player.get());
            if (p.isEmpty()) return Optional.empty();
            return fact(domain, p.get().stat("rushing", "TD").orElse(0.0) > 0);
        }
        if (desc.contains("First Score") && desc.contains("Touchdown") && !game.scoringPlays().isEmpty()) {
            return fact(domain, game.scoringPlays().get(0).isTouchdown());
        }
        if (desc.contains("Total Interceptions") && hasLine && line.isPresent()) {
            return compare(domain, game.sum(null, "passing", "INT"), line.getAsDouble());
        }
        if (desc.contains("Largest Lead") && hasLine && line.isPresent()) {
            int lead = game.scoringPlays().stream()
                    .mapToInt(p -> Math.abs(p.homeScore() - p.awayScore()))
                    .max().orElse(0);
            return compare(domain, lead, line.getAsDouble());
        }
        if (desc.contains("Shortest TD")) {
            OptionalDouble tdLine = line.isPresent() ? line : number(desc);
            OptionalDouble shortest = shortestTouchdown(game);
            if (tdLine.isPresent() && shortest.isPresent()) {
                if (domain == PropDomain.YES_NO) return fact(domain, shortest.getAsDouble() < tdLine.getAsDouble());
                return compare(domain, shortest.getAsDouble(), tdLine.getAsDouble());
            }
            return Optional.empty();
        }
        if (desc.contains("4th Down Conversions") && hasLine && line.isPresent()) {
            double made = game.teamStat(game.homeTeam(), "4th down efficiency")
                    + game.teamStat(game.awayTeam(), "4th down efficiency");
            return compare(domain, made, line.getAsDouble());
        }
        if (desc.contains("Overtime")) {
            return fact(domain, game.scoringPlays().stream().anyMatch(p -> p.period() > 4));
        }
        if (desc.contains("Total Made Field Goals") && hasLine && line.isPresent()) {
            return compare(domain, game.sum(null, "kicking", "FG"), line.getAsDouble());
        }
        if (desc.contains("Total Sacks") && desc.contains("Both Teams") && hasLine && line.isPresent()) {
            return compare(domain, game.sum(null, "passing", "SACKS"), line.getAsDouble());
        }
        if (desc.contains("Opening Kickoff") && desc.contains("Touchback") && !game.openingDrive().isEmpty()) {
            return fact(domain, game.openingDrive().get(0).text().toLowerCase(Locale.ROOT).contains("touchback"));
        }
        if (desc.contains("Final Play") && desc.toLowerCase(Locale.ROOT).contains("knee")) {
            List<GameSummary.DrivePlay> plays = game.closingDrive();
            for (int i = plays.size() - 1; i >= 0; i--) {
                String type = plays.get(i).type().toLowerCase(Locale.ROOT);
                if (type.contains("end") || type.contains("timeout")) continue;
                String text = plays.get(i).text().toLowerCase(Locale.ROOT);
                return fact(domain, text.contains("kneel") || text.contains("knee"));
            }
        }
        return Optional.empty();
    }

    private Optional<PropOutcome> playerStat(String desc, boolean hasLine, Optional<String> player,
                                             OptionalDouble line, GameSummary game, PropDomain domain) {
        if (player.isEmpty() || line.isEmpty()) return Optional.empty();
        String group;
        String label;
        if (desc.contains("Passing Yards") && hasLine) {
            group = "passing"; label = "YDS";
        } else if (desc.contains("Passing TDs") && hasLine) {
            group = "passing"; label = "TD";
        } else if (desc.contains("Rushing Yards") && hasLine && !desc.contains("Receiving")) {
            group = "rushing"; label = "YDS";
        } else if (desc.contains("Receiving Yards") && hasLine) {
            group = "receiving"; label = "YDS";
        } else if (desc.contains("Receptions") && hasLine) {
            group = "receiving"; label = "REC";
        } else if (desc.contains("Tackles") && hasLine) {
            group = "defensive"; label = "TOT";
        } else if (desc.contains("Longest Reception")) {
            group = "receiving"; label = "LONG";
        } else {
            return Optional.empty();
        }
        return game.player(player.get())
                .flatMap(p -> p.stat(group, label))
                .flatMap(v -> compare(domain, v, line.getAsDouble()));
    }

    // sacks by a defense are the sacks its opponent's passers took
    private Optional<PropOutcome> teamSacks(String desc, GameSummary game, PropDomain domain, double line) {
        String team = null;
        if (TeamNameNormalizer.mentions(desc, game.homeTeam())) team = game.homeTeam();
        else if (TeamNameNormalizer.mentions(desc, game.awayTeam())) team = game.awayTeam();
        if (team == null) return Optional.empty();
        String opponent = game.opponentOf(team).orElse(null);
        boolean passerFound = game.players().values().stream()
                .anyMatch(p -> opponent != null && opponent.equals(p.team()) && p.has("passing"));
        if (!passerFound) return Optional.empty();
        return compare(domain, game.sum(opponent, "passing", "SACKS"), line);
    }

    private static OptionalDouble shortestTouchdown(GameSummary game) {
        OptionalDouble shortest = OptionalDouble.empty();
        for (GameSummary.ScoringPlay play : game.scoringPlays()) {
            if (!play.isTouchdown()) continue;
            Matcher m = TD_YARDS.matcher(play.text());
            if (m.find()) {
                double yards = Double.parseDouble(m.group(1));
                if (shortest.isEmpty() || yards < shortest.getAsDouble()) shortest = OptionalDouble.of(yards);
            }
        }
        return shortest;
    }

    private static Optional<PropOutcome> compare(PropDomain domain, double value, double line) {
        if (value > line) return Optional.of(domain.getOptionA());
        if (value < line) return Optional.of(domain.getOptionB());
        return Optional.empty();
    }

    private static Optional<PropOutcome> fact(PropDomain domain, boolean happened) {
        if (domain != PropDomain.YES_NO) return Optional.empty();
        return Optional.of(happened ? PropOutcome.YES : PropOutcome.NO);
    }

    static Optional<String> playerName(String desc) {
        Matcher m = PLAYER.matcher(desc);
        return m.find() ? Optional.of(m.group(1).trim()) : Optional.empty();
    }

    static OptionalDouble line(String desc) {
        Matcher m = LINE.matcher(desc);
        return m.find() ? OptionalDouble.of(Double.parseDouble(m.group(1))) : OptionalDouble.empty();
    }

    private static OptionalDouble number(String desc) {
        Matcher m = ANY_NUMBER.matcher(desc);
        return m.find() ? OptionalDouble.of(Double.parseDouble(m.group(1))) : OptionalDouble.empty();
    }
}
