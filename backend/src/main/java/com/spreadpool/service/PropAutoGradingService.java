package com.spreadpool.service;

import com.spreadpool.dto.PropAutoGradeReport;
import com.spreadpool.model.Game;
import com.spreadpool.model.PropBet;
import com.spreadpool.model.PropOutcome;
import com.spreadpool.model.Week;
import com.spreadpool.provider.GameSummary;
import com.spreadpool.provider.GameSummaryClient;
import com.spreadpool.provider.ProviderException;
import com.spreadpool.repository.GameRepository;
import com.spreadpool.repository.PropBetRepository;
import com.spreadpool.repository.WeekRepository;
import com.spreadpool.util.TeamNameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Settles a week's open propositions from the provider's box scores. A dry run only reports
 * what would be recorded; a commit hands the decided results to {@link AdminService#gradeProps}
 * and leaves the undecided props open for manual grading.
 */
@Service
public class PropAutoGradingService {
    private static final Logger log = LoggerFactory.getLogger(PropAutoGradingService.class);

    private final WeekRepository weekRepository;
    private final GameRepository gameRepository;
    private final PropBetRepository propBetRepository;
    private final GameSummaryClient summaryClient;
    private final PropStatResolver resolver;
    private final AdminService adminService;

    public PropAutoGradingService(WeekRepository weekRepository,
                                  GameRepository gameRepository,
                                  PropBetRepository propBetRepository,
                                  GameSummaryClient summaryClient,
                                  PropStatResolver resolver,
                                  AdminService adminService) {
        this.weekRepository = weekRepository;
        this.gameRepository = gameRepository;
        this.propBetRepository = propBetRepository;
        this.summaryClient = summaryClient;
        this.resolver = resolver;
        this.adminService = adminService;
    }

    /**
     * @throws IllegalArgumentException for an unknown week
     */
    public PropAutoGradeReport autoGrade(int season, int weekNumber, boolean commit, String actor) {
        Week week = weekRepository.findBySeasonYearAndWeekNumber(season, weekNumber)
                .orElseThrow(() -> new IllegalArgumentException("Unknown week: " + season + " week " + weekNumber));
        List<Game> games = gameRepository.findByWeek_IdOrderByKickoffAsc(week.getId());
        List<PropBet> open = propBetRepository.findByWeek_IdOrderByIdAsc(week.getId()).stream()
                .filter(p -> !p.isGraded())
                .collect(Collectors.toList());

        Map<Long, GameSummary> summaries = new HashMap<>();
        Map<Long, String> failures = new HashMap<>();
        Map<Long, PropOutcome> decided = new LinkedHashMap<>();
        List<PropAutoGradeReport.Entry> entries = new ArrayList<>();

        for (PropBet prop : open) {
            Optional<Game> match = gameFor(prop.getGameLabel(), games);
            if (match.isEmpty()) {
                entries.add(entry(prop, null, null, "no game matches label '" + prop.getGameLabel() + "'"));
                continue;
            }
            Game game = match.get();
            if (!game.getStatus().isComplete()) {
                entries.add(entry(prop, game, null, "game is " + game.getStatus()));
                continue;
            }
            GameSummary summary = summaries.get(game.getId());
            if (summary == null && !failures.containsKey(game.getId())) {
                try {
                    summary = summaryClient.fetchSummary(game.getExternalId());
                    summaries.put(game.getId(), summary);
                } catch (ProviderException ex) {
                    log.warn("Summary for game {} unavailable: {}", game.getExternalId(), ex.getMessage());
                    failures.put(game.getId(), ex.getMessage());
                }
            }
            if (summary == null) {
                entries.add(entry(prop, game, null, "summary unavailable: " + failures.get(game.getId())));
                continue;
            }
            if (!summary.completed()) {
                entries.add(entry(prop, game, null, "provider has not completed the game"));
                continue;
            }
            Optional<PropOutcome> outcome = resolver.resolve(prop, summary);
            if (outcome.isPresent()) {
                decided.put(prop.getId(), outcome.get());
                entries.add(entry(prop, game, outcome.get(), null));
            } else {
                entries.add(entry(prop, game, null, "undecided"));
            }
        }

        int picksGraded = 0;
        boolean committed = commit && !decided.isEmpty();
        if (committed) {
            picksGraded = adminService.gradeProps(decided, actor == null || actor.isBlank() ? "auto-grader" : actor);
        }
        log.info("Prop auto-grade {} week {}: {} open, {} decided, commit={}",
                season, weekNumber, open.size(), decided.size(), committed);
        return PropAutoGradeReport.of(season, weekNumber, committed, picksGraded, entries);
    }

    /**
     * Labels are a matchup ("DEN @ NE", "Broncos vs Patriots"), a single team, or a
     * conference name when the week has exactly one game for that conference. A blank
     * label matches a week's only game.
     */
    static Optional<Game> gameFor(String label, List<Game> games) {
        if (label == null || label.isBlank()) {
            return games.size() == 1 ? Optional.of(games.get(0)) : Optional.empty();
        }
        String trimmed = label.trim();
        String[] sides = trimmed.split("\\s*@\\s*|\\s+(?i:vs\\.?|at)\\s+");
        if (sides.length == 2) {
            Optional<String> a = TeamNameNormalizer.toCode(sides[0]);
            Optional<String> b = TeamNameNormalizer.toCode(sides[1]);
            if (a.isEmpty() || b.isEmpty()) return Optional.empty();
            return single(games, g -> g.involves(a.get()) && g.involves(b.get()));
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (upper.equals("AFC") || upper.equals("NFC")) {
            return single(games, g -> TeamNameNormalizer.conferenceOf(g.getHomeTeam()).map(upper::equals).orElse(false)
                    && TeamNameNormalizer.conferenceOf(g.getAwayTeam()).map(upper::equals).orElse(false));
        }
        Optional<String> team = TeamNameNormalizer.toCode(trimmed);
        if (team.isEmpty()) return Optional.empty();
        return single(games, g -> g.involves(team.get()));
    }

    private static Optional<Game> single(List<Game> games, Predicate<Game> test) {
        List<Game> hits = games.stream().filter(test).collect(Collectors.toList());
        return hits.size() == 1 ? Optional.of(hits.get(0)) : Optional.empty();
    }

    private static PropAutoGradeReport.Entry entry(PropBet prop, Game game, PropOutcome result, String note) {
        return new PropAutoGradeReport.Entry(prop.getId(), prop.getDescription(),
                game == null ? null : game.getExternalId(),
                result == null ? null : result.name(), note);
    }
}
