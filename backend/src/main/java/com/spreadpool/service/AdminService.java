package com.spreadpool.service;

import com.spreadpool.model.*;
import com.spreadpool.repository.*;
import com.spreadpool.util.TeamNameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.*;

/**
 * Administrator corrections: placeholder resolution, deadline moves, prop results and pick
 * overrides. Every action is written to the admin audit table in the same transaction.
 */
@Service
public class AdminService {
    private static final Logger log = LoggerFactory.getLogger(AdminService.class);

    private final GameRepository gameRepository;
    private final WeekRepository weekRepository;
    private final PropBetRepository propBetRepository;
    private final PropPickRepository propPickRepository;
    private final PickRepository pickRepository;
    private final ParticipantRepository participantRepository;
    private final AdminAuditRepository adminAuditRepository;
    private final PropGradingService propGradingService;
    private final AtsScoringService atsScoringService;
    private final ClockService clockService;

    public AdminService(GameRepository gameRepository,
                        WeekRepository weekRepository,
                        PropBetRepository propBetRepository,
                        PropPickRepository propPickRepository,
                        PickRepository pickRepository,
                        ParticipantRepository participantRepository,
                        AdminAuditRepository adminAuditRepository,
                        PropGradingService propGradingService,
                        AtsScoringService atsScoringService,
                        ClockService clockService) {
        this.gameRepository = gameRepository;
        this.weekRepository = weekRepository;
        this.propBetRepository = propBetRepository;
        this.propPickRepository = propPickRepository;
        this.pickRepository = pickRepository;
        this.participantRepository = participantRepository;
        this.adminAuditRepository = adminAuditRepository;
        this.propGradingService = propGradingService;
        this.atsScoringService = atsScoringService;
        this.clockService = clockService;
    }

    /**
     * Replaces a game's placeholder teams with canonical codes and clears the unresolved flag.
     * When {@code favorite} and {@code spread} are both given the line is set as well.
     *
     * <p>Picks stored against the placeholders follow their side: a pick on the old home team
     * becomes a pick on the new home team, and likewise for away. Picks on a placeholder that
     * names both sides cannot be placed and are removed.</p>
     */
    @Transactional
    public Game resolvePlaceholder(Long gameId, String homeTeam, String awayTeam,
                                   String favorite, BigDecimal spread, String actor) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown game id: " + gameId));
        String home = canonical(homeTeam);
        String away = canonical(awayTeam);
        if (home.equals(away)) throw new IllegalArgumentException("A team cannot play itself: " + home);
        String oldHome = game.getHomeTeam();
        String oldAway = game.getAwayTeam();
        game.setHomeTeam(home);
        game.setAwayTeam(away);
        game.setUnresolvedTeam(false);
        if (favorite != null && spread != null) {
            String fav = canonical(favorite);
            if (!fav.equals(home) && !fav.equals(away)) {
                throw new IllegalArgumentException("Favorite " + fav + " is not playing in " + away + " @ " + home);
            }
            if (spread.signum() < 0) throw new IllegalArgumentException("Spread must be a non-negative magnitude");
            game.setFavoriteTeam(fav);
            game.setSpreadPts(spread.setScale(1, RoundingMode.HALF_UP));
        }
        boolean teamsChanged = !home.equals(oldHome) || !away.equals(oldAway);
        if (teamsChanged && game.getGradedAt() != null) {
            game.setGradedAt(null);
            Week week = game.getWeek();
            if (week.getPhase() == WeekPhase.GRADED) {
                week.setPhase(WeekPhase.COMPLETE);
                weekRepository.save(week);
            }
        }
        gameRepository.save(game);
        int remapped = remapPicks(game, oldHome, oldAway);
        String line = game.getSpreadPts() == null ? "no line"
                : game.getFavoriteTeam() + " -" + game.getSpreadPts().toPlainString();
        audit(AdminAction.RESOLVE_PLACEHOLDER, actor, AuditTarget.GAME, gameId,
                oldAway + " @ " + oldHome + " -> " + game.matchup() + ", " + line, remapped);
        log.info("Game {} resolved to {} by {} ({} picks moved)", game.getExternalId(), game.matchup(), actor, remapped);
        return game;
    }

    private int remapPicks(Game game, String oldHome, String oldAway) {
        boolean ambiguous = oldHome.equalsIgnoreCase(oldAway);
        int moved = 0;
        for (Pick pick : pickRepository.findByGameId(game.getId())) {
            String selected = pick.getSelectedTeam();
            if (game.involves(selected)) continue;
            if (ambiguous) {
                log.warn("Removing pick {} on {}: '{}' names both sides", pick.getId(), game.getExternalId(), selected);
                pickRepository.delete(pick);
            } else if (selected.equalsIgnoreCase(oldHome)) {
                pick.setSelectedTeam(game.getHomeTeam());
                pick.setResult(null);
                pickRepository.save(pick);
            } else if (selected.equalsIgnoreCase(oldAway)) {
                pick.setSelectedTeam(game.getAwayTeam());
                pick.setResult(null);
                pickRepository.save(pick);
            } else {
                throw new DataIntegrityException(game.getExternalId(),
                        "Pick " + pick.getId() + " selects " + selected + ", which is neither " + oldHome + " nor " + oldAway);
            }
            moved++;
        }
        return moved;
    }

    @Transactional
    public Week adjustDeadline(int seasonYear, int weekNumber, Instant deadline, String actor) {
        if (deadline == null) throw new IllegalArgumentException("deadline is required");
        Week week = weekRepository.findBySeasonYearAndWeekNumber(seasonYear, weekNumber)
                .orElseThrow(() -> new IllegalArgumentException("Unknown week " + seasonYear + "-W" + weekNumber));
        Instant previous = week.getPicksDeadline();
        week.setPicksDeadline(deadline);
        weekRepository.save(week);
        audit(AdminAction.ADJUST_DEADLINE, actor, AuditTarget.WEEK, week.getId(),
                week.label() + ": " + previous + " -> " + deadline, 1);
        log.info("Deadline of {} moved from {} to {} by {}", week.label(), previous, deadline, actor);
        return week;
    }

    /**
     * Declares results for the given props and grades their picks. Props absent from the mapping
     * are not touched; their picks stay as they are.
     *
     * @return number of prop picks graded
     */
    @Transactional
    public int gradeProps(Map<Long, PropOutcome> results, String actor) {
        if (results == null || results.isEmpty()) return 0;
        Instant now = clockService.nowUtc();
        for (Map.Entry<Long, PropOutcome> e : new TreeMap<>(results).entrySet()) {
            PropBet bet = propBetRepository.findById(e.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown prop id: " + e.getKey()));
            if (e.getValue() == null || !bet.getDomain().contains(e.getValue())) {
                throw new IllegalArgumentException("Result " + e.getValue() + " is outside " + bet.getDomain() + " for prop " + bet.getId());
            }
            bet.setResult(e.getValue());
            bet.setGradedAt(now);
            propBetRepository.save(bet);
        }
        List<PropPick> picks = propPickRepository.findByPropBetIds(results.keySet());
        Map<PropPick, PropGrade> grades = propGradingService.gradeAll(picks, results);
        Map<Long, Integer> perProp = new TreeMap<>();
        grades.forEach((pick, grade) -> {
            pick.setGrade(grade);
            propPickRepository.save(pick);
            perProp.merge(pick.getPropBet().getId(), 1, Integer::sum);
        });
        new TreeMap<>(results).forEach((propId, outcome) ->
                audit(AdminAction.GRADE_PROP, actor, AuditTarget.PROP_BET, propId,
                        "result " + outcome, perProp.getOrDefault(propId, 0)));
        log.info("Graded {} props ({} picks) by {}", results.size(), grades.size(), actor);
        return grades.size();
    }

    /** Stores or replaces a pick regardless of the deadline; the pick is flagged as overridden. */
    @Transactional
    public Pick overridePick(String participantExternalId, Long gameId, String team, String actor) {
        Participant participant = participantRepository.findByExternalId(participantExternalId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown participant: " + participantExternalId));
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown game id: " + gameId));
        if (game.isUnresolvedTeam()) {
            throw new IllegalArgumentException("Resolve the placeholder teams of " + game.getExternalId() + " before overriding picks");
        }
        String selected = PickService.resolveSelection(game, team)
                .orElseThrow(() -> new IllegalArgumentException(team + " is not playing in " + game.matchup()));
        Pick pick = pickRepository.findByParticipant_IdAndGame_Id(participant.getId(), gameId)
                .orElseGet(() -> new Pick(participant, game, selected, clockService.nowUtc()));
        pick.setSelectedTeam(selected);
        pick.setOverridden(true);
        AtsOutcome outcome = atsScoringService.score(game, selected);
        pick.setResult(outcome.isDecided() ? outcome : null);
        Pick saved = pickRepository.save(pick);
        audit(AdminAction.OVERRIDE_PICK, actor, AuditTarget.PICK, saved.getId(),
                participant.getExternalId() + " -> " + selected + " in " + game.matchup(), 1);
        log.info("Pick override: {} -> {} in {} by {}", participantExternalId, selected, game.matchup(), actor);
        return saved;
    }

    private static String canonical(String raw) {
        return TeamNameNormalizer.toCode(raw)
                .orElseThrow(() -> new IllegalArgumentException("Not a known team: " + raw));
    }

    private void audit(AdminAction action, String actor, AuditTarget target, Long targetId, String detail, long affected) {
        String who = actor == null || actor.isBlank() ? "admin" : actor.trim();
        adminAuditRepository.save(new AdminAudit(action, who, target, targetId, detail, affected, clockService.nowUtc()));
    }
}
