package com.spreadpool.service;

import com.spreadpool.model.*;
import com.spreadpool.provider.OddsRecord;
import com.spreadpool.provider.ScheduleRecord;
import com.spreadpool.provider.ScoreRecord;
import com.spreadpool.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Single-entity writes used by the sync jobs. Each public method runs in its own transaction,
 * so a job that fails halfway keeps every game it already committed and nothing half-written.
 */
@Service
public class WeekWriter {
    private static final Logger log = LoggerFactory.getLogger(WeekWriter.class);

    public enum ScoreChange { UNKNOWN_GAME, UNCHANGED, UPDATED, REOPENED }

    private final WeekRepository weekRepository;
    private final GameRepository gameRepository;
    private final PickRepository pickRepository;
    private final PropPickRepository propPickRepository;
    private final SyncIssueRepository syncIssueRepository;
    private final AtsScoringService atsScoringService;
    private final PropGradingService propGradingService;

    public WeekWriter(WeekRepository weekRepository,
                      GameRepository gameRepository,
                      PickRepository pickRepository,
                      PropPickRepository propPickRepository,
                      SyncIssueRepository syncIssueRepository,
                      AtsScoringService atsScoringService,
                      PropGradingService propGradingService) {
        this.weekRepository = weekRepository;
        this.gameRepository = gameRepository;
        this.pickRepository = pickRepository;
        this.propPickRepository = propPickRepository;
        this.syncIssueRepository = syncIssueRepository;
        this.atsScoringService = atsScoringService;
        this.propGradingService = propGradingService;
    }

    /**
     * Returns the week, creating it with {@code deadline} when absent. An existing week's deadline
     * is left alone; only an administrator moves it.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Week ensureWeek(int seasonYear, int weekNumber, Instant deadline) {
        return weekRepository.findBySeasonYearAndWeekNumber(seasonYear, weekNumber)
                .orElseGet(() -> {
                    if (deadline == null) {
                        throw new IllegalArgumentException("Cannot create week " + seasonYear + "-W" + weekNumber + " without a deadline");
                    }
                    Week created = weekRepository.saveAndFlush(new Week(seasonYear, weekNumber, deadline));
                    log.info("Created week {} with picks deadline {}", created.label(), deadline);
                    return created;
                });
    }

    /**
     * Inserts or updates one game by external id.
     *
     * @return true when a row was inserted or modified
     * @throws DataIntegrityException when the record lacks a kickoff or a team, or its external id
     *         already belongs to a game of another week
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean upsertGame(Long weekId, ScheduleRecord rec) {
        if (rec.kickoff() == null) {
            throw new DataIntegrityException(rec.externalId(), "Missing kickoff");
        }
        if (isBlank(rec.homeTeam()) || isBlank(rec.awayTeam())) {
            throw new DataIntegrityException(rec.externalId(), "Missing team name");
        }
        Week week = weekRepository.findById(weekId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown week id: " + weekId));
        Game game = gameRepository.findByExternalId(rec.externalId()).orElse(null);
        if (game == null) {
            game = new Game(week, rec.externalId(), rec.homeTeam(), rec.awayTeam(), rec.kickoff());
            game.setUnresolvedTeam(rec.unresolvedTeam());
            gameRepository.save(game);
            if (rec.unresolvedTeam()) {
                log.warn("Imported {} with unresolved team(s): {}", rec.externalId(), game.matchup());
            }
            return true;
        }
        if (!Objects.equals(game.getWeek().getId(), weekId)) {
            throw new DataIntegrityException(rec.externalId(),
                    "External id already belongs to week " + game.getWeek().label());
        }
        boolean changed = false;
        if (!rec.kickoff().equals(game.getKickoff())) {
            game.setKickoff(rec.kickoff());
            changed = true;
        }
        // a placeholder from the provider never undoes an administrator's resolution
        boolean keepTeams = rec.unresolvedTeam() && !game.isUnresolvedTeam();
        if (!keepTeams) {
            if (!rec.homeTeam().equals(game.getHomeTeam()) || !rec.awayTeam().equals(game.getAwayTeam())) {
                game.setHomeTeam(rec.homeTeam());
                game.setAwayTeam(rec.awayTeam());
                changed = true;
            }
            if (rec.unresolvedTeam() != game.isUnresolvedTeam()) {
                game.setUnresolvedTeam(rec.unresolvedTeam());
                changed = true;
            }
        }
        if (changed) {
            gameRepository.save(game);
        }
        return changed;
    }

    /**
     * Applies score and status to a game. Identical data and status regressions (a FINAL game
     * reported as anything else) write nothing. A changed score on a FINAL game clears that
     * game's grading and sends a graded week back to COMPLETE.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ScoreChange applyScore(ScoreRecord rec) {
        Game game = gameRepository.findByExternalId(rec.externalId()).orElse(null);
        if (game == null) {
            return ScoreChange.UNKNOWN_GAME;
        }
        GameStatus status = rec.status() == null ? GameStatus.SCHEDULED : rec.status();
        if (status == GameStatus.FINAL && !rec.hasScores()) {
            throw new DataIntegrityException(rec.externalId(), "Final status without both scores");
        }
        boolean wasFinal = game.getStatus() == GameStatus.FINAL;
        if (wasFinal && status != GameStatus.FINAL) {
            log.warn("Ignoring status regression for {}: FINAL -> {}", rec.externalId(), status);
            return ScoreChange.UNCHANGED;
        }
        Integer home = rec.hasScores() ? rec.homeScore() : game.getHomeScore();
        Integer away = rec.hasScores() ? rec.awayScore() : game.getAwayScore();
        boolean scoresChanged = !Objects.equals(home, game.getHomeScore()) || !Objects.equals(away, game.getAwayScore());
        if (!scoresChanged && status == game.getStatus()) {
            return ScoreChange.UNCHANGED;
        }
        game.setHomeScore(home);
        game.setAwayScore(away);
        game.setStatus(status);
        if (wasFinal && scoresChanged) {
            game.setGradedAt(null);
            gameRepository.save(game);
            pickRepository.clearResultsForGame(game.getId());
            Week week = game.getWeek();
            if (week.getPhase() == WeekPhase.GRADED) {
                week.setPhase(WeekPhase.COMPLETE);
                weekRepository.save(week);
            }
            log.warn("Score corrected on final game {} ({}): now {}-{}, grading reopened",
                    rec.externalId(), game.matchup(), home, away);
            return ScoreChange.REOPENED;
        }
        gameRepository.save(game);
        return ScoreChange.UPDATED;
    }

    /**
     * Attaches a line to a game that has not kicked off.
     *
     * @return true when the stored favorite or spread changed
     * @throws DataIntegrityException for an unreadable or negative spread, or a favorite that is
     *         not playing in the game
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean applyOdds(OddsRecord rec, Instant now) {
        Game game = gameRepository.findByExternalId(rec.externalId()).orElse(null);
        if (game == null) {
            return false;
        }
        if (!game.getKickoff().isAfter(now)) {
            log.debug("Line for {} ignored; game already kicked off", rec.externalId());
            return false;
        }
        BigDecimal spread = rec.spreadPts();
        if (spread == null) {
            throw new DataIntegrityException(rec.externalId(), "Malformed spread '" + rec.rawDetails() + "'");
        }
        if (spread.signum() < 0) {
            throw new DataIntegrityException(rec.externalId(), "Negative spread " + spread.toPlainString());
        }
        if (game.isUnresolvedTeam()) {
            log.debug("Line for {} held back; teams unresolved", rec.externalId());
            return false;
        }
        if (rec.favoriteTeam() == null || !game.involves(rec.favoriteTeam())) {
            throw new DataIntegrityException(rec.externalId(),
                    "Favorite '" + rec.favoriteTeam() + "' not in " + game.matchup());
        }
        String favorite = game.getHomeTeam().equalsIgnoreCase(rec.favoriteTeam()) ? game.getHomeTeam() : game.getAwayTeam();
        boolean sameSpread = game.getSpreadPts() != null && game.getSpreadPts().compareTo(spread) == 0;
        if (sameSpread && favorite.equals(game.getFavoriteTeam())) {
            return false;
        }
        game.setFavoriteTeam(favorite);
        game.setSpreadPts(spread);
        gameRepository.save(game);
        return true;
    }

    /** Moves the week forward to the phase its games imply. Never moves it backward. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WeekPhase advancePhase(Long weekId) {
        Week week = weekRepository.findById(weekId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown week id: " + weekId));
        long total = gameRepository.countByWeek_Id(weekId);
        if (total == 0) return week.getPhase();
        WeekPhase implied;
        if (gameRepository.countByWeek_IdAndStatusNot(weekId, GameStatus.FINAL) == 0) {
            implied = WeekPhase.COMPLETE;
        } else if (gameRepository.countByWeek_IdAndStatusNot(weekId, GameStatus.SCHEDULED) > 0) {
            implied = WeekPhase.IN_PROGRESS;
        } else if (gameRepository.countByWeek_IdAndSpreadPtsIsNull(weekId) == 0) {
            implied = WeekPhase.ODDS_LOADED;
        } else {
            implied = WeekPhase.IMPORTED;
        }
        if (implied.ordinal() > week.getPhase().ordinal()) {
            log.info("Week {} phase {} -> {}", week.label(), week.getPhase(), implied);
            week.setPhase(implied);
            weekRepository.save(week);
        }
        return week.getPhase();
    }

    /**
     * Stores the ATS result of every pick on the game.
     *
     * @return number of picks whose stored result changed; 0 when the game is not gradable yet
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int gradeGame(Long gameId, Instant now) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown game id: " + gameId));
        if (!atsScoringService.isGradable(game)) {
            return 0;
        }
        int changed = 0;
        for (Pick pick : pickRepository.findByGameIdWithParticipant(gameId)) {
            AtsOutcome outcome = atsScoringService.score(game, pick.getSelectedTeam());
            if (outcome != pick.getResult()) {
                pick.setResult(outcome);
                pickRepository.save(pick);
                changed++;
            }
        }
        game.setGradedAt(now);
        gameRepository.save(game);
        return changed;
    }

    /** Grades the week's prop picks against the results currently stored on their props. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int gradeProps(Long weekId) {
        int changed = 0;
        for (PropPick pick : propPickRepository.findByWeekId(weekId)) {
            PropGrade grade = propGradingService.grade(pick);
            if (grade != pick.getGrade()) {
                pick.setGrade(grade);
                propPickRepository.save(pick);
                changed++;
            }
        }
        return changed;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markGraded(Long weekId) {
        Week week = weekRepository.findById(weekId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown week id: " + weekId));
        week.setPhase(WeekPhase.GRADED);
        weekRepository.save(week);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordIssue(String jobName, String externalId, String reason, Instant now) {
        syncIssueRepository.save(new SyncIssue(jobName, externalId, reason, now));
    }

    @Transactional(readOnly = true)
    public List<Long> ungradedGameIds(Long weekId) {
        return gameRepository.findByWeek_IdOrderByKickoffAsc(weekId).stream()
                .filter(g -> g.getGradedAt() == null)
                .map(Game::getId)
                .toList();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
