package com.spreadpool.service;

import com.spreadpool.anomaly.Anomaly;
import com.spreadpool.anomaly.AnomalyNotifier;
import com.spreadpool.config.PoolSettings;
import com.spreadpool.dto.JobErrorReason;
import com.spreadpool.dto.JobResult;
import com.spreadpool.model.Game;
import com.spreadpool.model.GameStatus;
import com.spreadpool.model.Week;
import com.spreadpool.model.WeekPhase;
import com.spreadpool.provider.*;
import com.spreadpool.repository.GameRepository;
import com.spreadpool.repository.WeekRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * The four sync jobs. Each call is one attempt: it reads the clock once, talks to the provider
 * at most once per fetch (retries live in the client), commits game by game through
 * {@link WeekWriter}, and raises at most one anomaly.
 *
 * <p>Nothing here checks the offseason flag or guards against overlapping runs; {@link JobRunner}
 * does both before calling in.</p>
 */
@Service
public class SyncOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    public static final String IMPORT_UPCOMING_WEEK = "import_upcoming_week";
    public static final String SYNC_SCORES_ACTIVE_WEEK = "sync_scores_active_week";
    public static final String IMPORT_ODDS_UPCOMING = "import_odds_upcoming";
    public static final String GRADE_COMPLETED_WEEKS = "grade_completed_weeks";

    private final ScoreboardClient client;
    private final WeekWriter writer;
    private final WeekCalendar calendar;
    private final WeekRepository weekRepository;
    private final GameRepository gameRepository;
    private final AnomalyNotifier notifier;
    private final ClockService clockService;
    private final PoolSettings settings;

    public SyncOrchestrator(ScoreboardClient client,
                            WeekWriter writer,
                            WeekCalendar calendar,
                            WeekRepository weekRepository,
                            GameRepository gameRepository,
                            AnomalyNotifier notifier,
                            ClockService clockService,
                            PoolSettings settings) {
        this.client = client;
        this.writer = writer;
        this.calendar = calendar;
        this.weekRepository = weekRepository;
        this.gameRepository = gameRepository;
        this.notifier = notifier;
        this.clockService = clockService;
        this.settings = settings;
    }

    public JobResult importUpcomingWeek() {
        Instant now = clockService.nowUtc();
        WeekSelector target = calendar.upcomingWeek(now);
        String job = IMPORT_UPCOMING_WEEK;
        try {
            List<ScheduleRecord> records = client.fetchSchedule(target);
            if (records.isEmpty()) {
                return empty(job, target, now, "Provider returned no games for " + target);
            }
            Instant deadline = records.stream()
                    .map(ScheduleRecord::kickoff)
                    .filter(Objects::nonNull)
                    .min(Comparator.naturalOrder())
                    .orElse(null);
            if (deadline == null) {
                return empty(job, target, now, "No game of " + target + " carries a kickoff");
            }
            int changed = 0;
            boolean created = calendar.find(target).isEmpty();
            Week week = ensureWeek(target, deadline);
            if (created) changed++;

            Batch batch = new Batch(job, now);
            for (ScheduleRecord rec : records) {
                checkCancelled(job);
                try {
                    if (writer.upsertGame(week.getId(), rec)) changed++;
                } catch (DataIntegrityException | DataIntegrityViolationException e) {
                    batch.fail(rec.externalId(), e);
                }
                if (rec.unresolvedTeam()) batch.unresolved.add(rec.externalId());
            }
            writer.advancePhase(week.getId());
            log.info("Imported {}: {} games fetched, {} rows changed, {} failed", target, records.size(), changed, batch.failed);
            return batch.finish(target, changed);
        } catch (ProviderException e) {
            return providerFailure(job, target, now, e);
        }
    }

    public JobResult syncScoresActiveWeek() {
        Instant now = clockService.nowUtc();
        String job = SYNC_SCORES_ACTIVE_WEEK;
        Optional<Week> active = calendar.activeWeek(now);
        if (active.isEmpty()) {
            return JobResult.skipped(job, JobErrorReason.NO_ACTIVE_WEEK, "No active week");
        }
        Week week = active.get();
        WeekSelector target = new WeekSelector(week.getSeasonYear(), week.getWeekNumber());
        // kicked off or already moving; a final game stays in the set so corrections are seen
        List<Game> games = gameRepository.findByWeek_IdOrderByKickoffAsc(week.getId()).stream()
                .filter(g -> !g.getKickoff().isAfter(now) || g.getStatus() != GameStatus.SCHEDULED)
                .collect(Collectors.toList());
        if (games.isEmpty()) {
            return JobResult.ok(job, 0).forWeek(target.seasonYear(), target.weekNumber());
        }
        Set<String> ids = games.stream().map(Game::getExternalId).collect(Collectors.toCollection(LinkedHashSet::new));
        try {
            List<ScoreRecord> scores = client.fetchScores(target, ids);
            if (scores.isEmpty()) {
                return empty(job, target, now, "Provider returned no scores for " + ids.size() + " games of " + target);
            }
            Batch batch = new Batch(job, now);
            int changed = 0;
            int reopened = 0;
            for (ScoreRecord rec : scores) {
                checkCancelled(job);
                try {
                    WeekWriter.ScoreChange change = writer.applyScore(rec);
                    if (change == WeekWriter.ScoreChange.UPDATED) changed++;
                    if (change == WeekWriter.ScoreChange.REOPENED) {
                        changed++;
                        reopened++;
                    }
                } catch (DataIntegrityException | DataIntegrityViolationException e) {
                    batch.fail(rec.externalId(), e);
                }
            }
            if (changed > 0) {
                writer.advancePhase(week.getId());
            }
            log.info("Synced scores for {}: {} changed ({} reopened), {} failed", target, changed, reopened, batch.failed);
            return batch.finish(target, changed);
        } catch (ProviderException e) {
            return providerFailure(job, target, now, e);
        }
    }

    public JobResult importOddsUpcoming() {
        Instant now = clockService.nowUtc();
        String job = IMPORT_ODDS_UPCOMING;
        DayOfWeek today = clockService.appDayOfWeek(now);
        if (!settings.isAllowAnyDayOddsImport() && today != settings.getOddsImportDay()) {
            return JobResult.skipped(job, JobErrorReason.NOT_IMPORT_DAY,
                    "Odds import runs on " + settings.getOddsImportDay() + ", today is " + today);
        }
        WeekSelector target = calendar.upcomingWeek(now);
        Optional<Week> stored = calendar.find(target);
        if (stored.isEmpty()) {
            return JobResult.skipped(job, JobErrorReason.NO_ACTIVE_WEEK, "Week " + target + " not imported yet");
        }
        Week week = stored.get();
        try {
            List<OddsRecord> odds = client.fetchOdds(target);
            if (odds.isEmpty()) {
                return empty(job, target, now, "Provider returned no lines for " + target);
            }
            Batch batch = new Batch(job, now);
            int changed = 0;
            for (OddsRecord rec : odds) {
                checkCancelled(job);
                try {
                    if (writer.applyOdds(rec, now)) changed++;
                } catch (DataIntegrityException | DataIntegrityViolationException e) {
                    batch.fail(rec.externalId(), e);
                }
            }
            writer.advancePhase(week.getId());
            log.info("Imported odds for {}: {} games changed, {} failed", target, changed, batch.failed);
            return batch.finish(target, changed);
        } catch (ProviderException e) {
            return providerFailure(job, target, now, e);
        }
    }

    /**
     * Grades every week that is in progress or complete: stores ATS results of gradable games and
     * prop grades, and marks the week GRADED once all its games are graded. No provider calls.
     */
    public JobResult gradeCompletedWeeks() {
        Instant now = clockService.nowUtc();
        String job = GRADE_COMPLETED_WEEKS;
        Batch batch = new Batch(job, now);
        int changed = 0;
        int graded = 0;
        List<Week> weeks = weekRepository.findByPhaseInOrderBySeasonYearAscWeekNumberAsc(
                EnumSet.of(WeekPhase.IN_PROGRESS, WeekPhase.COMPLETE));
        for (Week week : weeks) {
            if (writer.advancePhase(week.getId()) != WeekPhase.COMPLETE) continue;
            for (Long gameId : writer.ungradedGameIds(week.getId())) {
                checkCancelled(job);
                try {
                    changed += writer.gradeGame(gameId, now);
                } catch (DataIntegrityException e) {
                    batch.fail(e.getExternalId(), e);
                }
            }
            changed += writer.gradeProps(week.getId());
            if (writer.ungradedGameIds(week.getId()).isEmpty()) {
                writer.markGraded(week.getId());
                graded++;
                log.info("Week {} graded", week.label());
            } else {
                log.warn("Week {} complete but has ungradable games (missing line or unresolved team)", week.label());
            }
        }
        if (graded > 0 || changed > 0) {
            log.info("Grading pass: {} weeks graded, {} results changed", graded, changed);
        }
        return batch.finish(null, changed);
    }

    private Week ensureWeek(WeekSelector target, Instant deadline) {
        try {
            return writer.ensureWeek(target.seasonYear(), target.weekNumber(), deadline);
        } catch (DataIntegrityViolationException race) {
            return calendar.find(target).orElseThrow(() -> race);
        }
    }

    private static void checkCancelled(String job) {
        if (Thread.currentThread().isInterrupted()) {
            throw new JobCancelledException(job + " cancelled", null);
        }
    }

    private JobResult empty(String job, WeekSelector target, Instant now, String message) {
        log.warn("{}: {}", job, message);
        notifier.notify(new Anomaly(Anomaly.Kind.EMPTY_RESPONSE, job, target.toString(), message, now));
        return JobResult.failed(job, 0, JobErrorReason.EMPTY_RESPONSE, message)
                .forWeek(target.seasonYear(), target.weekNumber());
    }

    private JobResult providerFailure(String job, WeekSelector target, Instant now, ProviderException e) {
        JobErrorReason reason = e.isExhaustedRetries() || e.isTransient()
                ? JobErrorReason.PROVIDER_TRANSIENT : JobErrorReason.PROVIDER_PERMANENT;
        notifier.notify(new Anomaly(Anomaly.Kind.PROVIDER_FAILURE, job, target.toString(), e.getMessage(), now));
        return JobResult.failed(job, 0, reason, e.getMessage())
                .forWeek(target.seasonYear(), target.weekNumber());
    }

    /** Per-attempt bookkeeping of record-level failures, reported as one anomaly at the end. */
    private final class Batch {
        final String job;
        final Instant now;
        final List<String> unresolved = new ArrayList<>();
        final List<String> failures = new ArrayList<>();
        int failed;

        Batch(String job, Instant now) {
            this.job = job;
            this.now = now;
        }

        void fail(String externalId, RuntimeException e) {
            failed++;
            String reason = e instanceof DataIntegrityViolationException
                    ? "Duplicate external id collision: " + ((DataIntegrityViolationException) e).getMostSpecificCause().getMessage()
                    : e.getMessage();
            log.warn("{}: record {} skipped: {}", job, externalId, reason);
            failures.add(externalId + ": " + reason);
            writer.recordIssue(job, externalId, reason, now);
        }

        JobResult finish(WeekSelector target, int changed) {
            String week = target == null ? null : target.toString();
            JobResult result;
            if (failed > 0) {
                String message = failed + " record(s) failed: " + String.join("; ", failures)
                        + (unresolved.isEmpty() ? "" : "; unresolved teams in " + unresolved);
                notifier.notify(new Anomaly(Anomaly.Kind.DATA_INTEGRITY, job, week, message, now));
                result = JobResult.failed(job, changed, JobErrorReason.DATA_INTEGRITY, message);
            } else {
                if (!unresolved.isEmpty()) {
                    notifier.notify(new Anomaly(Anomaly.Kind.UNRESOLVED_TEAM, job, week,
                            "Placeholder teams awaiting resolution: " + unresolved, now));
                }
                result = JobResult.ok(job, changed);
            }
            result.withFailedRecords(failed);
            return target == null ? result : result.forWeek(target.seasonYear(), target.weekNumber());
        }
    }
}
