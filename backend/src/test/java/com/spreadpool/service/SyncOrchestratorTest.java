package com.spreadpool.service;

import com.spreadpool.anomaly.Anomaly;
import com.spreadpool.anomaly.AnomalyNotifier;
import com.spreadpool.config.PoolSettings;
import com.spreadpool.dto.JobErrorReason;
import com.spreadpool.dto.JobResult;
import com.spreadpool.model.*;
import com.spreadpool.provider.*;
import com.spreadpool.repository.*;
import com.spreadpool.support.FakeScoreboardClient;
import com.spreadpool.support.MutableClock;
import com.spreadpool.support.Tables;
import com.spreadpool.support.TestClockConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Runs the sync jobs against the real writer and H2. Writes happen in their own transactions,
 * so this test opts out of the per-test rollback and wipes the tables instead.
 */
@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({TestClockConfig.class, PoolSettings.class, ClockService.class, AtsScoringService.class,
        PropGradingService.class, WeekWriter.class, WeekCalendar.class, SyncOrchestrator.class,
        PickService.class, SyncOrchestratorTest.ProviderStub.class})
class SyncOrchestratorTest {

    @TestConfiguration
    static class ProviderStub {
        @Bean
        FakeScoreboardClient scoreboardClient() {
            return new FakeScoreboardClient();
        }
    }

    private static final Instant KICKOFF_1 = Instant.parse("2025-09-07T17:00:00Z");
    private static final Instant KICKOFF_2 = Instant.parse("2025-09-07T20:25:00Z");
    private static final Instant MONDAY = Instant.parse("2025-09-08T12:00:00Z");

    @MockBean private AnomalyNotifier notifier;

    @Autowired private SyncOrchestrator orchestrator;
    @Autowired private FakeScoreboardClient client;
    @Autowired private MutableClock clock;
    @Autowired private PickService pickService;
    @Autowired private WeekWriter writer;
    @Autowired private WeekCalendar calendar;
    @Autowired private ClockService clockService;
    @Autowired private PoolSettings settings;
    @Autowired private WeekRepository weekRepository;
    @Autowired private GameRepository gameRepository;
    @Autowired private PickRepository pickRepository;
    @Autowired private ParticipantRepository participantRepository;
    @Autowired private SyncIssueRepository syncIssueRepository;
    @Autowired private JdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        client.reset();
        clock.set(TestClockConfig.START);
        client.schedule(
                new ScheduleRecord("401", "CLE", "PIT", KICKOFF_1, GameStatus.SCHEDULED, false),
                new ScheduleRecord("402", "KC", "LAC", KICKOFF_2, GameStatus.SCHEDULED, false));
        client.odds(
                new OddsRecord("401", "PIT", new BigDecimal("3.5"), "PIT -3.5"),
                new OddsRecord("402", "KC", new BigDecimal("3.0"), "KC -3"));
    }

    @AfterEach
    void cleanUp() {
        Tables.wipe(jdbc);
    }

    private Week week1() {
        return weekRepository.findBySeasonYearAndWeekNumber(2025, 1).orElseThrow();
    }

    private Game game(String externalId) {
        return gameRepository.findByExternalId(externalId).orElseThrow();
    }

    private AtsOutcome resultOf(String participant, String externalId) {
        Long participantId = participantRepository.findByExternalId(participant).orElseThrow().getId();
        return pickRepository.findByParticipant_IdAndGame_Id(participantId, game(externalId).getId())
                .orElseThrow().getResult();
    }

    @Test
    void importingTheSameWeekTwiceChangesNothingTheSecondTime() {
        JobResult first = orchestrator.importUpcomingWeek();

        assertThat(first.isOk()).isTrue();
        assertThat(first.getChanged()).isEqualTo(3); // week + 2 games
        assertThat(first.getWeekNumber()).isEqualTo(1);
        assertThat(week1().getPicksDeadline()).isEqualTo(KICKOFF_1);
        assertThat(week1().getPhase()).isEqualTo(WeekPhase.IMPORTED);

        JobResult second = orchestrator.importUpcomingWeek();

        assertThat(second.isOk()).isTrue();
        assertThat(second.getChanged()).isZero();
        assertThat(gameRepository.count()).isEqualTo(2);
        assertThat(client.getRequested()).containsExactly(new WeekSelector(2025, 1), new WeekSelector(2025, 1));
        verifyNoInteractions(notifier);
    }

    @Test
    void rescheduledKickoffIsApplied() {
        orchestrator.importUpcomingWeek();
        client.schedule(
                new ScheduleRecord("401", "CLE", "PIT", KICKOFF_1.plus(Duration.ofHours(3)), GameStatus.SCHEDULED, false),
                new ScheduleRecord("402", "KC", "LAC", KICKOFF_2, GameStatus.SCHEDULED, false));

        JobResult r = orchestrator.importUpcomingWeek();

        assertThat(r.getChanged()).isEqualTo(1);
        assertThat(game("401").getKickoff()).isEqualTo(KICKOFF_1.plus(Duration.ofHours(3)));
    }

    @Test
    void emptyScheduleCreatesNoWeek() {
        client.schedule();

        JobResult r = orchestrator.importUpcomingWeek();

        assertThat(r.isOk()).isFalse();
        assertThat(r.getErrorReason()).isEqualTo(JobErrorReason.EMPTY_RESPONSE);
        assertThat(weekRepository.count()).isZero();
        verify(notifier, times(1)).notify(argThat(a -> a.getKind() == Anomaly.Kind.EMPTY_RESPONSE));
    }

    @Test
    void providerFailureIsReportedOnce() {
        client.failWith(ProviderException.exhausted(3, ProviderException.transientFailure("HTTP 503", 503, null)));

        JobResult r = orchestrator.importUpcomingWeek();

        assertThat(r.isOk()).isFalse();
        assertThat(r.getErrorReason()).isEqualTo(JobErrorReason.PROVIDER_TRANSIENT);
        assertThat(weekRepository.count()).isZero();
        verify(notifier, times(1)).notify(argThat(a -> a.getKind() == Anomaly.Kind.PROVIDER_FAILURE));
        verifyNoMoreInteractions(notifier);
    }

    @Test
    void permanentProviderFailureIsClassified() {
        client.failWith(ProviderException.permanentFailure("HTTP 404", 404, null));

        assertThat(orchestrator.importUpcomingWeek().getErrorReason()).isEqualTo(JobErrorReason.PROVIDER_PERMANENT);
    }

    @Test
    void oddsLoadOnlyOnTheImportDay() {
        orchestrator.importUpcomingWeek();

        JobResult tuesday = orchestrator.importOddsUpcoming();
        assertThat(tuesday.isOk()).isTrue();
        assertThat(tuesday.getChanged()).isEqualTo(2);
        assertThat(game("401").getFavoriteTeam()).isEqualTo("PIT");
        assertThat(game("401").getSpreadPts()).isEqualByComparingTo("3.5");
        assertThat(week1().getPhase()).isEqualTo(WeekPhase.ODDS_LOADED);

        clock.advance(Duration.ofDays(1));
        int callsBefore = client.getCalls();
        JobResult wednesday = orchestrator.importOddsUpcoming();
        assertThat(wednesday.isOk()).isTrue();
        assertThat(wednesday.getErrorReason()).isEqualTo(JobErrorReason.NOT_IMPORT_DAY);
        assertThat(client.getCalls()).isEqualTo(callsBefore);

        SyncOrchestrator anyDay = new SyncOrchestrator(client, writer, calendar, weekRepository, gameRepository,
                notifier, clockService, settings.withAllowAnyDayOddsImport(true));
        JobResult overridden = anyDay.importOddsUpcoming();
        assertThat(overridden.isOk()).isTrue();
        assertThat(overridden.getErrorReason()).isNull();
        assertThat(overridden.getChanged()).isZero();
        assertThat(client.getCalls()).isEqualTo(callsBefore + 1);
    }

    @Test
    void oddsBeforeTheWeekIsImportedAreSkipped() {
        JobResult r = orchestrator.importOddsUpcoming();

        assertThat(r.isOk()).isTrue();
        assertThat(r.getErrorReason()).isEqualTo(JobErrorReason.NO_ACTIVE_WEEK);
        assertThat(client.getCalls()).isZero();
    }

    @Test
    void badLineIsRecordedWhileTheRestOfTheBatchLands() {
        orchestrator.importUpcomingWeek();
        client.odds(
                new OddsRecord("401", "PIT", new BigDecimal("-3.5"), "PIT +-3.5"),
                new OddsRecord("402", "KC", new BigDecimal("3.0"), "KC -3"));

        JobResult r = orchestrator.importOddsUpcoming();

        assertThat(r.isOk()).isFalse();
        assertThat(r.getErrorReason()).isEqualTo(JobErrorReason.DATA_INTEGRITY);
        assertThat(r.getChanged()).isEqualTo(1);
        assertThat(r.getFailedRecords()).isEqualTo(1);
        assertThat(game("401").getSpreadPts()).isNull();
        assertThat(game("402").getSpreadPts()).isEqualByComparingTo("3.0");
        assertThat(syncIssueRepository.findAll()).singleElement()
                .satisfies(issue -> assertThat(issue.getExternalId()).isEqualTo("401"));
        assertThat(week1().getPhase()).isEqualTo(WeekPhase.IMPORTED);
        verify(notifier, times(1)).notify(argThat(a -> a.getKind() == Anomaly.Kind.DATA_INTEGRITY));
    }

    @Test
    void placeholderTeamsImportButRaiseOneNotice() {
        client.schedule(
                new ScheduleRecord("401", "CLE", "PIT", KICKOFF_1, GameStatus.SCHEDULED, false),
                new ScheduleRecord("501", "NFC", "AFC", KICKOFF_2, GameStatus.SCHEDULED, true));

        JobResult r = orchestrator.importUpcomingWeek();

        assertThat(r.isOk()).isTrue();
        assertThat(game("501").isUnresolvedTeam()).isTrue();
        verify(notifier, times(1)).notify(argThat(a -> a.getKind() == Anomaly.Kind.UNRESOLVED_TEAM));
    }

    @Test
    void scoresGradingAndCorrectionsFlowThroughTheWeek() {
        orchestrator.importUpcomingWeek();
        orchestrator.importOddsUpcoming();
        pickService.registerParticipant("alice", "Alice");
        pickService.registerParticipant("bob", "Bob");
        assertThat(pickService.submitPick("alice", game("401").getId(), "PIT").isAccepted()).isTrue();
        assertThat(pickService.submitPick("alice", game("402").getId(), "KC").isAccepted()).isTrue();
        assertThat(pickService.submitPick("bob", game("401").getId(), "CLE").isAccepted()).isTrue();
        assertThat(pickService.submitPick("bob", game("402").getId(), "LAC").isAccepted()).isTrue();

        // nothing has kicked off: no provider call
        int calls = client.getCalls();
        assertThat(orchestrator.syncScoresActiveWeek().getChanged()).isZero();
        assertThat(client.getCalls()).isEqualTo(calls);

        clock.set(MONDAY);
        client.scores(
                new ScoreRecord("401", 16, 17, GameStatus.FINAL),
                new ScoreRecord("402", 27, 20, GameStatus.FINAL));
        JobResult sync = orchestrator.syncScoresActiveWeek();
        assertThat(sync.isOk()).isTrue();
        assertThat(sync.getChanged()).isEqualTo(2);
        assertThat(week1().getPhase()).isEqualTo(WeekPhase.COMPLETE);

        JobResult grade = orchestrator.gradeCompletedWeeks();
        assertThat(grade.isOk()).isTrue();
        assertThat(grade.getChanged()).isEqualTo(4);
        assertThat(week1().getPhase()).isEqualTo(WeekPhase.GRADED);
        assertThat(resultOf("alice", "401")).isEqualTo(AtsOutcome.LOSS);
        assertThat(resultOf("alice", "402")).isEqualTo(AtsOutcome.WIN);
        assertThat(resultOf("bob", "401")).isEqualTo(AtsOutcome.WIN);
        assertThat(resultOf("bob", "402")).isEqualTo(AtsOutcome.LOSS);

        // same payload again: no writes, no notification
        JobResult repeat = orchestrator.syncScoresActiveWeek();
        assertThat(repeat.isOk()).isTrue();
        assertThat(repeat.getChanged()).isZero();
        assertThat(week1().getPhase()).isEqualTo(WeekPhase.GRADED);
        verify(notifier, never()).notify(any());

        // late correction on a final game reopens grading for that game
        client.scores(
                new ScoreRecord("401", 16, 20, GameStatus.FINAL),
                new ScoreRecord("402", 27, 20, GameStatus.FINAL));
        JobResult corrected = orchestrator.syncScoresActiveWeek();
        assertThat(corrected.getChanged()).isEqualTo(1);
        assertThat(week1().getPhase()).isEqualTo(WeekPhase.COMPLETE);
        assertThat(game("401").getGradedAt()).isNull();
        assertThat(resultOf("alice", "401")).isNull();
        assertThat(resultOf("alice", "402")).isEqualTo(AtsOutcome.WIN);

        JobResult regrade = orchestrator.gradeCompletedWeeks();
        assertThat(regrade.getChanged()).isEqualTo(2);
        assertThat(week1().getPhase()).isEqualTo(WeekPhase.GRADED);
        assertThat(resultOf("alice", "401")).isEqualTo(AtsOutcome.WIN);
        assertThat(resultOf("bob", "401")).isEqualTo(AtsOutcome.LOSS);
    }

    @Test
    void finalStatusNeverRegresses() {
        orchestrator.importUpcomingWeek();
        clock.set(MONDAY);
        client.scores(new ScoreRecord("401", 16, 17, GameStatus.FINAL));
        orchestrator.syncScoresActiveWeek();

        client.scores(new ScoreRecord("401", 16, 17, GameStatus.IN_PROGRESS));
        JobResult r = orchestrator.syncScoresActiveWeek();

        assertThat(r.getChanged()).isZero();
        assertThat(game("401").getStatus()).isEqualTo(GameStatus.FINAL);
    }

    @Test
    void weekWithoutLinesStaysUngraded() {
        orchestrator.importUpcomingWeek();
        clock.set(MONDAY);
        client.scores(
                new ScoreRecord("401", 16, 17, GameStatus.FINAL),
                new ScoreRecord("402", 27, 20, GameStatus.FINAL));
        orchestrator.syncScoresActiveWeek();

        JobResult r = orchestrator.gradeCompletedWeeks();

        assertThat(r.isOk()).isTrue();
        assertThat(week1().getPhase()).isEqualTo(WeekPhase.COMPLETE);
        assertThat(game("401").getGradedAt()).isNull();
    }
}
