package com.spreadpool.service;

import com.spreadpool.config.PoolSettings;
import com.spreadpool.model.*;
import com.spreadpool.repository.*;
import com.spreadpool.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import({TestClockConfig.class, PoolSettings.class, ClockService.class, ReminderService.class})
class ReminderServiceTest {

    @Autowired private ReminderService reminderService;
    @Autowired private WeekRepository weekRepository;
    @Autowired private GameRepository gameRepository;
    @Autowired private ParticipantRepository participantRepository;
    @Autowired private PickRepository pickRepository;

    private Week week;
    private Participant alice;

    @BeforeEach
    void setUp() {
        week = weekRepository.save(new Week(2025, 1, Instant.parse("2025-09-05T00:20:00Z")));
        alice = participantRepository.save(new Participant("alice", "Alice"));
    }

    @Test
    void eachReminderIsClaimedOnce() {
        assertThat(reminderService.claimWeekReminder(alice.getId(), ReminderKind.DEADLINE, week.getId())).isTrue();
        assertThat(reminderService.claimWeekReminder(alice.getId(), ReminderKind.DEADLINE, week.getId())).isFalse();
        assertThat(reminderService.claimWeekReminder(alice.getId(), ReminderKind.RESULTS, week.getId())).isTrue();
        assertThat(reminderService.claimGameReminder(alice.getId(), ReminderKind.DEADLINE, week.getId())).isTrue();
    }

    @Test
    void claimsForUnknownParticipantsFail() {
        assertThat(reminderService.claimWeekReminder(987_654L, ReminderKind.WEEK_LAUNCH, week.getId())).isFalse();
    }

    @Test
    void participantsMissingAnOpenPickAreListed() {
        Participant bob = participantRepository.save(new Participant("bob", "Bob"));
        Participant carol = participantRepository.save(new Participant("carol", "Carol"));
        Game started = gameRepository.save(new Game(week, "401", "CLE", "PIT", TestClockConfig.START.minus(Duration.ofHours(1))));
        Game open = gameRepository.save(new Game(week, "402", "KC", "LAC", Instant.parse("2025-09-07T20:25:00Z")));
        pickRepository.save(new Pick(alice, open, "KC", TestClockConfig.START.minus(Duration.ofDays(1))));
        pickRepository.save(new Pick(carol, started, "PIT", TestClockConfig.START.minus(Duration.ofDays(1))));

        assertThat(reminderService.participantsMissingPicks(week.getId()))
                .extracting(Participant::getExternalId)
                .containsExactly("bob", "carol");
    }
}
