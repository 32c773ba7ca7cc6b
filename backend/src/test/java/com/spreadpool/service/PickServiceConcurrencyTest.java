package com.spreadpool.service;

import com.spreadpool.config.PoolSettings;
import com.spreadpool.dto.PickResult;
import com.spreadpool.dto.RejectReason;
import com.spreadpool.model.Game;
import com.spreadpool.model.Week;
import com.spreadpool.repository.GameRepository;
import com.spreadpool.repository.PickRepository;
import com.spreadpool.repository.WeekRepository;
import com.spreadpool.support.MutableClock;
import com.spreadpool.support.Tables;
import com.spreadpool.support.TestClockConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({TestClockConfig.class, PoolSettings.class, ClockService.class, AtsScoringService.class, PickService.class})
class PickServiceConcurrencyTest {

    @Autowired private PickService pickService;
    @Autowired private MutableClock clock;
    @Autowired private WeekRepository weekRepository;
    @Autowired private GameRepository gameRepository;
    @Autowired private PickRepository pickRepository;
    @Autowired private JdbcTemplate jdbc;

    @AfterEach
    void cleanUp() {
        Tables.wipe(jdbc);
    }

    @Test
    void simultaneousSubmissionsStoreExactlyOnePick() throws Exception {
        Instant kickoff = Instant.parse("2025-09-07T17:00:00Z");
        Week week = weekRepository.save(new Week(2025, 1, kickoff));
        Long gameId = gameRepository.save(new Game(week, "401", "CLE", "PIT", kickoff)).getId();
        pickService.registerParticipant("alice", "Alice");

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PickResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String team = i % 2 == 0 ? "PIT" : "CLE";
                futures.add(pool.submit(() -> {
                    start.await();
                    return pickService.submitPick("alice", gameId, team);
                }));
            }
            start.countDown();
            int accepted = 0;
            for (Future<PickResult> f : futures) {
                PickResult r = f.get(30, TimeUnit.SECONDS);
                if (r.isAccepted()) {
                    accepted++;
                } else {
                    assertThat(r.getReason()).isEqualTo(RejectReason.DUPLICATE_PICK);
                }
            }
            assertThat(accepted).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(pickRepository.countByGame_Id(gameId)).isEqualTo(1);
    }

    @Test
    void submissionsStraddlingKickoffStoreOnlyTheEarlyOne() throws Exception {
        Instant kickoff = Instant.parse("2025-09-07T17:00:00Z");
        Week week = weekRepository.save(new Week(2025, 1, kickoff));
        Long gameId = gameRepository.save(new Game(week, "401", "CLE", "PIT", kickoff)).getId();
        pickService.registerParticipant("alice", "Alice");

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<PickResult> early = pool.submit(() -> submitAt(kickoff.minusMillis(1), start, gameId, "PIT"));
            Future<PickResult> late = pool.submit(() -> submitAt(kickoff, start, gameId, "CLE"));
            start.countDown();

            PickResult before = early.get(30, TimeUnit.SECONDS);
            PickResult after = late.get(30, TimeUnit.SECONDS);
            assertThat(before.isAccepted()).isTrue();
            assertThat(after.isAccepted()).isFalse();
            assertThat(after.getReason()).isEqualTo(RejectReason.DEADLINE_PASSED);
        } finally {
            pool.shutdownNow();
        }
        assertThat(pickRepository.countByGame_Id(gameId)).isEqualTo(1);
        assertThat(pickRepository.findAll()).singleElement()
                .satisfies(p -> assertThat(p.getSelectedTeam()).isEqualTo("PIT"));
    }

    private PickResult submitAt(Instant instant, CountDownLatch start, Long gameId, String team) throws InterruptedException {
        clock.pinForCurrentThread(instant);
        try {
            start.await();
            return pickService.submitPick("alice", gameId, team);
        } finally {
            clock.unpinCurrentThread();
        }
    }
}
