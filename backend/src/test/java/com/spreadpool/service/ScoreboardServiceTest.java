package com.spreadpool.service;

import com.spreadpool.dto.ScoreboardRow;
import com.spreadpool.dto.WeekResults;
import com.spreadpool.model.*;
import com.spreadpool.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import({ScoreboardService.class, AtsScoringService.class, PropGradingService.class})
class ScoreboardServiceTest {

    private static final Instant KICKOFF = Instant.parse("2025-09-07T17:00:00Z");

    @Autowired private ScoreboardService scoreboardService;
    @Autowired private WeekRepository weekRepository;
    @Autowired private GameRepository gameRepository;
    @Autowired private ParticipantRepository participantRepository;
    @Autowired private PickRepository pickRepository;
    @Autowired private PropBetRepository propBetRepository;
    @Autowired private PropPickRepository propPickRepository;

    private Week week;
    private Participant alice;
    private Participant bob;
    private Participant carol;

    @BeforeEach
    void setUp() {
        week = weekRepository.save(new Week(2025, 1, KICKOFF));
        alice = participantRepository.save(new Participant("alice", "Alice"));
        bob = participantRepository.save(new Participant("bob", "Bob"));
        carol = participantRepository.save(new Participant("carol", "Carol"));
    }

    private Game finalGame(String id, String home, String away, String favorite, String spread, int hs, int as) {
        Game g = new Game(week, id, home, away, KICKOFF);
        g.setFavoriteTeam(favorite);
        g.setSpreadPts(new BigDecimal(spread));
        g.setHomeScore(hs);
        g.setAwayScore(as);
        g.setStatus(GameStatus.FINAL);
        return gameRepository.save(g);
    }

    private void pick(Participant p, Game g, String team) {
        pickRepository.save(new Pick(p, g, team, KICKOFF.minusSeconds(3600)));
    }

    @Test
    void standingsRankByWinsThenLossesThenId() {
        Game a = finalGame("401", "CLE", "PIT", "PIT", "3.5", 16, 17); // CLE covers
        Game b = finalGame("402", "KC", "LAC", "KC", "3.0", 27, 20);   // KC covers
        Game c = finalGame("403", "GB", "CHI", "GB", "3.0", 24, 21);   // push
        pick(alice, a, "PIT");
        pick(alice, b, "KC");
        pick(alice, c, "GB");
        pick(bob, a, "CLE");
        pick(bob, b, "KC");
        pick(carol, a, "CLE");
        pick(carol, b, "LAC");

        List<ScoreboardRow> rows = scoreboardService.getSeasonScoreboard(2025);

        assertThat(rows).extracting(ScoreboardRow::getParticipantId).containsExactly("bob", "alice", "carol");
        assertThat(rows.get(0).getWins()).isEqualTo(2);
        assertThat(rows.get(1).getPushes()).isEqualTo(1);
        assertThat(rows.get(2).getLosses()).isEqualTo(1);
    }

    @Test
    void correctedScoreShowsUpWithoutRegrading() {
        Game a = finalGame("401", "CLE", "PIT", "PIT", "3.5", 16, 17);
        pick(alice, a, "PIT");
        assertThat(scoreboardService.getSeasonScoreboard(2025).get(0).getLosses()).isEqualTo(1);

        a.setAwayScore(21);
        gameRepository.saveAndFlush(a);

        ScoreboardRow row = scoreboardService.getSeasonScoreboard(2025).get(0);
        assertThat(row.getWins()).isEqualTo(1);
        assertThat(row.getLosses()).isZero();
    }

    @Test
    void weekWinnersShareTheTopWinCount() {
        Game b = finalGame("402", "KC", "LAC", "KC", "3.0", 27, 20);
        pick(alice, b, "KC");
        pick(bob, b, "KC");
        pick(carol, b, "LAC");
        PropBet prop = propBetRepository.save(new PropBet(week, "KC@LAC", "Total over 44.5", PropDomain.OVER_UNDER));
        prop.setResult(PropOutcome.OVER);
        propBetRepository.save(prop);
        propPickRepository.save(new PropPick(carol, prop, PropOutcome.OVER, KICKOFF.minusSeconds(60)));
        week.setPhase(WeekPhase.COMPLETE);
        weekRepository.save(week);

        WeekResults results = scoreboardService.getWeekResults(2025, 1);

        assertThat(results.isComplete()).isTrue();
        assertThat(results.getWinners()).containsExactly("alice", "bob");
        assertThat(results.getRows()).filteredOn(r -> r.getParticipantId().equals("carol"))
                .singleElement().extracting(ScoreboardRow::getPropWins).isEqualTo(1);
    }

    @Test
    void noWinnersUntilSomethingIsDecided() {
        Game open = new Game(week, "404", "NE", "MIA", KICKOFF);
        gameRepository.save(open);
        pick(alice, open, "NE");

        WeekResults results = scoreboardService.getWeekResults(2025, 1);

        assertThat(results.isComplete()).isFalse();
        assertThat(results.getWinners()).isEmpty();
        assertThat(results.getRows()).hasSize(1);
        assertThatThrownBy(() -> scoreboardService.getWeekResults(2025, 9)).isInstanceOf(IllegalArgumentException.class);
    }
}
