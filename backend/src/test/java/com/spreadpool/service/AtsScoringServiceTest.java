package com.spreadpool.service;

import com.spreadpool.model.AtsOutcome;
import com.spreadpool.model.Game;
import com.spreadpool.model.GameStatus;
import com.spreadpool.model.Week;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtsScoringServiceTest {

    private final AtsScoringService service = new AtsScoringService();

    private static Game finalGame(String favorite, String spread, int homeScore, int awayScore) {
        Week week = new Week(2025, 1, Instant.parse("2025-09-05T00:20:00Z"));
        Game g = new Game(week, "401", "PIT", "CLE", Instant.parse("2025-09-07T17:00:00Z"));
        g.setFavoriteTeam(favorite);
        g.setSpreadPts(spread == null ? null : new BigDecimal(spread));
        g.setHomeScore(homeScore);
        g.setAwayScore(awayScore);
        g.setStatus(GameStatus.FINAL);
        return g;
    }

    @Test
    void marginEqualToSpreadIsPushForEitherSide() {
        Game g = finalGame("PIT", "3.0", 24, 21);
        assertThat(service.score(g, "PIT")).isEqualTo(AtsOutcome.PUSH);
        assertThat(service.score(g, "CLE")).isEqualTo(AtsOutcome.PUSH);
    }

    @Test
    void favoriteCoversWhenMarginExceedsSpread() {
        Game g = finalGame("PIT", "3.5", 27, 20);
        assertThat(service.score(g, "PIT")).isEqualTo(AtsOutcome.WIN);
        assertThat(service.score(g, "CLE")).isEqualTo(AtsOutcome.LOSS);
    }

    @Test
    void underdogCoversWhenFavoriteWinsByLess() {
        Game g = finalGame("PIT", "3.5", 17, 16);
        assertThat(service.score(g, "PIT")).isEqualTo(AtsOutcome.LOSS);
        assertThat(service.score(g, "CLE")).isEqualTo(AtsOutcome.WIN);
    }

    @Test
    void underdogCoversOnOutrightUpset() {
        // away favorite loses outright
        Game g = finalGame("CLE", "6.5", 20, 13);
        assertThat(service.score(g, "CLE")).isEqualTo(AtsOutcome.LOSS);
        assertThat(service.score(g, "PIT")).isEqualTo(AtsOutcome.WIN);
    }

    @Test
    void pickEmUsesZeroMargin() {
        assertThat(service.score(finalGame("PIT", "0.0", 20, 20), "CLE")).isEqualTo(AtsOutcome.PUSH);
        assertThat(service.score(finalGame("PIT", "0.0", 21, 20), "PIT")).isEqualTo(AtsOutcome.WIN);
        assertThat(service.score(finalGame("PIT", "0", 20, 21), "PIT")).isEqualTo(AtsOutcome.LOSS);
    }

    @Test
    void swappingThePickFlipsWinAndLossButKeepsPush() {
        int[][] scores = {{30, 10}, {10, 30}, {24, 21}, {21, 24}, {17, 17}, {28, 27}};
        String[] spreads = {"0.0", "1.0", "2.5", "3.0", "7.0", "13.5"};
        for (String spread : spreads) {
            for (int[] s : scores) {
                Game g = finalGame("PIT", spread, s[0], s[1]);
                AtsOutcome fav = service.score(g, "PIT");
                AtsOutcome dog = service.score(g, "CLE");
                assertThat(fav).isNotEqualTo(AtsOutcome.UNDECIDED);
                assertThat(dog).isEqualTo(fav.flip());
            }
        }
    }

    @Test
    void missingSpreadIsUndecided() {
        assertThat(service.score(finalGame("PIT", null, 27, 20), "PIT")).isEqualTo(AtsOutcome.UNDECIDED);
        assertThat(service.score(finalGame(null, "3.0", 27, 20), "PIT")).isEqualTo(AtsOutcome.UNDECIDED);
    }

    @Test
    void unfinishedOrUnresolvedGamesAreUndecided() {
        Game inProgress = finalGame("PIT", "3.5", 27, 20);
        inProgress.setStatus(GameStatus.IN_PROGRESS);
        assertThat(service.score(inProgress, "PIT")).isEqualTo(AtsOutcome.UNDECIDED);

        Game noScores = finalGame("PIT", "3.5", 27, 20);
        noScores.setHomeScore(null);
        assertThat(service.score(noScores, "PIT")).isEqualTo(AtsOutcome.UNDECIDED);

        Game placeholder = finalGame("PIT", "3.5", 27, 20);
        placeholder.setUnresolvedTeam(true);
        assertThat(service.score(placeholder, "PIT")).isEqualTo(AtsOutcome.UNDECIDED);
    }

    @Test
    void negativeSpreadFailsFast() {
        Game g = finalGame("PIT", "-3.5", 27, 20);
        assertThatThrownBy(() -> service.score(g, "PIT"))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("Negative spread");
    }

    @Test
    void favoriteOutsideTheMatchupFailsFast() {
        Game g = finalGame("DAL", "3.5", 27, 20);
        assertThatThrownBy(() -> service.score(g, "PIT")).isInstanceOf(DataIntegrityException.class);
    }
}
