package com.spreadpool.service;

import com.spreadpool.model.AtsOutcome;
import com.spreadpool.model.Game;
import com.spreadpool.model.GameStatus;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Against-the-spread scoring. Stateless; reads the game as stored and never writes.
 */
@Service
public class AtsScoringService {

    /**
     * Outcome of picking {@code selectedTeam} in {@code game}.
     *
     * @return WIN, LOSS or PUSH for a final game with scores, favorite and spread;
     *         UNDECIDED when any of those is missing or a team is still an unresolved placeholder
     * @throws DataIntegrityException when the stored spread is negative or the favorite/selection
     *         is not one of the two teams
     */
    public AtsOutcome score(Game game, String selectedTeam) {
        if (game == null) throw new IllegalArgumentException("game is required");
        if (!isGradable(game)) {
            return AtsOutcome.UNDECIDED;
        }
        BigDecimal spread = game.getSpreadPts();
        String favorite = game.getFavoriteTeam();
        if (spread.signum() < 0) {
            throw new DataIntegrityException(game.getExternalId(), "Negative spread " + spread.toPlainString() + " for " + game.matchup());
        }
        if (!game.involves(favorite)) {
            throw new DataIntegrityException(game.getExternalId(), "Favorite " + favorite + " is not playing in " + game.matchup());
        }
        if (!game.involves(selectedTeam)) {
            throw new DataIntegrityException(game.getExternalId(), "Selection " + selectedTeam + " is not playing in " + game.matchup());
        }

        String underdog = game.opponentOf(favorite);
        BigDecimal margin = BigDecimal.valueOf((long) game.scoreOf(favorite) - game.scoreOf(underdog));
        int cmp = margin.compareTo(spread);
        if (cmp == 0) return AtsOutcome.PUSH;
        AtsOutcome favoriteOutcome = cmp > 0 ? AtsOutcome.WIN : AtsOutcome.LOSS;
        return favorite.equalsIgnoreCase(selectedTeam) ? favoriteOutcome : favoriteOutcome.flip();
    }

    /** Final, scored, with a line attached and both teams resolved. */
    public boolean isGradable(Game game) {
        return game.getStatus() == GameStatus.FINAL
                && game.hasScores()
                && !game.isUnresolvedTeam()
                && game.getSpreadPts() != null
                && game.getFavoriteTeam() != null;
    }
}
