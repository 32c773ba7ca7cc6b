package com.spreadpool.provider;

import com.spreadpool.model.GameStatus;

public record ScoreRecord(String externalId,
                          Integer homeScore,
                          Integer awayScore,
                          GameStatus status) implements ProviderRecord {

    @Override
    public Kind kind() {
        return Kind.SCORE;
    }

    public boolean hasScores() {
        return homeScore != null && awayScore != null;
    }
}
