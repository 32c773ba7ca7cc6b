package com.spreadpool.model;

public enum GameStatus {
    SCHEDULED,
    IN_PROGRESS,
    FINAL;

    public boolean isComplete() {
        return this == FINAL;
    }
}
