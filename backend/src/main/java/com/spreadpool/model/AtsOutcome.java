package com.spreadpool.model;

public enum AtsOutcome {
    WIN,
    LOSS,
    PUSH,
    UNDECIDED;

    public boolean isDecided() {
        return this != UNDECIDED;
    }

    public AtsOutcome flip() {
        switch (this) {
            case WIN: return LOSS;
            case LOSS: return WIN;
            default: return this;
        }
    }
}
