package com.spreadpool.util;

import java.time.Instant;
import java.util.Objects;

/**
 * Pick acceptance rule: open strictly before kickoff, closed at and after it.
 * There is no grace period.
 */
public final class DeadlineGate {

    private DeadlineGate() {}

    public static boolean acceptsPick(Instant kickoff, Instant now) {
        Objects.requireNonNull(kickoff, "kickoff");
        Objects.requireNonNull(now, "now");
        return now.isBefore(kickoff);
    }
}
