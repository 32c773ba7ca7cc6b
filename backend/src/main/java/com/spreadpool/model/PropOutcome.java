package com.spreadpool.model;

import java.util.Locale;
import java.util.Optional;

public enum PropOutcome {
    OVER,
    UNDER,
    YES,
    NO;

    public static Optional<PropOutcome> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(PropOutcome.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
