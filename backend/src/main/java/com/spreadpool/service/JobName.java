package com.spreadpool.service;

import java.util.Locale;
import java.util.Optional;

public enum JobName {
    IMPORT_UPCOMING_WEEK(SyncOrchestrator.IMPORT_UPCOMING_WEEK),
    SYNC_SCORES_ACTIVE_WEEK(SyncOrchestrator.SYNC_SCORES_ACTIVE_WEEK),
    IMPORT_ODDS_UPCOMING(SyncOrchestrator.IMPORT_ODDS_UPCOMING),
    GRADE_COMPLETED_WEEKS(SyncOrchestrator.GRADE_COMPLETED_WEEKS);

    private final String key;

    JobName(String key) {
        this.key = key;
    }

    public String getKey() { return key; }

    /** Accepts the snake_case key, the kebab-case form or the constant name. */
    public static Optional<JobName> parse(String raw) {
        if (raw == null) return Optional.empty();
        String norm = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (JobName j : values()) {
            if (j.key.equals(norm)) return Optional.of(j);
        }
        return Optional.empty();
    }
}
