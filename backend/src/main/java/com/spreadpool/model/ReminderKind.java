package com.spreadpool.model;

public enum ReminderKind {
    WEEK_LAUNCH,
    DEADLINE,
    KICKOFF,
    RESULTS
}
