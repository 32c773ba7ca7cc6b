package com.spreadpool.anomaly;

import java.time.Instant;

public class Anomaly {

    public enum Kind { EMPTY_RESPONSE, PROVIDER_FAILURE, DATA_INTEGRITY, UNRESOLVED_TEAM }

    private final Kind kind;
    private final String job;
    private final String week; // "2025-W3", null when no week was targeted
    private final String message;
    private final Instant occurredAt;

    public Anomaly(Kind kind, String job, String week, String message, Instant occurredAt) {
        this.kind = kind;
        this.job = job;
        this.week = week;
        this.message = message;
        this.occurredAt = occurredAt;
    }

    public Kind getKind() { return kind; }
    public String getJob() { return job; }
    public String getWeek() { return week; }
    public String getMessage() { return message; }
    public Instant getOccurredAt() { return occurredAt; }

    @Override
    public String toString() {
        return kind + " in " + job + (week != null ? " [" + week + "]" : "") + ": " + message;
    }
}
