package com.spreadpool.model;

/**
 * Lifecycle of a week as advanced by the sync jobs.
 * NOT_IMPORTED is never persisted; it is what a missing row means.
 */
public enum WeekPhase {
    NOT_IMPORTED,
    IMPORTED,
    ODDS_LOADED,
    IN_PROGRESS,
    COMPLETE,
    GRADED
}
