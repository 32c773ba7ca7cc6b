package com.spreadpool.dto;

public enum JobErrorReason {
    OFFSEASON,
    ALREADY_RUNNING,
    NOT_IMPORT_DAY,
    NO_SEASON,
    NO_ACTIVE_WEEK,
    PROVIDER_TRANSIENT,
    PROVIDER_PERMANENT,
    EMPTY_RESPONSE,
    DATA_INTEGRITY,
    CANCELLED,
    INTERNAL
}
