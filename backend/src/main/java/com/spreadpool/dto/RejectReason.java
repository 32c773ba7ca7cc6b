package com.spreadpool.dto;

public enum RejectReason {
    DEADLINE_PASSED,
    DUPLICATE_PICK,
    UNKNOWN_GAME,
    INVALID_TEAM,
    UNRESOLVED_TEAM,
    UNKNOWN_PARTICIPANT
}
