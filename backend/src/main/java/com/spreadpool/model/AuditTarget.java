package com.spreadpool.model;

/** Kind of row an admin audit entry points at. */
public enum AuditTarget {
    GAME,
    WEEK,
    PROP_BET,
    PICK
}
