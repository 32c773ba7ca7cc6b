package com.spreadpool.model;

public enum AdminAction {
    RESOLVE_PLACEHOLDER,
    ADJUST_DEADLINE,
    GRADE_PROP,
    OVERRIDE_PICK
}
