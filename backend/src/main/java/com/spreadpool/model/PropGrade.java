package com.spreadpool.model;

public enum PropGrade {
    WIN,
    LOSS,
    UNGRADED
}
