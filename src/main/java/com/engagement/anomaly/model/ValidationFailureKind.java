package com.engagement.anomaly.model;

public enum ValidationFailureKind {
    MISSING_FIELD,
    EMPTY_SERIES,
    TOO_MANY_POINTS,
    LENGTH_MISMATCH,
    NEGATIVE_SCORE,
    NON_FINITE_SCORE,
    INVALID_TIMESTAMP
}
