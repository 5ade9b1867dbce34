package com.engagement.anomaly.model;

/**
 * Either a parsed series or the first validation failure found.
 */
public record ValidationResult(ScoreSeries series, ValidationFailureKind failure, String field, String detail) {

    public static ValidationResult ok(ScoreSeries series) {
        return new ValidationResult(series, null, null, null);
    }

    public static ValidationResult failure(ValidationFailureKind kind, String field, String detail) {
        return new ValidationResult(null, kind, field, detail);
    }

    public boolean isValid() {
        return failure == null;
    }
}
