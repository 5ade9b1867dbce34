package com.engagement.anomaly.model;

/**
 * A rejected configuration field and why it was rejected.
 */
public record FieldViolation(String field, String detail) {
}
