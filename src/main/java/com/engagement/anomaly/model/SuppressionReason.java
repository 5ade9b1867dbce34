package com.engagement.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why an alert evaluation did not send a notification. Listed in evaluation order.
 */
public enum SuppressionReason {
    DISABLED("disabled"),
    COOLDOWN("cooldown"),
    INSUFFICIENT_POINTS("insufficient points"),
    BELOW_THRESHOLD("below threshold"),
    DELIVERY_FAILED("delivery failed");

    private final String label;

    SuppressionReason(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
