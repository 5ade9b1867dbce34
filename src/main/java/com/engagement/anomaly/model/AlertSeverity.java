package com.engagement.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity {
    NONE,
    WARNING,
    CRITICAL;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    /**
     * Severity for an anomaly fraction, or NONE when it is below the warning threshold.
     */
    public static AlertSeverity fromFraction(double fraction, AlertThresholds thresholds) {
        if (fraction >= thresholds.getCriticalThreshold()) return CRITICAL;
        if (fraction >= thresholds.getWarningThreshold()) return WARNING;
        return NONE;
    }
}
