package com.engagement.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Outcome of an alert evaluation")
public class AlertDecision {

    @Schema(description = "True if a notification was delivered", example = "true")
    boolean sent;

    @Schema(description = "Severity tier (none, warning, critical)", example = "warning")
    AlertSeverity severity;

    @Schema(description = "Suppression reason; null when the alert was sent", example = "cooldown")
    SuppressionReason reason;

    @Schema(description = "Human-readable outcome", example = "WARNING alert sent successfully")
    String message;

    @Schema(description = "Epoch millis of the evaluation", example = "1739886764000")
    long timestamp;

    public static AlertDecision sent(AlertSeverity severity, long timestamp) {
        return AlertDecision.builder()
                .sent(true)
                .severity(severity)
                .message(severity.name() + " alert sent successfully")
                .timestamp(timestamp)
                .build();
    }

    public static AlertDecision suppressed(SuppressionReason reason, String message, long timestamp) {
        return suppressed(reason, AlertSeverity.NONE, message, timestamp);
    }

    public static AlertDecision suppressed(SuppressionReason reason, AlertSeverity severity,
                                           String message, long timestamp) {
        return AlertDecision.builder()
                .sent(false)
                .severity(severity)
                .reason(reason)
                .message(message)
                .timestamp(timestamp)
                .build();
    }
}
