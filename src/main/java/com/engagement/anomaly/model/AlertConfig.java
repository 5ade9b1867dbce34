package com.engagement.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Per-customer alerting configuration")
public class AlertConfig {

    @Schema(description = "Whether alerts are evaluated for this customer", example = "true")
    @Builder.Default
    private boolean enabled = true;

    @JsonProperty("email_recipients")
    @Schema(description = "Notification recipients (email addresses, or phone numbers for SMS/WhatsApp)",
            example = "[\"ops@example.com\"]")
    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    @Schema(description = "Severity thresholds and cooldown")
    @Builder.Default
    private AlertThresholds thresholds = new AlertThresholds();

    @JsonProperty("last_alert_time")
    @Schema(description = "Epoch millis of the last successful notification, null if none", example = "1739886764000")
    private Long lastAlertTime;

    /**
     * Deep copy, so callers never share mutable state with the engine's map.
     */
    public AlertConfig copy() {
        return toBuilder()
                .recipients(recipients == null ? new ArrayList<>() : new ArrayList<>(recipients))
                .thresholds(thresholds == null ? new AlertThresholds() : thresholds.toBuilder().build())
                .build();
    }
}
