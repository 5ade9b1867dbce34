package com.engagement.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Anomaly-density thresholds that decide alert severity")
public class AlertThresholds {

    @JsonProperty("warning_threshold")
    @Schema(description = "Anomaly fraction (0-1) at or above which a WARNING is raised", example = "0.15")
    @Builder.Default
    private double warningThreshold = 0.15;

    @JsonProperty("critical_threshold")
    @Schema(description = "Anomaly fraction (0-1) at or above which a CRITICAL is raised", example = "0.30")
    @Builder.Default
    private double criticalThreshold = 0.30;

    @JsonProperty("min_anomaly_points")
    @Schema(description = "Minimum anomalous points before any alert fires", example = "3")
    @Builder.Default
    private int minAnomalyPoints = 3;

    @JsonProperty("cooldown_minutes")
    @Schema(description = "Minimum minutes between two notifications for the same customer", example = "60")
    @Builder.Default
    private long cooldownMinutes = 60;

    public Duration cooldown() {
        return Duration.ofMinutes(cooldownMinutes);
    }
}
