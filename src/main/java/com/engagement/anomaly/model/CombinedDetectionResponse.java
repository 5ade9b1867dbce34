package com.engagement.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Detection result together with the alert decision for the customer")
public record CombinedDetectionResponse(
        @JsonProperty("anomaly_detection") DetectionResult anomalyDetection,
        AlertDecision alert) {
}
