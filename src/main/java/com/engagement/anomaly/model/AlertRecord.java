package com.engagement.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A notification that was delivered")
public class AlertRecord {

    @JsonProperty("customer_id")
    @Schema(description = "Customer the alert was raised for", example = "CUST-042")
    String customerId;

    @Schema(description = "Severity of the alert", example = "critical")
    AlertSeverity severity;

    @Schema(description = "Epoch millis the alert was sent", example = "1739886764000")
    long timestamp;

    @Schema(description = "Metadata of the detection that triggered the alert")
    DetectionMetadata details;
}
