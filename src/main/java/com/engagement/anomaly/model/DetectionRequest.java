package com.engagement.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A score series submitted for anomaly detection")
public class DetectionRequest {

    @Schema(description = "ISO-8601 timestamps, one per score", example = "[\"2024-01-01\", \"2024-01-02\"]")
    private List<String> dates;

    @Schema(description = "Non-negative engagement scores (1 to 1000 points)", example = "[12.5, 13.0]")
    private List<Double> scores;
}
