package com.engagement.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Summary statistics of a detection run")
public class DetectionMetadata {

    @JsonProperty("total_points")
    @Schema(description = "Number of points in the series", example = "30")
    int totalPoints;

    @JsonProperty("anomaly_count")
    @Schema(description = "Number of points flagged as anomalous", example = "6")
    int anomalyCount;

    @JsonProperty("anomaly_percentage")
    @Schema(description = "100 * anomaly_count / total_points, rounded to 2 decimals", example = "20.0")
    double anomalyPercentage;

    @JsonProperty("processed_at")
    @Schema(description = "ISO-8601 instant the series was scored", example = "2024-03-01T10:15:30Z")
    String processedAt;

    @JsonProperty("mean_score")
    @Schema(description = "Mean of the scores, rounded to 2 decimals", example = "41.27")
    double meanScore;

    @JsonProperty("std_score")
    @Schema(description = "Sample standard deviation of the scores, rounded to 2 decimals", example = "8.93")
    double stdScore;
}
