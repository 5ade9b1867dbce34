package com.engagement.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable outcome of scoring one series. Instances are shared through the result cache,
 * so nothing here may be mutated after construction.
 */
@Value
@Schema(description = "Per-point anomaly flags with summary metadata")
public class DetectionResult {

    @Schema(description = "One flag per input point, in input order")
    List<Boolean> anomalies;

    DetectionMetadata metadata;

    private DetectionResult(List<Boolean> anomalies, DetectionMetadata metadata) {
        this.anomalies = List.copyOf(anomalies);
        this.metadata = metadata;
    }

    /**
     * Builds a result whose metadata is derived from the flags and the scored values,
     * so that anomaly_count and anomaly_percentage always agree with the flags.
     */
    public static DetectionResult of(List<Boolean> anomalies, double[] values, Instant processedAt) {
        if (anomalies.size() != values.length) {
            throw new IllegalArgumentException("expected " + values.length + " flags, got " + anomalies.size());
        }
        int total = values.length;
        int count = (int) anomalies.stream().filter(Boolean::booleanValue).count();

        double sum = 0.0;
        for (double v : values) sum += v;
        double mean = total > 0 ? sum / total : 0.0;

        double std = 0.0;
        if (total > 1) {
            double sq = 0.0;
            for (double v : values) sq += (v - mean) * (v - mean);
            std = Math.sqrt(sq / (total - 1));
        }
        if (!Double.isFinite(mean) || !Double.isFinite(std)) {
            throw new ArithmeticException("Score statistics overflowed (mean=" + mean + ", std=" + std + ")");
        }

        DetectionMetadata metadata = DetectionMetadata.builder()
                .totalPoints(total)
                .anomalyCount(count)
                .anomalyPercentage(total > 0 ? round2(count * 100.0 / total) : 0.0)
                .processedAt(processedAt.toString())
                .meanScore(round2(mean))
                .stdScore(round2(std))
                .build();

        return new DetectionResult(anomalies, metadata);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
