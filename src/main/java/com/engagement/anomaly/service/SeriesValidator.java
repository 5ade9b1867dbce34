package com.engagement.anomaly.service;

import com.engagement.anomaly.config.DetectionConfig;
import com.engagement.anomaly.model.DetectionRequest;
import com.engagement.anomaly.model.ScoreSeries;
import com.engagement.anomaly.model.ValidationFailureKind;
import com.engagement.anomaly.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw detection request into a {@link ScoreSeries}, or reports the first problem found.
 *
 * Timestamps accept ISO-8601 dates ("2024-01-31") and date-times with or without an offset.
 * Values without an offset are taken as UTC.
 */
@Component
public class SeriesValidator {

    private final int maxPoints;

    public SeriesValidator(DetectionConfig config) {
        this.maxPoints = config.getMaxPoints();
    }

    public ValidationResult validate(DetectionRequest request) {
        if (request == null || request.getScores() == null) {
            return ValidationResult.failure(ValidationFailureKind.MISSING_FIELD, "scores", "scores is required");
        }
        if (request.getDates() == null) {
            return ValidationResult.failure(ValidationFailureKind.MISSING_FIELD, "dates", "dates is required");
        }

        List<Double> scores = request.getScores();
        List<String> dates = request.getDates();

        if (scores.isEmpty()) {
            return ValidationResult.failure(ValidationFailureKind.EMPTY_SERIES, "scores",
                    "at least one score is required");
        }
        if (scores.size() > maxPoints) {
            return ValidationResult.failure(ValidationFailureKind.TOO_MANY_POINTS, "scores",
                    "at most " + maxPoints + " points are allowed, got " + scores.size());
        }
        if (dates.size() != scores.size()) {
            return ValidationResult.failure(ValidationFailureKind.LENGTH_MISMATCH, "dates",
                    "dates has " + dates.size() + " entries but scores has " + scores.size());
        }

        for (int i = 0; i < scores.size(); i++) {
            Double score = scores.get(i);
            String field = "scores[" + i + "]";
            if (score == null) {
                return ValidationResult.failure(ValidationFailureKind.MISSING_FIELD, field, "score is required");
            }
            if (score.isNaN() || score.isInfinite()) {
                return ValidationResult.failure(ValidationFailureKind.NON_FINITE_SCORE, field,
                        "score must be a finite number");
            }
            if (score < 0) {
                return ValidationResult.failure(ValidationFailureKind.NEGATIVE_SCORE, field,
                        "score must be >= 0, got " + score);
            }
        }

        List<Instant> timestamps = new ArrayList<>(dates.size());
        for (int i = 0; i < dates.size(); i++) {
            Instant parsed = parseTimestamp(dates.get(i));
            if (parsed == null) {
                return ValidationResult.failure(ValidationFailureKind.INVALID_TIMESTAMP, "dates[" + i + "]",
                        "not an ISO-8601 date or date-time: " + dates.get(i));
            }
            timestamps.add(parsed);
        }

        return ValidationResult.ok(new ScoreSeries(timestamps, scores));
    }

    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value,
                    ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException notDateTime) {
            try {
                return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE)
                        .atStartOfDay(ZoneOffset.UTC)
                        .toInstant();
            } catch (DateTimeParseException notDate) {
                return null;
            }
        }
    }
}
