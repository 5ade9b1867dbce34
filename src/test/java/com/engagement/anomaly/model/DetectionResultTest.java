package com.engagement.anomaly.model;

import com.engagement.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionResultTest {

    @Test
    void of_derivesMetadataFromFlagsAndValues() {
        DetectionResult result = DetectionResult.of(List.of(false, true, false, false),
                new double[]{1, 2, 3, 4}, TestDataFactory.START);

        assertThat(result.getMetadata().getAnomalyCount()).isEqualTo(1);
        assertThat(result.getMetadata().getAnomalyPercentage()).isEqualTo(25.0);
        assertThat(result.getMetadata().getMeanScore()).isEqualTo(2.5);
        assertThat(result.getMetadata().getStdScore()).isEqualTo(1.29);
        assertThat(result.getMetadata().getProcessedAt()).isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    void of_overflowingMean_throws() {
        assertThatThrownBy(() -> DetectionResult.of(List.of(false, false, false),
                new double[]{1e308, 1e308, 1}, TestDataFactory.START))
                .isInstanceOf(ArithmeticException.class)
                .hasMessageContaining("overflowed");
    }

    @Test
    void of_overflowingStdDev_throws() {
        assertThatThrownBy(() -> DetectionResult.of(List.of(false, false),
                new double[]{1e200, 0}, TestDataFactory.START))
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void of_flagCountMismatch_throws() {
        assertThatThrownBy(() -> DetectionResult.of(List.of(true), new double[]{1, 2}, TestDataFactory.START))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
