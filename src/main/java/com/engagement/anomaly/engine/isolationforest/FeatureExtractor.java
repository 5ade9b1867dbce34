package com.engagement.anomaly.engine.isolationforest;

import com.engagement.anomaly.model.FeatureVector;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts a 4-dimensional feature vector for every point of a score series.
 *
 * Features:
 *   [0] Value: the raw score
 *   [1] Rolling mean: mean of the trailing window (up to 3 points, at least 1)
 *   [2] Rolling std: sample standard deviation of the same window, 0.0 when it holds fewer than 2 points
 *   [3] First difference: value[i] - value[i-1], 0.0 for the first point
 *
 * Timestamps do not contribute to the features.
 */
public final class FeatureExtractor {

    public static final int WINDOW = 3;

    public static final String[] FEATURE_NAMES = {
            "Value",
            "Rolling Mean",
            "Rolling Std",
            "First Difference"
    };

    private FeatureExtractor() {}

    public static List<FeatureVector> extract(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Cannot extract features from an empty series");
        }

        List<FeatureVector> features = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - WINDOW + 1);
            int count = i - from + 1;

            double sum = 0.0;
            for (int j = from; j <= i; j++) sum += values[j];
            double mean = sum / count;

            double std = 0.0;
            if (count >= 2) {
                double sq = 0.0;
                for (int j = from; j <= i; j++) sq += (values[j] - mean) * (values[j] - mean);
                std = Math.sqrt(sq / (count - 1));
            }

            double diff = i > 0 ? values[i] - values[i - 1] : 0.0;

            features.add(new FeatureVector(values[i], mean, std, diff));
        }
        return features;
    }

    public static double[][] toMatrix(List<FeatureVector> features) {
        double[][] matrix = new double[features.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = features.get(i).toArray();
        }
        return matrix;
    }
}
