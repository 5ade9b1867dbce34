package com.engagement.anomaly.model;

/**
 * Per-point features used by the outlier scorer.
 */
public record FeatureVector(double value, double rollingMean, double rollingStdDev, double firstDifference) {

    public static final int FEATURE_COUNT = 4;

    public double[] toArray() {
        return new double[]{value, rollingMean, rollingStdDev, firstDifference};
    }
}
