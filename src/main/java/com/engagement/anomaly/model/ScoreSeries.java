package com.engagement.anomaly.model;

import java.time.Instant;
import java.util.List;

/**
 * A validated, time-ordered series of non-negative scores. Lives for one detection request.
 */
public record ScoreSeries(List<Instant> timestamps, List<Double> values) {

    public ScoreSeries {
        if (timestamps.size() != values.size()) {
            throw new IllegalArgumentException("timestamps and values must have the same length");
        }
        timestamps = List.copyOf(timestamps);
        values = List.copyOf(values);
    }

    public int size() {
        return values.size();
    }

    public double[] valuesArray() {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }
}
