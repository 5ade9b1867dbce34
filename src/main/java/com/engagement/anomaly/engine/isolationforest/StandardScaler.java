package com.engagement.anomaly.engine.isolationforest;

/**
 * Column-wise z-score scaling fitted on a single batch.
 * Uses the population variance. A constant column has no spread and is mapped to 0.0.
 */
public final class StandardScaler {

    private StandardScaler() {}

    public static double[][] fitTransform(double[][] data) {
        int rows = data.length;
        if (rows == 0) return new double[0][];
        int cols = data[0].length;

        double[] means = new double[cols];
        double[] scales = new double[cols];

        for (int c = 0; c < cols; c++) {
            double sum = 0.0;
            for (double[] row : data) sum += row[c];
            means[c] = sum / rows;

            double sq = 0.0;
            for (double[] row : data) sq += (row[c] - means[c]) * (row[c] - means[c]);
            scales[c] = Math.sqrt(sq / rows);
        }

        double[][] scaled = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                scaled[r][c] = scales[c] > 0 ? (data[r][c] - means[c]) / scales[c] : 0.0;
            }
        }
        return scaled;
    }
}
