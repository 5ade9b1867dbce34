package com.engagement.anomaly.engine.isolationforest;

import java.util.Random;

final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    /**
     * Builds a tree over the rows of {@code data} selected by {@code indices}.
     * The index array is partitioned in place.
     */
    static IsolationTree build(double[][] data, int[] indices, int maxDepth, Random random) {
        return new IsolationTree(buildNode(data, indices, 0, indices.length, 0, maxDepth, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    private static IsolationNode buildNode(double[][] data, int[] idx, int from, int to,
                                           int depth, int maxDepth, Random random) {
        int n = to - from;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.leaf(n);
        }

        int numFeatures = data[idx[from]].length;
        double[] mins = new double[numFeatures];
        double[] maxs = new double[numFeatures];
        int[] splittable = new int[numFeatures];
        int splittableCount = 0;

        for (int f = 0; f < numFeatures; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int i = from; i < to; i++) {
                double v = data[idx[i]][f];
                if (v < min) min = v;
                if (v > max) max = v;
            }
            mins[f] = min;
            maxs[f] = max;
            if (min < max) splittable[splittableCount++] = f;
        }

        // Every remaining row is identical on every feature
        if (splittableCount == 0) {
            return IsolationNode.leaf(n);
        }

        int feature = splittable[random.nextInt(splittableCount)];
        double split = mins[feature] + random.nextDouble() * (maxs[feature] - mins[feature]);

        int mid = from;
        for (int i = from; i < to; i++) {
            if (data[idx[i]][feature] < split) {
                int tmp = idx[mid];
                idx[mid] = idx[i];
                idx[i] = tmp;
                mid++;
            }
        }

        IsolationNode left = buildNode(data, idx, from, mid, depth + 1, maxDepth, random);
        IsolationNode right = buildNode(data, idx, mid, to, depth + 1, maxDepth, random);
        return IsolationNode.internal(feature, split, left, right);
    }
}
