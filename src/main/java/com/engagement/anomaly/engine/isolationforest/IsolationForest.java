package com.engagement.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Isolation Forest fitted on one batch. Instances are not shared between requests.
 */
public class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * Fit a forest on the given rows.
     *
     * @param data       samples, each row is a feature vector
     * @param numTrees   number of trees in the forest
     * @param maxSamples sub-sampling size per tree, capped at the number of rows
     * @param seed       random seed; the same seed and data always produce the same forest
     */
    public static IsolationForest fit(double[][] data, int numTrees, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on an empty batch");
        }
        if (numTrees <= 0) {
            throw new IllegalArgumentException("numTrees must be > 0, got " + numTrees);
        }

        int sampleSize = Math.min(maxSamples, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            int[] sample = subsample(data.length, sampleSize, random);
            trees.add(IsolationTree.build(data, sample, maxDepth, random));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), sampleSize);
    }

    /**
     * Anomaly score s(x) = 2^(-E(h(x)) / c(sampleSize)), between 0.0 (normal) and 1.0 (anomalous).
     */
    public double anomalyScore(double[] point) {
        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        return Math.pow(2.0, -avgPathLength / c);
    }

    public double[] anomalyScores(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = anomalyScore(data[i]);
        }
        return scores;
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    // Partial Fisher-Yates: first `size` slots are a sample without replacement
    private static int[] subsample(int n, int size, Random random) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) indices[i] = i;
        if (size >= n) {
            return indices;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(indices, 0, sample, 0, size);
        return sample;
    }
}
