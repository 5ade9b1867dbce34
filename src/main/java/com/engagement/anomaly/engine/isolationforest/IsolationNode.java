package com.engagement.anomaly.engine.isolationforest;

final class IsolationNode {

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size; // samples that reached a leaf

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right, int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    static IsolationNode internal(int splitFeature, double splitValue, IsolationNode left, IsolationNode right) {
        return new IsolationNode(splitFeature, splitValue, left, right, 0);
    }

    static IsolationNode leaf(int size) {
        return new IsolationNode(-1, 0.0, null, null, size);
    }

    boolean isLeaf() {
        return left == null;
    }

    double pathLength(double[] point, int depth) {
        IsolationNode node = this;
        while (!node.isLeaf()) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful BST search over n points:
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) approximated by ln(i) + Euler's constant.
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + 0.5772156649;
        return 2.0 * harmonic - (2.0 * (n - 1.0) / n);
    }
}
