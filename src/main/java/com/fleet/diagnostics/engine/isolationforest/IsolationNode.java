package com.fleet.diagnostics.engine.isolationforest;

/**
 * Node of an isolation tree. A split node sends points with
 * {@code point[feature] < split} below and the rest above; a leaf only
 * remembers how many training points reached it.
 */
final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    final int feature;
    final double split;
    final IsolationNode below;
    final IsolationNode above;
    final int size;

    private IsolationNode(int feature, double split, IsolationNode below, IsolationNode above, int size) {
        this.feature = feature;
        this.split = split;
        this.below = below;
        this.above = above;
        this.size = size;
    }

    static IsolationNode split(int feature, double split, IsolationNode below, IsolationNode above) {
        return new IsolationNode(feature, split, below, above, below.size + above.size);
    }

    static IsolationNode leaf(int size) {
        return new IsolationNode(-1, Double.NaN, null, null, size);
    }

    boolean isLeaf() {
        return below == null;
    }

    /**
     * Expected depth still needed to isolate one of {@code n} points that
     * share a leaf: the mean unsuccessful-search length of a binary search
     * tree, 2H(n-1) - 2(n-1)/n.
     */
    static double unresolvedDepth(int n) {
        if (n < 2) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }
}
