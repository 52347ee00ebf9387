package com.fleet.diagnostics.engine.isolationforest;

import java.util.Random;

/**
 * One isolation tree over a sub-sample. Rows are never copied: the tree is
 * grown by partitioning an index array in place, each node owning the slice
 * [from, to) of it.
 */
public final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] sample, int maxDepth, Random random) {
        int[] rows = new int[sample.length];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = i;
        }
        return new IsolationTree(grow(sample, rows, 0, rows.length, 0, maxDepth, random));
    }

    private static IsolationNode grow(double[][] sample, int[] rows, int from, int to,
                                      int depth, int maxDepth, Random random) {
        int size = to - from;
        if (depth >= maxDepth || size <= 1) {
            return IsolationNode.leaf(size);
        }

        int feature = random.nextInt(sample[rows[from]].length);
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            double v = sample[rows[i]][feature];
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }

        // A feature constant over this slice cannot split it
        if (!(lo < hi)) {
            return IsolationNode.leaf(size);
        }

        double split = lo + random.nextDouble() * (hi - lo);
        int mid = partition(sample, rows, from, to, feature, split);

        return IsolationNode.split(feature, split,
                grow(sample, rows, from, mid, depth + 1, maxDepth, random),
                grow(sample, rows, mid, to, depth + 1, maxDepth, random));
    }

    /**
     * Moves rows below {@code split} on {@code feature} to the front of the
     * slice, keeping their relative order, and returns the first index of the rest.
     */
    private static int partition(double[][] sample, int[] rows, int from, int to, int feature, double split) {
        int[] upper = new int[to - from];
        int lowerEnd = from;
        int upperCount = 0;
        for (int i = from; i < to; i++) {
            int row = rows[i];
            if (sample[row][feature] < split) {
                rows[lowerEnd++] = row;
            } else {
                upper[upperCount++] = row;
            }
        }
        System.arraycopy(upper, 0, rows, lowerEnd, upperCount);
        return lowerEnd;
    }

    /**
     * Depth at which {@code point} lands in a leaf, plus the expected depth
     * still needed to separate it from the leaf's other training points.
     */
    public double pathLength(double[] point) {
        IsolationNode node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.feature] < node.split ? node.below : node.above;
            depth++;
        }
        return depth + IsolationNode.unresolvedDepth(node.size);
    }
}
