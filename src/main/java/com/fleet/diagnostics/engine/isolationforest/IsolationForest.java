package com.fleet.diagnostics.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest over fixed-length feature vectors. Immutable once
 * trained, so one instance can be scored from many threads.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final int featureCount;
    // Expected path length of a sample of sampleSize points, the score's unit depth
    private final double unitDepth;

    private IsolationForest(List<IsolationTree> trees, int sampleSize, int featureCount) {
        this.trees = Collections.unmodifiableList(trees);
        this.sampleSize = sampleSize;
        this.featureCount = featureCount;
        this.unitDepth = IsolationNode.unresolvedDepth(sampleSize);
    }

    /**
     * Grows {@code numTrees} trees, each on its own random sub-sample of at
     * most {@code sampleSize} rows and capped at depth ceil(log2(sampleSize)).
     * The same data and seed always give the same forest.
     */
    public static IsolationForest train(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest without samples");
        }
        int effectiveSampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(effectiveSampleSize, 2)) / Math.log(2));
        List<IsolationTree> trees = new ArrayList<>(numTrees);

        Random random = new Random(seed);

        for (int i = 0; i < numTrees; i++) {
            double[][] sample = subsample(data, effectiveSampleSize, random);
            trees.add(IsolationTree.build(sample, maxDepth, random));
        }
        return new IsolationForest(trees, effectiveSampleSize, data[0].length);
    }

    /**
     * Anomaly score 2^(-E[h(x)] / c(n)) of one point: near 1 for points that
     * isolate quickly, 0.5 or below for unremarkable ones.
     */
    public double anomalyScore(double[] point) {
        if (point.length != featureCount) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d features, got %d", featureCount, point.length));
        }
        if (unitDepth <= 0) {
            return 0.0;
        }
        double meanDepth = trees.stream().mapToDouble(tree -> tree.pathLength(point)).average().orElse(0.0);
        return Math.pow(2.0, -meanDepth / unitDepth);
    }

    /**
     * Per feature, how far the score falls when only that feature is reset to
     * its healthy mean. Never negative.
     */
    public double[] featureContributions(double[] point, double[] featureMeans) {
        double score = anomalyScore(point);
        double[] substituted = point.clone();
        double[] contributions = new double[substituted.length];
        for (int i = 0; i < substituted.length; i++) {
            double original = substituted[i];
            substituted[i] = featureMeans[i];
            contributions[i] = Math.max(0.0, score - anomalyScore(substituted));
            substituted[i] = original;
        }
        return contributions;
    }

    /**
     * Draws {@code size} distinct rows: the first {@code size} steps of a
     * Fisher-Yates shuffle over a copy of the row references.
     */
    private static double[][] subsample(double[][] data, int size, Random random) {
        double[][] rows = Arrays.copyOf(data, data.length);
        if (rows.length <= size) {
            return rows;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(rows.length - i);
            double[] picked = rows[j];
            rows[j] = rows[i];
            rows[i] = picked;
        }
        return Arrays.copyOf(rows, size);
    }

    public int getTreeCount() { return trees.size(); }
    public int getSampleSize() { return sampleSize; }
    public int getFeatureCount() { return featureCount; }
}
