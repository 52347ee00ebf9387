package com.fleet.diagnostics.engine.isolationforest;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsolationForestTest {

    private static double[][] gaussianCloud(int n, int features, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[n][features];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < features; j++) {
                data[i][j] = random.nextGaussian();
            }
        }
        return data;
    }

    @Test
    void anomalyScore_outlierScoresAboveInlier() {
        IsolationForest forest = IsolationForest.train(gaussianCloud(500, 3, 1), 100, 256, 42);

        double inlier = forest.anomalyScore(new double[]{0.0, 0.0, 0.0});
        double outlier = forest.anomalyScore(new double[]{8.0, -8.0, 8.0});

        assertThat(outlier).isGreaterThan(inlier);
        assertThat(outlier).isGreaterThan(0.6);
        assertThat(inlier).isLessThan(0.5);
    }

    @Test
    void train_sameSeed_givesIdenticalScores() {
        double[][] data = gaussianCloud(300, 2, 3);
        IsolationForest a = IsolationForest.train(data, 50, 128, 9);
        IsolationForest b = IsolationForest.train(data, 50, 128, 9);

        double[] point = {1.5, -0.5};
        assertThat(a.anomalyScore(point)).isEqualTo(b.anomalyScore(point));
    }

    @Test
    void train_fewerSamplesThanSampleSize_capsSampleSize() {
        IsolationForest forest = IsolationForest.train(gaussianCloud(40, 2, 5), 10, 256, 1);

        assertThat(forest.getSampleSize()).isEqualTo(40);
        assertThat(forest.getTreeCount()).isEqualTo(10);
        assertThat(forest.getFeatureCount()).isEqualTo(2);
    }

    @Test
    void train_noSamples_throws() {
        assertThatThrownBy(() -> IsolationForest.train(new double[0][], 10, 256, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void anomalyScore_wrongFeatureCount_throws() {
        IsolationForest forest = IsolationForest.train(gaussianCloud(50, 3, 1), 10, 32, 1);

        assertThatThrownBy(() -> forest.anomalyScore(new double[]{1.0, 2.0}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 3 features");
    }

    @Test
    void featureContributions_pointOffOnOneAxis_blamesThatAxis() {
        IsolationForest forest = IsolationForest.train(gaussianCloud(500, 3, 2), 100, 256, 42);

        double[] contributions = forest.featureContributions(new double[]{0.0, 9.0, 0.0}, new double[3]);

        assertThat(contributions[1]).isGreaterThan(contributions[0]);
        assertThat(contributions[1]).isGreaterThan(contributions[2]);
    }
}
