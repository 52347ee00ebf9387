package com.fleet.diagnostics.engine.isolationforest;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.exception.FeatureMismatchException;
import com.fleet.diagnostics.exception.ModelFitFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fits the fleet anomaly model on the pooled baseline-window vectors of every
 * unit.
 *
 * Baseline vectors are in-sample for their own unit's baseline, so they score
 * lower than later healthy cycles do. The decision threshold is therefore the
 * (1 - contamination) quantile of the scores of the calibration vectors, the
 * first healthy cycles whose indicator windows lie past the baseline window.
 */
@Component
public class AnomalyModelTrainer {

    private static final Logger log = LoggerFactory.getLogger(AnomalyModelTrainer.class);

    private final DiagnosticsConfig config;

    public AnomalyModelTrainer(DiagnosticsConfig config) {
        this.config = config;
    }

    /**
     * @throws ModelFitFailedException  when fewer baseline vectors than the configured minimum exist
     * @throws FeatureMismatchException when a feature set is not built over the configured sensors
     */
    public AnomalyModel fit(List<FeatureSet> featureSets) {
        List<String> sensors = List.copyOf(config.getSensors());
        DiagnosticsConfig.Anomaly anomaly = config.getAnomaly();

        List<double[]> training = new ArrayList<>();
        List<double[]> calibration = new ArrayList<>();
        for (FeatureSet featureSet : featureSets) {
            if (!featureSet.getSensors().equals(sensors)) {
                throw new FeatureMismatchException(featureSet.getUnitId(), sensors, featureSet.getSensors());
            }
            for (FeatureVector vector : featureSet.getVectors()) {
                if (vector.getStage() == FeatureVector.Stage.BASELINE) {
                    training.add(vector.getValues());
                } else if (vector.getStage() == FeatureVector.Stage.CALIBRATION) {
                    calibration.add(vector.getValues());
                }
            }
        }

        if (training.size() < anomaly.getMinFitSamples()) {
            throw new ModelFitFailedException(training.size(), anomaly.getMinFitSamples());
        }

        double[][] data = training.toArray(new double[0][]);
        IsolationForest forest = IsolationForest.train(
                data, anomaly.getNumTrees(), anomaly.getSampleSize(), anomaly.getSeed());

        double[][] thresholdData = calibration.toArray(new double[0][]);
        int calibrationSamples = thresholdData.length;
        if (calibrationSamples < anomaly.getMinFitSamples()) {
            log.warn("Only {} calibration vectors past the baseline windows (need {}); taking the threshold "
                            + "from the training scores, which flags later healthy cycles above the contamination rate",
                    calibrationSamples, anomaly.getMinFitSamples());
            thresholdData = data;
            calibrationSamples = 0;
        }
        double threshold = upperQuantile(scores(forest, thresholdData), anomaly.getContamination());

        log.info("Fitted fleet anomaly model: {} trees, {} samples from {} units, {} features, "
                        + "threshold={} from {} calibration vectors",
                forest.getTreeCount(), data.length, featureSets.size(), forest.getFeatureCount(),
                String.format("%.4f", threshold), calibrationSamples);

        return AnomalyModel.builder()
                .forest(forest)
                .sensors(sensors)
                .featureNames(FeatureExtractor.featureNames(sensors))
                .threshold(threshold)
                .contamination(anomaly.getContamination())
                .trainingSamples(data.length)
                .calibrationSamples(calibrationSamples)
                .featureMeans(columnMeans(data))
                .build();
    }

    private static double[] scores(IsolationForest forest, double[][] rows) {
        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scores[i] = forest.anomalyScore(rows[i]);
        }
        return scores;
    }

    /**
     * Smallest score such that at most {@code contamination} of the
     * scores lie strictly above it.
     */
    static double upperQuantile(double[] scores, double contamination) {
        double[] sorted = scores.clone();
        Arrays.sort(sorted);
        int index = (int) Math.ceil((1.0 - contamination) * sorted.length) - 1;
        index = Math.max(0, Math.min(sorted.length - 1, index));
        return sorted[index];
    }

    private static double[] columnMeans(double[][] data) {
        double[] means = new double[data[0].length];
        for (double[] row : data) {
            for (int j = 0; j < means.length; j++) {
                means[j] += row[j];
            }
        }
        for (int j = 0; j < means.length; j++) {
            means[j] /= data.length;
        }
        return means;
    }
}
