package com.fleet.diagnostics.engine.isolationforest;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.util.List;

/**
 * The fitted fleet anomaly model. Produced once by the trainer and passed by
 * reference into every scoring call; nothing in it changes after the fit.
 */
@Value
@Builder
public class AnomalyModel {

    IsolationForest forest;

    // Sensor order the feature vectors were built with
    List<String> sensors;

    List<String> featureNames;

    // Scores strictly above this are anomalous
    double threshold;

    double contamination;

    int trainingSamples;

    // Vectors the threshold was taken from; 0 when it fell back to the training scores
    int calibrationSamples;

    // Column means of the training vectors, used for feature contributions
    @Getter(AccessLevel.NONE)
    double[] featureMeans;

    public double[] getFeatureMeans() {
        return featureMeans.clone();
    }

    public static class AnomalyModelBuilder {

        public AnomalyModelBuilder featureMeans(double[] featureMeans) {
            this.featureMeans = featureMeans.clone();
            return this;
        }
    }
}
