package com.fleet.diagnostics.engine.isolationforest;

import com.fleet.diagnostics.exception.FeatureMismatchException;
import com.fleet.diagnostics.model.AnomalyScore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Scores a unit's feature vectors against a fitted model. Holds no state, so
 * a single instance serves all units concurrently.
 */
@Component
public class AnomalyScorer {

    private static final int TOP_CONTRIBUTORS = 3;

    /**
     * @throws FeatureMismatchException when the feature set's sensors differ from the model's
     */
    public void checkCompatible(AnomalyModel model, FeatureSet featureSet) {
        if (!model.getSensors().equals(featureSet.getSensors())) {
            throw new FeatureMismatchException(featureSet.getUnitId(), model.getSensors(), featureSet.getSensors());
        }
    }

    public List<AnomalyScore> score(AnomalyModel model, FeatureSet featureSet) {
        checkCompatible(model, featureSet);

        List<AnomalyScore> scores = new ArrayList<>(featureSet.getVectors().size());
        for (FeatureVector vector : featureSet.getVectors()) {
            double score = model.getForest().anomalyScore(vector.getValues());
            boolean anomaly = score > model.getThreshold();

            AnomalyScore.AnomalyScoreBuilder builder = AnomalyScore.builder()
                    .unitId(featureSet.getUnitId())
                    .cycle(vector.getCycle())
                    .score(score)
                    .anomaly(anomaly);
            if (anomaly) {
                builder.topContributors(topContributors(model, vector.getValues()));
            }
            scores.add(builder.build());
        }
        return scores;
    }

    private List<String> topContributors(AnomalyModel model, double[] values) {
        double[] contributions = model.getForest().featureContributions(values, model.getFeatureMeans());
        List<String> names = model.getFeatureNames();
        return IntStream.range(0, contributions.length)
                .filter(i -> contributions[i] > 0)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> contributions[i]).reversed()
                        .thenComparingInt(i -> i))
                .limit(TOP_CONTRIBUTORS)
                .map(i -> String.format("%s=%.2f (contribution=%.3f)", names.get(i), values[i], contributions[i]))
                .collect(Collectors.toList());
    }
}
