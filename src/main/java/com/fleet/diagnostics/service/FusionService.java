package com.fleet.diagnostics.service;

import com.fleet.diagnostics.model.Alert;
import com.fleet.diagnostics.model.AnomalyScore;
import com.fleet.diagnostics.model.ConfidenceTier;
import com.fleet.diagnostics.model.FusionResult;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Combines rule evidence and anomaly evidence for one (unit, cycle) into a
 * confidence tier. Pure and stateless: no smoothing happens here, since
 * stabilisation already lives in the rule debounce and the model threshold.
 *
 *   alert + anomaly    -> HIGH_CONFIDENCE
 *   alert only         -> MONITOR
 *   anomaly only       -> INVESTIGATE
 *   neither            -> NORMAL
 *
 * A cycle with no anomaly score (model unavailable, unit excluded, vector
 * undefined) counts as not anomalous, which leaves the rule-only tiers.
 */
@Service
public class FusionService {

    public FusionResult fuse(String unitId, int cycle, List<Alert> alerts, AnomalyScore anomalyScore) {
        boolean ruleAlert = !alerts.isEmpty();
        boolean anomaly = anomalyScore != null && anomalyScore.isAnomaly();

        return FusionResult.builder()
                .unitId(unitId)
                .cycle(cycle)
                .tier(ConfidenceTier.of(ruleAlert, anomaly))
                .alerts(List.copyOf(alerts))
                .anomalyScore(anomalyScore)
                .mlAvailable(anomalyScore != null)
                .build();
    }
}
