package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FusionResult {

    String unitId;

    int cycle;

    ConfidenceTier tier;

    List<Alert> alerts;

    // Null when no anomaly evidence exists for this cycle
    AnomalyScore anomalyScore;

    boolean mlAvailable;
}
