package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One row of the output table, keyed by (unitId, cycle).
 */
@Value
@Builder
public class DiagnosticRow {

    String unitId;

    int cycle;

    Double lifeFraction;

    // Sensor id to indicators; sensors without a record at this cycle are absent
    Map<String, IndicatorRecord> indicators;

    List<Alert> alerts;

    Double anomalyScore;

    Boolean anomaly;

    // Strongest anomaly-model contributors; empty unless the cycle is anomalous
    List<String> anomalyContributors;

    ConfidenceTier tier;
}
