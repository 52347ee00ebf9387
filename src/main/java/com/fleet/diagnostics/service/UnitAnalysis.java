package com.fleet.diagnostics.service;

import com.fleet.diagnostics.engine.isolationforest.FeatureSet;
import com.fleet.diagnostics.model.Alert;
import com.fleet.diagnostics.model.DiagnosticIssue;
import com.fleet.diagnostics.model.IndicatorRecord;
import com.fleet.diagnostics.model.UnitSeries;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the per-unit phase derives before the fleet model exists.
 */
@Value
@Builder
class UnitAnalysis {

    UnitSeries unit;

    // Null when the unit's life is unknown
    double[] lifeFractions;

    // Only sensors with a valid baseline appear here
    Map<String, List<IndicatorRecord>> recordsBySensor;

    List<Alert> alerts;

    // Null when the unit is excluded from the anomaly model
    FeatureSet featureSet;

    List<DiagnosticIssue> issues;
}
