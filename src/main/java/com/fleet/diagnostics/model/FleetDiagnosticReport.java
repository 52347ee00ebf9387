package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FleetDiagnosticReport {

    // Sorted by unit (input order) then cycle
    List<DiagnosticRow> rows;

    List<DiagnosticIssue> issues;

    AnomalyModelSummary anomalyModel;

    List<SensorDegradation> degradationRanking;
}
