package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnomalyModelSummary {

    public enum Status { FITTED, SUPPLIED, FAILED }

    Status status;

    List<String> sensors;

    int trainingSamples;

    int calibrationSamples;

    double threshold;

    double contamination;

    String failureReason;
}
