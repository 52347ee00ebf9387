package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnomalyScore {

    String unitId;

    int cycle;

    // Isolation score in [0, 1]; higher is more anomalous
    double score;

    boolean anomaly;

    // Features that pushed an anomalous cycle over the threshold, strongest first
    @Singular
    List<String> topContributors;
}
