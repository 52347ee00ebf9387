package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One row of the ingestion table: a unit's sensor readings at one cycle.
 */
@Value
@Builder
public class CycleReading {

    String unitId;

    int cycle;

    @Singular
    Map<String, Double> readings;
}
