package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Healthy reference statistics of one sensor on one unit, taken from the
 * unit's early-life window.
 */
@Value
@Builder
public class Baseline {

    String unitId;

    String sensorId;

    double mean0;

    // Sample standard deviation, floored to epsilon
    double std0;

    // Cycles in the early-life window
    int sampleCount;
}
