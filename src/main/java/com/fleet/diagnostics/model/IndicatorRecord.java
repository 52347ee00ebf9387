package com.fleet.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Indicators of one sensor at one cycle. Each indicator stays {@code null}
 * until its trailing window has filled.
 */
@Value
@Builder
public class IndicatorRecord {

    String unitId;

    String sensorId;

    int cycle;

    // Null when the unit's total life is unknown
    Double lifeFraction;

    // (rolling mean - mean0) / std0
    Double meanShiftZ;

    // rolling variance / std0^2; 1.0 is baseline-level spread
    Double varianceRatio;

    // OLS slope over the trend window, in baseline sigmas per window of life
    Double trendSlopeZ;

    @JsonIgnore
    public boolean isComplete() {
        return meanShiftZ != null && varianceRatio != null && trendSlopeZ != null;
    }
}
