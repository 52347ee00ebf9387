package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Fleet-level late-versus-early summary of one sensor. Fields are null when
 * no unit had enough points to define them.
 */
@Value
@Builder
public class SensorDegradation {

    String sensorId;

    Double meanShift;

    Double absMeanShift;

    Double varianceRatio;

    Double logVarianceRatio;

    Double slope;

    Double absSlope;

    // Sample std of the pooled early-life readings
    Double baselineStdEarly;

    Double meanShiftStd;

    Double absMeanShiftStd;

    Double slopeStd;

    Double absSlopeStd;

    int unitsUsedShift;

    int unitsUsedSlope;

    // |mean shift| + |slope| in baseline sigmas, plus any log variance increase
    double score;
}
