package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Value;

/**
 * A debounced, cycle-stamped rule alert. Never retracted once raised.
 */
@Value
@Builder
public class Alert {

    String unitId;

    String sensorId;

    int cycle;

    IndicatorKind kind;

    Severity severity;

    double value;

    double threshold;

    // Consecutive exceeding cycles up to and including this one
    int consecutiveCycles;

    String reason;
}
