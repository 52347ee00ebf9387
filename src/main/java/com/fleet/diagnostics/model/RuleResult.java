package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of testing one indicator of one record against its threshold,
 * before debouncing.
 */
@Value
@Builder
public class RuleResult {

    IndicatorKind kind;

    // Whether the indicator reached its threshold at this cycle
    boolean exceeded;

    // Indicator value as recorded; null when undefined
    Double value;

    // Magnitude compared against the threshold (absolute value for signed indicators)
    double magnitude;

    double threshold;

    String reason;
}
