package com.fleet.diagnostics.model;

/**
 * The three baseline-normalized indicators a rule can watch.
 */
public enum IndicatorKind {
    MEAN_SHIFT,
    VARIANCE_INCREASE,
    TREND
}
