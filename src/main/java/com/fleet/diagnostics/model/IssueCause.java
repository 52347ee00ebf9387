package com.fleet.diagnostics.model;

public enum IssueCause {
    // Baseline window too short; the (unit, sensor) pair is skipped downstream
    INSUFFICIENT_BASELINE_DATA,
    // Total life unknown; life fractions omitted, indicators kept
    UNKNOWN_LIFE_LENGTH,
    // Unit lacks a complete sensor set and gets rule-only tiers
    EXCLUDED_FROM_ANOMALY_MODEL,
    // Fleet-wide fit failed; every unit gets rule-only tiers
    MODEL_FIT_FAILED
}
