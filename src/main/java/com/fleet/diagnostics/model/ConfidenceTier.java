package com.fleet.diagnostics.model;

/**
 * Fused verdict combining rule evidence with the anomaly model.
 */
public enum ConfidenceTier {
    HIGH_CONFIDENCE("High Confidence"),
    MONITOR("Monitor"),
    INVESTIGATE("Investigate"),
    NORMAL("Normal");

    private final String label;

    ConfidenceTier(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static ConfidenceTier of(boolean ruleAlert, boolean anomaly) {
        if (ruleAlert && anomaly) return HIGH_CONFIDENCE;
        if (ruleAlert) return MONITOR;
        if (anomaly) return INVESTIGATE;
        return NORMAL;
    }
}
