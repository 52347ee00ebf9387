package com.fleet.diagnostics.engine.isolationforest;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * One cycle's feature vector. The values are copied in and out.
 */
@ToString
@EqualsAndHashCode
public final class FeatureVector {

    /**
     * Where a cycle sits relative to the unit's baseline window.
     */
    public enum Stage {
        // Inside the baseline window: the healthy data the forest is trained on
        BASELINE,
        // Healthy cycles whose indicator windows no longer overlap the baseline window
        CALIBRATION,
        MONITORED
    }

    private final int cycle;
    private final double[] values;
    private final Stage stage;

    public FeatureVector(int cycle, double[] values, Stage stage) {
        this.cycle = cycle;
        this.values = values.clone();
        this.stage = stage;
    }

    public int getCycle() {
        return cycle;
    }

    public double[] getValues() {
        return values.clone();
    }

    public Stage getStage() {
        return stage;
    }
}
