package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Singular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One unit's clean readings: strictly increasing cycles and one value per
 * cycle for every sensor. Arrays are copied in and out, so an instance never
 * changes after construction.
 */
public final class UnitSeries {

    private final String unitId;
    private final int[] cycles;
    private final Map<String, double[]> sensorValues;
    private final Integer observedLife;

    /**
     * @param observedLife total recorded life L of the unit; null while the
     *                     unit is still in service and L is not known
     */
    @Builder
    private UnitSeries(String unitId, int[] cycles, @Singular("sensor") Map<String, double[]> sensors,
                       Integer observedLife) {
        this.unitId = Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(cycles, "cycles");

        for (int i = 1; i < cycles.length; i++) {
            if (cycles[i] <= cycles[i - 1]) {
                throw new IllegalArgumentException(String.format(
                        "Unit %s: cycles must be strictly increasing, got %d after %d",
                        unitId, cycles[i], cycles[i - 1]));
            }
        }

        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : sensors.entrySet()) {
            double[] values = entry.getValue();
            if (values == null || values.length != cycles.length) {
                throw new IllegalArgumentException(String.format(
                        "Unit %s: sensor %s has %d values for %d cycles",
                        unitId, entry.getKey(), values == null ? 0 : values.length, cycles.length));
            }
            copy.put(entry.getKey(), values.clone());
        }

        this.cycles = cycles.clone();
        this.sensorValues = Collections.unmodifiableMap(copy);
        this.observedLife = observedLife;
    }

    public String getUnitId() {
        return unitId;
    }

    public Integer getObservedLife() {
        return observedLife;
    }

    public int size() {
        return cycles.length;
    }

    public int cycleAt(int index) {
        return cycles[index];
    }

    public int[] cycles() {
        return cycles.clone();
    }

    public boolean hasSensor(String sensorId) {
        return sensorValues.containsKey(sensorId);
    }

    public List<String> getSensorIds() {
        return new ArrayList<>(sensorValues.keySet());
    }

    public double[] values(String sensorId) {
        double[] values = sensorValues.get(sensorId);
        if (values == null) {
            throw new IllegalArgumentException("Unit " + unitId + " has no readings for sensor " + sensorId);
        }
        return values.clone();
    }

    @Override
    public String toString() {
        return "UnitSeries{unitId=" + unitId
                + ", cycles=" + cycles.length
                + ", sensors=" + sensorValues.keySet()
                + ", observedLife=" + observedLife
                + "}";
    }
}
