package com.fleet.diagnostics.engine.isolationforest;

import com.fleet.diagnostics.model.IndicatorRecord;
import com.fleet.diagnostics.model.UnitSeries;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a unit's multivariate feature vectors from its indicator records.
 *
 * For each sensor, in the given order, a vector carries three features:
 *   [3k]     mean shift z
 *   [3k + 1] variance ratio
 *   [3k + 2] trend slope z
 *
 * A cycle yields a vector only when every sensor has all three indicators
 * defined there.
 */
@Component
public class FeatureExtractor {

    public static final int FEATURES_PER_SENSOR = 3;

    private static final String[] INDICATOR_NAMES = {"meanShiftZ", "varianceRatio", "trendSlopeZ"};

    public static List<String> featureNames(List<String> sensors) {
        List<String> names = new ArrayList<>(sensors.size() * FEATURES_PER_SENSOR);
        for (String sensor : sensors) {
            for (String indicator : INDICATOR_NAMES) {
                names.add(sensor + "." + indicator);
            }
        }
        return names;
    }

    /**
     * Cycle {@code index} of a unit is BASELINE inside the first {@code baselineLength}
     * cycles. The CALIBRATION stage is the next {@code baselineLength} cycles whose
     * trailing windows, {@code lookback} cycles long, hold no baseline cycle.
     * Everything else is MONITORED.
     */
    static FeatureVector.Stage stageOf(int index, int baselineLength, int lookback) {
        if (index < baselineLength) {
            return FeatureVector.Stage.BASELINE;
        }
        int calibrationStart = baselineLength + lookback - 1;
        if (index >= calibrationStart && index < calibrationStart + baselineLength) {
            return FeatureVector.Stage.CALIBRATION;
        }
        return FeatureVector.Stage.MONITORED;
    }

    /**
     * @param recordsBySensor indicator records of the unit, per sensor, in cycle order
     * @param baselineLength  cycles in the unit's baseline window
     * @param lookback        longest indicator window, in cycles
     */
    public FeatureSet extract(UnitSeries unit, List<String> sensors,
                              Map<String, List<IndicatorRecord>> recordsBySensor, int baselineLength, int lookback) {
        String unitId = unit.getUnitId();
        List<Map<Integer, IndicatorRecord>> byCycle = new ArrayList<>(sensors.size());
        for (String sensor : sensors) {
            List<IndicatorRecord> records = recordsBySensor.get(sensor);
            if (records == null) {
                throw new IllegalArgumentException("Unit " + unitId + " has no indicator records for sensor " + sensor);
            }
            Map<Integer, IndicatorRecord> index = new HashMap<>();
            for (IndicatorRecord record : records) {
                index.put(record.getCycle(), record);
            }
            byCycle.add(index);
        }

        List<FeatureVector> vectors = new ArrayList<>();
        if (sensors.isEmpty()) {
            return new FeatureSet(unitId, List.copyOf(sensors), vectors);
        }

        double[] values = new double[sensors.size() * FEATURES_PER_SENSOR];
        for (int i = 0; i < unit.size(); i++) {
            int cycle = unit.cycleAt(i);
            if (fill(values, byCycle, cycle)) {
                vectors.add(new FeatureVector(cycle, values, stageOf(i, baselineLength, lookback)));
            }
        }
        return new FeatureSet(unitId, List.copyOf(sensors), vectors);
    }

    // False when any sensor lacks a complete record at this cycle
    private static boolean fill(double[] values, List<Map<Integer, IndicatorRecord>> byCycle, int cycle) {
        for (int k = 0; k < byCycle.size(); k++) {
            IndicatorRecord record = byCycle.get(k).get(cycle);
            if (record == null || !record.isComplete()) {
                return false;
            }
            values[k * FEATURES_PER_SENSOR] = record.getMeanShiftZ();
            values[k * FEATURES_PER_SENSOR + 1] = record.getVarianceRatio();
            values[k * FEATURES_PER_SENSOR + 2] = record.getTrendSlopeZ();
        }
        return true;
    }
}
