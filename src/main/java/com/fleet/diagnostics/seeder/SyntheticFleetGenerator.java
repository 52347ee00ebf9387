package com.fleet.diagnostics.seeder;

import com.fleet.diagnostics.model.UnitSeries;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Deterministic run-to-failure fleets for local runs and tests.
 *
 * Sensor k sits at level 100 + 25k with Gaussian noise of std 0.5 + 0.25k.
 * Degrading units add a quadratic drift on every sensor from an onset life
 * fraction, reaching {@code driftSigmas} noise stds at end of life.
 * Cycles start at 1 and every unit's observed life is its last cycle.
 */
public class SyntheticFleetGenerator {

    private final List<String> sensors;
    private final Random random;

    public SyntheticFleetGenerator(List<String> sensors, long seed) {
        this.sensors = List.copyOf(sensors);
        this.random = new Random(seed);
    }

    public UnitSeries healthyUnit(String unitId, int life) {
        return unit(unitId, life, 1.0, 0.0);
    }

    public UnitSeries degradingUnit(String unitId, int life, double onsetFraction, double driftSigmas) {
        if (onsetFraction < 0.0 || onsetFraction >= 1.0) {
            throw new IllegalArgumentException("onsetFraction must be in [0, 1): " + onsetFraction);
        }
        return unit(unitId, life, onsetFraction, driftSigmas);
    }

    /**
     * @param degradingShare share of units, taken from the end of the fleet, that degrade from mid-life
     */
    public List<UnitSeries> fleet(int units, int minLife, int maxLife, double degradingShare, double driftSigmas) {
        if (minLife < 1 || maxLife < minLife) {
            throw new IllegalArgumentException("Invalid life range [" + minLife + ", " + maxLife + "]");
        }
        int degrading = (int) Math.round(units * degradingShare);
        List<UnitSeries> fleet = new ArrayList<>(units);
        for (int u = 1; u <= units; u++) {
            String unitId = String.format("UNIT-%03d", u);
            int life = minLife + random.nextInt(maxLife - minLife + 1);
            fleet.add(u > units - degrading
                    ? degradingUnit(unitId, life, 0.5, driftSigmas)
                    : healthyUnit(unitId, life));
        }
        return fleet;
    }

    private UnitSeries unit(String unitId, int life, double onsetFraction, double driftSigmas) {
        int[] cycles = new int[life];
        for (int i = 0; i < life; i++) {
            cycles[i] = i + 1;
        }

        Map<String, double[]> values = new LinkedHashMap<>();
        for (int k = 0; k < sensors.size(); k++) {
            double level = 100.0 + 25.0 * k;
            double noise = 0.5 + 0.25 * k;
            double[] series = new double[life];
            for (int i = 0; i < life; i++) {
                double fraction = (double) cycles[i] / life;
                double drift = 0.0;
                if (driftSigmas != 0.0 && fraction > onsetFraction) {
                    double progress = (fraction - onsetFraction) / (1.0 - onsetFraction);
                    drift = driftSigmas * noise * progress * progress;
                }
                series[i] = level + drift + noise * random.nextGaussian();
            }
            values.put(sensors.get(k), series);
        }

        return UnitSeries.builder()
                .unitId(unitId)
                .cycles(cycles)
                .sensors(values)
                .observedLife(life)
                .build();
    }
}
