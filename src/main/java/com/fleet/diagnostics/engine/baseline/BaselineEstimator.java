package com.fleet.diagnostics.engine.baseline;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.engine.indicator.WindowStatistics;
import com.fleet.diagnostics.exception.InsufficientBaselineDataException;
import com.fleet.diagnostics.model.Baseline;
import com.fleet.diagnostics.model.UnitSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives a unit's healthy reference for one sensor from its early-life window.
 *
 * The window is the first K cycles, or the first floor(f0 * n) of the n
 * recorded cycles when a window fraction is configured instead. A unit
 * shorter than K uses what it has, provided that still reaches K_min.
 */
@Component
public class BaselineEstimator {

    private static final Logger log = LoggerFactory.getLogger(BaselineEstimator.class);

    private final DiagnosticsConfig config;

    public BaselineEstimator(DiagnosticsConfig config) {
        this.config = config;
    }

    /**
     * @throws InsufficientBaselineDataException when the window holds fewer than K_min cycles
     */
    public Baseline estimate(UnitSeries unit, String sensorId) {
        int window = windowLength(unit.size());
        int minCycles = config.getBaseline().getMinCycles();
        if (window < minCycles) {
            throw new InsufficientBaselineDataException(unit.getUnitId(), sensorId, window, minCycles);
        }

        double[] values = unit.values(sensorId);
        double mean0 = WindowStatistics.mean(values, 0, window);
        double std = Math.sqrt(WindowStatistics.sampleVariance(values, 0, window));
        double std0 = Math.max(std, config.getBaseline().getEpsilon());

        log.debug("Baseline for unit {} sensor {}: mean0={}, std0={}, cycles={}",
                unit.getUnitId(), sensorId, mean0, std0, window);

        return Baseline.builder()
                .unitId(unit.getUnitId())
                .sensorId(sensorId)
                .mean0(mean0)
                .std0(std0)
                .sampleCount(window)
                .build();
    }

    /**
     * Number of leading cycles forming the early-life window of a unit with
     * {@code recordedCycles} cycles.
     */
    public int windowLength(int recordedCycles) {
        DiagnosticsConfig.Baseline baseline = config.getBaseline();
        if (baseline.getWindowCycles() != null) {
            return Math.min(baseline.getWindowCycles(), recordedCycles);
        }
        return (int) Math.floor(baseline.getWindowFraction() * recordedCycles);
    }
}
