package com.fleet.diagnostics.engine.indicator;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.model.Baseline;
import com.fleet.diagnostics.model.IndicatorRecord;
import com.fleet.diagnostics.model.UnitSeries;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the three baseline-normalized indicators of one sensor over one
 * unit, using trailing windows that end at (and include) each cycle:
 *
 *   mean shift     (rollingMean(W) - mean0) / std0
 *   variance ratio max(rollingVar(W), eps^2) / std0^2
 *   trend slope    OLS slope over T cycles * x-range of the window / std0
 *
 * The trend is fitted against life fraction when known, otherwise against
 * the raw cycle index. Slope times x-range is unchanged by a linear rescaling
 * of x, so both give the same value in baseline sigmas.
 */
@Component
public class RollingIndicatorComputer {

    private final DiagnosticsConfig config;

    public RollingIndicatorComputer(DiagnosticsConfig config) {
        this.config = config;
    }

    /**
     * @param lifeFractions per-cycle life fractions of the unit, or null when its life is unknown
     * @return one record per cycle where at least one indicator is defined, in cycle order
     */
    public List<IndicatorRecord> compute(UnitSeries unit, String sensorId, Baseline baseline, double[] lifeFractions) {
        int n = unit.size();
        if (lifeFractions != null && lifeFractions.length != n) {
            throw new IllegalArgumentException(String.format(
                    "Unit %s: %d life fractions for %d cycles", unit.getUnitId(), lifeFractions.length, n));
        }

        double[] values = unit.values(sensorId);
        double[] x = lifeFractions != null ? lifeFractions : cycleAxis(unit);

        int window = config.getIndicators().getWindow();
        int trendWindow = config.getIndicators().getTrendWindow();
        double epsilon = config.getBaseline().getEpsilon();
        double mean0 = baseline.getMean0();
        double std0 = baseline.getStd0();
        double varianceFloor = epsilon * epsilon;

        List<IndicatorRecord> records = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Double meanShiftZ = null;
            Double varianceRatio = null;
            Double trendSlopeZ = null;

            if (i + 1 >= window) {
                int from = i + 1 - window;
                double rollingMean = WindowStatistics.mean(values, from, i + 1);
                double rollingVar = WindowStatistics.sampleVariance(values, from, i + 1);
                meanShiftZ = (rollingMean - mean0) / std0;
                varianceRatio = Math.max(rollingVar, varianceFloor) / (std0 * std0);
            }

            if (i + 1 >= trendWindow) {
                int from = i + 1 - trendWindow;
                double slope = WindowStatistics.olsSlope(x, values, from, i + 1);
                double range = x[i] - x[from];
                trendSlopeZ = slope * range / std0;
            }

            if (meanShiftZ == null && trendSlopeZ == null) {
                continue;
            }

            records.add(IndicatorRecord.builder()
                    .unitId(unit.getUnitId())
                    .sensorId(sensorId)
                    .cycle(unit.cycleAt(i))
                    .lifeFraction(lifeFractions != null ? lifeFractions[i] : null)
                    .meanShiftZ(meanShiftZ)
                    .varianceRatio(varianceRatio)
                    .trendSlopeZ(trendSlopeZ)
                    .build());
        }
        return records;
    }

    private double[] cycleAxis(UnitSeries unit) {
        double[] axis = new double[unit.size()];
        for (int i = 0; i < axis.length; i++) {
            axis[i] = unit.cycleAt(i);
        }
        return axis;
    }
}
