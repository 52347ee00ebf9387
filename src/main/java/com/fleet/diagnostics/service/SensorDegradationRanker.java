package com.fleet.diagnostics.service;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.engine.baseline.LifeNormalizer;
import com.fleet.diagnostics.engine.indicator.WindowStatistics;
import com.fleet.diagnostics.exception.UnknownLifeLengthException;
import com.fleet.diagnostics.model.SensorDegradation;
import com.fleet.diagnostics.model.UnitSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks the configured sensors by how much the fleet degrades on them, late
 * life against early life:
 *
 *   score = |mean shift| / std + |slope| / std + max(0, ln variance ratio)
 *
 * where std is the sample std of all early-life readings pooled over the
 * fleet. Shifts and variance ratios are per unit, then averaged; slopes are
 * fitted per unit against life fraction over the whole record. Units with no
 * known life are left out.
 */
@Service
public class SensorDegradationRanker {

    private static final Logger log = LoggerFactory.getLogger(SensorDegradationRanker.class);

    private final DiagnosticsConfig config;
    private final LifeNormalizer lifeNormalizer;

    public SensorDegradationRanker(DiagnosticsConfig config, LifeNormalizer lifeNormalizer) {
        this.config = config;
        this.lifeNormalizer = lifeNormalizer;
    }

    public List<SensorDegradation> rank(List<UnitSeries> fleet) {
        Map<UnitSeries, double[]> lifeFractions = new LinkedHashMap<>();
        int excluded = 0;
        for (UnitSeries unit : fleet) {
            try {
                lifeFractions.put(unit, lifeNormalizer.lifeFractions(unit));
            } catch (UnknownLifeLengthException e) {
                excluded++;
            }
        }
        if (excluded > 0) {
            log.info("Degradation ranking excludes {} of {} units with unknown life", excluded, fleet.size());
        }

        List<SensorDegradation> ranking = new ArrayList<>();
        for (String sensorId : config.getSensors()) {
            ranking.add(summarize(sensorId, lifeFractions));
        }
        ranking.sort(Comparator.comparingDouble(SensorDegradation::getScore).reversed());
        return ranking;
    }

    private SensorDegradation summarize(String sensorId, Map<UnitSeries, double[]> lifeFractions) {
        DiagnosticsConfig.Ranking ranking = config.getRanking();
        double earlyFraction = ranking.getEarlyFraction();
        double lateFraction = ranking.getLateFraction();
        int minPoints = ranking.getMinPointsPerWindow();

        List<Double> shifts = new ArrayList<>();
        List<Double> varianceRatios = new ArrayList<>();
        List<Double> slopes = new ArrayList<>();
        List<Double> pooledEarly = new ArrayList<>();

        for (Map.Entry<UnitSeries, double[]> entry : lifeFractions.entrySet()) {
            UnitSeries unit = entry.getKey();
            if (!unit.hasSensor(sensorId) || unit.size() == 0) {
                continue;
            }
            double[] x = entry.getValue();
            double[] y = unit.values(sensorId);

            double[] early = select(x, y, earlyFraction, true);
            double[] late = select(x, y, lateFraction, false);
            for (double v : early) {
                pooledEarly.add(v);
            }

            if (early.length >= minPoints && late.length >= minPoints) {
                shifts.add(WindowStatistics.mean(late, 0, late.length) - WindowStatistics.mean(early, 0, early.length));
                double earlyVar = WindowStatistics.sampleVariance(early, 0, early.length);
                if (earlyVar > 0) {
                    varianceRatios.add(WindowStatistics.sampleVariance(late, 0, late.length) / earlyVar);
                }
            }

            if (y.length >= ranking.getMinPointsForSlope()) {
                slopes.add(WindowStatistics.olsSlope(x, y, 0, y.length));
            }
        }

        Double meanShift = average(shifts, false);
        Double absMeanShift = average(shifts, true);
        Double varianceRatio = average(varianceRatios, false);
        Double logVarianceRatio = varianceRatio != null && varianceRatio > 0 ? Math.log(varianceRatio) : null;
        Double slope = average(slopes, false);
        Double absSlope = average(slopes, true);

        Double baselineStd = null;
        if (pooledEarly.size() >= 2) {
            double[] pooled = pooledEarly.stream().mapToDouble(Double::doubleValue).toArray();
            double std = Math.sqrt(WindowStatistics.sampleVariance(pooled, 0, pooled.length));
            baselineStd = std > 0 ? std : null;
        }

        Double absMeanShiftStd = scale(absMeanShift, baselineStd);
        Double absSlopeStd = scale(absSlope, baselineStd);
        double score = orZero(absMeanShiftStd)
                + orZero(absSlopeStd)
                + Math.max(0.0, orZero(logVarianceRatio));

        log.debug("Sensor {}: shift units={}, slope units={}, score={}", sensorId, shifts.size(), slopes.size(), score);

        return SensorDegradation.builder()
                .sensorId(sensorId)
                .meanShift(meanShift)
                .absMeanShift(absMeanShift)
                .varianceRatio(varianceRatio)
                .logVarianceRatio(logVarianceRatio)
                .slope(slope)
                .absSlope(absSlope)
                .baselineStdEarly(baselineStd)
                .meanShiftStd(scale(meanShift, baselineStd))
                .absMeanShiftStd(absMeanShiftStd)
                .slopeStd(scale(slope, baselineStd))
                .absSlopeStd(absSlopeStd)
                .unitsUsedShift(shifts.size())
                .unitsUsedSlope(slopes.size())
                .score(score)
                .build();
    }

    private static double[] select(double[] lifeFractions, double[] values, double bound, boolean atOrBelow) {
        List<Double> selected = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            boolean inWindow = atOrBelow ? lifeFractions[i] <= bound : lifeFractions[i] >= bound;
            if (inWindow) {
                selected.add(values[i]);
            }
        }
        return selected.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static Double average(List<Double> values, boolean absolute) {
        if (values.isEmpty()) return null;
        return values.stream()
                .mapToDouble(v -> absolute ? Math.abs(v) : v)
                .average()
                .orElseThrow();
    }

    private static Double scale(Double value, Double std) {
        return value != null && std != null ? value / std : null;
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
