package com.fleet.diagnostics.engine.baseline;

import com.fleet.diagnostics.exception.UnknownLifeLengthException;
import com.fleet.diagnostics.model.UnitSeries;
import org.springframework.stereotype.Component;

/**
 * Maps a cycle index onto the unit's life as c / L, clamped to [0, 1].
 *
 * L is the unit's total recorded life, which is only known once the unit has
 * run to the end of its record. For an in-service unit the caller may supply
 * an expected life as {@code observedLife}; otherwise no fraction exists.
 */
@Component
public class LifeNormalizer {

    public double lifeFraction(String unitId, Integer observedLife, int cycle) {
        if (observedLife == null || observedLife <= 0) {
            throw new UnknownLifeLengthException(unitId);
        }
        double fraction = (double) cycle / observedLife;
        return Math.max(0.0, Math.min(1.0, fraction));
    }

    public double[] lifeFractions(UnitSeries unit) {
        double[] fractions = new double[unit.size()];
        for (int i = 0; i < fractions.length; i++) {
            fractions[i] = lifeFraction(unit.getUnitId(), unit.getObservedLife(), unit.cycleAt(i));
        }
        return fractions;
    }
}
