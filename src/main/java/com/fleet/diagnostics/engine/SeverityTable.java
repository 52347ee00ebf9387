package com.fleet.diagnostics.engine;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered (multiple of threshold, severity) breakpoints. A magnitude gets the
 * severity of the highest breakpoint it reaches, and the lowest tier's
 * severity if it reaches none.
 */
public final class SeverityTable {

    private final double[] multiples;
    private final Severity[] severities;

    private SeverityTable(double[] multiples, Severity[] severities) {
        this.multiples = multiples;
        this.severities = severities;
    }

    public static SeverityTable from(List<DiagnosticsConfig.SeverityTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("At least one severity tier is required");
        }
        List<DiagnosticsConfig.SeverityTier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparingDouble(DiagnosticsConfig.SeverityTier::getMultiple));

        double[] multiples = new double[sorted.size()];
        Severity[] severities = new Severity[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            multiples[i] = sorted.get(i).getMultiple();
            severities[i] = sorted.get(i).getSeverity();
        }
        return new SeverityTable(multiples, severities);
    }

    public Severity lookup(double magnitude, double threshold) {
        Severity result = severities[0];
        for (int i = 0; i < multiples.length; i++) {
            if (magnitude < multiples[i] * threshold) break;
            result = severities[i];
        }
        return result;
    }
}
