package com.fleet.diagnostics.service;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.model.CycleReading;
import com.fleet.diagnostics.model.UnitSeries;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Regroups a flat (unit, cycle) table into per-unit series over the
 * configured sensors. Units keep the order of their first row.
 */
@Component
public class SeriesAssembler {

    private final DiagnosticsConfig config;

    public SeriesAssembler(DiagnosticsConfig config) {
        this.config = config;
    }

    /**
     * @param runToFailure whether each unit's record ends at end of life, making
     *                     its last cycle the observed life
     * @throws IllegalArgumentException on a missing in-scope reading or non-increasing cycles
     */
    public List<UnitSeries> assemble(List<CycleReading> rows, boolean runToFailure) {
        Map<String, List<CycleReading>> byUnit = new LinkedHashMap<>();
        for (CycleReading row : rows) {
            byUnit.computeIfAbsent(row.getUnitId(), k -> new ArrayList<>()).add(row);
        }

        List<UnitSeries> fleet = new ArrayList<>(byUnit.size());
        for (Map.Entry<String, List<CycleReading>> entry : byUnit.entrySet()) {
            fleet.add(toSeries(entry.getKey(), entry.getValue(), runToFailure));
        }
        return fleet;
    }

    private UnitSeries toSeries(String unitId, List<CycleReading> unitRows, boolean runToFailure) {
        int n = unitRows.size();
        int[] cycles = new int[n];
        Map<String, double[]> values = new LinkedHashMap<>();
        for (String sensor : config.getSensors()) {
            values.put(sensor, new double[n]);
        }

        for (int i = 0; i < n; i++) {
            CycleReading row = unitRows.get(i);
            cycles[i] = row.getCycle();
            for (String sensor : config.getSensors()) {
                Double reading = row.getReadings().get(sensor);
                if (reading == null) {
                    throw new IllegalArgumentException(String.format(
                            "Unit %s cycle %d: missing reading for sensor %s", unitId, row.getCycle(), sensor));
                }
                values.get(sensor)[i] = reading;
            }
        }

        return UnitSeries.builder()
                .unitId(unitId)
                .cycles(cycles)
                .sensors(values)
                .observedLife(runToFailure && n > 0 ? cycles[n - 1] : null)
                .build();
    }
}
