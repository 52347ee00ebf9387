package com.fleet.diagnostics.exception;

/**
 * The early-life window of a (unit, sensor) pair has fewer cycles than the
 * configured minimum. The pair is skipped; the batch continues.
 */
public class InsufficientBaselineDataException extends DiagnosticsException {

    private final String unitId;
    private final String sensorId;
    private final int availableCycles;
    private final int requiredCycles;

    public InsufficientBaselineDataException(String unitId, String sensorId, int availableCycles, int requiredCycles) {
        super(String.format("Unit %s sensor %s: baseline window has %d cycles, at least %d required",
                unitId, sensorId, availableCycles, requiredCycles));
        this.unitId = unitId;
        this.sensorId = sensorId;
        this.availableCycles = availableCycles;
        this.requiredCycles = requiredCycles;
    }

    public String getUnitId() { return unitId; }
    public String getSensorId() { return sensorId; }
    public int getAvailableCycles() { return availableCycles; }
    public int getRequiredCycles() { return requiredCycles; }
}
