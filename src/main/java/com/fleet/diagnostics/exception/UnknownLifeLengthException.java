package com.fleet.diagnostics.exception;

/**
 * The unit's total life is not known (still in service), so no life fraction
 * can be computed for it.
 */
public class UnknownLifeLengthException extends DiagnosticsException {

    private final String unitId;

    public UnknownLifeLengthException(String unitId) {
        super("Unit " + unitId + ": total observed life is unknown, life fraction unavailable");
        this.unitId = unitId;
    }

    public String getUnitId() { return unitId; }
}
