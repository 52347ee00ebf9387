package com.fleet.diagnostics.exception;

import java.util.List;

/**
 * A feature set was built over different sensors than the anomaly model was
 * fitted on. This is a configuration error and stops scoring entirely.
 */
public class FeatureMismatchException extends DiagnosticsException {

    private final List<String> expectedSensors;
    private final List<String> actualSensors;

    public FeatureMismatchException(String unitId, List<String> expectedSensors, List<String> actualSensors) {
        super(String.format("Unit %s: feature sensors %s do not match model sensors %s",
                unitId, actualSensors, expectedSensors));
        this.expectedSensors = List.copyOf(expectedSensors);
        this.actualSensors = List.copyOf(actualSensors);
    }

    public List<String> getExpectedSensors() { return expectedSensors; }
    public List<String> getActualSensors() { return actualSensors; }
}
