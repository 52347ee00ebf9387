package com.fleet.diagnostics.exception;

/**
 * The fleet-wide anomaly model could not be fitted. Only the ML stage is
 * lost; rule results are still emitted.
 */
public class ModelFitFailedException extends DiagnosticsException {

    private final int availableSamples;
    private final int requiredSamples;

    public ModelFitFailedException(int availableSamples, int requiredSamples) {
        super(String.format("Anomaly model fit needs at least %d healthy samples fleet-wide, found %d",
                requiredSamples, availableSamples));
        this.availableSamples = availableSamples;
        this.requiredSamples = requiredSamples;
    }

    public int getAvailableSamples() { return availableSamples; }
    public int getRequiredSamples() { return requiredSamples; }
}
