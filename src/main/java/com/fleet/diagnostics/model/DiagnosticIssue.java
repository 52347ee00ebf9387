package com.fleet.diagnostics.model;

import lombok.Builder;
import lombok.Value;

/**
 * A skipped or degraded piece of work, reported with its cause.
 */
@Value
@Builder
public class DiagnosticIssue {

    // Null for fleet-wide issues
    String unitId;

    // Null for unit-wide or fleet-wide issues
    String sensorId;

    IssueCause cause;

    String message;
}
