package com.fleet.diagnostics.exception;

/**
 * Base of every failure the diagnostic pipeline reports or propagates.
 */
public abstract class DiagnosticsException extends RuntimeException {

    protected DiagnosticsException(String message) {
        super(message);
    }

    protected DiagnosticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
