package com.distributed26.adaptivestream.shared.errors;

/**
 * Root of the pipeline's error taxonomy. All subtypes are unchecked; the HTTP layers map
 * each one to a status code and the orchestrator records {@link #describe()} as a failure reason.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Human-readable reason, e.g. {@code "UnsupportedFormatException: no video stream"}. */
    public String describe() {
        return getClass().getSimpleName() + ": " + getMessage();
    }
}
