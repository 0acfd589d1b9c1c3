package com.distributed26.adaptivestream.shared.errors;

/** A pipeline run is already active for the video. Rejected synchronously. */
public class ConcurrencyConflictException extends PipelineException {
    public ConcurrencyConflictException(String message) {
        super(message);
    }
}
