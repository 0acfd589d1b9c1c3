package com.distributed26.adaptivestream.shared.errors;

/** The container or codec of an input could not be identified. Never retried. */
public class UnsupportedFormatException extends PipelineException {
    public UnsupportedFormatException(String message) {
        super(message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
