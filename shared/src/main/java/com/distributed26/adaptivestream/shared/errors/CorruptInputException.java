package com.distributed26.adaptivestream.shared.errors;

/** The container was recognised but its metadata could not be parsed. Never retried. */
public class CorruptInputException extends PipelineException {
    public CorruptInputException(String message) {
        super(message);
    }

    public CorruptInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
