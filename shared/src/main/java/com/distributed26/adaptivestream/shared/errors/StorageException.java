package com.distributed26.adaptivestream.shared.errors;

/** Object storage or relational store failure. Treated as transient at the rendition level. */
public class StorageException extends PipelineException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
