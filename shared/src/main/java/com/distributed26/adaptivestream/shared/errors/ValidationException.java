package com.distributed26.adaptivestream.shared.errors;

public class ValidationException extends PipelineException {
    public ValidationException(String message) {
        super(message);
    }
}
