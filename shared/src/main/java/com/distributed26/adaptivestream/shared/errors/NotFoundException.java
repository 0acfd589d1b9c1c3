package com.distributed26.adaptivestream.shared.errors;

public class NotFoundException extends PipelineException {
    public NotFoundException(String message) {
        super(message);
    }
}
