package com.distributed26.adaptivestream.shared.errors;

public class RangeNotSatisfiableException extends PipelineException {
    private final long totalLength;

    public RangeNotSatisfiableException(String message, long totalLength) {
        super(message);
        this.totalLength = totalLength;
    }

    public long getTotalLength() {
        return totalLength;
    }
}
