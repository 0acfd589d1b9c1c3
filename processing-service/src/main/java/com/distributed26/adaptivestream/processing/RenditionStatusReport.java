package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.shared.model.Rendition;
import com.distributed26.adaptivestream.shared.model.RenditionStatus;

public class RenditionStatusReport {
    private final String quality;
    private final RenditionStatus status;
    private final int attempts;
    private final int segmentCount;
    private final String failureReason;

    public RenditionStatusReport(String quality, RenditionStatus status, int attempts, int segmentCount,
                                 String failureReason) {
        this.quality = quality;
        this.status = status;
        this.attempts = attempts;
        this.segmentCount = segmentCount;
        this.failureReason = failureReason;
    }

    /** {@code storedSegments} counts what is durable so far for a rendition still in progress. */
    static RenditionStatusReport of(Rendition rendition, int storedSegments) {
        int segments = rendition.isReady() ? rendition.getSegmentCount() : storedSegments;
        return new RenditionStatusReport(rendition.getQuality(), rendition.getStatus(), rendition.getAttempts(),
                segments, rendition.getFailureReason());
    }

    public String getQuality() { return quality; }
    public RenditionStatus getStatus() { return status; }
    public int getAttempts() { return attempts; }
    public int getSegmentCount() { return segmentCount; }
    public String getFailureReason() { return failureReason; }
}
