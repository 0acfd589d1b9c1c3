package com.distributed26.adaptivestream.shared.events;

import com.distributed26.adaptivestream.shared.model.RenditionStatus;
import java.time.Instant;
import java.util.Objects;

public class RenditionStatusEvent extends PipelineEvent {
    public static final String TYPE = "rendition-status";

    private final String quality;
    private final RenditionStatus status;
    private final int attempts;
    private final String reason;

    public RenditionStatusEvent(String videoId, String quality, RenditionStatus status, int attempts,
                                String reason, Instant timestamp) {
        super(videoId, timestamp);
        this.quality = Objects.requireNonNull(quality, "quality is null");
        this.status = Objects.requireNonNull(status, "status is null");
        this.attempts = attempts;
        this.reason = reason;
    }

    public String getQuality() {
        return quality;
    }

    public RenditionStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
