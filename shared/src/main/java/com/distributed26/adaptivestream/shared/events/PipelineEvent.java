package com.distributed26.adaptivestream.shared.events;

import java.time.Instant;
import java.util.Objects;

/** Base of everything carried on the {@link PipelineEventBus}. Keyed by video id. */
public abstract class PipelineEvent {
    private final String videoId;
    private final Instant timestamp;

    protected PipelineEvent(String videoId, Instant timestamp) {
        this.videoId = Objects.requireNonNull(videoId, "videoId is null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp is null");
    }

    public String getVideoId() {
        return videoId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /** Discriminator written to the wire and used in the routing key. */
    public abstract String getType();
}
