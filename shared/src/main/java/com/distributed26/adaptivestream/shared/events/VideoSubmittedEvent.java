package com.distributed26.adaptivestream.shared.events;

import java.time.Instant;

/** Intake accepted a source; processing should start a run. */
public class VideoSubmittedEvent extends PipelineEvent {
    public static final String TYPE = "submitted";

    private final String ownerId;

    public VideoSubmittedEvent(String videoId, String ownerId, Instant timestamp) {
        super(videoId, timestamp);
        this.ownerId = ownerId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
