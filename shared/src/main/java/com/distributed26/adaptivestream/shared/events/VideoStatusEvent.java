package com.distributed26.adaptivestream.shared.events;

import com.distributed26.adaptivestream.shared.model.VideoStatus;
import java.time.Instant;
import java.util.Objects;

public class VideoStatusEvent extends PipelineEvent {
    public static final String TYPE = "video-status";

    private final VideoStatus status;
    private final String reason;

    public VideoStatusEvent(String videoId, VideoStatus status, String reason, Instant timestamp) {
        super(videoId, timestamp);
        this.status = Objects.requireNonNull(status, "status is null");
        this.reason = reason;
    }

    public VideoStatus getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
