package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.shared.model.SourceProbe;
import com.distributed26.adaptivestream.shared.model.VideoStatus;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Point-in-time view of a video and its renditions, served by {@code GET /videos/{id}/status}. */
public class VideoStatusReport {
    private final String videoId;
    private final VideoStatus status;
    private final String failureReason;
    private final SourceProbe probe;
    private final List<RenditionStatusReport> renditions;

    public VideoStatusReport(String videoId, VideoStatus status, String failureReason, SourceProbe probe,
                             List<RenditionStatusReport> renditions) {
        this.videoId = Objects.requireNonNull(videoId, "videoId is null");
        this.status = Objects.requireNonNull(status, "status is null");
        this.failureReason = failureReason;
        this.probe = probe;
        this.renditions = List.copyOf(renditions);
    }

    public String getVideoId() { return videoId; }
    public VideoStatus getStatus() { return status; }
    public String getFailureReason() { return failureReason; }

    /** Absent until analysis has succeeded once. */
    public SourceProbe getProbe() { return probe; }

    public List<RenditionStatusReport> getRenditions() {
        return Collections.unmodifiableList(renditions);
    }

    public Optional<RenditionStatusReport> rendition(String quality) {
        return renditions.stream().filter(r -> r.getQuality().equals(quality)).findFirst();
    }
}
