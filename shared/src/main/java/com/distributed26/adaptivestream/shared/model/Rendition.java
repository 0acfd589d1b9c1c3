package com.distributed26.adaptivestream.shared.model;

import java.util.Objects;

/**
 * One quality level of a video. Instances are immutable snapshots of the rendition row;
 * the {@code with*} methods produce the next state.
 */
public final class Rendition {
    private final String videoId;
    private final String quality;
    private final int width;
    private final int height;
    private final int bitrate;
    private final String codec;
    private final RenditionStatus status;
    private final double durationSeconds;
    private final int segmentCount;
    private final double segmentDurationSeconds;
    private final int attempts;
    private final String failureReason;

    public Rendition(
            String videoId,
            String quality,
            int width,
            int height,
            int bitrate,
            String codec,
            RenditionStatus status,
            double durationSeconds,
            int segmentCount,
            double segmentDurationSeconds,
            int attempts,
            String failureReason
    ) {
        this.videoId = Objects.requireNonNull(videoId, "videoId is null");
        this.quality = Objects.requireNonNull(quality, "quality is null");
        if (width <= 0) throw new IllegalArgumentException("width must be > 0");
        if (height <= 0) throw new IllegalArgumentException("height must be > 0");
        if (bitrate <= 0) throw new IllegalArgumentException("bitrate must be > 0");
        if (segmentCount < 0) throw new IllegalArgumentException("segmentCount must be >= 0");
        if (attempts < 0) throw new IllegalArgumentException("attempts must be >= 0");
        this.width = width;
        this.height = height;
        this.bitrate = bitrate;
        this.codec = Objects.requireNonNull(codec, "codec is null");
        this.status = Objects.requireNonNull(status, "status is null");
        this.durationSeconds = durationSeconds;
        this.segmentCount = segmentCount;
        this.segmentDurationSeconds = segmentDurationSeconds;
        this.attempts = attempts;
        this.failureReason = failureReason;
    }

    public static Rendition pending(String videoId, String quality, int width, int height, int bitrate,
                                    String codec, double segmentDurationSeconds) {
        return new Rendition(videoId, quality, width, height, bitrate, codec, RenditionStatus.PENDING,
                0, 0, segmentDurationSeconds, 0, null);
    }

    public Rendition withStatus(RenditionStatus newStatus) {
        return new Rendition(videoId, quality, width, height, bitrate, codec, newStatus,
                durationSeconds, segmentCount, segmentDurationSeconds, attempts, failureReason);
    }

    public Rendition withAttempts(int newAttempts, String lastError) {
        return new Rendition(videoId, quality, width, height, bitrate, codec, status,
                durationSeconds, segmentCount, segmentDurationSeconds, newAttempts, lastError);
    }

    public Rendition ready(int count, double totalDurationSeconds) {
        return new Rendition(videoId, quality, width, height, bitrate, codec, RenditionStatus.READY,
                totalDurationSeconds, count, segmentDurationSeconds, attempts, null);
    }

    public Rendition failed(String reason) {
        return new Rendition(videoId, quality, width, height, bitrate, codec, RenditionStatus.FAILED,
                durationSeconds, segmentCount, segmentDurationSeconds, attempts,
                Objects.requireNonNull(reason, "reason is null"));
    }

    public String getVideoId() { return videoId; }
    public String getQuality() { return quality; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getBitrate() { return bitrate; }
    public String getCodec() { return codec; }
    public RenditionStatus getStatus() { return status; }
    public double getDurationSeconds() { return durationSeconds; }
    public int getSegmentCount() { return segmentCount; }
    public double getSegmentDurationSeconds() { return segmentDurationSeconds; }
    public int getAttempts() { return attempts; }
    public String getFailureReason() { return failureReason; }

    public boolean isReady() {
        return status == RenditionStatus.READY;
    }

    @Override
    public String toString() {
        return "Rendition{videoId='" + videoId + "', quality='" + quality + "', status=" + status
                + ", segments=" + segmentCount + ", attempts=" + attempts + "}";
    }
}
