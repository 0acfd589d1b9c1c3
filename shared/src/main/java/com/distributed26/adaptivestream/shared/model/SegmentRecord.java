package com.distributed26.adaptivestream.shared.model;

import java.util.Objects;

/** Row describing one stored segment. The payload itself lives in object storage under {@link #getObjectKey()}. */
public final class SegmentRecord {
    private final String videoId;
    private final String quality;
    private final int index;
    private final String objectKey;
    private final long byteLength;
    private final double startSeconds;
    private final double durationSeconds;
    private final String checksum;

    public SegmentRecord(
            String videoId,
            String quality,
            int index,
            String objectKey,
            long byteLength,
            double startSeconds,
            double durationSeconds,
            String checksum
    ) {
        this.videoId = Objects.requireNonNull(videoId, "videoId is null");
        this.quality = Objects.requireNonNull(quality, "quality is null");
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        if (byteLength < 0) throw new IllegalArgumentException("byteLength must be >= 0");
        if (!(durationSeconds > 0)) throw new IllegalArgumentException("durationSeconds must be > 0");
        this.index = index;
        this.objectKey = Objects.requireNonNull(objectKey, "objectKey is null");
        this.byteLength = byteLength;
        this.startSeconds = startSeconds;
        this.durationSeconds = durationSeconds;
        this.checksum = Objects.requireNonNull(checksum, "checksum is null");
    }

    public String getVideoId() { return videoId; }
    public String getQuality() { return quality; }
    public int getIndex() { return index; }
    public String getObjectKey() { return objectKey; }
    public long getByteLength() { return byteLength; }
    public double getStartSeconds() { return startSeconds; }
    public double getDurationSeconds() { return durationSeconds; }
    public String getChecksum() { return checksum; }

    @Override
    public String toString() {
        return "SegmentRecord{" + videoId + "/" + quality + "#" + index + ", " + byteLength + " bytes, "
                + durationSeconds + "s}";
    }
}
