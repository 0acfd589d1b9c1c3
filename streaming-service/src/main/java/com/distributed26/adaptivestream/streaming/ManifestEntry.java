package com.distributed26.adaptivestream.streaming;

import com.distributed26.adaptivestream.shared.model.Rendition;

/** One playable quality as listed in a {@link Manifest}. */
public final class ManifestEntry {
    private final String quality;
    private final int width;
    private final int height;
    private final int bitrate;
    private final String codec;
    private final int segmentCount;
    private final double segmentDurationSeconds;
    private final double durationSeconds;

    ManifestEntry(String quality, int width, int height, int bitrate, String codec, int segmentCount,
                  double segmentDurationSeconds, double durationSeconds) {
        this.quality = quality;
        this.width = width;
        this.height = height;
        this.bitrate = bitrate;
        this.codec = codec;
        this.segmentCount = segmentCount;
        this.segmentDurationSeconds = segmentDurationSeconds;
        this.durationSeconds = durationSeconds;
    }

    static ManifestEntry of(Rendition rendition) {
        return new ManifestEntry(
                rendition.getQuality(),
                rendition.getWidth(),
                rendition.getHeight(),
                rendition.getBitrate(),
                rendition.getCodec(),
                rendition.getSegmentCount(),
                rendition.getSegmentDurationSeconds(),
                rendition.getDurationSeconds());
    }

    public String getQuality() { return quality; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getBitrate() { return bitrate; }
    public String getCodec() { return codec; }
    public int getSegmentCount() { return segmentCount; }
    public double getSegmentDurationSeconds() { return segmentDurationSeconds; }
    public double getDurationSeconds() { return durationSeconds; }

    public String getResolution() {
        return width + "x" + height;
    }

    @Override
    public String toString() {
        return quality + " (" + getResolution() + ", " + bitrate + " bps, " + segmentCount + " segments)";
    }
}
