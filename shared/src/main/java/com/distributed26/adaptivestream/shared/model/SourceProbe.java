package com.distributed26.adaptivestream.shared.model;

import java.util.Objects;

/** Container metadata of an uploaded source. Immutable once recorded. */
public final class SourceProbe {
    private final double durationSeconds;
    private final int width;
    private final int height;
    private final String codec;
    private final double frameRate;
    private final String formatName;

    public SourceProbe(double durationSeconds, int width, int height, String codec, double frameRate,
                       String formatName) {
        if (!(durationSeconds > 0) || Double.isInfinite(durationSeconds)) {
            throw new IllegalArgumentException("durationSeconds must be a positive finite number");
        }
        if (width <= 0) throw new IllegalArgumentException("width must be > 0");
        if (height <= 0) throw new IllegalArgumentException("height must be > 0");
        if (frameRate < 0) throw new IllegalArgumentException("frameRate must be >= 0");
        this.durationSeconds = durationSeconds;
        this.width = width;
        this.height = height;
        this.codec = Objects.requireNonNull(codec, "codec");
        this.frameRate = frameRate;
        this.formatName = formatName;
    }

    public double getDurationSeconds() { return durationSeconds; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public String getCodec() { return codec; }
    public double getFrameRate() { return frameRate; }
    public String getFormatName() { return formatName; }

    public String getResolution() {
        return width + "x" + height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceProbe other)) return false;
        return Double.compare(durationSeconds, other.durationSeconds) == 0
                && width == other.width
                && height == other.height
                && Double.compare(frameRate, other.frameRate) == 0
                && codec.equals(other.codec)
                && Objects.equals(formatName, other.formatName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(durationSeconds, width, height, codec, frameRate, formatName);
    }

    @Override
    public String toString() {
        return "SourceProbe{" + getResolution() + ", " + durationSeconds + "s, codec=" + codec
                + ", fps=" + frameRate + ", format=" + formatName + "}";
    }
}
