package com.distributed26.adaptivestream.processing;

import java.util.Objects;

/** One rung of the quality ladder: the target an encode aims for. */
public class TranscodingProfile {
    private final String label;
    private final int width;
    private final int height;
    private final int bitrate;
    private final String codec;

    public TranscodingProfile(String label, int width, int height, int bitrate, String codec) {
        this.label = Objects.requireNonNull(label, "label");
        if (width <= 0) throw new IllegalArgumentException("width must be > 0");
        if (height <= 0) throw new IllegalArgumentException("height must be > 0");
        if (bitrate <= 0) throw new IllegalArgumentException("bitrate must be > 0");
        this.width = width;
        this.height = height;
        this.bitrate = bitrate;
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public String getLabel() { return label; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getBitrate() { return bitrate; }
    public String getCodec() { return codec; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TranscodingProfile other)) return false;
        return width == other.width && height == other.height && bitrate == other.bitrate
                && label.equals(other.label) && codec.equals(other.codec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, width, height, bitrate, codec);
    }

    @Override
    public String toString() {
        return "TranscodingProfile{label='" + label + "', " + width + "x" + height + ", " + bitrate + "bps, " + codec + "}";
    }
}
