package com.distributed26.adaptivestream.processing;

import java.util.Objects;

/** One fixed-length slice of an encoded stream, ready to be stored. */
public final class SegmentChunk {
    private final int index;
    private final double startSeconds;
    private final double durationSeconds;
    private final byte[] payload;
    private final String checksum;

    SegmentChunk(int index, double startSeconds, double durationSeconds, byte[] payload, String checksum) {
        this.index = index;
        this.startSeconds = startSeconds;
        this.durationSeconds = durationSeconds;
        this.payload = Objects.requireNonNull(payload, "payload is null");
        this.checksum = Objects.requireNonNull(checksum, "checksum is null");
    }

    public int getIndex() { return index; }
    public double getStartSeconds() { return startSeconds; }
    public double getDurationSeconds() { return durationSeconds; }
    public byte[] getPayload() { return payload; }
    public long getByteLength() { return payload.length; }
    public String getChecksum() { return checksum; }

    @Override
    public String toString() {
        return "SegmentChunk{#" + index + " @" + startSeconds + "s +" + durationSeconds + "s, "
                + payload.length + " bytes}";
    }
}
