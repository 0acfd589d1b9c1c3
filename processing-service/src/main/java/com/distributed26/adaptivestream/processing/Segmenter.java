package com.distributed26.adaptivestream.processing;

public class Segmenter {
    private final double chunkSeconds;

    public Segmenter(double chunkSeconds) {
        if (!(chunkSeconds > 0)) {
            throw new IllegalArgumentException("chunkSeconds must be > 0");
        }
        this.chunkSeconds = chunkSeconds;
    }

    public SegmentSequence segment(EncodedStream stream) {
        if (!(stream.getDurationSeconds() > 0)) {
            throw new IllegalArgumentException("stream has no duration");
        }
        return new SegmentSequence(stream, chunkSeconds);
    }

    public double getChunkSeconds() {
        return chunkSeconds;
    }
}
