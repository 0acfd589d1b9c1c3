package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.shared.storage.Checksums;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, finite and restartable view of an encoded stream cut into fixed-length chunks. Chunk
 * bytes are read only when the iterator reaches them; iterating again yields identical chunks.
 */
public final class SegmentSequence implements Iterable<SegmentChunk> {
    private final EncodedStream stream;
    private final double chunkSeconds;
    private final double totalSeconds;
    private final int count;

    SegmentSequence(EncodedStream stream, double chunkSeconds) {
        this.stream = stream;
        this.chunkSeconds = chunkSeconds;
        this.totalSeconds = stream.getDurationSeconds();
        this.count = chunkCount(totalSeconds, chunkSeconds);
    }

    /** ceil(total / chunk), ignoring floating point noise just above a whole multiple. */
    static int chunkCount(double totalSeconds, double chunkSeconds) {
        return (int) Math.ceil(totalSeconds / chunkSeconds - 1e-9);
    }

    public int count() {
        return count;
    }

    public double totalDurationSeconds() {
        return totalSeconds;
    }

    public double startOf(int index) {
        return index * chunkSeconds;
    }

    public double durationOf(int index) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("chunk " + index + " of " + count);
        }
        return index == count - 1 ? totalSeconds - (count - 1) * chunkSeconds : chunkSeconds;
    }

    public SegmentChunk chunk(int index) {
        double start = startOf(index);
        double duration = durationOf(index);
        byte[] payload = stream.read(start, duration);
        return new SegmentChunk(index, start, duration, payload, Checksums.sha256Hex(payload));
    }

    @Override
    public Iterator<SegmentChunk> iterator() {
        return from(0);
    }

    /** Iterates from {@code index}; used to resume a rendition whose first chunks are already stored. */
    public Iterator<SegmentChunk> from(int index) {
        if (index < 0 || index > count) {
            throw new IndexOutOfBoundsException("start " + index + " of " + count);
        }
        return new Iterator<>() {
            private int next = index;

            @Override
            public boolean hasNext() {
                return next < count;
            }

            @Override
            public SegmentChunk next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return chunk(next++);
            }
        };
    }
}
