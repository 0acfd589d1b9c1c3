package com.distributed26.adaptivestream.processing;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class SegmenterTest {
    private final Segmenter segmenter = new Segmenter(4.0);

    // ── Counting ───────────────────────────────────────────────────────────────

    @Test
    void tenSeconds_givesThreeChunks_lastIsShort() {
        SegmentSequence sequence = segmenter.segment(new InMemoryEncodedStream("240p", 10.0));

        assertEquals(3, sequence.count());
        assertEquals(4.0, sequence.durationOf(0), 1e-9);
        assertEquals(4.0, sequence.durationOf(1), 1e-9);
        assertEquals(2.0, sequence.durationOf(2), 1e-9);
        assertEquals(8.0, sequence.startOf(2), 1e-9);
    }

    @Test
    void exactMultiple_hasNoEmptyTrailingChunk() {
        SegmentSequence sequence = segmenter.segment(new InMemoryEncodedStream("240p", 12.0));

        assertEquals(3, sequence.count());
        assertEquals(4.0, sequence.durationOf(2), 1e-9);
    }

    @Test
    void shorterThanOneChunk_givesSingleChunk() {
        SegmentSequence sequence = segmenter.segment(new InMemoryEncodedStream("240p", 1.5));

        assertEquals(1, sequence.count());
        assertEquals(1.5, sequence.durationOf(0), 1e-9);
    }

    @Test
    void durations_sumToStreamDuration() {
        for (double total : new double[] {0.3, 3.99, 4.0, 4.01, 17.25, 123.456, 3600.0}) {
            SegmentSequence sequence = segmenter.segment(new InMemoryEncodedStream("q", total));
            double sum = 0;
            for (int i = 0; i < sequence.count(); i++) {
                sum += sequence.durationOf(i);
            }
            assertEquals(total, sum, 1e-6, "total " + total);
            assertEquals((int) Math.ceil(total / 4.0 - 1e-9), sequence.count());
        }
    }

    @Test
    void chunkCount_ignoresFloatingPointNoise() {
        assertEquals(3, SegmentSequence.chunkCount(12.000000000001, 4.0));
        assertEquals(4, SegmentSequence.chunkCount(12.001, 4.0));
    }

    // ── Iteration ──────────────────────────────────────────────────────────────

    @Test
    void iteratingTwice_yieldsIdenticalChecksums() {
        SegmentSequence sequence = segmenter.segment(new InMemoryEncodedStream("720p", 10.0));

        List<String> first = checksums(sequence.iterator());
        List<String> second = checksums(sequence.iterator());

        assertEquals(3, first.size());
        assertEquals(first, second);
    }

    @Test
    void chunks_areReadLazily() {
        InMemoryEncodedStream stream = new InMemoryEncodedStream("720p", 10.0);
        SegmentSequence sequence = segmenter.segment(stream);
        assertEquals(0, stream.reads());

        Iterator<SegmentChunk> it = sequence.iterator();
        it.next();

        assertEquals(1, stream.reads());
    }

    @Test
    void from_resumesAtIndex() {
        SegmentSequence sequence = segmenter.segment(new InMemoryEncodedStream("720p", 10.0));

        Iterator<SegmentChunk> it = sequence.from(2);
        SegmentChunk last = it.next();

        assertEquals(2, last.getIndex());
        assertEquals(2.0, last.getDurationSeconds(), 1e-9);
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void chunk_carriesLengthAndChecksum() {
        SegmentChunk chunk = segmenter.segment(new InMemoryEncodedStream("720p", 10.0)).chunk(0);

        assertEquals(chunk.getPayload().length, chunk.getByteLength());
        assertEquals(64, chunk.getChecksum().length());
    }

    // ── Validation ─────────────────────────────────────────────────────────────

    @Test
    void nonPositiveChunkLength_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new Segmenter(0));
    }

    @Test
    void streamWithoutDuration_rejected() {
        assertThrows(IllegalArgumentException.class, () -> segmenter.segment(new InMemoryEncodedStream("q", 0)));
    }

    private static List<String> checksums(Iterator<SegmentChunk> it) {
        List<String> result = new ArrayList<>();
        it.forEachRemaining(chunk -> result.add(chunk.getChecksum()));
        return result;
    }
}
