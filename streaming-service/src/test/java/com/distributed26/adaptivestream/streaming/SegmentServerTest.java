package com.distributed26.adaptivestream.streaming;

import com.distributed26.adaptivestream.shared.db.InMemoryCatalog;
import com.distributed26.adaptivestream.shared.errors.NotFoundException;
import com.distributed26.adaptivestream.shared.errors.RangeNotSatisfiableException;
import com.distributed26.adaptivestream.shared.errors.StorageException;
import com.distributed26.adaptivestream.shared.storage.BinaryStore;
import com.distributed26.adaptivestream.shared.storage.InMemoryObjectStorageClient;
import com.distributed26.adaptivestream.shared.storage.StorageKeys;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.distributed26.adaptivestream.streaming.StreamingFixtures.VIDEO_ID;
import static com.distributed26.adaptivestream.streaming.StreamingFixtures.payload;
import static com.distributed26.adaptivestream.streaming.StreamingFixtures.seedPending;
import static com.distributed26.adaptivestream.streaming.StreamingFixtures.seedReady;
import static com.distributed26.adaptivestream.streaming.StreamingFixtures.seedVideo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SegmentServerTest {
    private InMemoryObjectStorageClient storage;
    private SegmentServer server;
    private byte[] first;

    @BeforeEach
    void setUp() {
        storage = new InMemoryObjectStorageClient();
        BinaryStore store = new BinaryStore(storage, new InMemoryCatalog());
        seedVideo(store, VIDEO_ID);
        seedReady(store, VIDEO_ID, "240p", 426, 240, 400_000, 4.0, 4.0, 2.0);
        seedPending(store, VIDEO_ID, "720p", 1280, 720, 2_800_000);
        server = new SegmentServer(store);
        first = payload("240p", 0);
    }

    @Test
    void serve_withoutRange_returnsWholeSegment() {
        SegmentResponse response = server.serve(VIDEO_ID, "240p", 0, null);

        assertArrayEquals(first, response.getBody());
        assertEquals("video/MP2T", response.getContentType());
        assertEquals(first.length, response.getTotalLength());
        assertFalse(response.isPartial());
        assertNull(response.getContentRange());
    }

    @Test
    void serve_lastSegment() {
        assertArrayEquals(payload("240p", 2), server.serve(VIDEO_ID, "240p", 2, null).getBody());
    }

    // ── Ranges ──

    @Test
    void serve_closedRange_returnsSlice() {
        SegmentResponse response = server.serve(VIDEO_ID, "240p", 0, "bytes=0-9");

        assertTrue(response.isPartial());
        assertArrayEquals(Arrays.copyOfRange(first, 0, 10), response.getBody());
        assertEquals("bytes 0-9/" + first.length, response.getContentRange());
        assertEquals(first.length, response.getTotalLength());
    }

    @Test
    void serve_openEndedRange_runsToTheEnd() {
        SegmentResponse response = server.serve(VIDEO_ID, "240p", 0, "bytes=100-");

        assertArrayEquals(Arrays.copyOfRange(first, 100, first.length), response.getBody());
        assertEquals("bytes 100-" + (first.length - 1) + "/" + first.length, response.getContentRange());
    }

    @Test
    void serve_suffixRange_returnsTail() {
        SegmentResponse response = server.serve(VIDEO_ID, "240p", 0, "bytes=-5");

        assertArrayEquals(Arrays.copyOfRange(first, first.length - 5, first.length), response.getBody());
    }

    @Test
    void serve_malformedRange_returnsWholeSegment() {
        SegmentResponse response = server.serve(VIDEO_ID, "240p", 0, "items=1-2");

        assertFalse(response.isPartial());
        assertArrayEquals(first, response.getBody());
    }

    @Test
    void serve_rangeBeyondSegment_isUnsatisfiable() {
        RangeNotSatisfiableException e = assertThrows(RangeNotSatisfiableException.class,
                () -> server.serve(VIDEO_ID, "240p", 0, "bytes=5000-"));
        assertEquals(first.length, e.getTotalLength());
    }

    // ── Not found ──

    @Test
    void serve_indexPastSegmentCount_throwsNotFound() {
        assertThrows(NotFoundException.class, () -> server.serve(VIDEO_ID, "240p", 3, null));
        assertThrows(NotFoundException.class, () -> server.serve(VIDEO_ID, "240p", -1, null));
    }

    @Test
    void serve_unreadyOrUnknownRendition_throwsNotFound() {
        assertThrows(NotFoundException.class, () -> server.serve(VIDEO_ID, "720p", 0, null));
        assertThrows(NotFoundException.class, () -> server.serve(VIDEO_ID, "1080p", 0, null));
        assertThrows(NotFoundException.class, () -> server.serve("other-video", "240p", 0, null));
    }

    @Test
    void serve_corruptedBlob_failsChecksum() {
        storage.overwrite(StorageKeys.segment(VIDEO_ID, "240p", 1), "tampered".getBytes());

        assertThrows(StorageException.class, () -> server.serve(VIDEO_ID, "240p", 1, null));
    }
}
