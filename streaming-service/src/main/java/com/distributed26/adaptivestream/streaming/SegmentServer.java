package com.distributed26.adaptivestream.streaming;

import com.distributed26.adaptivestream.shared.storage.BinaryStore;
import com.distributed26.adaptivestream.shared.storage.SegmentSlice;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class SegmentServer {
    private static final Logger LOGGER = LogManager.getLogger(SegmentServer.class);

    private final BinaryStore store;

    public SegmentServer(BinaryStore store) {
        this.store = Objects.requireNonNull(store, "store is null");
    }

    /**
     * Returns segment {@code index} of a ready rendition, or the part of it selected by
     * {@code rangeHeader}. A header that does not parse is ignored.
     *
     * @throws com.distributed26.adaptivestream.shared.errors.NotFoundException if the rendition
     *         is not ready or the index is out of range
     * @throws com.distributed26.adaptivestream.shared.errors.RangeNotSatisfiableException if the
     *         range lies outside the segment
     */
    public SegmentResponse serve(String videoId, String quality, int index, String rangeHeader) {
        SegmentSlice slice = store.getSegmentRange(videoId, quality, index, rangeHeader);
        String contentRange = slice.isPartial() ? slice.getRange().contentRange() : null;
        LOGGER.debug("Serving {}/{}#{} {}", videoId, quality, index,
                contentRange == null ? slice.getTotalLength() + " bytes" : contentRange);
        return new SegmentResponse(slice.getBody(), slice.getTotalLength(), contentRange);
    }
}
