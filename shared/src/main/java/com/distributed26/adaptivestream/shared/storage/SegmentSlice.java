package com.distributed26.adaptivestream.shared.storage;

import com.distributed26.adaptivestream.shared.model.SegmentRecord;
import java.util.Objects;

/** Verified segment bytes, either whole or the part selected by a byte range. */
public final class SegmentSlice {
    private final SegmentRecord record;
    private final byte[] body;
    private final ByteRange range;

    SegmentSlice(SegmentRecord record, byte[] body, ByteRange range) {
        this.record = Objects.requireNonNull(record, "record is null");
        this.body = Objects.requireNonNull(body, "body is null");
        this.range = range;
    }

    public SegmentRecord getRecord() {
        return record;
    }

    public byte[] getBody() {
        return body;
    }

    /** {@code null} when the whole segment is returned. */
    public ByteRange getRange() {
        return range;
    }

    public boolean isPartial() {
        return range != null;
    }

    public long getTotalLength() {
        return record.getByteLength();
    }
}
