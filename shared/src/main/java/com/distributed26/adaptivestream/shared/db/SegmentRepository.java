package com.distributed26.adaptivestream.shared.db;

import com.distributed26.adaptivestream.shared.model.SegmentRecord;
import java.util.List;
import java.util.Optional;

public interface SegmentRepository {
    /**
     * @return {@code false} if a row with the same (video, quality, index) already exists
     */
    boolean insertSegment(SegmentRecord segment);

    int countSegments(String videoId, String quality);

    Optional<SegmentRecord> findSegment(String videoId, String quality, int index);

    /** Segments ordered by index. */
    List<SegmentRecord> listSegments(String videoId, String quality);

    int deleteSegments(String videoId, String quality);
}
