package com.distributed26.adaptivestream.shared.db;

import com.distributed26.adaptivestream.shared.model.SourceProbe;
import com.distributed26.adaptivestream.shared.model.Video;
import com.distributed26.adaptivestream.shared.model.VideoStatus;
import java.util.Optional;
import java.util.Set;

public interface VideoRepository {
    void create(Video video);

    Optional<Video> findVideo(String videoId);

    /**
     * Moves the video to {@code next} only if its current status is one of {@code expected}.
     *
     * @return {@code false} when the video is missing or in another status
     */
    boolean compareAndSetStatus(String videoId, Set<VideoStatus> expected, VideoStatus next, String failureReason);

    void updateStatus(String videoId, VideoStatus status, String failureReason);

    /** Stores the probe; a second call with the same video replaces the row with identical data. */
    void saveProbe(String videoId, SourceProbe probe);

    Optional<SourceProbe> findProbe(String videoId);

    /** Deletes the video and, by cascade, its probe, renditions, segments and thumbnails. */
    boolean deleteVideo(String videoId);
}
