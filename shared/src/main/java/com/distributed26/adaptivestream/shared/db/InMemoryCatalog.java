package com.distributed26.adaptivestream.shared.db;

import com.distributed26.adaptivestream.shared.errors.StorageException;
import com.distributed26.adaptivestream.shared.model.Rendition;
import com.distributed26.adaptivestream.shared.model.SegmentRecord;
import com.distributed26.adaptivestream.shared.model.SourceProbe;
import com.distributed26.adaptivestream.shared.model.ThumbnailRecord;
import com.distributed26.adaptivestream.shared.model.ThumbnailSize;
import com.distributed26.adaptivestream.shared.model.Video;
import com.distributed26.adaptivestream.shared.model.VideoStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Process-local stand-in for the relational store. All four repositories share one monitor so
 * the cascade on delete is atomic.
 */
public class InMemoryCatalog implements VideoRepository, RenditionRepository, SegmentRepository, ThumbnailRepository {
    private final Map<String, Video> videos = new HashMap<>();
    private final Map<String, SourceProbe> probes = new HashMap<>();
    private final Map<String, Map<String, Rendition>> renditions = new HashMap<>();
    private final Map<String, TreeMap<Integer, SegmentRecord>> segments = new HashMap<>();
    private final Map<String, Map<ThumbnailSize, ThumbnailRecord>> thumbnails = new HashMap<>();

    // ── Videos ──

    @Override
    public synchronized void create(Video video) {
        Objects.requireNonNull(video, "video is null");
        if (videos.putIfAbsent(video.getId(), video) != null) {
            throw new IllegalStateException("Video already exists: " + video.getId());
        }
    }

    @Override
    public synchronized Optional<Video> findVideo(String videoId) {
        return Optional.ofNullable(videos.get(videoId));
    }

    @Override
    public synchronized boolean compareAndSetStatus(String videoId, Set<VideoStatus> expected, VideoStatus next,
                                                    String failureReason) {
        Video current = videos.get(videoId);
        if (current == null || !expected.contains(current.getStatus())) {
            return false;
        }
        videos.put(videoId, current.withStatus(next, failureReason, Instant.now()));
        return true;
    }

    @Override
    public synchronized void updateStatus(String videoId, VideoStatus status, String failureReason) {
        Video current = videos.get(videoId);
        if (current != null) {
            videos.put(videoId, current.withStatus(status, failureReason, Instant.now()));
        }
    }

    @Override
    public synchronized void saveProbe(String videoId, SourceProbe probe) {
        requireVideo(videoId);
        probes.put(videoId, probe);
    }

    @Override
    public synchronized Optional<SourceProbe> findProbe(String videoId) {
        return Optional.ofNullable(probes.get(videoId));
    }

    @Override
    public synchronized boolean deleteVideo(String videoId) {
        Video removed = videos.remove(videoId);
        probes.remove(videoId);
        renditions.remove(videoId);
        String prefix = videoId + "/";
        segments.keySet().removeIf(key -> key.startsWith(prefix));
        thumbnails.remove(videoId);
        return removed != null;
    }

    // ── Renditions ──

    @Override
    public synchronized void upsertRendition(Rendition rendition) {
        requireVideo(rendition.getVideoId());
        renditions.computeIfAbsent(rendition.getVideoId(), k -> new LinkedHashMap<>())
                .put(rendition.getQuality(), rendition);
    }

    @Override
    public synchronized Optional<Rendition> findRendition(String videoId, String quality) {
        Map<String, Rendition> byQuality = renditions.get(videoId);
        return byQuality == null ? Optional.empty() : Optional.ofNullable(byQuality.get(quality));
    }

    @Override
    public synchronized List<Rendition> listRenditions(String videoId) {
        Map<String, Rendition> byQuality = renditions.get(videoId);
        if (byQuality == null) {
            return List.of();
        }
        List<Rendition> result = new ArrayList<>(byQuality.values());
        result.sort(Comparator.comparingInt(Rendition::getHeight).thenComparing(Rendition::getQuality));
        return result;
    }

    // ── Segments ──

    @Override
    public synchronized boolean insertSegment(SegmentRecord segment) {
        if (findRendition(segment.getVideoId(), segment.getQuality()).isEmpty()) {
            throw new StorageException("No rendition " + segment.getVideoId() + "/" + segment.getQuality());
        }
        TreeMap<Integer, SegmentRecord> rows = segments.computeIfAbsent(
                segmentKey(segment.getVideoId(), segment.getQuality()), k -> new TreeMap<>());
        return rows.putIfAbsent(segment.getIndex(), segment) == null;
    }

    @Override
    public synchronized int countSegments(String videoId, String quality) {
        TreeMap<Integer, SegmentRecord> rows = segments.get(segmentKey(videoId, quality));
        return rows == null ? 0 : rows.size();
    }

    @Override
    public synchronized Optional<SegmentRecord> findSegment(String videoId, String quality, int index) {
        TreeMap<Integer, SegmentRecord> rows = segments.get(segmentKey(videoId, quality));
        return rows == null ? Optional.empty() : Optional.ofNullable(rows.get(index));
    }

    @Override
    public synchronized List<SegmentRecord> listSegments(String videoId, String quality) {
        TreeMap<Integer, SegmentRecord> rows = segments.get(segmentKey(videoId, quality));
        return rows == null ? List.of() : new ArrayList<>(rows.values());
    }

    @Override
    public synchronized int deleteSegments(String videoId, String quality) {
        TreeMap<Integer, SegmentRecord> removed = segments.remove(segmentKey(videoId, quality));
        return removed == null ? 0 : removed.size();
    }

    // ── Thumbnails ──

    @Override
    public synchronized void saveThumbnail(ThumbnailRecord thumbnail) {
        requireVideo(thumbnail.getVideoId());
        thumbnails.computeIfAbsent(thumbnail.getVideoId(), k -> new LinkedHashMap<>())
                .put(thumbnail.getSize(), thumbnail);
    }

    @Override
    public synchronized Optional<ThumbnailRecord> findThumbnail(String videoId, ThumbnailSize size) {
        Map<ThumbnailSize, ThumbnailRecord> bySize = thumbnails.get(videoId);
        return bySize == null ? Optional.empty() : Optional.ofNullable(bySize.get(size));
    }

    @Override
    public synchronized List<ThumbnailRecord> listThumbnails(String videoId) {
        Map<ThumbnailSize, ThumbnailRecord> bySize = thumbnails.get(videoId);
        return bySize == null ? List.of() : new ArrayList<>(bySize.values());
    }

    private void requireVideo(String videoId) {
        if (!videos.containsKey(videoId)) {
            throw new StorageException("No video " + videoId);
        }
    }

    private static String segmentKey(String videoId, String quality) {
        return videoId + "/" + quality;
    }
}
