package com.distributed26.adaptivestream.shared.storage;

import com.distributed26.adaptivestream.shared.db.InMemoryCatalog;
import com.distributed26.adaptivestream.shared.db.RenditionRepository;
import com.distributed26.adaptivestream.shared.db.SegmentRepository;
import com.distributed26.adaptivestream.shared.db.ThumbnailRepository;
import com.distributed26.adaptivestream.shared.db.VideoRepository;
import com.distributed26.adaptivestream.shared.errors.NotFoundException;
import com.distributed26.adaptivestream.shared.errors.StorageException;
import com.distributed26.adaptivestream.shared.model.Rendition;
import com.distributed26.adaptivestream.shared.model.RenditionStatus;
import com.distributed26.adaptivestream.shared.model.SegmentRecord;
import com.distributed26.adaptivestream.shared.model.ThumbnailRecord;
import com.distributed26.adaptivestream.shared.model.ThumbnailSize;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Durable home of every rendition, segment and thumbnail.
 *
 * <p>Writes go blob first, row second; the row insert is the commit point, so a crash between
 * the two leaves only an orphaned blob that the next attempt overwrites. Reads only ever see
 * renditions in {@link RenditionStatus#READY} and verify segment checksums.
 */
public class BinaryStore {
    private static final Logger LOGGER = LogManager.getLogger(BinaryStore.class);
    private static final double DURATION_EPSILON = 1e-6;
    private static final String JPEG = "image/jpeg";

    private final ObjectStorageClient storage;
    private final VideoRepository videos;
    private final RenditionRepository renditions;
    private final SegmentRepository segments;
    private final ThumbnailRepository thumbnails;

    public BinaryStore(
            ObjectStorageClient storage,
            VideoRepository videos,
            RenditionRepository renditions,
            SegmentRepository segments,
            ThumbnailRepository thumbnails
    ) {
        this.storage = Objects.requireNonNull(storage, "storage is null");
        this.videos = Objects.requireNonNull(videos, "videos is null");
        this.renditions = Objects.requireNonNull(renditions, "renditions is null");
        this.segments = Objects.requireNonNull(segments, "segments is null");
        this.thumbnails = Objects.requireNonNull(thumbnails, "thumbnails is null");
    }

    public BinaryStore(ObjectStorageClient storage, InMemoryCatalog catalog) {
        this(storage, catalog, catalog, catalog, catalog);
    }

    public VideoRepository videos() {
        return videos;
    }

    // ── Source ──

    public void putSource(String videoId, InputStream data, long size) {
        storage.uploadFile(StorageKeys.source(videoId), data, size);
    }

    public InputStream openSource(String videoId) {
        return storage.downloadFile(StorageKeys.source(videoId));
    }

    // ── Write path ──

    public void putRendition(Rendition rendition) {
        renditions.upsertRendition(rendition);
    }

    public Optional<Rendition> findRendition(String videoId, String quality) {
        return renditions.findRendition(videoId, quality);
    }

    public List<Rendition> listRenditions(String videoId) {
        return renditions.listRenditions(videoId);
    }

    /** Drops every stored segment of the rendition and stores {@code fresh} in its place. */
    public void resetRendition(Rendition fresh) {
        String videoId = fresh.getVideoId();
        String quality = fresh.getQuality();
        int rows = segments.deleteSegments(videoId, quality);
        int blobs = storage.deletePrefix(StorageKeys.renditionPrefix(videoId, quality));
        renditions.upsertRendition(fresh);
        if (rows > 0 || blobs > 0) {
            LOGGER.info("Reset rendition {}/{}: removed {} segment row(s), {} blob(s)", videoId, quality, rows, blobs);
        }
    }

    /**
     * Stores segment {@code index} of a rendition. Indices must arrive in order: {@code index}
     * must equal the number already stored. Re-sending an already stored index with the same
     * bytes is a no-op.
     *
     * @throws StorageException on a gap, a conflicting duplicate, or an I/O failure
     */
    public SegmentRecord appendSegment(String videoId, String quality, int index, double startSeconds,
                                       double durationSeconds, byte[] payload) {
        Objects.requireNonNull(payload, "payload is null");
        Rendition rendition = renditions.findRendition(videoId, quality)
                .orElseThrow(() -> new StorageException("No rendition " + videoId + "/" + quality));
        if (rendition.getStatus() == RenditionStatus.READY) {
            throw new StorageException("Rendition " + videoId + "/" + quality + " is already READY");
        }
        String checksum = Checksums.sha256Hex(payload);
        int stored = segments.countSegments(videoId, quality);
        if (index < stored) {
            return existingOrConflict(videoId, quality, index, checksum);
        }
        if (index > stored) {
            throw new StorageException("Segment gap for " + videoId + "/" + quality
                    + ": expected index " + stored + ", got " + index);
        }

        String key = StorageKeys.segment(videoId, quality, index);
        storage.uploadBytes(key, payload);
        SegmentRecord record = new SegmentRecord(videoId, quality, index, key, payload.length,
                startSeconds, durationSeconds, checksum);
        if (!segments.insertSegment(record)) {
            return existingOrConflict(videoId, quality, index, checksum);
        }
        LOGGER.debug("Stored segment {} ({} bytes)", key, payload.length);
        return record;
    }

    /** Number of segments stored so far for a rendition that may still be in progress. */
    public int storedSegmentCount(String videoId, String quality) {
        return segments.countSegments(videoId, quality);
    }

    private SegmentRecord existingOrConflict(String videoId, String quality, int index, String checksum) {
        SegmentRecord existing = segments.findSegment(videoId, quality, index)
                .orElseThrow(() -> new StorageException("Segment " + index + " vanished for " + videoId + "/" + quality));
        if (!existing.getChecksum().equals(checksum)) {
            throw new StorageException("Segment " + videoId + "/" + quality + "#" + index
                    + " already stored with a different checksum");
        }
        return existing;
    }

    /**
     * Flips the rendition to READY once exactly {@code expectedCount} contiguous segments are stored
     * and their durations add up to {@code expectedDurationSeconds}.
     *
     * @return the READY rendition
     */
    public Rendition markRenditionReady(String videoId, String quality, int expectedCount,
                                        double expectedDurationSeconds) {
        Rendition rendition = renditions.findRendition(videoId, quality)
                .orElseThrow(() -> new StorageException("No rendition " + videoId + "/" + quality));
        List<SegmentRecord> rows = segments.listSegments(videoId, quality);
        if (rows.size() != expectedCount) {
            throw new StorageException("Rendition " + videoId + "/" + quality + " has " + rows.size()
                    + " segment(s), expected " + expectedCount);
        }
        double total = 0;
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).getIndex() != i) {
                throw new StorageException("Rendition " + videoId + "/" + quality + " is missing segment " + i);
            }
            total += rows.get(i).getDurationSeconds();
        }
        if (!sameDuration(total, expectedDurationSeconds)) {
            throw new StorageException("Rendition " + videoId + "/" + quality + " segments add up to " + total
                    + "s, expected " + expectedDurationSeconds + "s");
        }
        Rendition ready = rendition.ready(expectedCount, total);
        renditions.upsertRendition(ready);
        LOGGER.info("Rendition {}/{} READY: {} segment(s), {}s", videoId, quality, expectedCount, total);
        return ready;
    }

    public void putThumbnail(String videoId, ThumbnailSize size, byte[] jpeg) {
        String key = StorageKeys.thumbnail(videoId, size);
        storage.uploadBytes(key, jpeg);
        thumbnails.saveThumbnail(new ThumbnailRecord(videoId, size, key, jpeg.length, JPEG));
    }

    public boolean hasThumbnailSet(String videoId) {
        return thumbnails.listThumbnails(videoId).size() == ThumbnailSize.values().length;
    }

    // ── Read path ──

    public List<Rendition> listReadyRenditions(String videoId) {
        return renditions.listRenditions(videoId).stream()
                .filter(Rendition::isReady)
                .collect(Collectors.toList());
    }

    public Rendition getReadyRendition(String videoId, String quality) {
        return renditions.findRendition(videoId, quality)
                .filter(Rendition::isReady)
                .orElseThrow(() -> new NotFoundException("No ready rendition " + quality + " for video " + videoId));
    }

    public List<SegmentRecord> listSegments(String videoId, String quality) {
        getReadyRendition(videoId, quality);
        return segments.listSegments(videoId, quality);
    }

    public SegmentSlice getSegment(String videoId, String quality, int index) {
        SegmentRecord record = readableSegment(videoId, quality, index);
        return new SegmentSlice(record, verifiedBytes(record), null);
    }

    /**
     * Like {@link #getSegment} but honours an HTTP {@code Range} header. A header that does not
     * parse yields the whole segment.
     *
     * @throws com.distributed26.adaptivestream.shared.errors.RangeNotSatisfiableException when the
     *         range lies outside the segment
     */
    public SegmentSlice getSegmentRange(String videoId, String quality, int index, String rangeHeader) {
        SegmentRecord record = readableSegment(videoId, quality, index);
        Optional<ByteRange> range = ByteRange.parse(rangeHeader, record.getByteLength());
        byte[] bytes = verifiedBytes(record);
        if (range.isEmpty()) {
            return new SegmentSlice(record, bytes, null);
        }
        ByteRange r = range.get();
        byte[] part = Arrays.copyOfRange(bytes, (int) r.getStart(), (int) r.getEnd() + 1);
        return new SegmentSlice(record, part, r);
    }

    public byte[] getThumbnail(String videoId, ThumbnailSize size) {
        ThumbnailRecord record = thumbnails.findThumbnail(videoId, size)
                .orElseThrow(() -> new NotFoundException("No " + size.label() + " thumbnail for video " + videoId));
        return storage.downloadBytes(record.getObjectKey());
    }

    private SegmentRecord readableSegment(String videoId, String quality, int index) {
        Rendition rendition = getReadyRendition(videoId, quality);
        if (index < 0 || index >= rendition.getSegmentCount()) {
            throw new NotFoundException("Segment " + index + " out of range for " + videoId + "/" + quality
                    + " (" + rendition.getSegmentCount() + " segments)");
        }
        return segments.findSegment(videoId, quality, index)
                .orElseThrow(() -> new StorageException("Segment row missing for " + videoId + "/" + quality + "#" + index));
    }

    private byte[] verifiedBytes(SegmentRecord record) {
        byte[] bytes = storage.downloadBytes(record.getObjectKey());
        String actual = Checksums.sha256Hex(bytes);
        if (!actual.equals(record.getChecksum())) {
            LOGGER.error("Checksum mismatch for {}: stored {}, read {}", record.getObjectKey(), record.getChecksum(), actual);
            throw new StorageException("Checksum mismatch for " + record.getObjectKey());
        }
        return bytes;
    }

    // ── Delete ──

    /**
     * Removes the video's rows (cascading) and every blob under its prefix.
     *
     * @return {@code false} if the video did not exist
     */
    public boolean deleteVideo(String videoId) {
        boolean existed = videos.deleteVideo(videoId);
        int blobs = storage.deletePrefix(StorageKeys.videoPrefix(videoId));
        LOGGER.info("Deleted video {} (row existed: {}, blobs removed: {})", videoId, existed, blobs);
        return existed;
    }

    private static boolean sameDuration(double a, double b) {
        return Math.abs(a - b) <= DURATION_EPSILON;
    }
}
