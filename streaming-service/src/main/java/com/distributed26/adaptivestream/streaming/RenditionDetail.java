package com.distributed26.adaptivestream.streaming;

import com.distributed26.adaptivestream.shared.model.SegmentRecord;
import java.util.List;

/** Body of {@code GET /stream/{videoId}/{quality}}. */
public final class RenditionDetail {
    private final String videoId;
    private final ManifestEntry rendition;
    private final List<SegmentInfo> segments;

    RenditionDetail(String videoId, ManifestEntry rendition, List<SegmentRecord> records) {
        this.videoId = videoId;
        this.rendition = rendition;
        this.segments = records.stream()
                .map(r -> new SegmentInfo(r.getIndex(), r.getStartSeconds(), r.getDurationSeconds(), r.getByteLength(),
                        "/stream/" + videoId + "/" + rendition.getQuality() + "/segment/" + r.getIndex()))
                .toList();
    }

    public String getVideoId() {
        return videoId;
    }

    public ManifestEntry getRendition() {
        return rendition;
    }

    public List<SegmentInfo> getSegments() {
        return segments;
    }

    public long getTotalBytes() {
        return segments.stream().mapToLong(SegmentInfo::getByteLength).sum();
    }

    public static final class SegmentInfo {
        private final int index;
        private final double startSeconds;
        private final double durationSeconds;
        private final long byteLength;
        private final String url;

        SegmentInfo(int index, double startSeconds, double durationSeconds, long byteLength, String url) {
            this.index = index;
            this.startSeconds = startSeconds;
            this.durationSeconds = durationSeconds;
            this.byteLength = byteLength;
            this.url = url;
        }

        public int getIndex() { return index; }
        public double getStartSeconds() { return startSeconds; }
        public double getDurationSeconds() { return durationSeconds; }
        public long getByteLength() { return byteLength; }
        public String getUrl() { return url; }
    }
}
