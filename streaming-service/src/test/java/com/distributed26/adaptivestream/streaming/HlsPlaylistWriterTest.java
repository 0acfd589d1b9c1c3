package com.distributed26.adaptivestream.streaming;

import com.distributed26.adaptivestream.shared.model.SegmentRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HlsPlaylistWriterTest {
    private static final String VIDEO_ID = "vid-1";
    private final HlsPlaylistWriter writer = new HlsPlaylistWriter();

    private static ManifestEntry entry(String quality, int w, int h, int bitrate) {
        return new ManifestEntry(quality, w, h, bitrate, "libx264", 3, 4.0, 10.0);
    }

    private static SegmentRecord segment(String quality, int index, double start, double duration) {
        return new SegmentRecord(VIDEO_ID, quality, index, VIDEO_ID + "/" + quality + "/segment_" + index + ".ts",
                188, start, duration, "0".repeat(64));
    }

    @Test
    void masterPlaylist_listsDefaultVariantFirst() {
        Manifest manifest = new Manifest(VIDEO_ID, "clip", List.of(
                entry("240p", 426, 240, 400_000),
                entry("480p", 854, 480, 1_400_000),
                entry("720p", 1280, 720, 2_800_000)), "480p");

        String playlist = writer.masterPlaylist(manifest);

        assertEquals("#EXTM3U\n"
                + "#EXT-X-VERSION:3\n"
                + "#EXT-X-STREAM-INF:BANDWIDTH=1400000,RESOLUTION=854x480,NAME=\"480p\"\n"
                + "480p/playlist.m3u8\n"
                + "#EXT-X-STREAM-INF:BANDWIDTH=400000,RESOLUTION=426x240,NAME=\"240p\"\n"
                + "240p/playlist.m3u8\n"
                + "#EXT-X-STREAM-INF:BANDWIDTH=2800000,RESOLUTION=1280x720,NAME=\"720p\"\n"
                + "720p/playlist.m3u8\n", playlist);
    }

    @Test
    void mediaPlaylist_usesStoredSegmentDurations() {
        RenditionDetail detail = new RenditionDetail(VIDEO_ID, entry("240p", 426, 240, 400_000), List.of(
                segment("240p", 0, 0.0, 4.0),
                segment("240p", 1, 4.0, 4.0),
                segment("240p", 2, 8.0, 2.5)));

        String playlist = writer.mediaPlaylist(detail);

        assertEquals("#EXTM3U\n"
                + "#EXT-X-VERSION:3\n"
                + "#EXT-X-PLAYLIST-TYPE:VOD\n"
                + "#EXT-X-TARGETDURATION:4\n"
                + "#EXT-X-MEDIA-SEQUENCE:0\n"
                + "#EXTINF:4.000,\nsegment/0\n"
                + "#EXTINF:4.000,\nsegment/1\n"
                + "#EXTINF:2.500,\nsegment/2\n"
                + "#EXT-X-ENDLIST\n", playlist);
    }

    @Test
    void mediaPlaylist_targetDurationRoundsUp() {
        RenditionDetail detail = new RenditionDetail(VIDEO_ID, entry("240p", 426, 240, 400_000), List.of(
                segment("240p", 0, 0.0, 4.2),
                segment("240p", 1, 4.2, 3.8)));

        String playlist = writer.mediaPlaylist(detail);

        assertTrue(playlist.contains("#EXT-X-TARGETDURATION:5\n"));
        assertTrue(playlist.contains("#EXTINF:4.200,\n"));
    }
}
