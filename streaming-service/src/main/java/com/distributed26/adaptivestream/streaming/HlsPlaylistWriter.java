package com.distributed26.adaptivestream.streaming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders manifests as HLS playlists. URIs are relative: the master playlist points at
 * {@code {quality}/playlist.m3u8}, each media playlist at {@code segment/{index}}.
 */
public class HlsPlaylistWriter {
    public static final String CONTENT_TYPE = "application/vnd.apple.mpegurl";

    /** Default quality first, since players start with the first variant listed. */
    public String masterPlaylist(Manifest manifest) {
        List<ManifestEntry> ordered = new ArrayList<>();
        manifest.rendition(manifest.getDefaultQuality()).ifPresent(ordered::add);
        for (ManifestEntry entry : manifest.getRenditions()) {
            if (!entry.getQuality().equals(manifest.getDefaultQuality())) {
                ordered.add(entry);
            }
        }

        StringBuilder out = new StringBuilder("#EXTM3U\n#EXT-X-VERSION:3\n");
        for (ManifestEntry entry : ordered) {
            out.append("#EXT-X-STREAM-INF:BANDWIDTH=").append(entry.getBitrate())
                    .append(",RESOLUTION=").append(entry.getResolution())
                    .append(",NAME=\"").append(entry.getQuality()).append("\"\n")
                    .append(entry.getQuality()).append("/playlist.m3u8\n");
        }
        return out.toString();
    }

    public String mediaPlaylist(RenditionDetail detail) {
        double longest = detail.getSegments().stream()
                .mapToDouble(RenditionDetail.SegmentInfo::getDurationSeconds)
                .max()
                .orElse(detail.getRendition().getSegmentDurationSeconds());

        StringBuilder out = new StringBuilder("#EXTM3U\n#EXT-X-VERSION:3\n#EXT-X-PLAYLIST-TYPE:VOD\n");
        out.append("#EXT-X-TARGETDURATION:").append((int) Math.ceil(longest)).append('\n');
        out.append("#EXT-X-MEDIA-SEQUENCE:0\n");
        for (RenditionDetail.SegmentInfo segment : detail.getSegments()) {
            out.append(String.format(Locale.ROOT, "#EXTINF:%.3f,", segment.getDurationSeconds())).append('\n')
                    .append("segment/").append(segment.getIndex()).append('\n');
        }
        out.append("#EXT-X-ENDLIST\n");
        return out.toString();
    }
}
