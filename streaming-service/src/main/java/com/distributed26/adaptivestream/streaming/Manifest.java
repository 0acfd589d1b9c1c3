package com.distributed26.adaptivestream.streaming;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Playable renditions of a video, lowest quality first, plus the quality a player should start with.
 * Serialized as-is for {@code GET /stream/{videoId}/manifest}.
 */
public final class Manifest {
    private final String videoId;
    private final String title;
    private final List<ManifestEntry> renditions;
    private final String defaultQuality;

    Manifest(String videoId, String title, List<ManifestEntry> renditions, String defaultQuality) {
        this.videoId = Objects.requireNonNull(videoId, "videoId is null");
        this.title = title;
        this.renditions = List.copyOf(renditions);
        this.defaultQuality = Objects.requireNonNull(defaultQuality, "defaultQuality is null");
        if (rendition(defaultQuality).isEmpty()) {
            throw new IllegalArgumentException("default quality " + defaultQuality + " is not among the renditions");
        }
    }

    public String getVideoId() {
        return videoId;
    }

    public String getTitle() {
        return title;
    }

    public List<ManifestEntry> getRenditions() {
        return renditions;
    }

    public String getDefaultQuality() {
        return defaultQuality;
    }

    public List<String> getAvailableQualities() {
        return renditions.stream().map(ManifestEntry::getQuality).toList();
    }

    /** Longest rendition duration; renditions of one source differ only by container rounding. */
    public double getDurationSeconds() {
        return renditions.stream().mapToDouble(ManifestEntry::getDurationSeconds).max().orElse(0);
    }

    public Optional<ManifestEntry> rendition(String quality) {
        return renditions.stream().filter(r -> r.getQuality().equals(quality)).findFirst();
    }
}
