package com.distributed26.adaptivestream.streaming;

import com.distributed26.adaptivestream.shared.errors.NotFoundException;
import com.distributed26.adaptivestream.shared.model.Rendition;
import com.distributed26.adaptivestream.shared.model.SegmentRecord;
import com.distributed26.adaptivestream.shared.model.Video;
import com.distributed26.adaptivestream.shared.storage.BinaryStore;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Read-only view over the Binary Store that tells a player which qualities it can play.
 *
 * <p>Only {@code READY} renditions are listed. The default is the lowest quality unless the
 * client says otherwise: a bandwidth estimate selects the highest quality whose bitrate fits
 * it, and mobile clients never default above {@value #MOBILE_MAX_HEIGHT}p.
 */
public class ManifestBuilder {
    private static final Logger LOGGER = LogManager.getLogger(ManifestBuilder.class);
    static final int MOBILE_MAX_HEIGHT = 480;

    private static final Comparator<Rendition> LOWEST_FIRST =
            Comparator.comparingInt(Rendition::getHeight).thenComparingInt(Rendition::getBitrate);

    private final BinaryStore store;

    public ManifestBuilder(BinaryStore store) {
        this.store = Objects.requireNonNull(store, "store is null");
    }

    /**
     * @throws NotFoundException if the video does not exist or has no ready rendition yet
     */
    public Manifest build(String videoId, ClientHint hint) {
        Video video = store.videos().findVideo(videoId)
                .orElseThrow(() -> new NotFoundException("Video not found: " + videoId));
        List<Rendition> ready = store.listReadyRenditions(videoId).stream()
                .sorted(LOWEST_FIRST)
                .collect(Collectors.toList());
        if (ready.isEmpty()) {
            throw new NotFoundException("Video " + videoId + " has no ready rendition (status " + video.getStatus() + ")");
        }
        Rendition chosen = selectDefault(ready, hint == null ? ClientHint.none() : hint);
        LOGGER.debug("Manifest for {}: {} ready, default {} for {}", videoId, ready.size(), chosen.getQuality(), hint);
        List<ManifestEntry> entries = ready.stream().map(ManifestEntry::of).toList();
        return new Manifest(videoId, video.getTitle(), entries, chosen.getQuality());
    }

    /** Per-quality detail with the full segment list. */
    public RenditionDetail describe(String videoId, String quality) {
        Rendition rendition = store.getReadyRendition(videoId, quality);
        List<SegmentRecord> segments = store.listSegments(videoId, quality);
        return new RenditionDetail(videoId, ManifestEntry.of(rendition), segments);
    }

    /** @param ready non-empty, lowest first */
    static Rendition selectDefault(List<Rendition> ready, ClientHint hint) {
        List<Rendition> candidates = ready;
        if (hint.prefersLowResolution()) {
            List<Rendition> capped = ready.stream()
                    .filter(r -> r.getHeight() <= MOBILE_MAX_HEIGHT)
                    .collect(Collectors.toList());
            if (!capped.isEmpty()) {
                candidates = capped;
            }
        }
        Rendition lowest = candidates.get(0);
        if (hint.getBandwidthKbps().isEmpty()) {
            return lowest;
        }
        long budget = hint.getBandwidthKbps().get() * 1000L;
        Rendition best = lowest;
        for (Rendition r : candidates) {
            if (r.getBitrate() <= budget) {
                best = r;
            }
        }
        return best;
    }
}
