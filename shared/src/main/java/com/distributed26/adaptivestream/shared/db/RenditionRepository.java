package com.distributed26.adaptivestream.shared.db;

import com.distributed26.adaptivestream.shared.model.Rendition;
import java.util.List;
import java.util.Optional;

public interface RenditionRepository {
    void upsertRendition(Rendition rendition);

    Optional<Rendition> findRendition(String videoId, String quality);

    /** Renditions of the video ordered by height, lowest first. */
    List<Rendition> listRenditions(String videoId);
}
