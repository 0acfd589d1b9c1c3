package com.distributed26.adaptivestream.shared.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public enum VideoStatus {
    UPLOADED,
    ANALYZING,
    PROCESSING,
    READY,
    PARTIALLY_READY,
    FAILED;

    /** Statuses from which a new pipeline run may take the lease. */
    public static final Set<VideoStatus> SUBMITTABLE =
            EnumSet.of(UPLOADED, READY, PARTIALLY_READY, FAILED);

    public boolean isTerminal() {
        return this == READY || this == PARTIALLY_READY || this == FAILED;
    }

    /**
     * Derives the terminal video status from the terminal statuses of its renditions.
     * Every rendition must already be terminal.
     */
    public static VideoStatus fromRenditions(Collection<RenditionStatus> renditionStatuses) {
        Objects.requireNonNull(renditionStatuses, "renditionStatuses is null");
        int ready = 0;
        int failed = 0;
        for (RenditionStatus status : renditionStatuses) {
            if (status == RenditionStatus.READY) {
                ready++;
            } else if (status == RenditionStatus.FAILED) {
                failed++;
            } else {
                throw new IllegalArgumentException("rendition is not terminal: " + status);
            }
        }
        if (ready == 0) {
            return FAILED;
        }
        return failed == 0 ? READY : PARTIALLY_READY;
    }
}
