package com.distributed26.adaptivestream.processing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Picks the ladder levels worth encoding for a source of a given size. */
public class QualityLadderPlanner {
    private final QualityLadder ladder;

    public QualityLadderPlanner(QualityLadder ladder) {
        this.ladder = Objects.requireNonNull(ladder, "ladder is null");
    }

    /**
     * Every level no taller than the source, lowest first. The lowest level is always included
     * so even a tiny source gets one rendition.
     */
    public List<TranscodingProfile> plan(int sourceWidth, int sourceHeight) {
        if (sourceWidth <= 0 || sourceHeight <= 0) {
            throw new IllegalArgumentException("source dimensions must be > 0");
        }
        List<TranscodingProfile> plan = new ArrayList<>();
        for (TranscodingProfile level : ladder.levels()) {
            if (level.getHeight() <= sourceHeight) {
                plan.add(level);
            }
        }
        if (plan.isEmpty()) {
            plan.add(ladder.lowest());
        }
        return List.copyOf(plan);
    }

    public QualityLadder getLadder() {
        return ladder;
    }
}
