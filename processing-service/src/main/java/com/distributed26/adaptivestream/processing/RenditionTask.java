package com.distributed26.adaptivestream.processing;

import java.util.Objects;
import java.util.UUID;

/** Unit of work on the transcoding queue: encode one profile of one run. */
public final class RenditionTask {
    private final String id;
    private final PipelineRun run;
    private final TranscodingProfile profile;
    private final int attempt;

    public RenditionTask(PipelineRun run, TranscodingProfile profile, int attempt) {
        this(UUID.randomUUID().toString(), run, profile, attempt);
    }

    private RenditionTask(String id, PipelineRun run, TranscodingProfile profile, int attempt) {
        this.id = id;
        this.run = Objects.requireNonNull(run, "run is null");
        this.profile = Objects.requireNonNull(profile, "profile is null");
        if (attempt <= 0) throw new IllegalArgumentException("attempt must be > 0");
        this.attempt = attempt;
    }

    /** Same rendition, next attempt number. */
    public RenditionTask nextAttempt() {
        return new RenditionTask(id, run, profile, attempt + 1);
    }

    public String getId() { return id; }
    public PipelineRun getRun() { return run; }
    public String getVideoId() { return run.getVideoId(); }
    public TranscodingProfile getProfile() { return profile; }
    public String getQuality() { return profile.getLabel(); }
    public int getAttempt() { return attempt; }

    @Override
    public String toString() {
        return getVideoId() + "/" + getQuality() + " attempt " + attempt;
    }
}
