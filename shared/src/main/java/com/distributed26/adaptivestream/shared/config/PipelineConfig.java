package com.distributed26.adaptivestream.shared.config;

/**
 * Tuning knobs for the processing pipeline. Instances are immutable; use {@link #builder()} to
 * derive variants.
 */
public final class PipelineConfig {
    private final int workerPoolSize;
    private final double segmentDurationSeconds;
    private final int maxAttempts;
    private final long retryBaseDelayMillis;
    private final long retryMaxDelayMillis;
    private final long transcodeTimeoutSeconds;
    private final int threadsPerWorker;
    private final String ffmpegPath;
    private final String ffprobePath;

    private PipelineConfig(Builder builder) {
        if (builder.workerPoolSize <= 0) {
            throw new IllegalArgumentException("workerPoolSize must be > 0");
        }
        if (!(builder.segmentDurationSeconds > 0)) {
            throw new IllegalArgumentException("segmentDurationSeconds must be > 0");
        }
        if (builder.maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (builder.retryBaseDelayMillis < 0 || builder.retryMaxDelayMillis < builder.retryBaseDelayMillis) {
            throw new IllegalArgumentException("retry delays must satisfy 0 <= base <= max");
        }
        if (builder.transcodeTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("transcodeTimeoutSeconds must be > 0");
        }
        this.workerPoolSize = builder.workerPoolSize;
        this.segmentDurationSeconds = builder.segmentDurationSeconds;
        this.maxAttempts = builder.maxAttempts;
        this.retryBaseDelayMillis = builder.retryBaseDelayMillis;
        this.retryMaxDelayMillis = builder.retryMaxDelayMillis;
        this.transcodeTimeoutSeconds = builder.transcodeTimeoutSeconds;
        this.threadsPerWorker = Math.max(1, builder.threadsPerWorker);
        this.ffmpegPath = builder.ffmpegPath;
        this.ffprobePath = builder.ffprobePath;
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static PipelineConfig fromEnv(EnvConfig env) {
        return builder()
                .workerPoolSize(env.getInt("WORKER_POOL_SIZE", "pipeline.worker-pool-size",
                        Math.max(1, Runtime.getRuntime().availableProcessors() / 2)))
                .segmentDurationSeconds(env.getDouble("SEGMENT_DURATION_SECONDS", "pipeline.segment-duration-seconds", 4.0))
                .maxAttempts(env.getInt("MAX_ATTEMPTS", "pipeline.max-attempts", 3))
                .retryBaseDelayMillis(env.getLong("RETRY_BASE_DELAY_MILLIS", "pipeline.retry-base-delay-millis", 2_000L))
                .retryMaxDelayMillis(env.getLong("RETRY_MAX_DELAY_MILLIS", "pipeline.retry-max-delay-millis", 30_000L))
                .transcodeTimeoutSeconds(env.getLong("TRANSCODE_TIMEOUT_SECONDS", "pipeline.transcode-timeout-seconds", 3_600L))
                .threadsPerWorker(env.getInt("THREADS_PER_WORKER", "pipeline.threads-per-worker", 2))
                .ffmpegPath(env.get("FFMPEG_PATH", "pipeline.ffmpeg-path", "ffmpeg"))
                .ffprobePath(env.get("FFPROBE_PATH", "pipeline.ffprobe-path", "ffprobe"))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .workerPoolSize(workerPoolSize)
                .segmentDurationSeconds(segmentDurationSeconds)
                .maxAttempts(maxAttempts)
                .retryBaseDelayMillis(retryBaseDelayMillis)
                .retryMaxDelayMillis(retryMaxDelayMillis)
                .transcodeTimeoutSeconds(transcodeTimeoutSeconds)
                .threadsPerWorker(threadsPerWorker)
                .ffmpegPath(ffmpegPath)
                .ffprobePath(ffprobePath);
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public double getSegmentDurationSeconds() {
        return segmentDurationSeconds;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getRetryBaseDelayMillis() {
        return retryBaseDelayMillis;
    }

    public long getRetryMaxDelayMillis() {
        return retryMaxDelayMillis;
    }

    public long getTranscodeTimeoutSeconds() {
        return transcodeTimeoutSeconds;
    }

    public int getThreadsPerWorker() {
        return threadsPerWorker;
    }

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public String getFfprobePath() {
        return ffprobePath;
    }

    @Override
    public String toString() {
        return "PipelineConfig{workers=" + workerPoolSize
                + ", segmentSeconds=" + segmentDurationSeconds
                + ", maxAttempts=" + maxAttempts
                + ", retryDelay=" + retryBaseDelayMillis + ".." + retryMaxDelayMillis + "ms"
                + ", timeout=" + transcodeTimeoutSeconds + "s}";
    }

    public static final class Builder {
        private int workerPoolSize = 2;
        private double segmentDurationSeconds = 4.0;
        private int maxAttempts = 3;
        private long retryBaseDelayMillis = 2_000L;
        private long retryMaxDelayMillis = 30_000L;
        private long transcodeTimeoutSeconds = 3_600L;
        private int threadsPerWorker = 2;
        private String ffmpegPath = "ffmpeg";
        private String ffprobePath = "ffprobe";

        private Builder() {
        }

        public Builder workerPoolSize(int value) {
            this.workerPoolSize = value;
            return this;
        }

        public Builder segmentDurationSeconds(double value) {
            this.segmentDurationSeconds = value;
            return this;
        }

        public Builder maxAttempts(int value) {
            this.maxAttempts = value;
            return this;
        }

        public Builder retryBaseDelayMillis(long value) {
            this.retryBaseDelayMillis = value;
            return this;
        }

        public Builder retryMaxDelayMillis(long value) {
            this.retryMaxDelayMillis = value;
            return this;
        }

        public Builder transcodeTimeoutSeconds(long value) {
            this.transcodeTimeoutSeconds = value;
            return this;
        }

        public Builder threadsPerWorker(int value) {
            this.threadsPerWorker = value;
            return this;
        }

        public Builder ffmpegPath(String value) {
            this.ffmpegPath = value;
            return this;
        }

        public Builder ffprobePath(String value) {
            this.ffprobePath = value;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
