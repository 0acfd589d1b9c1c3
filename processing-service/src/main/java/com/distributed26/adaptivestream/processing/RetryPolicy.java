package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.shared.config.PipelineConfig;

/** Capped exponential backoff over a fixed attempt budget. */
public final class RetryPolicy {
    private final int maxAttempts;
    private final long baseDelayMillis;
    private final long maxDelayMillis;

    public RetryPolicy(int maxAttempts, long baseDelayMillis, long maxDelayMillis) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (baseDelayMillis < 0 || maxDelayMillis < baseDelayMillis) {
            throw new IllegalArgumentException("delays must satisfy 0 <= base <= max");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = baseDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
    }

    public static RetryPolicy from(PipelineConfig config) {
        return new RetryPolicy(config.getMaxAttempts(), config.getRetryBaseDelayMillis(),
                config.getRetryMaxDelayMillis());
    }

    /** Whether another attempt is allowed after {@code attemptsMade} have failed. */
    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /** Delay before attempt {@code attemptsMade + 1}: base * 2^(attemptsMade - 1), capped. */
    public long delayMillis(int attemptsMade) {
        if (attemptsMade <= 0) {
            return 0;
        }
        int shift = Math.min(attemptsMade - 1, 30);
        long delay = baseDelayMillis << shift;
        if (delay < 0 || delay > maxDelayMillis) {
            return maxDelayMillis;
        }
        return delay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
