package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.shared.model.SourceProbe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * State of one submission of one video, from lease to terminal status.
 *
 * <p>Every durable write made on behalf of the run goes through {@link #guarded(Runnable)}, which
 * holds the read lock and checks the cancelled flag. {@link #cancel()} takes the write lock, so
 * once it returns no further write can land.
 */
public class PipelineRun {
    private static final Logger LOGGER = LogManager.getLogger(PipelineRun.class);

    private final String videoId;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicInteger remaining = new AtomicInteger();
    private final Set<EncodedStream> openStreams = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;
    private volatile Path source;
    private volatile SourceProbe probe;
    private volatile Set<String> plannedQualities = Set.of();

    public PipelineRun(String videoId) {
        this.videoId = Objects.requireNonNull(videoId, "videoId is null");
    }

    public String getVideoId() {
        return videoId;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Runs {@code write} unless the run was cancelled.
     *
     * @return {@code false} if the write was skipped
     */
    public boolean guarded(Runnable write) {
        Lock read = lock.readLock();
        read.lock();
        try {
            if (cancelled) {
                return false;
            }
            write.run();
            return true;
        } finally {
            read.unlock();
        }
    }

    /** Blocks until in-flight guarded writes finish, then releases every resource of the run. */
    public void cancel() {
        Lock write = lock.writeLock();
        write.lock();
        try {
            cancelled = true;
        } finally {
            write.unlock();
        }
        for (EncodedStream stream : openStreams) {
            release(stream);
        }
        deleteSource();
        LOGGER.info("Run for video {} cancelled", videoId);
    }

    void attachSource(Path source) {
        this.source = source;
    }

    void attachProbe(SourceProbe probe) {
        this.probe = probe;
    }

    void plan(Set<String> qualities) {
        this.plannedQualities = Set.copyOf(qualities);
    }

    /** Qualities this run is responsible for, READY ones carried over from earlier runs included. */
    Set<String> plannedQualities() {
        return plannedQualities;
    }

    Path getSource() {
        return source;
    }

    SourceProbe getProbe() {
        return probe;
    }

    void expectRenditions(int count) {
        remaining.set(count);
    }

    /** @return renditions still outstanding after this one */
    int renditionFinished() {
        return remaining.decrementAndGet();
    }

    int remainingRenditions() {
        return remaining.get();
    }

    void track(EncodedStream stream) {
        openStreams.add(stream);
        if (cancelled) {
            release(stream);
        }
    }

    void release(EncodedStream stream) {
        if (openStreams.remove(stream)) {
            stream.close();
        }
    }

    void deleteSource() {
        Path path = source;
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.warn("Could not delete source copy {} of video {}", path, videoId, e);
        }
    }
}
