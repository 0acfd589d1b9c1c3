package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.shared.config.PipelineConfig;
import com.distributed26.adaptivestream.shared.db.VideoRepository;
import com.distributed26.adaptivestream.shared.errors.ConcurrencyConflictException;
import com.distributed26.adaptivestream.shared.errors.NotFoundException;
import com.distributed26.adaptivestream.shared.errors.PipelineException;
import com.distributed26.adaptivestream.shared.errors.StorageException;
import com.distributed26.adaptivestream.shared.errors.TranscodeException;
import com.distributed26.adaptivestream.shared.errors.ValidationException;
import com.distributed26.adaptivestream.shared.events.PipelineEvent;
import com.distributed26.adaptivestream.shared.events.PipelineEventBus;
import com.distributed26.adaptivestream.shared.events.RenditionStatusEvent;
import com.distributed26.adaptivestream.shared.events.VideoStatusEvent;
import com.distributed26.adaptivestream.shared.jobs.Worker;
import com.distributed26.adaptivestream.shared.model.Rendition;
import com.distributed26.adaptivestream.shared.model.RenditionStatus;
import com.distributed26.adaptivestream.shared.model.SourceProbe;
import com.distributed26.adaptivestream.shared.model.ThumbnailSize;
import com.distributed26.adaptivestream.shared.model.Video;
import com.distributed26.adaptivestream.shared.model.VideoStatus;
import com.distributed26.adaptivestream.shared.storage.BinaryStore;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives a video from {@code UPLOADED} to a terminal status.
 *
 * <p>{@link #submit(String)} takes the per-video lease (a status compare-and-set) and hands the
 * run to the pipeline executor, which probes the source and plans the ladder. Each rendition is
 * then queued for the {@link TranscodingWorker} pool; a finished encode is segmented on a
 * separate executor so the worker can take the next task. Transient failures are retried through
 * a scheduler, never by sleeping on a worker. When the last rendition of a run is terminal the
 * video status is derived from the rendition statuses, which releases the lease.
 */
public class JobOrchestrator {
    private static final Logger LOGGER = LogManager.getLogger(JobOrchestrator.class);

    private final BinaryStore store;
    private final VideoRepository videos;
    private final MediaProber prober;
    private final Transcoder transcoder;
    private final ThumbnailGenerator thumbnails;
    private final QualityLadderPlanner planner;
    private final Segmenter segmenter;
    private final RetryPolicy retryPolicy;
    private final PipelineEventBus events;

    private final BlockingQueue<RenditionTask> taskQueue = new LinkedBlockingQueue<>();
    private final List<TranscodingWorker> workers = new ArrayList<>();
    private final ExecutorService pipelineExecutor;
    private final ExecutorService segmentingExecutor;
    private final ScheduledExecutorService retryScheduler;

    private final Map<String, PipelineRun> activeRuns = new ConcurrentHashMap<>();
    private final Object runsLock = new Object();

    public JobOrchestrator(
            BinaryStore store,
            MediaProber prober,
            Transcoder transcoder,
            ThumbnailGenerator thumbnails,
            QualityLadderPlanner planner,
            PipelineEventBus events,
            PipelineConfig config
    ) {
        this.store = Objects.requireNonNull(store, "store is null");
        this.videos = store.videos();
        this.prober = Objects.requireNonNull(prober, "prober is null");
        this.transcoder = Objects.requireNonNull(transcoder, "transcoder is null");
        this.thumbnails = Objects.requireNonNull(thumbnails, "thumbnails is null");
        this.planner = Objects.requireNonNull(planner, "planner is null");
        this.events = Objects.requireNonNull(events, "events is null");
        Objects.requireNonNull(config, "config is null");
        this.segmenter = new Segmenter(config.getSegmentDurationSeconds());
        this.retryPolicy = RetryPolicy.from(config);

        int poolSize = config.getWorkerPoolSize();
        this.pipelineExecutor = Executors.newFixedThreadPool(poolSize, named("pipeline"));
        this.segmentingExecutor = Executors.newFixedThreadPool(poolSize, named("segmenter"));
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(named("retry"));
        for (int i = 0; i < poolSize; i++) {
            workers.add(new TranscodingWorker("worker-" + i, taskQueue, this::encode));
        }
    }

    public JobOrchestrator start() {
        workers.forEach(TranscodingWorker::start);
        LOGGER.info("Started {} transcoding worker(s)", workers.size());
        return this;
    }

    public void shutdown() {
        LOGGER.info("Shutdown: stopping workers...");
        workers.forEach(TranscodingWorker::stop);
        retryScheduler.shutdownNow();
        pipelineExecutor.shutdownNow();
        segmentingExecutor.shutdownNow();
        for (PipelineRun run : activeRuns.values()) {
            run.cancel();
        }
        activeRuns.clear();
        transcoder.close();
    }

    // ── Intake ──

    /**
     * Stores the uploaded source and records the video as {@code UPLOADED}. The source blob is
     * written first so a video row never points at a missing source.
     */
    public Video ingest(Video video, InputStream data, long size) {
        Objects.requireNonNull(video, "video is null");
        Objects.requireNonNull(data, "data is null");
        if (size <= 0) {
            throw new ValidationException("Uploaded file is empty");
        }
        if (video.getStatus() != VideoStatus.UPLOADED) {
            throw new ValidationException("New videos must start as UPLOADED, got " + video.getStatus());
        }
        store.putSource(video.getId(), data, size);
        videos.create(video);
        LOGGER.info("Ingested video {} ({} bytes) for owner {}", video.getId(), size, video.getOwnerId());
        return video;
    }

    // ── Lease ──

    /**
     * Starts a pipeline run for a video that is not already being processed.
     *
     * @throws NotFoundException if the video does not exist
     * @throws ConcurrencyConflictException if a run is already in progress
     */
    public void submit(String videoId) {
        PipelineRun run;
        synchronized (runsLock) {
            Video video = videos.findVideo(videoId)
                    .orElseThrow(() -> new NotFoundException("Video " + videoId + " not found"));
            if (!videos.compareAndSetStatus(videoId, VideoStatus.SUBMITTABLE, VideoStatus.ANALYZING, null)) {
                throw new ConcurrencyConflictException("Video " + videoId + " is already being processed ("
                        + videos.findVideo(videoId).map(Video::getStatus).orElse(video.getStatus()) + ")");
            }
            run = new PipelineRun(videoId);
            activeRuns.put(videoId, run);
        }
        LOGGER.info("Submitted video {}", videoId);
        publish(new VideoStatusEvent(videoId, VideoStatus.ANALYZING, null, Instant.now()));
        pipelineExecutor.execute(() -> analyze(run));
    }

    // ── Analysis ──

    void analyze(PipelineRun run) {
        String videoId = run.getVideoId();
        try {
            Path source = Files.createTempFile("source-" + videoId + "-", ".bin");
            run.attachSource(source);
            try (InputStream in = store.openSource(videoId)) {
                Files.copy(in, source, StandardCopyOption.REPLACE_EXISTING);
            }
            if (run.isCancelled()) {
                run.deleteSource();
                return;
            }

            SourceProbe probe = prober.probe(source);
            run.attachProbe(probe);
            if (!run.guarded(() -> videos.saveProbe(videoId, probe))) {
                return;
            }
            storeThumbnails(run, source, probe);

            List<TranscodingProfile> plan = planner.plan(probe.getWidth(), probe.getHeight());
            Map<String, Rendition> existing = store.listRenditions(videoId).stream()
                    .collect(Collectors.toMap(Rendition::getQuality, Function.identity()));
            Set<String> planned = new LinkedHashSet<>();
            List<TranscodingProfile> pending = new ArrayList<>();
            for (TranscodingProfile profile : plan) {
                planned.add(profile.getLabel());
                Rendition previous = existing.get(profile.getLabel());
                if (previous != null && previous.isReady() && matches(previous, profile)) {
                    LOGGER.info("Keeping READY rendition {}/{}", videoId, profile.getLabel());
                    continue;
                }
                Rendition fresh = Rendition.pending(videoId, profile.getLabel(), profile.getWidth(),
                        profile.getHeight(), profile.getBitrate(), profile.getCodec(), segmenter.getChunkSeconds());
                if (!run.guarded(() -> store.resetRendition(fresh))) {
                    return;
                }
                pending.add(profile);
            }
            run.plan(planned);

            if (pending.isEmpty()) {
                LOGGER.info("Video {} has every planned rendition READY already", videoId);
                finalizeVideo(run);
                return;
            }
            run.expectRenditions(pending.size());
            boolean moved = run.guarded(() -> {
                if (!videos.compareAndSetStatus(videoId, EnumSet.of(VideoStatus.ANALYZING), VideoStatus.PROCESSING, null)) {
                    throw new StorageException("Video " + videoId + " left ANALYZING unexpectedly");
                }
            });
            if (!moved) {
                return;
            }
            publish(new VideoStatusEvent(videoId, VideoStatus.PROCESSING, null, Instant.now()));
            LOGGER.info("Video {} PROCESSING: queuing {} rendition(s) {}", videoId, pending.size(),
                    pending.stream().map(TranscodingProfile::getLabel).collect(Collectors.toList()));
            for (TranscodingProfile profile : pending) {
                taskQueue.offer(new RenditionTask(run, profile, 1));
            }
        } catch (PipelineException e) {
            failAnalysis(run, e.describe(), e);
        } catch (IOException e) {
            failAnalysis(run, "IOException: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            failAnalysis(run, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private void storeThumbnails(PipelineRun run, Path source, SourceProbe probe) {
        String videoId = run.getVideoId();
        if (store.hasThumbnailSet(videoId)) {
            return;
        }
        try {
            Map<ThumbnailSize, byte[]> images = thumbnails.generate(source, probe);
            for (Map.Entry<ThumbnailSize, byte[]> image : images.entrySet()) {
                run.guarded(() -> store.putThumbnail(videoId, image.getKey(), image.getValue()));
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Thumbnail generation failed for video {}; continuing without thumbnails", videoId, e);
        }
    }

    private static boolean matches(Rendition rendition, TranscodingProfile profile) {
        return rendition.getWidth() == profile.getWidth()
                && rendition.getHeight() == profile.getHeight()
                && rendition.getBitrate() == profile.getBitrate()
                && rendition.getCodec().equals(profile.getCodec());
    }

    private void failAnalysis(PipelineRun run, String reason, Exception cause) {
        String videoId = run.getVideoId();
        LOGGER.error("Analysis of video {} failed: {}", videoId, reason, cause);
        run.deleteSource();
        persist(run, "FAILED status of video " + videoId,
                () -> videos.updateStatus(videoId, VideoStatus.FAILED, reason),
                () -> {
                    activeRuns.remove(videoId, run);
                    publish(new VideoStatusEvent(videoId, VideoStatus.FAILED, reason, Instant.now()));
                });
    }

    // ── Encode (worker threads) ──

    void encode(RenditionTask task) {
        PipelineRun run = task.getRun();
        if (run.isCancelled()) {
            LOGGER.debug("Dropping {}: run cancelled", task);
            return;
        }
        EncodedStream stream;
        try {
            Optional<Rendition> current = store.findRendition(task.getVideoId(), task.getQuality());
            if (current.isEmpty()) {
                return;
            }
            Rendition encoding = current.get().withStatus(RenditionStatus.ENCODING)
                    .withAttempts(task.getAttempt(), current.get().getFailureReason());
            if (!run.guarded(() -> store.putRendition(encoding))) {
                return;
            }
            publishRendition(encoding);
            stream = transcoder.transcode(run.getSource(), run.getProbe(), task.getProfile());
        } catch (PipelineException e) {
            onFailure(task, e, null);
            return;
        } catch (RuntimeException e) {
            onFailure(task, TranscodeException.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage(), e), null);
            return;
        }

        run.track(stream);
        if (run.isCancelled()) {
            return;
        }
        segmentingExecutor.execute(() -> segment(task, stream));
    }

    // ── Segment (segmenting executor) ──

    void segment(RenditionTask task, EncodedStream stream) {
        PipelineRun run = task.getRun();
        String videoId = task.getVideoId();
        String quality = task.getQuality();
        Rendition[] ready = new Rendition[1];
        try {
            Optional<Rendition> current = store.findRendition(videoId, quality);
            if (current.isEmpty() || run.isCancelled()) {
                run.release(stream);
                return;
            }
            Rendition segmenting = current.get().withStatus(RenditionStatus.SEGMENTING)
                    .withAttempts(task.getAttempt(), current.get().getFailureReason());
            if (!run.guarded(() -> store.putRendition(segmenting))) {
                return;
            }
            publishRendition(segmenting);

            SegmentSequence sequence = segmenter.segment(stream);
            int resumeAt = Math.min(store.storedSegmentCount(videoId, quality), sequence.count());
            if (resumeAt > 0) {
                LOGGER.info("Resuming {}/{} at segment {} of {}", videoId, quality, resumeAt, sequence.count());
            }
            Iterator<SegmentChunk> chunks = sequence.from(resumeAt);
            while (chunks.hasNext()) {
                SegmentChunk chunk = chunks.next();
                boolean stored = run.guarded(() -> store.appendSegment(videoId, quality, chunk.getIndex(),
                        chunk.getStartSeconds(), chunk.getDurationSeconds(), chunk.getPayload()));
                if (!stored) {
                    return;
                }
            }

            boolean marked = run.guarded(() -> ready[0] = store.markRenditionReady(videoId, quality,
                    sequence.count(), sequence.totalDurationSeconds()));
            run.release(stream);
            if (!marked) {
                return;
            }
        } catch (PipelineException e) {
            onFailure(task, e, stream);
            return;
        } catch (RuntimeException e) {
            onFailure(task, TranscodeException.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage(), e), stream);
            return;
        }
        // READY is recorded; nothing past here goes through onFailure.
        publishRendition(ready[0]);
        renditionDone(run);
    }

    // ── Failure and retry ──

    private void onFailure(RenditionTask task, PipelineException error, EncodedStream stream) {
        PipelineRun run = task.getRun();
        String videoId = task.getVideoId();
        String quality = task.getQuality();
        String reason = error.describe();
        if (run.isCancelled()) {
            if (stream != null) {
                run.release(stream);
            }
            return;
        }

        boolean retry = isRetryable(error) && retryPolicy.shouldRetry(task.getAttempt());
        if (retry) {
            LOGGER.warn("Rendition {}/{} attempt {} failed ({}); retrying in {} ms",
                    videoId, quality, task.getAttempt(), reason, retryPolicy.delayMillis(task.getAttempt()), error);
        } else {
            if (stream != null) {
                run.release(stream);
            }
            LOGGER.error("Rendition {}/{} FAILED after {} attempt(s): {}", videoId, quality, task.getAttempt(), reason, error);
        }

        Rendition[] recorded = new Rendition[1];
        persist(run, (retry ? "retry of " : "failure of ") + task,
                () -> recorded[0] = store.findRendition(videoId, quality)
                        .map(current -> retry
                                ? current.withStatus(RenditionStatus.PENDING).withAttempts(task.getAttempt(), reason)
                                : current.withAttempts(task.getAttempt(), reason).failed(reason))
                        .map(next -> {
                            store.putRendition(next);
                            return next;
                        })
                        .orElse(null),
                () -> {
                    if (recorded[0] == null) {
                        // rendition row is gone
                        if (stream != null) {
                            run.release(stream);
                        }
                        return;
                    }
                    publishRendition(recorded[0]);
                    if (retry) {
                        scheduleRetry(task.nextAttempt(), stream, retryPolicy.delayMillis(task.getAttempt()));
                    } else {
                        renditionDone(run);
                    }
                });
    }

    private void scheduleRetry(RenditionTask next, EncodedStream stream, long delayMillis) {
        schedule(() -> {
            if (stream != null) {
                segmentingExecutor.execute(() -> segment(next, stream));
            } else {
                taskQueue.offer(next);
            }
        }, delayMillis, "retry of " + next);
    }

    /**
     * Runs a write that moves the run toward a terminal state, then {@code onWritten}. A write that
     * throws is retried with backoff until it succeeds or the run is cancelled.
     */
    private void persist(PipelineRun run, String what, Runnable write, Runnable onWritten) {
        persist(run, what, write, onWritten, 1);
    }

    private void persist(PipelineRun run, String what, Runnable write, Runnable onWritten, int attempt) {
        boolean written;
        try {
            written = run.guarded(write);
        } catch (RuntimeException e) {
            long delay = retryPolicy.delayMillis(attempt);
            LOGGER.error("Could not record {} (attempt {}); retrying in {} ms", what, attempt, delay, e);
            schedule(() -> persist(run, what, write, onWritten, attempt + 1), delay, what);
            return;
        }
        if (written) {
            onWritten.run();
        }
    }

    private void schedule(Runnable action, long delayMillis, String what) {
        try {
            retryScheduler.schedule(action, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Dropping {}: orchestrator is shutting down", what);
        }
    }

    static boolean isRetryable(PipelineException error) {
        if (error instanceof TranscodeException) {
            return ((TranscodeException) error).isTransient();
        }
        return error instanceof StorageException;
    }

    // ── Completion ──

    private void renditionDone(PipelineRun run) {
        if (run.renditionFinished() == 0) {
            finalizeVideo(run);
        }
    }

    private void finalizeVideo(PipelineRun run) {
        String videoId = run.getVideoId();
        Set<String> planned = run.plannedQualities();
        VideoStatusEvent[] outcome = new VideoStatusEvent[1];
        persist(run, "final status of video " + videoId, () -> {
            List<Rendition> renditions = store.listRenditions(videoId).stream()
                    .filter(r -> planned.contains(r.getQuality()))
                    .collect(Collectors.toList());
            VideoStatus terminal = VideoStatus.fromRenditions(
                    renditions.stream().map(Rendition::getStatus).collect(Collectors.toList()));
            String reason = terminal == VideoStatus.READY ? null : renditions.stream()
                    .filter(r -> r.getStatus() == RenditionStatus.FAILED)
                    .map(r -> r.getQuality() + ": " + r.getFailureReason())
                    .collect(Collectors.joining("; "));
            videos.updateStatus(videoId, terminal, reason);
            outcome[0] = new VideoStatusEvent(videoId, terminal, reason, Instant.now());
        }, () -> {
            run.deleteSource();
            activeRuns.remove(videoId, run);
            LOGGER.info("Video {} finished: {}", videoId, outcome[0].getStatus());
            publish(outcome[0]);
        });
    }

    // ── Queries ──

    public VideoStatusReport status(String videoId) {
        Video video = videos.findVideo(videoId)
                .orElseThrow(() -> new NotFoundException("Video " + videoId + " not found"));
        List<RenditionStatusReport> renditions = store.listRenditions(videoId).stream()
                .map(r -> RenditionStatusReport.of(r,
                        r.isReady() ? r.getSegmentCount() : store.storedSegmentCount(videoId, r.getQuality())))
                .collect(Collectors.toList());
        return new VideoStatusReport(videoId, video.getStatus(), video.getFailureReason(),
                videos.findProbe(videoId).orElse(null), renditions);
    }

    // ── Delete ──

    /**
     * Cancels any active run, then removes the video's rows and blobs. Once the run is cancelled no
     * further write on its behalf can land; encodes still in flight finish and are discarded.
     *
     * @throws NotFoundException if the video does not exist
     */
    public void delete(String videoId) {
        synchronized (runsLock) {
            PipelineRun run = activeRuns.remove(videoId);
            if (run != null) {
                run.cancel();
                taskQueue.removeIf(task -> task.getRun() == run);
            }
            if (!store.deleteVideo(videoId)) {
                throw new NotFoundException("Video " + videoId + " not found");
            }
        }
    }

    // ── Pool visibility ──

    public List<Worker> workers() {
        return workers.stream().map(TranscodingWorker::getWorker).collect(Collectors.toList());
    }

    public int queuedTasks() {
        return taskQueue.size();
    }

    boolean isActive(String videoId) {
        return activeRuns.containsKey(videoId);
    }

    // ── Events ──

    private void publishRendition(Rendition rendition) {
        publish(new RenditionStatusEvent(rendition.getVideoId(), rendition.getQuality(), rendition.getStatus(),
                rendition.getAttempts(), rendition.getFailureReason(), Instant.now()));
    }

    private void publish(PipelineEvent event) {
        try {
            events.publish(event);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to publish {} event for video {}", event.getType(), event.getVideoId(), e);
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
