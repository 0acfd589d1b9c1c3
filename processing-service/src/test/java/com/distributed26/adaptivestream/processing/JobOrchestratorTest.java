package com.distributed26.adaptivestream.processing;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

import com.distributed26.adaptivestream.shared.config.PipelineConfig;
import com.distributed26.adaptivestream.shared.db.InMemoryCatalog;
import com.distributed26.adaptivestream.shared.errors.ConcurrencyConflictException;
import com.distributed26.adaptivestream.shared.errors.NotFoundException;
import com.distributed26.adaptivestream.shared.errors.StorageException;
import com.distributed26.adaptivestream.shared.errors.TranscodeException;
import com.distributed26.adaptivestream.shared.errors.ValidationException;
import com.distributed26.adaptivestream.shared.events.InMemoryPipelineEventBus;
import com.distributed26.adaptivestream.shared.events.PipelineEvent;
import com.distributed26.adaptivestream.shared.events.VideoStatusEvent;
import com.distributed26.adaptivestream.shared.model.Rendition;
import com.distributed26.adaptivestream.shared.model.RenditionStatus;
import com.distributed26.adaptivestream.shared.model.SegmentRecord;
import com.distributed26.adaptivestream.shared.model.SourceProbe;
import com.distributed26.adaptivestream.shared.model.Video;
import com.distributed26.adaptivestream.shared.model.VideoStatus;
import com.distributed26.adaptivestream.shared.storage.BinaryStore;
import com.distributed26.adaptivestream.shared.storage.InMemoryObjectStorageClient;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobOrchestratorTest {
    private static final String CLIP = "clip-10s";
    private static final SourceProbe TEN_SECONDS_720P =
            new SourceProbe(10.0, 1280, 720, "h264", 30.0, "mov,mp4,m4a,3gp,3g2,mj2");
    private static final QualityLadder LADDER = QualityLadder.of(List.of(
            new TranscodingProfile("240p", 426, 240, 300_000, "libx264"),
            new TranscodingProfile("720p", 1280, 720, 3_000_000, "libx264")));

    private InMemoryObjectStorageClient storage;
    private InMemoryCatalog catalog;
    private BinaryStore store;
    private FakeMediaProber prober;
    private FakeTranscoder transcoder;
    private FakeThumbnailGenerator thumbnails;
    private InMemoryPipelineEventBus bus;
    private List<PipelineEvent> published;
    private JobOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        storage = new InMemoryObjectStorageClient();
        catalog = new InMemoryCatalog();
        prober = new FakeMediaProber().register(CLIP, TEN_SECONDS_720P);
        transcoder = new FakeTranscoder();
        thumbnails = new FakeThumbnailGenerator();
        bus = new InMemoryPipelineEventBus();
        published = new CopyOnWriteArrayList<>();
        bus.subscribeAll(published::add);
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    private void startOrchestrator() {
        store = new BinaryStore(storage, catalog);
        PipelineConfig config = PipelineConfig.builder()
                .workerPoolSize(2)
                .retryBaseDelayMillis(10)
                .retryMaxDelayMillis(40)
                .build();
        orchestrator = new JobOrchestrator(store, prober, transcoder, thumbnails,
                new QualityLadderPlanner(LADDER), bus, config).start();
    }

    // ── Happy path ─────────────────────────────────────────────────────────────

    @Test
    void tenSecondSource_twoLevels_bothReadyWithThreeSegments() {
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);
        VideoStatusReport report = awaitTerminal(videoId);

        assertEquals(VideoStatus.READY, report.getStatus());
        assertNull(report.getFailureReason());
        assertEquals(TEN_SECONDS_720P, report.getProbe());
        assertEquals(List.of("240p", "720p"),
                report.getRenditions().stream().map(RenditionStatusReport::getQuality).collect(Collectors.toList()));
        for (String quality : List.of("240p", "720p")) {
            RenditionStatusReport rendition = report.rendition(quality).orElseThrow();
            assertEquals(RenditionStatus.READY, rendition.getStatus());
            assertEquals(3, rendition.getSegmentCount());
            assertEquals(1, rendition.getAttempts());
            List<Double> durations = store.listSegments(videoId, quality).stream()
                    .map(SegmentRecord::getDurationSeconds).collect(Collectors.toList());
            assertEquals(List.of(4.0, 4.0, 2.0), durations);
        }
    }

    @Test
    void finishedRun_releasesEncodedStreamsAndStoresThumbnails() {
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);
        awaitTerminal(videoId);

        assertEquals(2, transcoder.produced().size());
        assertTrue(transcoder.produced().stream().allMatch(InMemoryEncodedStream::isClosed));
        assertTrue(store.hasThumbnailSet(videoId));
        assertEquals(0, orchestrator.queuedTasks());
    }

    @Test
    void videoStatusEvents_followTheStateMachine() {
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);
        awaitTerminal(videoId);

        List<VideoStatus> statuses = published.stream()
                .filter(e -> e instanceof VideoStatusEvent)
                .map(e -> ((VideoStatusEvent) e).getStatus())
                .collect(Collectors.toList());
        assertEquals(List.of(VideoStatus.ANALYZING, VideoStatus.PROCESSING, VideoStatus.READY), statuses);
    }

    @Test
    void thumbnailFailure_doesNotFailVideo() {
        thumbnails.failing(true);
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);

        assertEquals(VideoStatus.READY, awaitTerminal(videoId).getStatus());
        assertFalse(store.hasThumbnailSet(videoId));
    }

    // ── Lease ──────────────────────────────────────────────────────────────────

    @Test
    void submit_whileRunActive_throwsConflict() {
        CountDownLatch gate = new CountDownLatch(1);
        transcoder.holdUntil(gate);
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);
        assertThrows(ConcurrencyConflictException.class, () -> orchestrator.submit(videoId));

        gate.countDown();
        assertEquals(VideoStatus.READY, awaitTerminal(videoId).getStatus());
    }

    @Test
    void resubmit_afterTerminal_keepsReadyRenditions() {
        startOrchestrator();
        String videoId = ingest(CLIP);
        orchestrator.submit(videoId);
        awaitTerminal(videoId);
        assertEquals(2, transcoder.calls());

        orchestrator.submit(videoId);
        VideoStatusReport report = awaitTerminal(videoId);

        assertEquals(VideoStatus.READY, report.getStatus());
        assertEquals(2, transcoder.calls(), "READY renditions must not be encoded again");
    }

    @Test
    void resubmit_afterPartialFailure_rerunsOnlyFailedRendition() {
        transcoder.failPermanently("720p");
        startOrchestrator();
        String videoId = ingest(CLIP);
        orchestrator.submit(videoId);
        assertEquals(VideoStatus.PARTIALLY_READY, awaitTerminal(videoId).getStatus());
        int callsAfterFirstRun = transcoder.calls();

        orchestrator.submit(videoId);
        awaitTerminal(videoId);

        assertEquals(callsAfterFirstRun + 1, transcoder.calls());
    }

    @Test
    void submit_unknownVideo_throwsNotFound() {
        startOrchestrator();
        assertThrows(NotFoundException.class, () -> orchestrator.submit("missing"));
    }

    // ── Failures ───────────────────────────────────────────────────────────────

    @Test
    void onePermanentFailure_givesPartiallyReady() {
        transcoder.failPermanently("720p");
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);
        VideoStatusReport report = awaitTerminal(videoId);

        assertEquals(VideoStatus.PARTIALLY_READY, report.getStatus());
        RenditionStatusReport failed = report.rendition("720p").orElseThrow();
        assertEquals(RenditionStatus.FAILED, failed.getStatus());
        assertEquals(1, failed.getAttempts(), "permanent failures are not retried");
        assertTrue(failed.getFailureReason().contains("permanent"), failed.getFailureReason());
        assertTrue(report.getFailureReason().contains("720p"));
        assertEquals(List.of("240p"), store.listReadyRenditions(videoId).stream()
                .map(Rendition::getQuality).collect(Collectors.toList()));
    }

    @Test
    void allRenditionsFail_videoFailed() {
        transcoder.failPermanently("240p").failPermanently("720p");
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);

        assertEquals(VideoStatus.FAILED, awaitTerminal(videoId).getStatus());
    }

    @Test
    void transientFailures_retriedUntilReady() {
        transcoder.failTransiently("240p", 2);
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);
        VideoStatusReport report = awaitTerminal(videoId);

        assertEquals(VideoStatus.READY, report.getStatus());
        assertEquals(3, report.rendition("240p").orElseThrow().getAttempts());
        assertEquals(1, report.rendition("720p").orElseThrow().getAttempts());
    }

    @Test
    void transientFailures_exhaustAttemptBudget() {
        transcoder.failTransiently("240p", 5);
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);
        VideoStatusReport report = awaitTerminal(videoId);

        assertEquals(VideoStatus.PARTIALLY_READY, report.getStatus());
        RenditionStatusReport failed = report.rendition("240p").orElseThrow();
        assertEquals(RenditionStatus.FAILED, failed.getStatus());
        assertEquals(3, failed.getAttempts());
        assertTrue(failed.getFailureReason().contains("transient"), failed.getFailureReason());
    }

    @Test
    void storageFailureWhileSegmenting_resumesWithoutReencoding() {
        AtomicBoolean failedOnce = new AtomicBoolean();
        storage = new InMemoryObjectStorageClient() {
            @Override
            public void uploadBytes(String key, byte[] data) {
                if (key.endsWith("240p/segment_00001.ts") && failedOnce.compareAndSet(false, true)) {
                    throw new StorageException("connection reset");
                }
                super.uploadBytes(key, data);
            }
        };
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);
        VideoStatusReport report = awaitTerminal(videoId);

        assertEquals(VideoStatus.READY, report.getStatus());
        assertEquals(2, report.rendition("240p").orElseThrow().getAttempts());
        assertEquals(2, transcoder.calls(), "segmenting retry must reuse the encoded stream");
        InMemoryEncodedStream low = transcoder.produced().stream()
                .filter(s -> s.label().equals("240p")).findFirst().orElseThrow();
        assertEquals(4, low.reads(), "chunk 0 must not be read again after the retry");
        assertEquals(3, store.listSegments(videoId, "240p").size());
    }

    @Test
    void unsupportedFormat_failsDuringAnalysisWithoutRenditions() {
        startOrchestrator();
        String videoId = ingest("not a video");

        orchestrator.submit(videoId);
        VideoStatusReport report = awaitTerminal(videoId);

        assertEquals(VideoStatus.FAILED, report.getStatus());
        assertTrue(report.getFailureReason().contains("UnsupportedFormatException"), report.getFailureReason());
        assertTrue(report.getRenditions().isEmpty());
        assertEquals(0, transcoder.calls());
    }

    // ── Catalog write failures ─────────────────────────────────────────────────

    @Test
    void failedRenditionWriteFailsOnce_videoStillFinalizesAndReleasesLease() {
        AtomicBoolean failedOnce = new AtomicBoolean();
        catalog = new InMemoryCatalog() {
            @Override
            public synchronized void upsertRendition(Rendition rendition) {
                if (rendition.getStatus() == RenditionStatus.FAILED && failedOnce.compareAndSet(false, true)) {
                    throw new StorageException("catalog unavailable");
                }
                super.upsertRendition(rendition);
            }
        };
        transcoder.failPermanently("720p");
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);
        VideoStatusReport report = awaitTerminal(videoId);

        assertTrue(failedOnce.get());
        assertEquals(VideoStatus.PARTIALLY_READY, report.getStatus());
        assertEquals(RenditionStatus.FAILED, report.rendition("720p").orElseThrow().getStatus());
        assertFalse(orchestrator.isActive(videoId));
        assertDoesNotThrow(() -> orchestrator.submit(videoId));
        awaitTerminal(videoId);
    }

    @Test
    void finalStatusWriteFailsOnce_videoStillBecomesReady() {
        AtomicBoolean failedOnce = new AtomicBoolean();
        catalog = new InMemoryCatalog() {
            @Override
            public synchronized void updateStatus(String videoId, VideoStatus status, String failureReason) {
                if (status.isTerminal() && failedOnce.compareAndSet(false, true)) {
                    throw new StorageException("catalog unavailable");
                }
                super.updateStatus(videoId, status, failureReason);
            }
        };
        startOrchestrator();
        String videoId = ingest(CLIP);

        orchestrator.submit(videoId);
        VideoStatusReport report = awaitTerminal(videoId);

        assertTrue(failedOnce.get());
        assertEquals(VideoStatus.READY, report.getStatus());
        assertTrue(published.stream().anyMatch(e -> e instanceof VideoStatusEvent
                && ((VideoStatusEvent) e).getStatus() == VideoStatus.READY));
    }

    @Test
    void analysisFailureWriteFailsOnce_videoStillFails() {
        AtomicBoolean failedOnce = new AtomicBoolean();
        catalog = new InMemoryCatalog() {
            @Override
            public synchronized void updateStatus(String videoId, VideoStatus status, String failureReason) {
                if (status == VideoStatus.FAILED && failedOnce.compareAndSet(false, true)) {
                    throw new StorageException("catalog unavailable");
                }
                super.updateStatus(videoId, status, failureReason);
            }
        };
        startOrchestrator();
        String videoId = ingest("not a video");

        orchestrator.submit(videoId);

        assertEquals(VideoStatus.FAILED, awaitTerminal(videoId).getStatus());
        assertTrue(failedOnce.get());
    }

    // ── Worker pool ────────────────────────────────────────────────────────────

    @Test
    void fiveVideos_poolOfTwo_neverExceedsTwoConcurrentEncodes() {
        transcoder.encodeMillis(30);
        startOrchestrator();
        List<String> videoIds = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            videoIds.add(ingest(CLIP));
        }

        videoIds.forEach(orchestrator::submit);

        for (String videoId : videoIds) {
            assertEquals(VideoStatus.READY, awaitTerminal(videoId).getStatus());
        }
        assertEquals(10, transcoder.calls());
        assertTrue(transcoder.maxConcurrent() <= 2, "max concurrent encodes was " + transcoder.maxConcurrent());
        assertTrue(transcoder.maxConcurrent() >= 1);
    }

    @Test
    void shutdown_closesTranscoder() {
        startOrchestrator();

        orchestrator.shutdown();

        assertTrue(transcoder.isClosed());
    }

    @Test
    void workers_reportPoolSize() {
        startOrchestrator();
        assertEquals(2, orchestrator.workers().size());
    }

    // ── Intake and delete ──────────────────────────────────────────────────────

    @Test
    void ingest_emptyUpload_throwsValidation() {
        startOrchestrator();
        Video video = Video.uploaded("v-empty", "owner-1", "empty", Instant.now());

        assertThrows(ValidationException.class,
                () -> orchestrator.ingest(video, new ByteArrayInputStream(new byte[0]), 0));
    }

    @Test
    void delete_cancelsActiveRunAndRemovesEverything() {
        CountDownLatch gate = new CountDownLatch(1);
        transcoder.holdUntil(gate);
        startOrchestrator();
        String videoId = ingest(CLIP);
        orchestrator.submit(videoId);
        await().atMost(Duration.ofSeconds(5)).until(() -> transcoder.calls() >= 1);

        orchestrator.delete(videoId);
        gate.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> transcoder.produced().size() == transcoder.calls()
                && transcoder.produced().stream().allMatch(InMemoryEncodedStream::isClosed));

        assertFalse(orchestrator.isActive(videoId));
        assertTrue(catalog.findVideo(videoId).isEmpty());
        assertTrue(catalog.listRenditions(videoId).isEmpty());
        assertEquals(0, storage.size());
        assertThrows(NotFoundException.class, () -> orchestrator.status(videoId));
    }

    @Test
    void delete_unknownVideo_throwsNotFound() {
        startOrchestrator();
        assertThrows(NotFoundException.class, () -> orchestrator.delete("missing"));
    }

    // ── Retry classification ───────────────────────────────────────────────────

    @Test
    void isRetryable_onlyTransientAndStorageErrors() {
        assertTrue(JobOrchestrator.isRetryable(TranscodeException.transientFailure("x", null)));
        assertFalse(JobOrchestrator.isRetryable(TranscodeException.permanentFailure("x")));
        assertTrue(JobOrchestrator.isRetryable(new StorageException("x")));
        assertFalse(JobOrchestrator.isRetryable(new ValidationException("x")));
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private String ingest(String marker) {
        String videoId = UUID.randomUUID().toString();
        byte[] bytes = marker.getBytes(StandardCharsets.UTF_8);
        orchestrator.ingest(Video.uploaded(videoId, "owner-1", "clip", Instant.now()),
                new ByteArrayInputStream(bytes), bytes.length);
        return videoId;
    }

    private VideoStatusReport awaitTerminal(String videoId) {
        await().atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(10))
                .until(() -> orchestrator.status(videoId).getStatus().isTerminal() && !orchestrator.isActive(videoId));
        return orchestrator.status(videoId);
    }
}
