package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.processing.ffmpeg.FfmpegBinaries;
import com.distributed26.adaptivestream.processing.ffmpeg.FfmpegThumbnailGenerator;
import com.distributed26.adaptivestream.processing.ffmpeg.FfmpegTranscoder;
import com.distributed26.adaptivestream.processing.ffmpeg.FfprobeMediaProber;
import com.distributed26.adaptivestream.shared.config.EnvConfig;
import com.distributed26.adaptivestream.shared.config.PipelineConfig;
import com.distributed26.adaptivestream.shared.errors.ConcurrencyConflictException;
import com.distributed26.adaptivestream.shared.errors.NotFoundException;
import com.distributed26.adaptivestream.shared.errors.PipelineException;
import com.distributed26.adaptivestream.shared.errors.ValidationException;
import com.distributed26.adaptivestream.shared.events.PipelineEvent;
import com.distributed26.adaptivestream.shared.events.PipelineEventBus;
import com.distributed26.adaptivestream.shared.events.PipelineEventBuses;
import com.distributed26.adaptivestream.shared.events.VideoSubmittedEvent;
import com.distributed26.adaptivestream.shared.storage.BinaryStore;
import com.distributed26.adaptivestream.shared.storage.BinaryStoreFactory;
import io.javalin.Javalin;
import io.javalin.config.SizeUnit;
import io.javalin.http.Context;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for the processing service.
 *
 * <p>Accepts uploads over HTTP and listens on the {@code pipeline.events} exchange for
 * {@link VideoSubmittedEvent}s; each submission becomes a pipeline run on the
 * {@link JobOrchestrator}.
 *
 * <p>Relevant .env entries:
 * <pre>
 *   PROCESSING_PORT=8081
 *   WORKER_POOL_SIZE=2
 *   STORAGE_MODE=memory      # skip MinIO
 *   EVENT_BUS=memory         # skip RabbitMQ
 * </pre>
 */
public class ProcessingServiceApplication {
    private static final Logger LOGGER = LogManager.getLogger(ProcessingServiceApplication.class);

    public static void main(String[] args) throws Exception {
        EnvConfig env = EnvConfig.load();
        PipelineConfig config = PipelineConfig.fromEnv(env);
        LOGGER.info("Pipeline config: {}", config);

        BinaryStore store = BinaryStoreFactory.fromEnv(env);
        PipelineEventBus bus = PipelineEventBuses.fromEnv(env, "processing");

        FfmpegBinaries binaries = FfmpegBinaries.from(config);
        JobOrchestrator orchestrator = new JobOrchestrator(
                store,
                new FfprobeMediaProber(binaries),
                new FfmpegTranscoder(binaries, config),
                new FfmpegThumbnailGenerator(binaries),
                new QualityLadderPlanner(QualityLadder.load()),
                bus,
                config).start();

        bus.subscribeAll(event -> onEvent(event, orchestrator));

        int port = env.getInt("PROCESSING_PORT", "processing.port", 8081);
        Javalin app = createApp(orchestrator, bus);
        LOGGER.info("Starting processing HTTP server on port {}", port);
        app.start(port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            app.stop();
            orchestrator.shutdown();
            if (bus instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    LOGGER.warn("Error closing bus", e);
                }
            }
        }));

        Thread.currentThread().join();
    }

    static Javalin createApp(JobOrchestrator orchestrator, PipelineEventBus bus) {
        ensureLogsDirectory();
        VideoIntakeHandler intake = new VideoIntakeHandler(orchestrator, bus);

        Javalin app = Javalin.create(config -> {
            config.jetty.multipartConfig.maxFileSize(10, SizeUnit.GB);
            config.requestLogger.http((ctx, ms) ->
                    LOGGER.debug("{} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms));
        });

        app.before(ctx -> {
            ctx.header("Access-Control-Allow-Origin", "*");
            ctx.header("Access-Control-Allow-Methods", "GET, POST, DELETE, OPTIONS");
            ctx.header("Access-Control-Allow-Headers", "Content-Type, " + VideoIntakeHandler.OWNER_HEADER);
        });
        app.options("/*", ctx -> ctx.status(204));

        app.get("/health", ctx -> ctx.json(Map.of("status", "ok")));

        app.get("/workers", ctx -> {
            var snapshot = orchestrator.workers().stream().map(w -> Map.of(
                    "id",             w.getId(),
                    "status",         w.getStatus().name(),
                    "completedTasks", w.getCompletedTasks(),
                    "currentTask",    w.getCurrentTask() == null ? "" : w.getCurrentTask()
            )).toList();
            ctx.json(Map.of(
                    "workers", snapshot,
                    "queued",  orchestrator.queuedTasks()
            ));
        });

        app.post("/videos", intake::upload);

        app.post("/videos/{videoId}/submit", ctx -> {
            String videoId = ctx.pathParam("videoId");
            orchestrator.submit(videoId);
            ctx.status(202).json(Map.of("videoId", videoId));
        });

        app.get("/videos/{videoId}/status", ctx -> ctx.json(orchestrator.status(ctx.pathParam("videoId"))));

        app.delete("/videos/{videoId}", ctx -> {
            orchestrator.delete(ctx.pathParam("videoId"));
            ctx.status(204);
        });

        app.exception(ValidationException.class, (e, ctx) -> error(ctx, 400, e));
        app.exception(NotFoundException.class, (e, ctx) -> error(ctx, 404, e));
        app.exception(ConcurrencyConflictException.class, (e, ctx) -> error(ctx, 409, e));
        app.exception(PipelineException.class, (e, ctx) -> {
            LOGGER.error("Unhandled pipeline error on {} {}", ctx.method(), ctx.path(), e);
            error(ctx, 500, e);
        });

        return app;
    }

    static void error(Context ctx, int status, PipelineException e) {
        ctx.status(status).json(Map.of(
                "error",   e.getClass().getSimpleName(),
                "message", String.valueOf(e.getMessage())
        ));
    }

    private static void ensureLogsDirectory() {
        try {
            Files.createDirectories(Path.of("logs"));
        } catch (IOException e) {
            LOGGER.warn("Failed to create logs directory", e);
        }
    }

    // ── Event handling ──

    static void onEvent(PipelineEvent event, JobOrchestrator orchestrator) {
        if (!(event instanceof VideoSubmittedEvent submitted)) {
            return;
        }
        LOGGER.info("VideoSubmittedEvent: videoId={} owner={}", submitted.getVideoId(), submitted.getOwnerId());
        try {
            orchestrator.submit(submitted.getVideoId());
        } catch (ConcurrencyConflictException | NotFoundException e) {
            LOGGER.warn("Ignoring submission of {}: {}", submitted.getVideoId(), e.describe());
        }
    }
}
