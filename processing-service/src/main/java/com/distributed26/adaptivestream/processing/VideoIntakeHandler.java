package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.shared.errors.ValidationException;
import com.distributed26.adaptivestream.shared.events.PipelineEventBus;
import com.distributed26.adaptivestream.shared.events.VideoSubmittedEvent;
import com.distributed26.adaptivestream.shared.model.Video;
import com.distributed26.adaptivestream.shared.model.VideoStatus;
import com.distributed26.adaptivestream.shared.model.Visibility;
import io.javalin.http.Context;
import io.javalin.http.UploadedFile;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@code POST /videos}: stores the multipart {@code file} part as the video source, then
 * announces the submission on the event bus.
 */
public class VideoIntakeHandler {
    private static final Logger LOGGER = LogManager.getLogger(VideoIntakeHandler.class);
    static final String OWNER_HEADER = "X-Owner-Id";

    private final JobOrchestrator orchestrator;
    private final PipelineEventBus events;

    public VideoIntakeHandler(JobOrchestrator orchestrator, PipelineEventBus events) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator is null");
        this.events = Objects.requireNonNull(events, "events is null");
    }

    public void upload(Context ctx) {
        String ownerId = ctx.header(OWNER_HEADER);
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Missing " + OWNER_HEADER + " header");
        }
        UploadedFile uploadedFile = ctx.uploadedFile("file");
        if (uploadedFile == null) {
            throw new ValidationException("No 'file' part found in request");
        }

        String videoId = UUID.randomUUID().toString();
        String filename = uploadedFile.filename();
        LOGGER.info("Receiving upload {} as video {}", filename, videoId);

        Instant now = Instant.now();
        Video video = new Video(
                videoId,
                ownerId.trim(),
                ctx.formParam("title"),
                ctx.formParam("description"),
                ctx.formParam("category"),
                parseTags(ctx.formParam("tags")),
                parseVisibility(ctx.formParam("visibility")),
                filename,
                VideoStatus.UPLOADED,
                null,
                now,
                now);

        try (InputStream is = uploadedFile.content()) {
            orchestrator.ingest(video, is, uploadedFile.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded file", e);
        }

        events.publish(new VideoSubmittedEvent(videoId, video.getOwnerId(), Instant.now()));
        ctx.status(202).json(Map.of("videoId", videoId));
    }

    static List<String> parseTags(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    static Visibility parseVisibility(String raw) {
        if (raw == null || raw.isBlank()) {
            return Visibility.PUBLIC;
        }
        try {
            return Visibility.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown visibility '" + raw + "'");
        }
    }
}
