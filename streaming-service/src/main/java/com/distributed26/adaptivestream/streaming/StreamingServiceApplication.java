package com.distributed26.adaptivestream.streaming;

import com.distributed26.adaptivestream.shared.config.EnvConfig;
import com.distributed26.adaptivestream.shared.errors.NotFoundException;
import com.distributed26.adaptivestream.shared.errors.PipelineException;
import com.distributed26.adaptivestream.shared.errors.RangeNotSatisfiableException;
import com.distributed26.adaptivestream.shared.errors.ValidationException;
import com.distributed26.adaptivestream.shared.model.ThumbnailSize;
import com.distributed26.adaptivestream.shared.storage.BinaryStore;
import com.distributed26.adaptivestream.shared.storage.BinaryStoreFactory;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class StreamingServiceApplication {
    private static final Logger logger = LogManager.getLogger(StreamingServiceApplication.class);
    private static final int DEFAULT_STREAMING_PORT = 8082;
    private static final String INSTANCE_ID = resolveInstanceId();

    public static void main(String[] args) {
        EnvConfig env = EnvConfig.load();
        int port = env.getInt("STREAMING_PORT", "streaming.port", DEFAULT_STREAMING_PORT);
        BinaryStore store = BinaryStoreFactory.fromEnv(env);
        Javalin app = createStreamingApp(store);
        logger.info("Starting streaming service on port {}", port);
        app.start(port);
    }

    static Javalin createStreamingApp(BinaryStore store) {
        ManifestBuilder manifests = new ManifestBuilder(store);
        SegmentServer segments = new SegmentServer(store);
        HlsPlaylistWriter playlists = new HlsPlaylistWriter();

        Javalin app = Javalin.create(config -> {
            config.http.prefer405over404 = true;
        });
        app.before(ctx -> {
            ctx.header("Access-Control-Allow-Origin", "*");
            ctx.header("Access-Control-Allow-Methods", "GET,OPTIONS");
            ctx.header("Access-Control-Allow-Headers", "Content-Type,Range");
            ctx.header("Access-Control-Expose-Headers", "Content-Range,Accept-Ranges,Content-Length");
        });
        app.options("/*", ctx -> ctx.status(204));
        app.before(ctx -> {
            logger.info("streaming_request instance={} method={} path={} query={} remote={}",
                INSTANCE_ID,
                ctx.method(),
                ctx.path(),
                ctx.queryString(),
                ctx.ip()
            );
        });

        app.get("/health", ctx -> ctx.json(Map.of("status", "ok", "instance", INSTANCE_ID)));

        // Literal routes first: Javalin picks the first registered match.
        app.get("/stream/{videoId}/manifest", ctx -> {
            ClientHint hint = clientHint(ctx);
            ctx.json(manifests.build(ctx.pathParam("videoId"), hint));
        });

        app.get("/stream/{videoId}/master.m3u8", ctx -> {
            ClientHint hint = clientHint(ctx);
            Manifest manifest = manifests.build(ctx.pathParam("videoId"), hint);
            ctx.status(HttpStatus.OK)
                .contentType(HlsPlaylistWriter.CONTENT_TYPE)
                .result(playlists.masterPlaylist(manifest));
        });

        app.get("/stream/{videoId}/thumbnail/{size}", ctx -> {
            String label = ctx.pathParam("size");
            ThumbnailSize size = ThumbnailSize.fromLabel(label)
                .orElseThrow(() -> new NotFoundException("Unknown thumbnail size: " + label));
            byte[] jpeg = store.getThumbnail(ctx.pathParam("videoId"), size);
            ctx.status(HttpStatus.OK)
                .contentType("image/jpeg")
                .result(jpeg);
        });

        app.get("/stream/{videoId}/{quality}/playlist.m3u8", ctx -> {
            RenditionDetail detail = manifests.describe(ctx.pathParam("videoId"), ctx.pathParam("quality"));
            ctx.status(HttpStatus.OK)
                .contentType(HlsPlaylistWriter.CONTENT_TYPE)
                .result(playlists.mediaPlaylist(detail));
        });

        app.get("/stream/{videoId}/{quality}/segment/{index}", ctx -> {
            String videoId = ctx.pathParam("videoId");
            String quality = ctx.pathParam("quality");
            int index = parseIndex(ctx.pathParam("index"));
            SegmentResponse response = segments.serve(videoId, quality, index, ctx.header("Range"));
            ctx.header("Accept-Ranges", "bytes");
            ctx.header("X-Video-Quality", quality);
            if (response.isPartial()) {
                ctx.status(HttpStatus.PARTIAL_CONTENT);
                ctx.header("Content-Range", response.getContentRange());
            } else {
                ctx.status(HttpStatus.OK);
            }
            ctx.contentType(response.getContentType()).result(response.getBody());
        });

        app.get("/stream/{videoId}/{quality}", ctx ->
            ctx.json(manifests.describe(ctx.pathParam("videoId"), ctx.pathParam("quality"))));

        app.exception(ValidationException.class, (e, ctx) -> error(ctx, 400, e));
        app.exception(NotFoundException.class, (e, ctx) -> error(ctx, 404, e));
        app.exception(RangeNotSatisfiableException.class, (e, ctx) -> {
            ctx.header("Content-Range", "bytes */" + e.getTotalLength());
            error(ctx, 416, e);
        });
        app.exception(PipelineException.class, (e, ctx) -> {
            logger.error("Failed to serve {} {}", ctx.method(), ctx.path(), e);
            error(ctx, 500, e);
        });

        return app;
    }

    /** The {@code connection} query parameter wins over the {@code Connection} header. */
    static ClientHint clientHint(Context ctx) {
        String connection = ctx.queryParam("connection");
        if (connection == null || connection.isBlank()) {
            connection = ctx.header("Connection");
        }
        return ClientHint.fromRequest(ctx.queryParam("bandwidth"), ctx.userAgent(), connection);
    }

    private static void error(Context ctx, int status, PipelineException e) {
        ctx.status(status).json(Map.of(
            "error", e.getClass().getSimpleName(),
            "message", String.valueOf(e.getMessage())
        ));
    }

    static int parseIndex(String raw) {
        try {
            int index = Integer.parseInt(raw);
            if (index < 0) {
                throw new ValidationException("Segment index must be >= 0, got " + index);
            }
            return index;
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid segment index: " + raw);
        }
    }

    private static String resolveInstanceId() {
        String id = System.getenv("CONTAINER_ID");
        if (id == null || id.isBlank()) {
            id = System.getenv("HOSTNAME");
        }
        if (id == null || id.isBlank()) {
            id = "local";
        }
        return id;
    }
}
