package com.distributed26.adaptivestream.processing.ffmpeg;

import com.distributed26.adaptivestream.processing.EncodedStream;
import com.distributed26.adaptivestream.processing.Transcoder;
import com.distributed26.adaptivestream.processing.TranscodingProfile;
import com.distributed26.adaptivestream.shared.config.PipelineConfig;
import com.distributed26.adaptivestream.shared.errors.TranscodeException;
import com.distributed26.adaptivestream.shared.model.SourceProbe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import net.bramp.ffmpeg.FFmpeg;
import net.bramp.ffmpeg.RunProcessFunction;
import net.bramp.ffmpeg.builder.FFmpegBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Encodes a whole source to one profile as MPEG-TS, with a key frame forced at every chunk
 * boundary so the {@link com.distributed26.adaptivestream.processing.Segmenter} can cut on them.
 */
public class FfmpegTranscoder implements Transcoder {
    private static final Logger LOGGER = LogManager.getLogger(FfmpegTranscoder.class);
    private static final Set<String> SUPPORTED_CODECS = Set.of("libx264");
    private static final long KILL_WAIT_SECONDS = 10;

    private final FfmpegBinaries binaries;
    private final double chunkSeconds;
    private final int threads;
    private final long timeoutSeconds;
    private final ExecutorService processes = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "ffmpeg-encode");
        t.setDaemon(true);
        return t;
    });

    public FfmpegTranscoder(FfmpegBinaries binaries, PipelineConfig config) {
        this.binaries = Objects.requireNonNull(binaries, "binaries is null");
        this.chunkSeconds = config.getSegmentDurationSeconds();
        this.threads = config.getThreadsPerWorker();
        this.timeoutSeconds = config.getTranscodeTimeoutSeconds();
    }

    @Override
    public EncodedStream transcode(Path source, SourceProbe probe, TranscodingProfile profile) {
        if (!SUPPORTED_CODECS.contains(profile.getCodec())) {
            throw TranscodeException.permanentFailure("codec " + profile.getCodec() + " is not supported");
        }

        Path output;
        try {
            output = Files.createTempFile("encode-" + profile.getLabel() + "-", ".ts");
        } catch (IOException e) {
            throw TranscodeException.transientFailure("could not create encode output file", e);
        }

        boolean handedOver = false;
        try {
            run(buildEncode(source, output, profile), profile);
            long size = Files.size(output);
            if (size == 0) {
                throw TranscodeException.permanentFailure("encoder produced no output for " + profile.getLabel());
            }
            LOGGER.info("Encoded {} to {} ({} bytes)", source.getFileName(), profile.getLabel(), size);
            EncodedStream stream = new FfmpegEncodedStream(binaries, output, probe.getDurationSeconds());
            handedOver = true;
            return stream;
        } catch (IOException e) {
            throw TranscodeException.transientFailure("could not inspect encode output", e);
        } finally {
            if (!handedOver) {
                deleteQuietly(output);
            }
        }
    }

    FFmpegBuilder buildEncode(Path source, Path output, TranscodingProfile profile) {
        String bitrate = String.valueOf(profile.getBitrate());
        return new FFmpegBuilder()
                .setInput(source.toString())
                .overrideOutputFiles(true)
                .addOutput(output.toString())
                    .setFormat("mpegts")
                    .addExtraArgs("-vf", "scale=-2:" + profile.getHeight())
                    .addExtraArgs("-c:v", profile.getCodec())
                    .addExtraArgs("-b:v", bitrate)
                    .addExtraArgs("-maxrate", bitrate)
                    .addExtraArgs("-bufsize", String.valueOf(profile.getBitrate() * 2L))
                    .addExtraArgs("-force_key_frames", "expr:gte(t,n_forced*" + formatSeconds(chunkSeconds) + ")")
                    .addExtraArgs("-c:a", "copy")
                    .addExtraArgs("-threads", String.valueOf(threads))
                    .done();
    }

    private void run(FFmpegBuilder builder, TranscodingProfile profile) {
        TrackedProcesses launched = new TrackedProcesses();
        CompletableFuture<Void> job;
        try {
            job = CompletableFuture.runAsync(() -> {
                try {
                    new FFmpeg(binaries.ffmpegPath(), launched).run(builder);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }, processes);
        } catch (RejectedExecutionException e) {
            throw TranscodeException.transientFailure("transcoder is closed", e);
        }
        try {
            job.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            job.cancel(true);
            launched.kill();
            throw TranscodeException.transientFailure(
                    "encode to " + profile.getLabel() + " timed out after " + timeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            throw TranscodeException.transientFailure("ffmpeg failed for " + profile.getLabel(), e.getCause());
        } catch (InterruptedException e) {
            job.cancel(true);
            launched.kill();
            Thread.currentThread().interrupt();
            throw TranscodeException.transientFailure("encode to " + profile.getLabel() + " interrupted", e);
        }
    }

    /** Stops accepting encodes and interrupts the threads still waiting on ffmpeg. */
    @Override
    public void close() {
        processes.shutdownNow();
    }

    static String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    /** Remembers every process ffmpeg starts for one encode, so a timeout can kill them. */
    static final class TrackedProcesses extends RunProcessFunction {
        private final List<Process> started = new CopyOnWriteArrayList<>();
        private volatile boolean killed;

        @Override
        public Process run(List<String> args) throws IOException {
            if (killed) {
                throw new IOException("encode was abandoned before ffmpeg started");
            }
            Process process = super.run(args);
            started.add(process);
            if (killed) {
                process.destroyForcibly();
            }
            return process;
        }

        /** Kills every started process and waits for it to exit. Later starts are refused. */
        void kill() {
            killed = true;
            for (Process process : started) {
                if (!process.isAlive()) {
                    continue;
                }
                process.destroyForcibly();
                try {
                    if (!process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
                        LOGGER.warn("ffmpeg pid {} still running {}s after kill", process.pid(), KILL_WAIT_SECONDS);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Interrupted while waiting for ffmpeg pid {} to exit", process.pid());
                    return;
                }
            }
        }

        List<Process> started() {
            return started;
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.warn("Could not delete {}", path, e);
        }
    }
}
