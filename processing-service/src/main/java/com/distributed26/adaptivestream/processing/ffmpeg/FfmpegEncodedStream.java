package com.distributed26.adaptivestream.processing.ffmpeg;

import com.distributed26.adaptivestream.processing.EncodedStream;
import com.distributed26.adaptivestream.shared.errors.TranscodeException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import net.bramp.ffmpeg.builder.FFmpegBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Encoded rendition backed by a temp file. Chunks are cut with stream copy and bit-exact
 * muxing so the same time window always yields the same bytes.
 */
class FfmpegEncodedStream implements EncodedStream {
    private static final Logger LOGGER = LogManager.getLogger(FfmpegEncodedStream.class);

    private final FfmpegBinaries binaries;
    private final Path file;
    private final double durationSeconds;
    private volatile boolean closed;

    FfmpegEncodedStream(FfmpegBinaries binaries, Path file, double durationSeconds) {
        this.binaries = Objects.requireNonNull(binaries, "binaries is null");
        this.file = Objects.requireNonNull(file, "file is null");
        this.durationSeconds = durationSeconds;
    }

    @Override
    public double getDurationSeconds() {
        return durationSeconds;
    }

    @Override
    public byte[] read(double startSeconds, double durationSeconds) {
        if (closed) {
            throw new IllegalStateException("encoded stream " + file + " is closed");
        }
        Path chunk = null;
        try {
            chunk = Files.createTempFile("chunk-", ".ts");
            FFmpegBuilder builder = new FFmpegBuilder()
                    .setInput(file.toString())
                    .overrideOutputFiles(true)
                    .addOutput(chunk.toString())
                        .setFormat("mpegts")
                        .addExtraArgs("-ss", FfmpegTranscoder.formatSeconds(startSeconds))
                        .addExtraArgs("-t", FfmpegTranscoder.formatSeconds(durationSeconds))
                        .addExtraArgs("-c", "copy")
                        .addExtraArgs("-fflags", "+bitexact")
                        .addExtraArgs("-map_metadata", "-1")
                        .done();
            binaries.executor().createJob(builder).run();
            return Files.readAllBytes(chunk);
        } catch (IOException e) {
            throw TranscodeException.transientFailure("could not read chunk at " + startSeconds + "s", e);
        } catch (RuntimeException e) {
            throw TranscodeException.transientFailure("ffmpeg failed cutting chunk at " + startSeconds + "s", e);
        } finally {
            if (chunk != null) {
                try {
                    Files.deleteIfExists(chunk);
                } catch (IOException e) {
                    LOGGER.warn("Could not delete chunk file {}", chunk, e);
                }
            }
        }
    }

    @Override
    public void close() {
        closed = true;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOGGER.warn("Could not delete encoded file {}", file, e);
        }
    }
}
