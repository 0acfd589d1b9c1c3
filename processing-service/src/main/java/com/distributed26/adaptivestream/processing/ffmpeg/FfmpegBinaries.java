package com.distributed26.adaptivestream.processing.ffmpeg;

import com.distributed26.adaptivestream.shared.config.PipelineConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import net.bramp.ffmpeg.FFmpeg;
import net.bramp.ffmpeg.FFmpegExecutor;
import net.bramp.ffmpeg.FFprobe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * FFmpeg and FFprobe handles, created on first use. Construction runs {@code ffmpeg -version},
 * so services that never encode (and unit tests) never touch the binaries.
 */
public class FfmpegBinaries {
    private static final Logger LOGGER = LogManager.getLogger(FfmpegBinaries.class);

    private final String ffmpegPath;
    private final String ffprobePath;
    private volatile FFmpeg ffmpeg;
    private volatile FFprobe ffprobe;

    public FfmpegBinaries(String ffmpegPath, String ffprobePath) {
        this.ffmpegPath = Objects.requireNonNull(ffmpegPath, "ffmpegPath is null");
        this.ffprobePath = Objects.requireNonNull(ffprobePath, "ffprobePath is null");
    }

    public static FfmpegBinaries from(PipelineConfig config) {
        return new FfmpegBinaries(config.getFfmpegPath(), config.getFfprobePath());
    }

    public FFmpeg ffmpeg() {
        FFmpeg result = ffmpeg;
        if (result == null) {
            synchronized (this) {
                if (ffmpeg == null) {
                    try {
                        ffmpeg = new FFmpeg(ffmpegPath);
                        LOGGER.info("Using ffmpeg at {}", ffmpegPath);
                    } catch (IOException e) {
                        throw new UncheckedIOException("ffmpeg not usable at " + ffmpegPath, e);
                    }
                }
                result = ffmpeg;
            }
        }
        return result;
    }

    public FFprobe ffprobe() {
        FFprobe result = ffprobe;
        if (result == null) {
            synchronized (this) {
                if (ffprobe == null) {
                    try {
                        ffprobe = new FFprobe(ffprobePath);
                        LOGGER.info("Using ffprobe at {}", ffprobePath);
                    } catch (IOException e) {
                        throw new UncheckedIOException("ffprobe not usable at " + ffprobePath, e);
                    }
                }
                result = ffprobe;
            }
        }
        return result;
    }

    public String ffmpegPath() {
        return ffmpegPath;
    }

    public FFmpegExecutor executor() {
        return new FFmpegExecutor(ffmpeg(), ffprobe());
    }
}
