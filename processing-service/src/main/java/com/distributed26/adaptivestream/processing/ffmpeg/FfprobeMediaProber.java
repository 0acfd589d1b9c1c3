package com.distributed26.adaptivestream.processing.ffmpeg;

import com.distributed26.adaptivestream.processing.MediaProber;
import com.distributed26.adaptivestream.shared.errors.CorruptInputException;
import com.distributed26.adaptivestream.shared.errors.UnsupportedFormatException;
import com.distributed26.adaptivestream.shared.model.SourceProbe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;
import net.bramp.ffmpeg.probe.FFmpegFormat;
import net.bramp.ffmpeg.probe.FFmpegProbeResult;
import net.bramp.ffmpeg.probe.FFmpegStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class FfprobeMediaProber implements MediaProber {
    private static final Logger LOGGER = LogManager.getLogger(FfprobeMediaProber.class);

    private final FfmpegBinaries binaries;

    public FfprobeMediaProber(FfmpegBinaries binaries) {
        this.binaries = Objects.requireNonNull(binaries, "binaries is null");
    }

    @Override
    public SourceProbe probe(Path source) {
        FFmpegProbeResult result;
        try {
            result = binaries.ffprobe().probe(source.toString());
        } catch (IOException | UncheckedIOException e) {
            throw new UnsupportedFormatException("ffprobe could not read " + source.getFileName(), e);
        } catch (RuntimeException e) {
            throw new CorruptInputException("ffprobe output could not be parsed", e);
        }

        FFmpegFormat format = result.getFormat();
        if (format == null) {
            throw new UnsupportedFormatException("no container format detected");
        }
        FFmpegStream video = null;
        if (result.getStreams() != null) {
            for (FFmpegStream stream : result.getStreams()) {
                if ("video".equalsIgnoreCase(String.valueOf(stream.codec_type))) {
                    video = stream;
                    break;
                }
            }
        }
        if (video == null) {
            throw new UnsupportedFormatException("no video stream in " + format.format_name);
        }
        double frameRate = frameRate(video.avg_frame_rate);
        if (frameRate <= 0) {
            frameRate = frameRate(video.r_frame_rate);
        }
        SourceProbe probe = classify(format.format_name, format.duration, video.codec_name,
                video.width, video.height, frameRate);
        LOGGER.info("Probed {}: {}", source.getFileName(), probe);
        return probe;
    }

    /** Turns raw ffprobe fields into a probe, or the matching error. */
    static SourceProbe classify(String formatName, double duration, String codec, int width, int height,
                                double frameRate) {
        if (formatName == null || formatName.isBlank()) {
            throw new UnsupportedFormatException("no container format detected");
        }
        if (codec == null || codec.isBlank()) {
            throw new UnsupportedFormatException("video codec not identified in " + formatName);
        }
        if (!Double.isFinite(duration) || duration <= 0) {
            throw new CorruptInputException("invalid duration " + duration);
        }
        if (width <= 0 || height <= 0) {
            throw new CorruptInputException("invalid dimensions " + width + "x" + height);
        }
        double fps = (Double.isFinite(frameRate) && frameRate > 0) ? frameRate : 0;
        return new SourceProbe(duration, width, height, codec, fps, formatName);
    }

    private static double frameRate(Number fraction) {
        if (fraction == null) {
            return 0;
        }
        double value = fraction.doubleValue();
        return Double.isFinite(value) ? value : 0;
    }
}
