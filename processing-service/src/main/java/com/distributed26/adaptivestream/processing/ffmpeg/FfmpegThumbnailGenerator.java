package com.distributed26.adaptivestream.processing.ffmpeg;

import com.distributed26.adaptivestream.processing.ThumbnailGenerator;
import com.distributed26.adaptivestream.shared.errors.TranscodeException;
import com.distributed26.adaptivestream.shared.model.SourceProbe;
import com.distributed26.adaptivestream.shared.model.ThumbnailSize;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import net.bramp.ffmpeg.builder.FFmpegBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Grabs one frame per {@link ThumbnailSize}, letterboxed to the exact size. */
public class FfmpegThumbnailGenerator implements ThumbnailGenerator {
    private static final Logger LOGGER = LogManager.getLogger(FfmpegThumbnailGenerator.class);

    private final FfmpegBinaries binaries;

    public FfmpegThumbnailGenerator(FfmpegBinaries binaries) {
        this.binaries = Objects.requireNonNull(binaries, "binaries is null");
    }

    /** 1 s into the video, or its midpoint when it is shorter than 2 s. */
    static double frameOffset(double durationSeconds) {
        return durationSeconds < 2.0 ? durationSeconds / 2.0 : 1.0;
    }

    @Override
    public Map<ThumbnailSize, byte[]> generate(Path source, SourceProbe probe) {
        String offset = FfmpegTranscoder.formatSeconds(frameOffset(probe.getDurationSeconds()));
        Map<ThumbnailSize, byte[]> result = new EnumMap<>(ThumbnailSize.class);
        for (ThumbnailSize size : ThumbnailSize.values()) {
            result.put(size, grab(source, offset, size));
        }
        LOGGER.info("Generated {} thumbnails for {}", result.size(), source.getFileName());
        return result;
    }

    private byte[] grab(Path source, String offset, ThumbnailSize size) {
        Path out = null;
        try {
            out = Files.createTempFile("thumb-" + size.label() + "-", ".jpg");
            String scale = "scale=" + size.getWidth() + ":" + size.getHeight()
                    + ":force_original_aspect_ratio=decrease,pad=" + size.getWidth() + ":" + size.getHeight()
                    + ":(ow-iw)/2:(oh-ih)/2";
            FFmpegBuilder builder = new FFmpegBuilder()
                    .setInput(source.toString())
                    .overrideOutputFiles(true)
                    .addOutput(out.toString())
                        .setFormat("image2")
                        .addExtraArgs("-ss", offset)
                        .addExtraArgs("-frames:v", "1")
                        .addExtraArgs("-vf", scale)
                        .done();
            binaries.executor().createJob(builder).run();
            byte[] jpeg = Files.readAllBytes(out);
            if (jpeg.length == 0) {
                throw TranscodeException.permanentFailure("empty " + size.label() + " thumbnail");
            }
            return jpeg;
        } catch (IOException e) {
            throw TranscodeException.transientFailure("could not write " + size.label() + " thumbnail", e);
        } finally {
            if (out != null) {
                try {
                    Files.deleteIfExists(out);
                } catch (IOException e) {
                    LOGGER.warn("Could not delete thumbnail file {}", out, e);
                }
            }
        }
    }
}
