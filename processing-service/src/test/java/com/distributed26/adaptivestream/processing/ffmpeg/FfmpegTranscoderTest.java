package com.distributed26.adaptivestream.processing.ffmpeg;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.distributed26.adaptivestream.processing.TranscodingProfile;
import com.distributed26.adaptivestream.shared.config.PipelineConfig;
import com.distributed26.adaptivestream.shared.errors.TranscodeException;
import com.distributed26.adaptivestream.shared.model.SourceProbe;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FfmpegTranscoderTest {
    private static final SourceProbe PROBE = new SourceProbe(10.0, 1280, 720, "h264", 30.0, "mp4");

    private final FfmpegTranscoder transcoder = new FfmpegTranscoder(
            new FfmpegBinaries("ffmpeg", "ffprobe"),
            PipelineConfig.builder().threadsPerWorker(3).build());

    @Test
    void unsupportedCodec_failsPermanentlyWithoutRunningFfmpeg() {
        TranscodingProfile vp9 = new TranscodingProfile("720p", 1280, 720, 3_000_000, "libvpx-vp9");

        TranscodeException e = assertThrows(TranscodeException.class,
                () -> transcoder.transcode(Path.of("in.mp4"), PROBE, vp9));

        assertFalse(e.isTransient());
    }

    @Test
    void buildEncode_targetsProfileAndForcesKeyFramesAtChunkBoundaries() {
        TranscodingProfile p720 = new TranscodingProfile("720p", 1280, 720, 3_000_000, "libx264");

        List<String> args = transcoder.buildEncode(Path.of("in.mp4"), Path.of("out.ts"), p720).build();

        assertArg(args, "-vf", "scale=-2:720");
        assertArg(args, "-c:v", "libx264");
        assertArg(args, "-b:v", "3000000");
        assertArg(args, "-maxrate", "3000000");
        assertArg(args, "-bufsize", "6000000");
        assertArg(args, "-force_key_frames", "expr:gte(t,n_forced*4.000)");
        assertArg(args, "-c:a", "copy");
        assertArg(args, "-threads", "3");
        assertArg(args, "-f", "mpegts");
        assertEquals("out.ts", args.get(args.size() - 1));
    }

    @Test
    void close_rejectsFurtherEncodes() {
        TranscodingProfile p240 = new TranscodingProfile("240p", 426, 240, 300_000, "libx264");
        transcoder.close();

        TranscodeException e = assertThrows(TranscodeException.class,
                () -> transcoder.transcode(Path.of("in.mp4"), PROBE, p240));

        assertTrue(e.isTransient());
        assertTrue(e.getMessage().contains("closed"), e.getMessage());
    }

    // ── Timeout ────────────────────────────────────────────────────────────────

    @Test
    void timeout_killsFfmpegBeforeItFinishes(@TempDir Path dir) throws Exception {
        assumeTrue(File.separatorChar == '/', "needs a POSIX shell");
        Path finished = dir.resolve("finished");
        Path slowFfmpeg = dir.resolve("ffmpeg");
        Files.writeString(slowFfmpeg, String.join("\n",
                "#!/bin/sh",
                "if [ \"$1\" = \"-version\" ]; then echo 'ffmpeg version 6.0-stub'; exit 0; fi",
                "sleep 3",
                "touch '" + finished + "'",
                ""), StandardCharsets.UTF_8);
        assertTrue(slowFfmpeg.toFile().setExecutable(true));
        Path source = Files.writeString(dir.resolve("in.mp4"), "source");
        FfmpegTranscoder slow = new FfmpegTranscoder(
                new FfmpegBinaries(slowFfmpeg.toString(), "ffprobe"),
                PipelineConfig.builder().transcodeTimeoutSeconds(1).build());
        TranscodingProfile p240 = new TranscodingProfile("240p", 426, 240, 300_000, "libx264");

        try {
            TranscodeException e = assertThrows(TranscodeException.class,
                    () -> slow.transcode(source, PROBE, p240));

            assertTrue(e.isTransient());
            assertTrue(e.getMessage().contains("timed out"), e.getMessage());
            await().during(Duration.ofSeconds(4))
                    .atMost(Duration.ofSeconds(5))
                    .until(() -> !Files.exists(finished));
        } finally {
            slow.close();
        }
    }

    @Test
    void formatSeconds_usesDotDecimalSeparator() {
        assertEquals("2.500", FfmpegTranscoder.formatSeconds(2.5));
    }

    private static void assertArg(List<String> args, String flag, String value) {
        int i = args.indexOf(flag);
        assertTrue(i >= 0, "missing " + flag + " in " + args);
        assertEquals(value, args.get(i + 1), flag);
    }
}
