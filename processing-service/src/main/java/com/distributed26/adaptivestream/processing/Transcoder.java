package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.shared.model.SourceProbe;
import java.nio.file.Path;

public interface Transcoder {
    /**
     * Encodes {@code source} to {@code profile}.
     *
     * @throws com.distributed26.adaptivestream.shared.errors.TranscodeException TRANSIENT for
     *         process, I/O or timeout failures; PERMANENT for unsupported codecs or empty output
     */
    EncodedStream transcode(Path source, SourceProbe probe, TranscodingProfile profile);

    /** Releases encoder threads; called once when the orchestrator shuts down. */
    default void close() {
    }
}
