package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.shared.model.SourceProbe;
import java.nio.file.Path;

public interface MediaProber {
    /**
     * @throws com.distributed26.adaptivestream.shared.errors.UnsupportedFormatException when the
     *         container or codec cannot be identified
     * @throws com.distributed26.adaptivestream.shared.errors.CorruptInputException when the
     *         metadata is unreadable or nonsensical
     */
    SourceProbe probe(Path source);
}
