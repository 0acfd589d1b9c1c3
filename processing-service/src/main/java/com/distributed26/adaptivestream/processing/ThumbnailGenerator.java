package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.shared.model.SourceProbe;
import com.distributed26.adaptivestream.shared.model.ThumbnailSize;
import java.nio.file.Path;
import java.util.Map;

public interface ThumbnailGenerator {
    /** JPEG bytes for every {@link ThumbnailSize}. */
    Map<ThumbnailSize, byte[]> generate(Path source, SourceProbe probe);
}
