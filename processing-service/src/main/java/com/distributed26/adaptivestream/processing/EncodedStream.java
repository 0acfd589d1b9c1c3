package com.distributed26.adaptivestream.processing;

/**
 * Output of one encode, owned exclusively by the rendition that produced it. Closing releases
 * the backing file; reads after close fail.
 */
public interface EncodedStream extends AutoCloseable {
    double getDurationSeconds();

    /**
     * Bytes covering {@code [startSeconds, startSeconds + durationSeconds)}. The same arguments
     * always return the same bytes.
     *
     * @throws com.distributed26.adaptivestream.shared.errors.TranscodeException if extraction fails
     */
    byte[] read(double startSeconds, double durationSeconds);

    @Override
    void close();
}
