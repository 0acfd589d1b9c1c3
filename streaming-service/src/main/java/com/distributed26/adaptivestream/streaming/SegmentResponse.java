package com.distributed26.adaptivestream.streaming;

/** Bytes to send for one segment request, whole or a single byte range. */
public final class SegmentResponse {
    public static final String CONTENT_TYPE = "video/MP2T";

    private final byte[] body;
    private final long totalLength;
    private final String contentRange;

    SegmentResponse(byte[] body, long totalLength, String contentRange) {
        this.body = body;
        this.totalLength = totalLength;
        this.contentRange = contentRange;
    }

    public byte[] getBody() {
        return body;
    }

    public String getContentType() {
        return CONTENT_TYPE;
    }

    public long getTotalLength() {
        return totalLength;
    }

    public boolean isPartial() {
        return contentRange != null;
    }

    /** {@code bytes start-end/total}, or {@code null} for a full response. */
    public String getContentRange() {
        return contentRange;
    }
}
