package com.distributed26.adaptivestream.shared.model;

import java.util.Objects;

public final class ThumbnailRecord {
    private final String videoId;
    private final ThumbnailSize size;
    private final String objectKey;
    private final long byteLength;
    private final String mimeType;

    public ThumbnailRecord(String videoId, ThumbnailSize size, String objectKey, long byteLength, String mimeType) {
        this.videoId = Objects.requireNonNull(videoId, "videoId is null");
        this.size = Objects.requireNonNull(size, "size is null");
        this.objectKey = Objects.requireNonNull(objectKey, "objectKey is null");
        this.byteLength = byteLength;
        this.mimeType = Objects.requireNonNull(mimeType, "mimeType is null");
    }

    public String getVideoId() { return videoId; }
    public ThumbnailSize getSize() { return size; }
    public String getObjectKey() { return objectKey; }
    public long getByteLength() { return byteLength; }
    public String getMimeType() { return mimeType; }
}
