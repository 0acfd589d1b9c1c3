package com.distributed26.adaptivestream.shared.storage;

import com.distributed26.adaptivestream.shared.model.ThumbnailSize;

/** Object key layout. Everything a video owns lives under {@code {videoId}/}. */
public final class StorageKeys {
    private StorageKeys() {
    }

    public static String videoPrefix(String videoId) {
        return videoId + "/";
    }

    public static String source(String videoId) {
        return videoId + "/source/original";
    }

    public static String renditionPrefix(String videoId, String quality) {
        return videoId + "/renditions/" + quality + "/";
    }

    public static String segment(String videoId, String quality, int index) {
        return renditionPrefix(videoId, quality) + String.format("segment_%05d.ts", index);
    }

    public static String thumbnail(String videoId, ThumbnailSize size) {
        return videoId + "/thumbnails/" + size.label() + ".jpg";
    }
}
