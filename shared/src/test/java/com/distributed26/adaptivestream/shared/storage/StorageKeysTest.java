package com.distributed26.adaptivestream.shared.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.distributed26.adaptivestream.shared.model.ThumbnailSize;
import org.junit.jupiter.api.Test;

class StorageKeysTest {

    @Test
    void keysFollowVideoLayout() {
        assertEquals("v1/source/original", StorageKeys.source("v1"));
        assertEquals("v1/renditions/720p/segment_00007.ts", StorageKeys.segment("v1", "720p", 7));
        assertEquals("v1/thumbnails/small.jpg", StorageKeys.thumbnail("v1", ThumbnailSize.SMALL));
    }

    @Test
    void everyKeySharesTheVideoPrefix() {
        String prefix = StorageKeys.videoPrefix("v1");
        assertTrue(StorageKeys.source("v1").startsWith(prefix));
        assertTrue(StorageKeys.segment("v1", "144p", 0).startsWith(StorageKeys.renditionPrefix("v1", "144p")));
        assertTrue(StorageKeys.thumbnail("v1", ThumbnailSize.LARGE).startsWith(prefix));
    }
}
