package com.distributed26.adaptivestream.shared.storage;

import com.distributed26.adaptivestream.shared.errors.StorageException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/** Blob access used by {@link BinaryStore}. Implementations throw {@link StorageException} on failure. */
public interface ObjectStorageClient {
    void uploadFile(String key, InputStream data, long size);

    InputStream downloadFile(String key);

    void deleteFile(String key);

    boolean fileExists(String key);

    List<String> listFiles(String prefix);

    void ensureBucketExists();

    default void uploadBytes(String key, byte[] data) {
        uploadFile(key, new ByteArrayInputStream(data), data.length);
    }

    default byte[] downloadBytes(String key) {
        try (InputStream in = downloadFile(key)) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new StorageException("Failed to read object: " + key, e);
        }
    }

    /** Deletes every object under {@code prefix}; returns how many were removed. */
    default int deletePrefix(String prefix) {
        List<String> keys = listFiles(prefix);
        for (String key : keys) {
            deleteFile(key);
        }
        return keys.size();
    }
}
