package com.distributed26.adaptivestream.shared.storage;

import com.distributed26.adaptivestream.shared.errors.StorageException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryObjectStorageClient implements ObjectStorageClient {
    private final Map<String, byte[]> objects = new ConcurrentSkipListMap<>();

    @Override
    public void uploadFile(String key, InputStream data, long size) {
        try {
            byte[] bytes = data.readAllBytes();
            if (size >= 0 && bytes.length != size) {
                throw new StorageException("Size mismatch for " + key + ": declared " + size + ", read " + bytes.length);
            }
            objects.put(key, bytes);
        } catch (IOException e) {
            throw new StorageException("Failed to upload object: " + key, e);
        }
    }

    @Override
    public void uploadBytes(String key, byte[] data) {
        objects.put(key, data.clone());
    }

    @Override
    public InputStream downloadFile(String key) {
        return new ByteArrayInputStream(downloadBytes(key));
    }

    @Override
    public byte[] downloadBytes(String key) {
        byte[] bytes = objects.get(key);
        if (bytes == null) {
            throw new StorageException("Object not found: " + key);
        }
        return bytes.clone();
    }

    @Override
    public void deleteFile(String key) {
        objects.remove(key);
    }

    @Override
    public boolean fileExists(String key) {
        return objects.containsKey(key);
    }

    @Override
    public List<String> listFiles(String prefix) {
        List<String> keys = new ArrayList<>();
        for (String key : objects.keySet()) {
            if (key.startsWith(prefix)) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Override
    public void ensureBucketExists() {
    }

    /** Overwrites a stored object in place; lets tests simulate corruption. */
    public void overwrite(String key, byte[] data) {
        if (!objects.containsKey(key)) {
            throw new StorageException("Object not found: " + key);
        }
        objects.put(key, data.clone());
    }

    public int size() {
        return objects.size();
    }
}
