package com.distributed26.adaptivestream.shared.config;

import java.util.Objects;

public class StorageConfig {
    private final String endpointUrl;
    private final String accessKey;
    private final String secretKey;
    private final String bucketName;
    private final String region;

    public StorageConfig(
            String endpointUrl,
            String accessKey,
            String secretKey,
            String bucketName,
            String region
    ) {
        this.endpointUrl = Objects.requireNonNull(endpointUrl, "endpointUrl");
        this.accessKey = Objects.requireNonNull(accessKey, "accessKey");
        this.secretKey = Objects.requireNonNull(secretKey, "secretKey");
        this.bucketName = Objects.requireNonNull(bucketName, "bucketName");
        this.region = Objects.requireNonNull(region, "region");
    }

    public static StorageConfig fromEnv(EnvConfig env) {
        return new StorageConfig(
                env.get("MINIO_ENDPOINT", "minio.endpoint", "http://localhost:9000"),
                env.get("MINIO_ACCESS_KEY", "minio.access-key", "minioadmin"),
                env.get("MINIO_SECRET_KEY", "minio.secret-key", "minioadmin"),
                env.get("MINIO_BUCKET_NAME", "minio.bucket-name", "renditions"),
                env.get("MINIO_REGION", "minio.region", "us-east-1")
        );
    }

    /** {@code true} when {@code STORAGE_MODE=memory}; the services then keep blobs in process. */
    public static boolean inMemoryRequested(EnvConfig env) {
        return "memory".equalsIgnoreCase(env.get("STORAGE_MODE", "storage.mode", "s3"));
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }

    public String getAccessKey() {
        return accessKey;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public String getBucketName() {
        return bucketName;
    }

    public String getRegion() {
        return region;
    }

    @Override
    public String toString() {
        return "StorageConfig{" +
                "endpointUrl='" + endpointUrl + '\'' +
                ", accessKey='" + accessKey + '\'' +
                ", secretKey='***'" +
                ", bucketName='" + bucketName + '\'' +
                ", region='" + region + '\'' +
                '}';
    }
}
