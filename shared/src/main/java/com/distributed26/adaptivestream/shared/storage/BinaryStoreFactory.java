package com.distributed26.adaptivestream.shared.storage;

import com.distributed26.adaptivestream.shared.config.DatabaseConfig;
import com.distributed26.adaptivestream.shared.config.EnvConfig;
import com.distributed26.adaptivestream.shared.config.StorageConfig;
import com.distributed26.adaptivestream.shared.db.InMemoryCatalog;
import com.distributed26.adaptivestream.shared.db.JdbcRenditionRepository;
import com.distributed26.adaptivestream.shared.db.JdbcSegmentRepository;
import com.distributed26.adaptivestream.shared.db.JdbcThumbnailRepository;
import com.distributed26.adaptivestream.shared.db.JdbcVideoRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Wires a {@link BinaryStore} from the environment, falling back to in-memory backends. */
public final class BinaryStoreFactory {
    private static final Logger LOGGER = LogManager.getLogger(BinaryStoreFactory.class);

    private BinaryStoreFactory() {
    }

    public static BinaryStore fromEnv(EnvConfig env) {
        ObjectStorageClient storage = createStorage(env);
        DatabaseConfig database;
        try {
            database = DatabaseConfig.fromEnv(env);
        } catch (IllegalStateException e) {
            LOGGER.warn("Postgres not configured; using in-memory catalog: {}", e.getMessage());
            return new BinaryStore(storage, new InMemoryCatalog());
        }
        LOGGER.info("Catalog ready — {}", database);
        return new BinaryStore(
                storage,
                new JdbcVideoRepository(database),
                new JdbcRenditionRepository(database),
                new JdbcSegmentRepository(database),
                new JdbcThumbnailRepository(database));
    }

    static ObjectStorageClient createStorage(EnvConfig env) {
        if (StorageConfig.inMemoryRequested(env)) {
            LOGGER.warn("STORAGE_MODE=memory; blobs are kept in process memory only");
            return new InMemoryObjectStorageClient();
        }
        StorageConfig config = StorageConfig.fromEnv(env);
        S3StorageClient client = new S3StorageClient(config);
        client.ensureBucketExists();
        LOGGER.info("Storage ready — bucket={}", config.getBucketName());
        return client;
    }
}
