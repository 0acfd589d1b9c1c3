package com.distributed26.adaptivestream.shared.db;

import com.distributed26.adaptivestream.shared.config.DatabaseConfig;
import com.distributed26.adaptivestream.shared.errors.ValidationException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

abstract class JdbcRepository {
    private final String jdbcUrl;
    private final String username;
    private final String password;

    JdbcRepository(DatabaseConfig config) {
        Objects.requireNonNull(config, "config is null");
        this.jdbcUrl = config.getJdbcUrl();
        this.username = config.getUsername();
        this.password = config.getPassword();
    }

    Connection connect() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, username, password);
    }

    /** Empty when {@code videoId} is not a UUID; no catalog row can have such an id. */
    static Optional<UUID> parseId(String videoId) {
        if (videoId == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(videoId));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    static UUID uuid(String videoId) {
        return parseId(videoId)
                .orElseThrow(() -> new ValidationException("video id is not a UUID: " + videoId));
    }
}
