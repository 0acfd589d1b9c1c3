package com.distributed26.adaptivestream.shared.config;

import java.util.Objects;

public class DatabaseConfig {
    private final String jdbcUrl;
    private final String username;
    private final String password;

    public DatabaseConfig(String jdbcUrl, String username, String password) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        this.username = Objects.requireNonNull(username, "username");
        this.password = password;
    }

    /**
     * @throws IllegalStateException when PG_URL or PG_USER is missing
     */
    public static DatabaseConfig fromEnv(EnvConfig env) {
        String url = env.get("PG_URL", "pg.url", null);
        String user = env.get("PG_USER", "pg.user", null);
        String pass = env.get("PG_PASSWORD", "pg.password", null);

        if (url == null || url.isBlank()) {
            throw new IllegalStateException("PG_URL is not set");
        }
        if (user == null || user.isBlank()) {
            throw new IllegalStateException("PG_USER is not set");
        }
        return new DatabaseConfig(url, user, pass);
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        return "DatabaseConfig{jdbcUrl='" + jdbcUrl + "', username='" + username + "', password='***'}";
    }
}
