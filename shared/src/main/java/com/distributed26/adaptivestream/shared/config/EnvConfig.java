package com.distributed26.adaptivestream.shared.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves settings from, in order: process environment, {@code .env}, {@code application.properties}
 * on the classpath, and finally the caller's default.
 */
public final class EnvConfig {
    private static final Logger LOGGER = LogManager.getLogger(EnvConfig.class);

    private final Map<String, String> environment;
    private final Dotenv dotenv;
    private final Properties properties;

    EnvConfig(Map<String, String> environment, Dotenv dotenv, Properties properties) {
        this.environment = Objects.requireNonNull(environment, "environment is null");
        this.dotenv = dotenv;
        this.properties = Objects.requireNonNull(properties, "properties is null");
    }

    public static EnvConfig load() {
        Dotenv dotenv = Dotenv.configure().directory("./").ignoreIfMissing().load();
        return new EnvConfig(System.getenv(), dotenv, loadProperties("application.properties"));
    }

    /** Configuration backed only by the given maps; used by tests and embedded setups. */
    public static EnvConfig of(Map<String, String> environment, Properties properties) {
        return new EnvConfig(new HashMap<>(environment), null, properties == null ? new Properties() : properties);
    }

    public String get(String envKey, String propKey, String defaultValue) {
        String envVal = environment.get(envKey);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }
        if (dotenv != null) {
            String dotenvVal = dotenv.get(envKey);
            if (dotenvVal != null && !dotenvVal.isBlank()) {
                return dotenvVal.trim();
            }
        }
        if (propKey != null) {
            String propVal = properties.getProperty(propKey);
            if (propVal != null && !propVal.isBlank()) {
                return propVal.trim();
            }
        }
        return defaultValue;
    }

    public int getInt(String envKey, String propKey, int defaultValue) {
        String raw = get(envKey, propKey, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} '{}', using default {}", envKey, raw, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String envKey, String propKey, long defaultValue) {
        String raw = get(envKey, propKey, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} '{}', using default {}", envKey, raw, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String envKey, String propKey, double defaultValue) {
        String raw = get(envKey, propKey, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} '{}', using default {}", envKey, raw, defaultValue);
            return defaultValue;
        }
    }

    private static Properties loadProperties(String resource) {
        Properties props = new Properties();
        try (InputStream input = EnvConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input != null) {
                props.load(input);
            }
        } catch (IOException e) {
            LOGGER.warn("Could not load {}, using defaults", resource, e);
        }
        return props;
    }
}
