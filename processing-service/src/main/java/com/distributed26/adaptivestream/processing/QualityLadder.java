package com.distributed26.adaptivestream.processing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Immutable table of quality levels, ordered by height ascending. Loaded once at start-up from
 * {@code quality-ladder.json} on the classpath, falling back to {@link #defaultLadder()}.
 */
public final class QualityLadder {
    private static final Logger LOGGER = LogManager.getLogger(QualityLadder.class);
    static final String RESOURCE = "quality-ladder.json";

    private final List<TranscodingProfile> levels;

    private QualityLadder(List<TranscodingProfile> levels) {
        if (levels.isEmpty()) {
            throw new IllegalArgumentException("quality ladder must have at least one level");
        }
        List<TranscodingProfile> sorted = new ArrayList<>(levels);
        sorted.sort(Comparator.comparingInt(TranscodingProfile::getHeight));
        this.levels = List.copyOf(sorted);
    }

    public static QualityLadder of(List<TranscodingProfile> levels) {
        return new QualityLadder(levels);
    }

    public static QualityLadder defaultLadder() {
        return new QualityLadder(List.of(
                new TranscodingProfile("144p", 256, 144, 100_000, "libx264"),
                new TranscodingProfile("240p", 426, 240, 300_000, "libx264"),
                new TranscodingProfile("360p", 640, 360, 700_000, "libx264"),
                new TranscodingProfile("480p", 854, 480, 1_500_000, "libx264"),
                new TranscodingProfile("720p", 1280, 720, 3_000_000, "libx264"),
                new TranscodingProfile("1080p", 1920, 1080, 6_000_000, "libx264"),
                new TranscodingProfile("1440p", 2560, 1440, 12_000_000, "libx264"),
                new TranscodingProfile("2160p", 3840, 2160, 25_000_000, "libx264")
        ));
    }

    public static QualityLadder load() {
        return load(RESOURCE);
    }

    static QualityLadder load(String resource) {
        try (InputStream input = QualityLadder.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                LOGGER.info("{} not found on classpath, using built-in ladder", resource);
                return defaultLadder();
            }
            return parse(input);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Could not read {}, using built-in ladder", resource, e);
            return defaultLadder();
        }
    }

    static QualityLadder parse(InputStream json) throws IOException {
        List<Map<String, Object>> rows = new ObjectMapper().readValue(json, new TypeReference<>() {});
        List<TranscodingProfile> levels = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            levels.add(new TranscodingProfile(
                    (String) row.get("label"),
                    ((Number) row.get("width")).intValue(),
                    ((Number) row.get("height")).intValue(),
                    ((Number) row.get("bitrate")).intValue(),
                    (String) row.getOrDefault("codec", "libx264")));
        }
        return new QualityLadder(levels);
    }

    public List<TranscodingProfile> levels() {
        return levels;
    }

    public TranscodingProfile lowest() {
        return levels.get(0);
    }
}
