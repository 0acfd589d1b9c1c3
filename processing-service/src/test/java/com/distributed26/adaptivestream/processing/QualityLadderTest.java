package com.distributed26.adaptivestream.processing;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class QualityLadderTest {

    @Test
    void defaultLadder_hasEightLevelsSortedByHeight() {
        List<TranscodingProfile> levels = QualityLadder.defaultLadder().levels();

        assertEquals(8, levels.size());
        for (int i = 1; i < levels.size(); i++) {
            assertTrue(levels.get(i - 1).getHeight() < levels.get(i).getHeight());
        }
        assertEquals("144p", QualityLadder.defaultLadder().lowest().getLabel());
    }

    @Test
    void load_classpathResource_matchesDefaultLadder() {
        assertEquals(QualityLadder.defaultLadder().levels(), QualityLadder.load().levels());
    }

    @Test
    void load_missingResource_fallsBackToDefault() {
        assertEquals(QualityLadder.defaultLadder().levels(), QualityLadder.load("no-such-ladder.json").levels());
    }

    @Test
    void parse_sortsLevelsAndDefaultsCodec() throws IOException {
        String json = "[{\"label\":\"720p\",\"width\":1280,\"height\":720,\"bitrate\":3000000},"
                + "{\"label\":\"240p\",\"width\":426,\"height\":240,\"bitrate\":300000,\"codec\":\"libx264\"}]";

        QualityLadder ladder = QualityLadder.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertEquals(List.of("240p", "720p"),
                ladder.levels().stream().map(TranscodingProfile::getLabel).collect(Collectors.toList()));
        assertEquals("libx264", ladder.levels().get(1).getCodec());
    }

    @Test
    void emptyLadder_rejected() {
        assertThrows(IllegalArgumentException.class, () -> QualityLadder.of(List.of()));
    }

    @Test
    void levels_areImmutable() {
        List<TranscodingProfile> levels = QualityLadder.defaultLadder().levels();
        assertThrows(UnsupportedOperationException.class, () -> levels.remove(0));
    }
}
