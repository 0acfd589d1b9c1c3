package com.distributed26.adaptivestream.shared.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.distributed26.adaptivestream.shared.config.DatabaseConfig;
import com.distributed26.adaptivestream.shared.errors.ValidationException;
import com.distributed26.adaptivestream.shared.model.ThumbnailSize;
import com.distributed26.adaptivestream.shared.model.VideoStatus;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/** Ids that cannot be UUIDs never reach the database, so nothing here needs a running PostgreSQL. */
class JdbcRepositoryTest {
    private static final DatabaseConfig UNREACHABLE =
            new DatabaseConfig("jdbc:postgresql://127.0.0.1:1/unreachable", "nobody", "nothing");
    private static final String NOT_A_UUID = "not-a-uuid";

    @Test
    void parseId_acceptsUuidsOnly() {
        UUID id = UUID.randomUUID();

        assertEquals(id, JdbcRepository.parseId(id.toString()).orElseThrow());
        assertTrue(JdbcRepository.parseId(NOT_A_UUID).isEmpty());
        assertTrue(JdbcRepository.parseId("").isEmpty());
        assertTrue(JdbcRepository.parseId(null).isEmpty());
    }

    @Test
    void uuid_malformedId_throwsValidation() {
        assertThrows(ValidationException.class, () -> JdbcRepository.uuid(NOT_A_UUID));
    }

    @Test
    void videoLookups_malformedId_areAbsent() {
        JdbcVideoRepository videos = new JdbcVideoRepository(UNREACHABLE);

        assertTrue(videos.findVideo(NOT_A_UUID).isEmpty());
        assertTrue(videos.findProbe(NOT_A_UUID).isEmpty());
        assertFalse(videos.compareAndSetStatus(NOT_A_UUID, VideoStatus.SUBMITTABLE, VideoStatus.ANALYZING, null));
        assertFalse(videos.deleteVideo(NOT_A_UUID));
    }

    @Test
    void renditionSegmentAndThumbnailLookups_malformedId_areAbsent() {
        JdbcRenditionRepository renditions = new JdbcRenditionRepository(UNREACHABLE);
        JdbcSegmentRepository segments = new JdbcSegmentRepository(UNREACHABLE);
        JdbcThumbnailRepository thumbnails = new JdbcThumbnailRepository(UNREACHABLE);

        assertTrue(renditions.findRendition(NOT_A_UUID, "720p").isEmpty());
        assertTrue(renditions.listRenditions(NOT_A_UUID).isEmpty());
        assertEquals(0, segments.countSegments(NOT_A_UUID, "720p"));
        assertTrue(segments.findSegment(NOT_A_UUID, "720p", 0).isEmpty());
        assertTrue(segments.listSegments(NOT_A_UUID, "720p").isEmpty());
        assertEquals(0, segments.deleteSegments(NOT_A_UUID, "720p"));
        assertTrue(thumbnails.findThumbnail(NOT_A_UUID, ThumbnailSize.SMALL).isEmpty());
        assertTrue(thumbnails.listThumbnails(NOT_A_UUID).isEmpty());
    }
}
