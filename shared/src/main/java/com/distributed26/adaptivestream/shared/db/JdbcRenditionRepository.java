package com.distributed26.adaptivestream.shared.db;

import com.distributed26.adaptivestream.shared.config.DatabaseConfig;
import com.distributed26.adaptivestream.shared.errors.StorageException;
import com.distributed26.adaptivestream.shared.model.Rendition;
import com.distributed26.adaptivestream.shared.model.RenditionStatus;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class JdbcRenditionRepository extends JdbcRepository implements RenditionRepository {
    private static final String COLUMNS = """
            video_id, quality, width, height, bitrate, codec, status, duration_seconds,
            segment_count, segment_duration_seconds, attempts, failure_reason
            """;

    public JdbcRenditionRepository(DatabaseConfig config) {
        super(config);
    }

    @Override
    public void upsertRendition(Rendition r) {
        String sql = "INSERT INTO renditions (" + COLUMNS + """
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (video_id, quality) DO UPDATE
            SET width = EXCLUDED.width,
                height = EXCLUDED.height,
                bitrate = EXCLUDED.bitrate,
                codec = EXCLUDED.codec,
                status = EXCLUDED.status,
                duration_seconds = EXCLUDED.duration_seconds,
                segment_count = EXCLUDED.segment_count,
                segment_duration_seconds = EXCLUDED.segment_duration_seconds,
                attempts = EXCLUDED.attempts,
                failure_reason = EXCLUDED.failure_reason
            """;
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(r.getVideoId()));
            ps.setString(2, r.getQuality());
            ps.setInt(3, r.getWidth());
            ps.setInt(4, r.getHeight());
            ps.setInt(5, r.getBitrate());
            ps.setString(6, r.getCodec());
            ps.setString(7, r.getStatus().name());
            ps.setDouble(8, r.getDurationSeconds());
            ps.setInt(9, r.getSegmentCount());
            ps.setDouble(10, r.getSegmentDurationSeconds());
            ps.setInt(11, r.getAttempts());
            ps.setString(12, r.getFailureReason());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to upsert rendition " + r.getVideoId() + "/" + r.getQuality(), e);
        }
    }

    @Override
    public Optional<Rendition> findRendition(String videoId, String quality) {
        if (parseId(videoId).isEmpty()) {
            return Optional.empty();
        }
        String sql = "SELECT " + COLUMNS + " FROM renditions WHERE video_id = ? AND quality = ?";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            ps.setString(2, quality);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to query rendition " + videoId + "/" + quality, e);
        }
    }

    @Override
    public List<Rendition> listRenditions(String videoId) {
        if (parseId(videoId).isEmpty()) {
            return List.of();
        }
        String sql = "SELECT " + COLUMNS + " FROM renditions WHERE video_id = ? ORDER BY height, quality";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            List<Rendition> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(map(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new StorageException("Failed to list renditions of video " + videoId, e);
        }
    }

    private static Rendition map(ResultSet rs) throws SQLException {
        return new Rendition(
                rs.getString("video_id"),
                rs.getString("quality"),
                rs.getInt("width"),
                rs.getInt("height"),
                rs.getInt("bitrate"),
                rs.getString("codec"),
                RenditionStatus.valueOf(rs.getString("status")),
                rs.getDouble("duration_seconds"),
                rs.getInt("segment_count"),
                rs.getDouble("segment_duration_seconds"),
                rs.getInt("attempts"),
                rs.getString("failure_reason"));
    }
}
