package com.distributed26.adaptivestream.shared.db;

import com.distributed26.adaptivestream.shared.config.DatabaseConfig;
import com.distributed26.adaptivestream.shared.errors.StorageException;
import com.distributed26.adaptivestream.shared.model.SegmentRecord;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class JdbcSegmentRepository extends JdbcRepository implements SegmentRepository {
    private static final String COLUMNS =
            "video_id, quality, idx, object_key, byte_length, start_seconds, duration_seconds, checksum";

    public JdbcSegmentRepository(DatabaseConfig config) {
        super(config);
    }

    @Override
    public boolean insertSegment(SegmentRecord s) {
        String sql = "INSERT INTO segments (" + COLUMNS + """
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (video_id, quality, idx) DO NOTHING
            """;
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(s.getVideoId()));
            ps.setString(2, s.getQuality());
            ps.setInt(3, s.getIndex());
            ps.setString(4, s.getObjectKey());
            ps.setLong(5, s.getByteLength());
            ps.setDouble(6, s.getStartSeconds());
            ps.setDouble(7, s.getDurationSeconds());
            ps.setString(8, s.getChecksum());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageException("Failed to insert segment " + s, e);
        }
    }

    @Override
    public int countSegments(String videoId, String quality) {
        if (parseId(videoId).isEmpty()) {
            return 0;
        }
        String sql = "SELECT COUNT(*) FROM segments WHERE video_id = ? AND quality = ?";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            ps.setString(2, quality);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
                return 0;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count segments of " + videoId + "/" + quality, e);
        }
    }

    @Override
    public Optional<SegmentRecord> findSegment(String videoId, String quality, int index) {
        if (parseId(videoId).isEmpty()) {
            return Optional.empty();
        }
        String sql = "SELECT " + COLUMNS + " FROM segments WHERE video_id = ? AND quality = ? AND idx = ?";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            ps.setString(2, quality);
            ps.setInt(3, index);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to query segment " + videoId + "/" + quality + "#" + index, e);
        }
    }

    @Override
    public List<SegmentRecord> listSegments(String videoId, String quality) {
        if (parseId(videoId).isEmpty()) {
            return List.of();
        }
        String sql = "SELECT " + COLUMNS + " FROM segments WHERE video_id = ? AND quality = ? ORDER BY idx";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            ps.setString(2, quality);
            List<SegmentRecord> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(map(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new StorageException("Failed to list segments of " + videoId + "/" + quality, e);
        }
    }

    @Override
    public int deleteSegments(String videoId, String quality) {
        if (parseId(videoId).isEmpty()) {
            return 0;
        }
        String sql = "DELETE FROM segments WHERE video_id = ? AND quality = ?";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            ps.setString(2, quality);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to delete segments of " + videoId + "/" + quality, e);
        }
    }

    private static SegmentRecord map(ResultSet rs) throws SQLException {
        return new SegmentRecord(
                rs.getString("video_id"),
                rs.getString("quality"),
                rs.getInt("idx"),
                rs.getString("object_key"),
                rs.getLong("byte_length"),
                rs.getDouble("start_seconds"),
                rs.getDouble("duration_seconds"),
                rs.getString("checksum"));
    }
}
