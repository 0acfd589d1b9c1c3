package com.distributed26.adaptivestream.shared.db;

import com.distributed26.adaptivestream.shared.config.DatabaseConfig;
import com.distributed26.adaptivestream.shared.errors.StorageException;
import com.distributed26.adaptivestream.shared.model.ThumbnailRecord;
import com.distributed26.adaptivestream.shared.model.ThumbnailSize;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class JdbcThumbnailRepository extends JdbcRepository implements ThumbnailRepository {

    public JdbcThumbnailRepository(DatabaseConfig config) {
        super(config);
    }

    @Override
    public void saveThumbnail(ThumbnailRecord t) {
        String sql = """
            INSERT INTO thumbnails (video_id, size, object_key, byte_length, mime_type)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (video_id, size) DO NOTHING
            """;
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(t.getVideoId()));
            ps.setString(2, t.getSize().name());
            ps.setString(3, t.getObjectKey());
            ps.setLong(4, t.getByteLength());
            ps.setString(5, t.getMimeType());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to save thumbnail " + t.getVideoId() + "/" + t.getSize(), e);
        }
    }

    @Override
    public Optional<ThumbnailRecord> findThumbnail(String videoId, ThumbnailSize size) {
        if (parseId(videoId).isEmpty()) {
            return Optional.empty();
        }
        String sql = "SELECT video_id, size, object_key, byte_length, mime_type FROM thumbnails "
                + "WHERE video_id = ? AND size = ?";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            ps.setString(2, size.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to query thumbnail " + videoId + "/" + size, e);
        }
    }

    @Override
    public List<ThumbnailRecord> listThumbnails(String videoId) {
        if (parseId(videoId).isEmpty()) {
            return List.of();
        }
        String sql = "SELECT video_id, size, object_key, byte_length, mime_type FROM thumbnails WHERE video_id = ?";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            List<ThumbnailRecord> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(map(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new StorageException("Failed to list thumbnails of video " + videoId, e);
        }
    }

    private static ThumbnailRecord map(ResultSet rs) throws SQLException {
        return new ThumbnailRecord(
                rs.getString("video_id"),
                ThumbnailSize.valueOf(rs.getString("size")),
                rs.getString("object_key"),
                rs.getLong("byte_length"),
                rs.getString("mime_type"));
    }
}
