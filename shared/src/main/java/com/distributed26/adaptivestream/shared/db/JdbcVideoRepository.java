package com.distributed26.adaptivestream.shared.db;

import com.distributed26.adaptivestream.shared.config.DatabaseConfig;
import com.distributed26.adaptivestream.shared.errors.StorageException;
import com.distributed26.adaptivestream.shared.model.SourceProbe;
import com.distributed26.adaptivestream.shared.model.Video;
import com.distributed26.adaptivestream.shared.model.VideoStatus;
import com.distributed26.adaptivestream.shared.model.Visibility;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class JdbcVideoRepository extends JdbcRepository implements VideoRepository {

    public JdbcVideoRepository(DatabaseConfig config) {
        super(config);
    }

    @Override
    public void create(Video video) {
        String sql = """
            INSERT INTO videos (id, owner_id, title, description, category, tags, visibility,
                                original_filename, status, failure_reason, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(video.getId()));
            ps.setString(2, video.getOwnerId());
            ps.setString(3, video.getTitle());
            ps.setString(4, video.getDescription());
            ps.setString(5, video.getCategory());
            ps.setArray(6, conn.createArrayOf("text", video.getTags().toArray()));
            ps.setString(7, video.getVisibility().name());
            ps.setString(8, video.getOriginalFilename());
            ps.setString(9, video.getStatus().name());
            ps.setString(10, video.getFailureReason());
            ps.setTimestamp(11, Timestamp.from(video.getCreatedAt()));
            ps.setTimestamp(12, Timestamp.from(video.getUpdatedAt()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to insert video " + video.getId(), e);
        }
    }

    @Override
    public Optional<Video> findVideo(String videoId) {
        if (parseId(videoId).isEmpty()) {
            return Optional.empty();
        }
        String sql = """
            SELECT id, owner_id, title, description, category, tags, visibility, original_filename,
                   status, failure_reason, created_at, updated_at
            FROM videos WHERE id = ?
            """;
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapVideo(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to query video " + videoId, e);
        }
    }

    @Override
    public boolean compareAndSetStatus(String videoId, Set<VideoStatus> expected, VideoStatus next,
                                       String failureReason) {
        if (parseId(videoId).isEmpty()) {
            return false;
        }
        String sql = """
            UPDATE videos SET status = ?, failure_reason = ?, updated_at = now()
            WHERE id = ? AND status = ANY (?)
            """;
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, next.name());
            ps.setString(2, failureReason);
            ps.setObject(3, uuid(videoId));
            ps.setArray(4, conn.createArrayOf("text", expected.stream().map(Enum::name).toArray()));
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageException("Failed to update status of video " + videoId, e);
        }
    }

    @Override
    public void updateStatus(String videoId, VideoStatus status, String failureReason) {
        if (parseId(videoId).isEmpty()) {
            return;
        }
        String sql = "UPDATE videos SET status = ?, failure_reason = ?, updated_at = now() WHERE id = ?";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, status.name());
            ps.setString(2, failureReason);
            ps.setObject(3, uuid(videoId));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to update status of video " + videoId, e);
        }
    }

    @Override
    public void saveProbe(String videoId, SourceProbe probe) {
        String sql = """
            INSERT INTO source_probes (video_id, duration_seconds, width, height, codec, frame_rate, format_name)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (video_id) DO UPDATE
            SET duration_seconds = EXCLUDED.duration_seconds,
                width = EXCLUDED.width,
                height = EXCLUDED.height,
                codec = EXCLUDED.codec,
                frame_rate = EXCLUDED.frame_rate,
                format_name = EXCLUDED.format_name
            """;
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            ps.setDouble(2, probe.getDurationSeconds());
            ps.setInt(3, probe.getWidth());
            ps.setInt(4, probe.getHeight());
            ps.setString(5, probe.getCodec());
            ps.setDouble(6, probe.getFrameRate());
            ps.setString(7, probe.getFormatName());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to save probe for video " + videoId, e);
        }
    }

    @Override
    public Optional<SourceProbe> findProbe(String videoId) {
        if (parseId(videoId).isEmpty()) {
            return Optional.empty();
        }
        String sql = """
            SELECT duration_seconds, width, height, codec, frame_rate, format_name
            FROM source_probes WHERE video_id = ?
            """;
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new SourceProbe(
                        rs.getDouble("duration_seconds"),
                        rs.getInt("width"),
                        rs.getInt("height"),
                        rs.getString("codec"),
                        rs.getDouble("frame_rate"),
                        rs.getString("format_name")));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to query probe for video " + videoId, e);
        }
    }

    @Override
    public boolean deleteVideo(String videoId) {
        if (parseId(videoId).isEmpty()) {
            return false;
        }
        String sql = "DELETE FROM videos WHERE id = ?";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, uuid(videoId));
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete video " + videoId, e);
        }
    }

    private static Video mapVideo(ResultSet rs) throws SQLException {
        List<String> tags = new ArrayList<>();
        Array tagArray = rs.getArray("tags");
        if (tagArray != null) {
            tags.addAll(Arrays.asList((String[]) tagArray.getArray()));
        }
        String visibility = rs.getString("visibility");
        return new Video(
                rs.getString("id"),
                rs.getString("owner_id"),
                rs.getString("title"),
                rs.getString("description"),
                rs.getString("category"),
                tags,
                visibility == null ? Visibility.PUBLIC : Visibility.valueOf(visibility),
                rs.getString("original_filename"),
                VideoStatus.valueOf(rs.getString("status")),
                rs.getString("failure_reason"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
    }
}
