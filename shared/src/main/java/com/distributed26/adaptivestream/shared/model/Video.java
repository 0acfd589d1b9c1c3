package com.distributed26.adaptivestream.shared.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a video row. Repositories hand out fresh snapshots; status changes go through
 * {@code VideoRepository} so the status column stays the single source of truth.
 */
public class Video {
    private final String id;
    private final String ownerId;
    private final String title;
    private final String description;
    private final String category;
    private final List<String> tags;
    private final Visibility visibility;
    private final String originalFilename;
    private final VideoStatus status;
    private final String failureReason;
    private final Instant createdAt;
    private final Instant updatedAt;

    public Video(
            String id,
            String ownerId,
            String title,
            String description,
            String category,
            List<String> tags,
            Visibility visibility,
            String originalFilename,
            VideoStatus status,
            String failureReason,
            Instant createdAt,
            Instant updatedAt
    ) {
        this.id = Objects.requireNonNull(id, "id is null");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId is null");
        this.title = (title == null || title.isBlank()) ? "Untitled Video" : title;
        this.description = description;
        this.category = category;
        this.tags = (tags == null) ? new ArrayList<>() : new ArrayList<>(tags);
        this.visibility = (visibility == null) ? Visibility.PUBLIC : visibility;
        this.originalFilename = originalFilename;
        this.status = Objects.requireNonNull(status, "status is null");
        this.failureReason = failureReason;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt is null");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt is null");
    }

    public static Video uploaded(String id, String ownerId, String title, Instant now) {
        return new Video(id, ownerId, title, null, null, null, Visibility.PUBLIC, null,
                VideoStatus.UPLOADED, null, now, now);
    }

    public Video withStatus(VideoStatus newStatus, String reason, Instant now) {
        return new Video(id, ownerId, title, description, category, tags, visibility, originalFilename,
                newStatus, reason, createdAt, now);
    }

    public String getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public VideoStatus getStatus() {
        return status;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "Video{id='" + id + "', status=" + status + ", title='" + title + "'}";
    }
}
