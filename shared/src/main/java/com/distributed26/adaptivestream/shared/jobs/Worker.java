package com.distributed26.adaptivestream.shared.jobs;

import java.time.Instant;
import java.util.Objects;

/**
 * Bookkeeping for one transcoding worker thread. Written by the owning thread, read by the
 * {@code /workers} endpoint, hence the volatile fields.
 */
public class Worker {
    private final String id;
    private final Instant registeredAt;
    private volatile WorkerStatus status;
    private volatile Instant lastHeartbeatAt;
    private volatile String currentTask;
    private volatile long completedTasks;

    public Worker(String id, Instant registeredAt) {
        this.id = Objects.requireNonNull(id, "id is null");
        this.registeredAt = Objects.requireNonNull(registeredAt, "registeredAt is null");
        this.status = WorkerStatus.IDLE;
        this.lastHeartbeatAt = registeredAt;
    }

    public String getId() {
        return id;
    }

    public WorkerStatus getStatus() {
        return status;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public Instant getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    /** Task description while BUSY, otherwise {@code null}. */
    public String getCurrentTask() {
        return currentTask;
    }

    public long getCompletedTasks() {
        return completedTasks;
    }

    public void heartbeat() {
        this.lastHeartbeatAt = Instant.now();
    }

    public void startTask(String description) {
        this.currentTask = Objects.requireNonNull(description, "description is null");
        this.status = WorkerStatus.BUSY;
        heartbeat();
    }

    public void finishTask() {
        this.currentTask = null;
        this.completedTasks++;
        this.status = WorkerStatus.IDLE;
        heartbeat();
    }

    public void markOffline() {
        this.currentTask = null;
        this.status = WorkerStatus.OFFLINE;
    }
}
