package com.distributed26.adaptivestream.shared.jobs;

public enum WorkerStatus {
    IDLE,
    BUSY,
    OFFLINE
}
