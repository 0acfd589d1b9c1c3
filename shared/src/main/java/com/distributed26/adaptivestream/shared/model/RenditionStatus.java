package com.distributed26.adaptivestream.shared.model;

public enum RenditionStatus {
    PENDING,
    ENCODING,
    SEGMENTING,
    READY,
    FAILED;

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }
}
