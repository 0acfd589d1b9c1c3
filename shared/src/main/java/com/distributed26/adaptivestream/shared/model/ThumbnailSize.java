package com.distributed26.adaptivestream.shared.model;

import java.util.Locale;
import java.util.Optional;

public enum ThumbnailSize {
    SMALL(320, 180),
    MEDIUM(480, 270),
    LARGE(640, 360);

    private final int width;
    private final int height;

    ThumbnailSize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ThumbnailSize> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (ThumbnailSize size : values()) {
            if (size.label().equalsIgnoreCase(label.trim())) {
                return Optional.of(size);
            }
        }
        return Optional.empty();
    }
}
