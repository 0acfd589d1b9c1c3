package com.distributed26.adaptivestream.shared.model;

public enum Visibility {
    PUBLIC,
    PRIVATE,
    UNLISTED
}
