package com.distributed26.adaptivestream.processing;

@FunctionalInterface
public interface RenditionTaskHandler {
    void handle(RenditionTask task);
}
