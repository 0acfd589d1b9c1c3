package com.distributed26.adaptivestream.shared.events;

@FunctionalInterface
public interface PipelineEventListener {
    void onEvent(PipelineEvent event);
}
