package com.distributed26.adaptivestream.shared.events;

import java.util.Objects;

/** Synchronous bus: {@link #publish} delivers on the caller's thread. */
public class InMemoryPipelineEventBus implements PipelineEventBus {
    private final ListenerRegistry registry = new ListenerRegistry();

    @Override
    public void publish(PipelineEvent event) {
        Objects.requireNonNull(event, "event is null");
        registry.dispatch(event);
    }

    @Override
    public void subscribe(String videoId, PipelineEventListener listener) {
        registry.subscribe(videoId, listener);
    }

    @Override
    public void unsubscribe(String videoId, PipelineEventListener listener) {
        registry.unsubscribe(videoId, listener);
    }

    @Override
    public void subscribeAll(PipelineEventListener listener) {
        registry.subscribeAll(listener);
    }
}
