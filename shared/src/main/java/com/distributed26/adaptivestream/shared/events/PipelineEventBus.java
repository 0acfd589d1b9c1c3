package com.distributed26.adaptivestream.shared.events;

public interface PipelineEventBus {
    void publish(PipelineEvent event);

    void subscribe(String videoId, PipelineEventListener listener);

    void unsubscribe(String videoId, PipelineEventListener listener);

    /**
     * Registers a listener that receives every event regardless of video id. The processing
     * service uses this to pick up submissions for videos it has not seen yet.
     */
    void subscribeAll(PipelineEventListener listener);
}
