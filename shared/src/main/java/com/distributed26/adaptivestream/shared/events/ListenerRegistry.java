package com.distributed26.adaptivestream.shared.events;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Listener bookkeeping shared by the bus implementations. */
final class ListenerRegistry {
    private static final Logger LOGGER = LogManager.getLogger(ListenerRegistry.class);

    private final Map<String, List<PipelineEventListener>> listenersByVideoId = new ConcurrentHashMap<>();
    private final List<PipelineEventListener> globalListeners = new CopyOnWriteArrayList<>();

    void subscribe(String videoId, PipelineEventListener listener) {
        Objects.requireNonNull(videoId, "videoId is null");
        Objects.requireNonNull(listener, "listener is null");
        listenersByVideoId
                .computeIfAbsent(videoId, key -> new CopyOnWriteArrayList<>())
                .add(listener);
    }

    void unsubscribe(String videoId, PipelineEventListener listener) {
        Objects.requireNonNull(videoId, "videoId is null");
        Objects.requireNonNull(listener, "listener is null");
        List<PipelineEventListener> listeners = listenersByVideoId.get(videoId);
        if (listeners == null) {
            return;
        }
        listeners.remove(listener);
        if (listeners.isEmpty()) {
            listenersByVideoId.remove(videoId, listeners);
        }
    }

    void subscribeAll(PipelineEventListener listener) {
        globalListeners.add(Objects.requireNonNull(listener, "listener is null"));
    }

    /** Delivers to global listeners first, then to the video's listeners. A failing listener does not stop the rest. */
    void dispatch(PipelineEvent event) {
        for (PipelineEventListener listener : globalListeners) {
            deliver(listener, event);
        }
        List<PipelineEventListener> listeners = listenersByVideoId.get(event.getVideoId());
        if (listeners == null) {
            return;
        }
        for (PipelineEventListener listener : listeners) {
            deliver(listener, event);
        }
    }

    private static void deliver(PipelineEventListener listener, PipelineEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            LOGGER.error("Listener failed on {} event for video {}", event.getType(), event.getVideoId(), e);
        }
    }
}
