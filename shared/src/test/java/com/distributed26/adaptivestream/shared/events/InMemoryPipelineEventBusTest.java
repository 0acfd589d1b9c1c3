package com.distributed26.adaptivestream.shared.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.distributed26.adaptivestream.shared.model.VideoStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InMemoryPipelineEventBusTest {
    @Mock
    private PipelineEventListener listener;

    @Mock
    private PipelineEventListener other;

    private final InMemoryPipelineEventBus bus = new InMemoryPipelineEventBus();

    @Test
    void deliversOnlyToSubscribersOfTheVideo() {
        bus.subscribe("v1", listener);
        bus.subscribe("v2", other);
        VideoStatusEvent event = new VideoStatusEvent("v1", VideoStatus.READY, null, Instant.now());

        bus.publish(event);

        verify(listener).onEvent(event);
        verify(other, never()).onEvent(any());
    }

    @Test
    void globalListenersSeeEverything() {
        List<PipelineEvent> seen = new ArrayList<>();
        bus.subscribeAll(seen::add);

        bus.publish(new VideoSubmittedEvent("v1", "owner", Instant.now()));
        bus.publish(new VideoSubmittedEvent("v2", "owner", Instant.now()));

        assertEquals(2, seen.size());
        assertEquals("v2", seen.get(1).getVideoId());
    }

    @Test
    void unsubscribeStopsDelivery() {
        bus.subscribe("v1", listener);
        bus.unsubscribe("v1", listener);

        bus.publish(new VideoSubmittedEvent("v1", "owner", Instant.now()));

        verify(listener, never()).onEvent(any());
    }

    @Test
    void failingListenerDoesNotBlockOthers() {
        List<PipelineEvent> seen = new ArrayList<>();
        doThrow(new IllegalStateException("boom")).when(listener).onEvent(any());
        bus.subscribe("v1", listener);
        bus.subscribe("v1", seen::add);
        VideoSubmittedEvent event = new VideoSubmittedEvent("v1", "owner", Instant.now());

        bus.publish(event);

        assertEquals(1, seen.size());
        assertSame(event, seen.get(0));
        assertTrue(seen.get(0) instanceof VideoSubmittedEvent);
    }
}
