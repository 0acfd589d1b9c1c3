package com.distributed26.adaptivestream.processing;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.distributed26.adaptivestream.shared.jobs.WorkerStatus;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscodingWorkerTest {
    private static final TranscodingProfile P240 = new TranscodingProfile("240p", 426, 240, 300_000, "libx264");

    @Mock
    private RenditionTaskHandler handler;

    private final BlockingQueue<RenditionTask> queue = new LinkedBlockingQueue<>();
    private TranscodingWorker worker;

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop();
        }
    }

    @Test
    void newWorker_isIdle() {
        worker = new TranscodingWorker("w1", queue, handler);

        assertEquals("w1", worker.getId());
        assertEquals(WorkerStatus.IDLE, worker.getStatus());
    }

    @Test
    void queuedTask_isHandedToHandler() {
        worker = new TranscodingWorker("w1", queue, handler);
        RenditionTask task = new RenditionTask(new PipelineRun("v1"), P240, 1);
        queue.add(task);

        worker.start();

        verify(handler, timeout(5_000)).handle(task);
    }

    @Test
    void handlerFailure_doesNotKillWorker() {
        doThrow(new IllegalStateException("boom")).doNothing().when(handler).handle(any());
        worker = new TranscodingWorker("w1", queue, handler);
        queue.add(new RenditionTask(new PipelineRun("v1"), P240, 1));
        queue.add(new RenditionTask(new PipelineRun("v2"), P240, 1));

        worker.start();

        verify(handler, timeout(5_000).times(2)).handle(any());
    }

    @Test
    void stop_marksOffline() {
        worker = new TranscodingWorker("w1", queue, handler);
        worker.start();

        worker.stop();

        assertEquals(WorkerStatus.OFFLINE, worker.getStatus());
    }

    @Test
    void nextAttempt_keepsIdentityAndIncrementsAttempt() {
        RenditionTask first = new RenditionTask(new PipelineRun("v1"), P240, 1);
        RenditionTask second = first.nextAttempt();

        assertEquals(first.getId(), second.getId());
        assertEquals(2, second.getAttempt());
        assertEquals("240p", second.getQuality());
        assertEquals("v1", second.getVideoId());
    }
}
