package com.distributed26.adaptivestream.processing;

import com.distributed26.adaptivestream.shared.jobs.Worker;
import com.distributed26.adaptivestream.shared.jobs.WorkerStatus;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Polls the shared {@link BlockingQueue} for {@link RenditionTask}s and hands each to the
 * orchestrator. The number of workers bounds how many encodes run at once.
 */
public class TranscodingWorker {
    private static final Logger LOGGER = LogManager.getLogger(TranscodingWorker.class);

    private final Worker worker;
    private final BlockingQueue<RenditionTask> queue;
    private final RenditionTaskHandler handler;
    private volatile boolean running = false;
    private Thread thread;

    public TranscodingWorker(String id, BlockingQueue<RenditionTask> queue, RenditionTaskHandler handler) {
        this.worker = new Worker(id, Instant.now());
        this.queue = Objects.requireNonNull(queue, "queue is null");
        this.handler = Objects.requireNonNull(handler, "handler is null");
    }

    public String getId() { return worker.getId(); }
    public WorkerStatus getStatus() { return worker.getStatus(); }
    public Worker getWorker() { return worker; }

    public void start() {
        running = true;
        thread = new Thread(this::runLoop, "TranscodingWorker-" + worker.getId());
        thread.setDaemon(true);
        thread.start();
        LOGGER.info("Worker started: {}", worker.getId());
    }

    public void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
        }
        worker.markOffline();
        LOGGER.info("Worker stopped: {}", worker.getId());
    }

    private void runLoop() {
        while (running) {
            try {
                RenditionTask task = queue.poll(1, TimeUnit.SECONDS);
                if (task == null) {
                    worker.heartbeat();
                    continue;
                }

                worker.startTask(task.toString());
                LOGGER.info("Worker {} picked up {}", worker.getId(), task);
                try {
                    handler.handle(task);
                } catch (RuntimeException e) {
                    LOGGER.error("Worker {} failed on {}", worker.getId(), task, e);
                }
                worker.finishTask();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (worker.getStatus() != WorkerStatus.OFFLINE) {
            worker.markOffline();
        }
    }
}
