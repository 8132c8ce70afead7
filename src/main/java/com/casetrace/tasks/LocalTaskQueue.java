package com.casetrace.tasks;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process {@link TaskQueue} over a fixed pool of worker threads.
 *
 * A task id moves from pending to active before it leaves pending, so a
 * snapshot never misses a task that is between the two.
 */
@Component
public class LocalTaskQueue implements TaskQueue {
    private static final Logger log = LoggerFactory.getLogger(LocalTaskQueue.class);

    static final String WORKER_NAME = "local";

    private final FileTaskHandler handler;
    private final ExecutorService workers;
    private final Set<String> pending = ConcurrentHashMap.newKeySet();
    private final Set<String> active = ConcurrentHashMap.newKeySet();

    public LocalTaskQueue(FileTaskHandler handler,
                          @Value("${casetrace.tasks.workers:2}") int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("casetrace.tasks.workers must be at least 1");
        }
        this.handler = handler;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable, "casetrace-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Local task queue started with {} workers", workerCount);
    }

    @Override
    public String submit(FileProcessingTask task) {
        if (task.getTaskId() == null) {
            task.setTaskId(UUID.randomUUID().toString());
        }
        String taskId = task.getTaskId();
        pending.add(taskId);
        try {
            workers.execute(() -> run(task));
        } catch (RejectedExecutionException e) {
            pending.remove(taskId);
            throw new TaskQueueUnavailableException("Task queue is shut down, cannot submit " + task, e);
        }
        log.debug("Submitted {}", task);
        return taskId;
    }

    private void run(FileProcessingTask task) {
        active.add(task.getTaskId());
        pending.remove(task.getTaskId());
        try {
            handler.handle(task);
        } catch (RuntimeException e) {
            log.error("Task {} for file {} failed", task.getTaskId(), task.getFileId(), e);
        } finally {
            active.remove(task.getTaskId());
        }
    }

    /**
     * Local state is always readable, so the timeout only matters once the
     * pool has been shut down.
     */
    @Override
    public TaskQueueSnapshot snapshot(Duration timeout) {
        if (workers.isShutdown()) {
            throw new TaskQueueUnavailableException("Task queue is shut down");
        }
        return new TaskQueueSnapshot(
            Map.of(WORKER_NAME, Set.copyOf(active)),
            Map.of(WORKER_NAME, Set.copyOf(pending)));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping local task queue ({} active, {} pending)", active.size(), pending.size());
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
