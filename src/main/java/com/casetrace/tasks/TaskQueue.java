package com.casetrace.tasks;

import java.time.Duration;

/**
 * Background queue for file processing.
 */
public interface TaskQueue {

    /**
     * Enqueue a task. A task without an id is given a random UUID.
     *
     * @return the id the task runs under
     */
    String submit(FileProcessingTask task);

    /**
     * Active and pending task ids across all workers.
     *
     * @throws TaskQueueUnavailableException when the queue could not be
     *         inspected within {@code timeout}
     */
    TaskQueueSnapshot snapshot(Duration timeout);
}
