package com.casetrace.tasks;

/**
 * The task queue could not be reached or inspected.
 */
public class TaskQueueUnavailableException extends RuntimeException {

    public TaskQueueUnavailableException(String message) {
        super(message);
    }

    public TaskQueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
