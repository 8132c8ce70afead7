package com.casetrace.tasks;

/**
 * Work performed for each task taken off the queue.
 */
public interface FileTaskHandler {

    void handle(FileProcessingTask task);
}
