package com.casetrace.tasks;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time view of the task queue, keyed by worker name.
 */
public class TaskQueueSnapshot {

    private final Map<String, Set<String>> activeByWorker;
    private final Map<String, Set<String>> pendingByWorker;
    private final Set<String> liveIds;

    public TaskQueueSnapshot(Map<String, Set<String>> activeByWorker,
                             Map<String, Set<String>> pendingByWorker) {
        this.activeByWorker = copy(activeByWorker);
        this.pendingByWorker = copy(pendingByWorker);
        Set<String> ids = new HashSet<>();
        this.activeByWorker.values().forEach(ids::addAll);
        this.pendingByWorker.values().forEach(ids::addAll);
        this.liveIds = Collections.unmodifiableSet(ids);
    }

    public static TaskQueueSnapshot empty() {
        return new TaskQueueSnapshot(Map.of(), Map.of());
    }

    public Map<String, Set<String>> getActiveByWorker() {
        return activeByWorker;
    }

    public Map<String, Set<String>> getPendingByWorker() {
        return pendingByWorker;
    }

    public int activeCount() {
        return activeByWorker.values().stream().mapToInt(Set::size).sum();
    }

    public int pendingCount() {
        return pendingByWorker.values().stream().mapToInt(Set::size).sum();
    }

    public boolean isIdle() {
        return activeCount() == 0 && pendingCount() == 0;
    }

    /**
     * @return true when the id is running or waiting on some worker
     */
    public boolean isLive(String taskId) {
        return taskId != null && liveIds.contains(taskId);
    }

    private static Map<String, Set<String>> copy(Map<String, Set<String>> source) {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((worker, ids) -> result.put(worker, Set.copyOf(ids)));
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return "TaskQueueSnapshot{active=" + activeCount() + ", pending=" + pendingCount() + "}";
    }
}
