package com.casetrace.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Processing backlog and worker state at one point in time.
 */
public class QueueHealthReport {

    @JsonProperty("queued")
    private long queued;

    @JsonProperty("processing")
    private long processing;

    @JsonProperty("completed")
    private long completed;

    @JsonProperty("failed")
    private long failed;

    @JsonProperty("workers")
    private int workers;

    @JsonProperty("active_tasks")
    private int activeTasks;

    @JsonProperty("pending_tasks")
    private int pendingTasks;

    @JsonProperty("queue_reachable")
    private boolean queueReachable;

    @JsonProperty("stuck_queued")
    private long stuckQueued;

    @JsonProperty("healthy")
    private boolean healthy;

    public long getQueued() {
        return queued;
    }

    public void setQueued(long queued) {
        this.queued = queued;
    }

    public long getProcessing() {
        return processing;
    }

    public void setProcessing(long processing) {
        this.processing = processing;
    }

    public long getCompleted() {
        return completed;
    }

    public void setCompleted(long completed) {
        this.completed = completed;
    }

    public long getFailed() {
        return failed;
    }

    public void setFailed(long failed) {
        this.failed = failed;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public int getActiveTasks() {
        return activeTasks;
    }

    public void setActiveTasks(int activeTasks) {
        this.activeTasks = activeTasks;
    }

    public int getPendingTasks() {
        return pendingTasks;
    }

    public void setPendingTasks(int pendingTasks) {
        this.pendingTasks = pendingTasks;
    }

    public boolean isQueueReachable() {
        return queueReachable;
    }

    public void setQueueReachable(boolean queueReachable) {
        this.queueReachable = queueReachable;
    }

    /**
     * Files waiting in {@code Queued} while no worker has anything to do
     */
    public long getStuckQueued() {
        return stuckQueued;
    }

    public void setStuckQueued(long stuckQueued) {
        this.stuckQueued = stuckQueued;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    @Override
    public String toString() {
        return "QueueHealthReport{queued=" + queued + ", processing=" + processing
            + ", failed=" + failed + ", active=" + activeTasks + ", pending=" + pendingTasks
            + ", stuckQueued=" + stuckQueued + ", healthy=" + healthy + "}";
    }
}
