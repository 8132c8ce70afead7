package com.casetrace.ingestion;

import com.casetrace.domain.ProcessingStatus;
import com.casetrace.storage.IndexedFileRepository;
import com.casetrace.tasks.TaskQueue;
import com.casetrace.tasks.TaskQueueSnapshot;
import com.casetrace.tasks.TaskQueueUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;

@Service
public class QueueHealthService {
    private static final Logger log = LoggerFactory.getLogger(QueueHealthService.class);

    private final IndexedFileRepository repository;
    private final TaskQueue taskQueue;

    @Value("${casetrace.tasks.inspect-timeout-ms:5000}")
    private long inspectTimeoutMs = 5000;

    public QueueHealthService(IndexedFileRepository repository, TaskQueue taskQueue) {
        this.repository = repository;
        this.taskQueue = taskQueue;
    }

    public QueueHealthReport health() {
        QueueHealthReport report = new QueueHealthReport();
        for (Map.Entry<String, Long> entry : repository.countByStatus().entrySet()) {
            long count = entry.getValue();
            ProcessingStatus status = ProcessingStatus.fromValue(entry.getKey()).orElse(null);
            if (status == null) {
                report.setFailed(report.getFailed() + count);
            } else if (status == ProcessingStatus.QUEUED) {
                report.setQueued(report.getQueued() + count);
            } else if (status == ProcessingStatus.COMPLETED) {
                report.setCompleted(report.getCompleted() + count);
            } else {
                report.setProcessing(report.getProcessing() + count);
            }
        }

        try {
            TaskQueueSnapshot snapshot = taskQueue.snapshot(Duration.ofMillis(inspectTimeoutMs));
            report.setQueueReachable(true);
            report.setWorkers(Math.max(snapshot.getActiveByWorker().size(), snapshot.getPendingByWorker().size()));
            report.setActiveTasks(snapshot.activeCount());
            report.setPendingTasks(snapshot.pendingCount());
            if (snapshot.isIdle()) {
                report.setStuckQueued(report.getQueued());
            }
        } catch (TaskQueueUnavailableException e) {
            log.warn("Task queue could not be inspected: {}", e.getMessage());
            report.setQueueReachable(false);
        }

        report.setHealthy(report.isQueueReachable() && report.getStuckQueued() == 0);
        if (!report.isHealthy()) {
            log.warn("Queue unhealthy: {}", report);
        }
        return report;
    }
}
