package com.casetrace.ingestion;

import com.casetrace.domain.IndexedFile;
import com.casetrace.support.FakeTaskQueue;
import com.casetrace.support.InMemoryIndexedFileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueueHealthService Tests")
class QueueHealthServiceTest {

    private InMemoryIndexedFileRepository repository;
    private FakeTaskQueue taskQueue;
    private QueueHealthService service;
    private long nextId = 1;

    @BeforeEach
    void setUp() {
        repository = new InMemoryIndexedFileRepository();
        taskQueue = new FakeTaskQueue();
        service = new QueueHealthService(repository, taskQueue);
    }

    private void file(String status) {
        IndexedFile file = new IndexedFile();
        file.setId(nextId++);
        file.setCaseId(1);
        file.setIndexingStatus(status);
        repository.save(file);
    }

    @Test
    @DisplayName("Should bucket statuses and count live tasks")
    void shouldBucketStatuses() {
        file("Queued");
        file("Indexing");
        file("SIGMA Testing");
        file("Completed");
        file("Completed");
        file("Failed");
        file("Failed: 0 events indexed");
        file("Error: index version mismatch");
        taskQueue.withActive("a").withActive("b").withPending("c");

        QueueHealthReport report = service.health();

        assertThat(report.getQueued()).isEqualTo(1);
        assertThat(report.getProcessing()).isEqualTo(2);
        assertThat(report.getCompleted()).isEqualTo(2);
        assertThat(report.getFailed()).isEqualTo(3);
        assertThat(report.getWorkers()).isEqualTo(1);
        assertThat(report.getActiveTasks()).isEqualTo(2);
        assertThat(report.getPendingTasks()).isEqualTo(1);
        assertThat(report.getStuckQueued()).isZero();
        assertThat(report.isQueueReachable()).isTrue();
        assertThat(report.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Should report queued files as stuck when no work is live")
    void shouldReportStuckQueued() {
        file("Queued");
        file("Queued");

        QueueHealthReport report = service.health();

        assertThat(report.getStuckQueued()).isEqualTo(2);
        assertThat(report.isHealthy()).isFalse();
    }

    @Test
    @DisplayName("Should stay unhealthy but answer when the queue cannot be inspected")
    void shouldReportUnreachableQueue() {
        file("Completed");
        taskQueue.setUnavailable(true);

        QueueHealthReport report = service.health();

        assertThat(report.isQueueReachable()).isFalse();
        assertThat(report.isHealthy()).isFalse();
        assertThat(report.getCompleted()).isEqualTo(1);
        assertThat(report.getWorkers()).isZero();
    }
}
