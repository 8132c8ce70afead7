package com.casetrace.storage.hot;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for bulk writes into case indices and per-file indexing runs
 */
@Component
public class IndexingMetrics {

    @Autowired
    MeterRegistry meterRegistry;

    private Counter documentsIndexed;
    private Counter bulkFailures;
    private Counter filesIndexed;
    private Counter filesFailed;
    private Timer bulkLatency;
    private Timer fileLatency;

    @PostConstruct
    public void init() {
        documentsIndexed = Counter.builder("casetrace.indexing.documents")
            .description("Documents written to case indices")
            .register(meterRegistry);

        bulkFailures = Counter.builder("casetrace.indexing.bulk.failures")
            .description("Documents rejected by bulk requests")
            .register(meterRegistry);

        filesIndexed = Counter.builder("casetrace.indexing.files")
            .tag("outcome", "completed")
            .description("Source files indexed to completion")
            .register(meterRegistry);

        filesFailed = Counter.builder("casetrace.indexing.files")
            .tag("outcome", "failed")
            .description("Source files whose indexing failed")
            .register(meterRegistry);

        bulkLatency = Timer.builder("casetrace.indexing.bulk.latency")
            .description("Latency of bulk requests")
            .register(meterRegistry);

        fileLatency = Timer.builder("casetrace.indexing.latency")
            .description("Wall time to index one source file")
            .register(meterRegistry);
    }

    public void recordDocumentsIndexed(long count) {
        documentsIndexed.increment(count);
    }

    public void recordBulkFailures(long count) {
        bulkFailures.increment(count);
    }

    public void recordBulkLatency(long millis) {
        bulkLatency.record(millis, TimeUnit.MILLISECONDS);
    }

    public Timer.Sample startFileTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordFileCompleted(Timer.Sample sample) {
        sample.stop(fileLatency);
        filesIndexed.increment();
    }

    public void recordFileFailed(Timer.Sample sample) {
        sample.stop(fileLatency);
        filesFailed.increment();
    }

    public Counter getDocumentsIndexed() {
        return documentsIndexed;
    }

    public Counter getBulkFailures() {
        return bulkFailures;
    }

    public Counter getFilesIndexed() {
        return filesIndexed;
    }

    public Counter getFilesFailed() {
        return filesFailed;
    }
}
