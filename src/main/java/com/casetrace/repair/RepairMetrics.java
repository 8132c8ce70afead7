package com.casetrace.repair;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Metrics for consistency repair passes
 */
@Component
public class RepairMetrics {

    @Autowired
    MeterRegistry meterRegistry;

    private final Map<RepairDetection, Counter> actionsApplied = new EnumMap<>(RepairDetection.class);
    private Counter runs;
    private Counter abortedRuns;
    private Counter failedBatches;
    private Counter concurrentSkips;
    private Timer runLatency;

    @PostConstruct
    public void init() {
        for (RepairDetection detection : RepairDetection.values()) {
            actionsApplied.put(detection, Counter.builder("casetrace.repair.actions")
                .tag("detection", detection.name().toLowerCase(Locale.ROOT))
                .description("Repair actions committed")
                .register(meterRegistry));
        }

        runs = Counter.builder("casetrace.repair.runs")
            .description("Repair passes started")
            .register(meterRegistry);

        abortedRuns = Counter.builder("casetrace.repair.aborted")
            .description("Repair passes aborted because the task queue could not be inspected")
            .register(meterRegistry);

        failedBatches = Counter.builder("casetrace.repair.batches.failed")
            .description("Case batches rolled back or skipped")
            .register(meterRegistry);

        concurrentSkips = Counter.builder("casetrace.repair.skipped.concurrent")
            .description("Repair writes lost to a concurrent worker update")
            .register(meterRegistry);

        runLatency = Timer.builder("casetrace.repair.latency")
            .description("Duration of a repair pass")
            .register(meterRegistry);
    }

    public Timer.Sample startRun() {
        runs.increment();
        return Timer.start(meterRegistry);
    }

    public void recordRunFinished(Timer.Sample sample) {
        sample.stop(runLatency);
    }

    public void recordAborted() {
        abortedRuns.increment();
    }

    public void recordApplied(RepairDetection detection) {
        actionsApplied.get(detection).increment();
    }

    public void recordConcurrentSkip() {
        concurrentSkips.increment();
    }

    public void recordFailedBatch() {
        failedBatches.increment();
    }

    public Counter getActionsApplied(RepairDetection detection) {
        return actionsApplied.get(detection);
    }

    public Counter getRuns() {
        return runs;
    }

    public Counter getAbortedRuns() {
        return abortedRuns;
    }

    public Counter getFailedBatches() {
        return failedBatches;
    }

    public Counter getConcurrentSkips() {
        return concurrentSkips;
    }
}
