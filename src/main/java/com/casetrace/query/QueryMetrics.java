package com.casetrace.query;

import com.casetrace.storage.hot.SearchEngineException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for paged searches, scroll exports and the latest-event cache
 */
@Component
public class QueryMetrics {

    @Autowired
    MeterRegistry meterRegistry;

    private Counter searchesExecuted;
    private Counter exportsExecuted;
    private Counter exportsTruncated;
    private Counter queryTimeouts;
    private Counter queryErrors;
    private Timer searchLatency;
    private Timer exportLatency;
    private DistributionSummary exportSize;
    private Counter cacheHits;
    private Counter cacheMisses;

    @PostConstruct
    public void init() {
        searchesExecuted = Counter.builder("casetrace.query.count")
            .tag("type", "search")
            .description("Paged searches executed")
            .register(meterRegistry);

        exportsExecuted = Counter.builder("casetrace.query.count")
            .tag("type", "export")
            .description("Scroll exports executed")
            .register(meterRegistry);

        exportsTruncated = Counter.builder("casetrace.query.export.truncated")
            .description("Exports cut short by a result cap")
            .register(meterRegistry);

        queryTimeouts = Counter.builder("casetrace.query.timeouts")
            .description("Searches and exports that timed out")
            .register(meterRegistry);

        queryErrors = Counter.builder("casetrace.query.errors")
            .description("Searches and exports that failed")
            .register(meterRegistry);

        searchLatency = Timer.builder("casetrace.query.latency")
            .tag("type", "search")
            .description("Latency of paged searches")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofSeconds(60))
            .register(meterRegistry);

        exportLatency = Timer.builder("casetrace.query.latency")
            .tag("type", "export")
            .description("Latency of full scroll exports")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        exportSize = DistributionSummary.builder("casetrace.query.export.size")
            .description("Documents returned per export")
            .baseUnit("records")
            .register(meterRegistry);

        cacheHits = Counter.builder("casetrace.query.cache.hits")
            .description("Latest-event cache hits")
            .register(meterRegistry);

        cacheMisses = Counter.builder("casetrace.query.cache.misses")
            .description("Latest-event cache misses")
            .register(meterRegistry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordSearch(Timer.Sample sample) {
        searchesExecuted.increment();
        sample.stop(searchLatency);
    }

    public void recordExport(Timer.Sample sample, long documents, boolean truncated) {
        exportsExecuted.increment();
        sample.stop(exportLatency);
        exportSize.record(documents);
        if (truncated) {
            exportsTruncated.increment();
        }
    }

    public void recordFailure(SearchEngineException.Kind kind) {
        queryErrors.increment();
        if (kind == SearchEngineException.Kind.TIMEOUT) {
            queryTimeouts.increment();
        }
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    /**
     * @return cache hit rate (0-100), or 0 before any lookup
     */
    public double getCacheHitRate() {
        double hits = cacheHits.count();
        double total = hits + cacheMisses.count();
        return total == 0 ? 0.0 : (hits / total) * 100.0;
    }

    public Counter getSearchesExecuted() {
        return searchesExecuted;
    }

    public Counter getExportsExecuted() {
        return exportsExecuted;
    }

    public Counter getExportsTruncated() {
        return exportsTruncated;
    }

    public Counter getQueryTimeouts() {
        return queryTimeouts;
    }

    public Counter getQueryErrors() {
        return queryErrors;
    }

    public Timer getSearchLatency() {
        return searchLatency;
    }

    public Timer getExportLatency() {
        return exportLatency;
    }

    public DistributionSummary getExportSize() {
        return exportSize;
    }
}
