package com.casetrace.query;

import com.casetrace.storage.hot.SearchEngineException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("QueryMetrics Tests")
class QueryMetricsTest {

    private QueryMetrics queryMetrics;
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queryMetrics = new QueryMetrics();
        queryMetrics.meterRegistry = meterRegistry;
        queryMetrics.init();
    }

    @Test
    @DisplayName("Should initialize all metrics on startup")
    void shouldInitializeAllMetrics() {
        assertThat(queryMetrics.getSearchesExecuted()).isNotNull();
        assertThat(queryMetrics.getExportsExecuted()).isNotNull();
        assertThat(queryMetrics.getExportsTruncated()).isNotNull();
        assertThat(queryMetrics.getQueryTimeouts()).isNotNull();
        assertThat(queryMetrics.getQueryErrors()).isNotNull();
        assertThat(queryMetrics.getSearchLatency()).isNotNull();
        assertThat(queryMetrics.getExportLatency()).isNotNull();
        assertThat(queryMetrics.getExportSize()).isNotNull();
    }

    @Test
    @DisplayName("Should count searches and time them")
    void shouldRecordSearch() {
        Timer.Sample sample = queryMetrics.startTimer();
        queryMetrics.recordSearch(sample);

        assertThat(queryMetrics.getSearchesExecuted().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getSearchLatency().count()).isEqualTo(1);
        assertThat(meterRegistry.get("casetrace.query.count").tag("type", "search").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record export size and truncation")
    void shouldRecordExport() {
        queryMetrics.recordExport(queryMetrics.startTimer(), 25_000, false);
        queryMetrics.recordExport(queryMetrics.startTimer(), 12_345, true);

        assertThat(queryMetrics.getExportsExecuted().count()).isEqualTo(2.0);
        assertThat(queryMetrics.getExportsTruncated().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getExportSize().totalAmount()).isEqualTo(37_345.0);
        assertThat(queryMetrics.getExportSize().max()).isEqualTo(25_000.0);
    }

    @Test
    @DisplayName("Should count timeouts separately from other errors")
    void shouldRecordFailures() {
        queryMetrics.recordFailure(SearchEngineException.Kind.TIMEOUT);
        queryMetrics.recordFailure(SearchEngineException.Kind.MALFORMED_QUERY);
        queryMetrics.recordFailure(SearchEngineException.Kind.INDEX_NOT_FOUND);

        assertThat(queryMetrics.getQueryErrors().count()).isEqualTo(3.0);
        assertThat(queryMetrics.getQueryTimeouts().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should calculate cache hit rate")
    void shouldCalculateCacheHitRate() {
        assertThat(queryMetrics.getCacheHitRate()).isEqualTo(0.0);

        queryMetrics.recordCacheHit();
        queryMetrics.recordCacheHit();
        queryMetrics.recordCacheHit();
        queryMetrics.recordCacheMiss();

        assertThat(queryMetrics.getCacheHitRate()).isCloseTo(75.0, within(0.01));
    }
}
