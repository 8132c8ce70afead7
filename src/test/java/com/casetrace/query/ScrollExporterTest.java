package com.casetrace.query;

import com.casetrace.domain.ExportResult;
import com.casetrace.storage.hot.SearchEngineException;
import com.casetrace.support.FakeSearchEngineClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.opensearch.index.query.QueryBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScrollExporter Tests")
class ScrollExporterTest {

    private static final String INDEX = "case_11";

    private FakeSearchEngineClient engine;
    private QueryMetrics metrics;
    private ScrollExporter exporter;

    @BeforeEach
    void setUp() {
        engine = new FakeSearchEngineClient();
        metrics = new QueryMetrics();
        metrics.meterRegistry = new SimpleMeterRegistry();
        metrics.init();
        exporter = new ScrollExporter(engine, new SortFieldResolver(), metrics);
    }

    @Test
    @DisplayName("Should export past the result window in full batches")
    void shouldExportEverything() {
        engine.withDocuments(INDEX, 25_000);

        ExportResult result = exporter.scrollExport(INDEX, QueryBuilders.matchAllQuery(), 1000, null, null, null);

        assertThat(result.size()).isEqualTo(25_000);
        assertThat(result.getBatches()).isEqualTo(25);
        assertThat(result.getTotalCount()).isEqualTo(result.size());
        assertThat(result.isTruncated()).isFalse();
        assertThat(result.getHits().get(24_999).getId()).isEqualTo("doc-24999");
        assertThat(metrics.getExportsExecuted().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should trim to exactly the cap and flag truncation")
    void shouldTrimToCap() {
        engine.withDocuments(INDEX, 25_000);

        ExportResult result = exporter.scrollExport(INDEX, QueryBuilders.matchAllQuery(), 1000, null, null, 12_345);

        assertThat(result.size()).isEqualTo(12_345);
        assertThat(result.isTruncated()).isTrue();
        assertThat(result.getTotalCount()).isEqualTo(25_000);
        assertThat(result.getHits().get(12_344).getId()).isEqualTo("doc-12344");
        assertThat(metrics.getExportsTruncated().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not flag truncation when the cap equals the match count")
    void shouldNotFlagExactCap() {
        engine.withDocuments(INDEX, 2_000);

        ExportResult result = exporter.scrollExport(INDEX, QueryBuilders.matchAllQuery(), 500, null, null, 2_000);

        assertThat(result.size()).isEqualTo(2_000);
        assertThat(result.isTruncated()).isFalse();
    }

    @Test
    @DisplayName("Should release the cursor after a successful export")
    void shouldReleaseCursorOnSuccess() {
        engine.withDocuments(INDEX, 3_500);

        exporter.scrollExport(INDEX, QueryBuilders.matchAllQuery(), 1000, null, null, null);

        assertThat(engine.getClearedScrolls()).hasSize(1);
        assertThat(engine.getOpenScrolls()).isEmpty();
    }

    @Test
    @DisplayName("Should release the cursor when a batch fails mid-export")
    void shouldReleaseCursorOnFailure() {
        engine.withDocuments(INDEX, 10_000);
        engine.failContinueScrollAfter(3,
            new SearchEngineException(SearchEngineException.Kind.TIMEOUT, null, "scroll timed out", null));

        assertThatThrownBy(() -> exporter.scrollExport(INDEX, QueryBuilders.matchAllQuery(), 1000, null, null, null))
            .isInstanceOf(QueryExecutionException.class)
            .hasMessageContaining("after 4000 documents")
            .satisfies(e -> assertThat(((QueryExecutionException) e).isTransient()).isTrue());

        assertThat(engine.getClearedScrolls()).containsExactly("scroll-1");
        assertThat(engine.getOpenScrolls()).isEmpty();
        assertThat(metrics.getQueryTimeouts().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should release the cursor when the cap stops the export early")
    void shouldReleaseCursorOnCap() {
        engine.withDocuments(INDEX, 5_000);

        exporter.scrollExport(INDEX, QueryBuilders.matchAllQuery(), 1000, null, null, 1_500);

        assertThat(engine.getOpenScrolls()).isEmpty();
    }

    @Test
    @DisplayName("Should surface a missing index as a non-transient error")
    void shouldSurfaceMissingIndex() {
        assertThatThrownBy(() -> exporter.scrollExport("case_404", QueryBuilders.matchAllQuery(), null, null, null))
            .isInstanceOf(QueryExecutionException.class)
            .satisfies(e -> {
                QueryExecutionException error = (QueryExecutionException) e;
                assertThat(error.getKind()).isEqualTo(SearchEngineException.Kind.INDEX_NOT_FOUND);
                assertThat(error.isTransient()).isFalse();
            });
        assertThat(engine.getClearedScrolls()).isEmpty();
    }

    @Test
    @DisplayName("Should return an empty export for an empty index")
    void shouldHandleEmptyIndex() {
        engine.createIndex(INDEX);

        ExportResult result = exporter.scrollExport(INDEX, QueryBuilders.matchAllQuery(), null, null, null);

        assertThat(result.size()).isZero();
        assertThat(result.getBatches()).isZero();
        assertThat(engine.getOpenScrolls()).isEmpty();
    }

    @Test
    @DisplayName("Should reject invalid batch sizes and caps")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> exporter.scrollExport(INDEX, QueryBuilders.matchAllQuery(), 0, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> exporter.scrollExport(INDEX, QueryBuilders.matchAllQuery(), 10, null, null, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
