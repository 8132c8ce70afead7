package com.casetrace.query;

import com.casetrace.domain.EventHit;
import com.casetrace.domain.SearchResult;
import com.casetrace.storage.hot.SearchEngineClient;
import com.casetrace.storage.hot.SearchEngineException;
import com.casetrace.storage.hot.SearchPage;
import io.micrometer.core.instrument.Timer;
import org.opensearch.index.query.QueryBuilder;
import org.opensearch.search.aggregations.AggregationBuilder;
import org.opensearch.search.builder.SearchSourceBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;

/**
 * Runs paged searches for display.
 *
 * Total hits are tracked exactly so page counts are correct beyond the
 * engine's default ten thousand hit estimate. Pages reaching past the index
 * result window are rejected; full result sets go through {@link ScrollExporter}.
 */
@Service
public class SearchExecutor {
    private static final Logger logger = LoggerFactory.getLogger(SearchExecutor.class);

    private final SearchEngineClient engine;
    private final SortFieldResolver sortResolver;
    private final QueryMetrics metrics;

    @Value("${casetrace.search.max-result-window:10000}")
    private long maxResultWindow = 10_000;

    public SearchExecutor(SearchEngineClient engine, SortFieldResolver sortResolver, QueryMetrics metrics) {
        this.engine = engine;
        this.sortResolver = sortResolver;
        this.metrics = metrics;
    }

    public SearchResult search(String index, QueryBuilder query, int page, int pageSize,
                               String sortField, String sortOrder) {
        return search(index, query, page, pageSize, sortField, sortOrder, Collections.emptyList());
    }

    /**
     * @param page         1-based page number; values below 1 are treated as 1
     * @param aggregations aggregations to compute over the whole match set
     * @throws IllegalArgumentException when the page ends beyond the result window
     */
    public SearchResult search(String index, QueryBuilder query, int page, int pageSize,
                               String sortField, String sortOrder,
                               Collection<AggregationBuilder> aggregations) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1");
        }
        int effectivePage = Math.max(page, 1);
        long offset = (long) (effectivePage - 1) * pageSize;
        if (offset + pageSize > maxResultWindow) {
            throw new IllegalArgumentException(String.format(
                "Page %d of size %d ends beyond the result window of %d hits; use the scroll export for deep result sets",
                effectivePage, pageSize, maxResultWindow));
        }
        int from = (int) offset;

        SearchSourceBuilder source = new SearchSourceBuilder()
            .query(query)
            .from(from)
            .size(pageSize)
            .trackTotalHits(true)
            .sort(sortResolver.resolve(sortField, sortOrder));
        if (aggregations != null) {
            aggregations.forEach(source::aggregation);
        }

        Timer.Sample sample = metrics.startTimer();
        try {
            SearchPage response = engine.search(index, source);
            metrics.recordSearch(sample);

            SearchResult result = new SearchResult(response.getHits(), response.getTotalHits(),
                response.getAggregations());
            result.setPage(effectivePage);
            result.setPageSize(pageSize);
            result.setExecutionTimeMs(response.getTookMillis());

            long totalPages = (response.getTotalHits() + pageSize - 1) / pageSize;
            logger.info("Search on {} found {} results, page {}/{} (from={})",
                index, response.getTotalHits(), effectivePage, totalPages, from);
            return result;

        } catch (SearchEngineException e) {
            metrics.recordFailure(e.getKind());
            throw QueryExecutionException.from("Search failed", index, String.valueOf(query), e);
        }
    }

    void setMaxResultWindow(long maxResultWindow) {
        this.maxResultWindow = maxResultWindow;
    }

    /**
     * Fetch one event by document id.
     */
    public Optional<EventHit> getEvent(String index, String id) {
        try {
            return engine.getDocument(index, id);
        } catch (SearchEngineException e) {
            metrics.recordFailure(e.getKind());
            throw QueryExecutionException.from("Event lookup failed for " + id, index, null, e);
        }
    }
}
