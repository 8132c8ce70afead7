package com.casetrace.query;

import com.casetrace.domain.EventHit;
import com.casetrace.domain.ExportResult;
import com.casetrace.storage.hot.SearchEngineClient;
import com.casetrace.storage.hot.SearchEngineException;
import com.casetrace.storage.hot.SearchPage;
import io.micrometer.core.instrument.Timer;
import org.opensearch.index.query.QueryBuilder;
import org.opensearch.search.builder.SearchSourceBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls every matching document through a scroll cursor, bypassing the
 * engine's result window.
 *
 * The cursor is released on every exit path. A caller-supplied cap trims
 * the result to exactly that many documents and flags it as truncated.
 */
@Service
public class ScrollExporter {
    private static final Logger logger = LoggerFactory.getLogger(ScrollExporter.class);

    private final SearchEngineClient engine;
    private final SortFieldResolver sortResolver;
    private final QueryMetrics metrics;

    @Value("${casetrace.search.scroll-keep-alive:5m}")
    private String keepAlive = "5m";

    @Value("${casetrace.search.export-batch-size:1000}")
    private int defaultBatchSize = 1000;

    public ScrollExporter(SearchEngineClient engine, SortFieldResolver sortResolver, QueryMetrics metrics) {
        this.engine = engine;
        this.sortResolver = sortResolver;
        this.metrics = metrics;
    }

    /**
     * Export with the configured batch size.
     */
    public ExportResult scrollExport(String index, QueryBuilder query, String sortField, String sortOrder,
                                     Integer maxResults) {
        return scrollExport(index, query, defaultBatchSize, sortField, sortOrder, maxResults);
    }

    /**
     * @param maxResults optional cap; null exports everything
     */
    public ExportResult scrollExport(String index, QueryBuilder query, int batchSize,
                                     String sortField, String sortOrder, Integer maxResults) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (maxResults != null && maxResults < 0) {
            throw new IllegalArgumentException("maxResults must not be negative");
        }

        SearchSourceBuilder source = new SearchSourceBuilder()
            .query(query)
            .size(batchSize)
            .trackTotalHits(true)
            .sort(sortResolver.resolve(sortField, sortOrder));

        List<EventHit> results = new ArrayList<>();
        String scrollId = null;
        long totalCount = 0;
        int batches = 0;
        boolean truncated = false;
        Timer.Sample sample = metrics.startTimer();

        try {
            SearchPage page = engine.openScroll(index, source, keepAlive);
            scrollId = page.getScrollId();
            totalCount = page.getTotalHits();
            logger.info("Scroll export on {}: {} matching documents, batch size {}", index, totalCount, batchSize);

            while (!page.isEmpty()) {
                batches++;
                results.addAll(page.getHits());
                logger.info("Scroll batch {}: {} documents (running total {})",
                    batches, page.getHits().size(), results.size());

                if (maxResults != null && results.size() >= maxResults) {
                    truncated = results.size() > maxResults || totalCount > maxResults;
                    if (results.size() > maxResults) {
                        results = new ArrayList<>(results.subList(0, maxResults));
                    }
                    logger.info("Reached export cap of {} documents", maxResults);
                    break;
                }

                page = engine.continueScroll(scrollId, keepAlive);
                if (page.getScrollId() != null) {
                    scrollId = page.getScrollId();
                }
            }

            metrics.recordExport(sample, results.size(), truncated);
            logger.info("Scroll export on {} complete: {} documents in {} batches{}",
                index, results.size(), batches, truncated ? " (truncated)" : "");
            return new ExportResult(results, totalCount, batches, truncated);

        } catch (SearchEngineException e) {
            metrics.recordFailure(e.getKind());
            throw QueryExecutionException.from("Scroll export failed after " + results.size() + " documents",
                index, String.valueOf(query), e);
        } finally {
            releaseCursor(scrollId);
        }
    }

    private void releaseCursor(String scrollId) {
        if (scrollId == null) {
            return;
        }
        try {
            boolean released = engine.clearScroll(scrollId);
            logger.debug("Scroll cursor released: {}", released);
        } catch (SearchEngineException e) {
            logger.warn("Failed to release scroll cursor, it will expire after {}: {}", keepAlive, e.getMessage());
        }
    }

    void setKeepAlive(String keepAlive) {
        this.keepAlive = keepAlive;
    }
}
