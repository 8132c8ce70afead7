package com.casetrace.query;

import com.casetrace.domain.NormalizedFields;
import com.casetrace.storage.hot.IndexNames;
import com.casetrace.storage.hot.SearchEngineClient;
import com.casetrace.storage.hot.SearchEngineException;
import com.casetrace.storage.hot.SearchPage;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.opensearch.index.query.QueryBuilders;
import org.opensearch.search.aggregations.AggregationBuilders;
import org.opensearch.search.builder.SearchSourceBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Finds the newest normalized event timestamp in a case.
 *
 * Relative date windows ("last 24 hours") are anchored on this value rather
 * than the wall clock, since evidence is usually older than the analysis.
 */
@Component
public class LatestEventTimestampResolver {
    private static final Logger log = LoggerFactory.getLogger(LatestEventTimestampResolver.class);

    static final String AGGREGATION_NAME = "latest_event";
    private static final long CACHE_MAX_SIZE = 10_000;

    private final SearchEngineClient engine;
    private final QueryMetrics metrics;
    private final Cache<Long, Instant> cache;

    public LatestEventTimestampResolver(SearchEngineClient engine, QueryMetrics metrics,
                                        @Value("${casetrace.search.latest-event-cache-ttl-seconds:300}") long ttlSeconds) {
        this.engine = engine;
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
            .maximumSize(CACHE_MAX_SIZE)
            .expireAfterWrite(ttlSeconds, TimeUnit.SECONDS)
            .build();
    }

    /**
     * @return the latest event time, or empty when the case has no index or
     *         no event carries a normalized timestamp
     */
    public Optional<Instant> latestEventTime(long caseId) {
        Instant cached = cache.getIfPresent(caseId);
        if (cached != null) {
            metrics.recordCacheHit();
            return Optional.of(cached);
        }
        metrics.recordCacheMiss();

        String index = IndexNames.forCase(caseId);
        SearchSourceBuilder source = new SearchSourceBuilder()
            .query(QueryBuilders.matchAllQuery())
            .size(0)
            .aggregation(AggregationBuilders.max(AGGREGATION_NAME).field(NormalizedFields.TIMESTAMP_FIELD));

        SearchPage page;
        try {
            page = engine.search(index, source);
        } catch (SearchEngineException e) {
            if (e.getKind() == SearchEngineException.Kind.INDEX_NOT_FOUND) {
                return Optional.empty();
            }
            metrics.recordFailure(e.getKind());
            throw QueryExecutionException.from("Latest event lookup failed", index, null, e);
        }

        Optional<Instant> latest = toInstant(page.getAggregations().get(AGGREGATION_NAME));
        latest.ifPresent(value -> {
            cache.put(caseId, value);
            log.debug("Latest event in case {} is {}", caseId, value);
        });
        return latest;
    }

    /**
     * Drop the cached value after new events were indexed into a case
     */
    public void invalidate(long caseId) {
        cache.invalidate(caseId);
    }

    static Optional<Instant> toInstant(Object aggregationValue) {
        if (!(aggregationValue instanceof Number)) {
            return Optional.empty();
        }
        double millis = ((Number) aggregationValue).doubleValue();
        if (Double.isNaN(millis) || Double.isInfinite(millis)) {
            return Optional.empty();
        }
        return Optional.of(Instant.ofEpochMilli((long) millis));
    }
}
