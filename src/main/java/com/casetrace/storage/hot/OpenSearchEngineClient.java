package com.casetrace.storage.hot;

import com.casetrace.domain.EventHit;
import org.opensearch.OpenSearchException;
import org.opensearch.action.admin.indices.delete.DeleteIndexRequest;
import org.opensearch.action.bulk.BulkItemResponse;
import org.opensearch.action.bulk.BulkRequest;
import org.opensearch.action.bulk.BulkResponse;
import org.opensearch.action.get.GetRequest;
import org.opensearch.action.get.GetResponse;
import org.opensearch.action.index.IndexRequest;
import org.opensearch.action.search.ClearScrollRequest;
import org.opensearch.action.search.SearchRequest;
import org.opensearch.action.search.SearchResponse;
import org.opensearch.action.search.SearchScrollRequest;
import org.opensearch.client.RequestOptions;
import org.opensearch.client.RestHighLevelClient;
import org.opensearch.client.indices.GetIndexRequest;
import org.opensearch.client.indices.GetMappingsRequest;
import org.opensearch.client.indices.GetMappingsResponse;
import org.opensearch.client.indices.PutMappingRequest;
import org.opensearch.cluster.metadata.MappingMetadata;
import org.opensearch.index.query.QueryBuilder;
import org.opensearch.index.reindex.UpdateByQueryRequest;
import org.opensearch.script.Script;
import org.opensearch.script.ScriptType;
import org.opensearch.search.SearchHit;
import org.opensearch.search.SearchHits;
import org.opensearch.search.aggregations.Aggregation;
import org.opensearch.search.aggregations.Aggregations;
import org.opensearch.search.aggregations.bucket.histogram.Histogram;
import org.opensearch.search.aggregations.bucket.terms.Terms;
import org.opensearch.search.aggregations.metrics.NumericMetricsAggregation;
import org.opensearch.search.builder.SearchSourceBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SearchEngineClient} backed by the OpenSearch high level REST client.
 *
 * Index markers live in the mapping's {@code _meta} object, which accepts
 * arbitrary keys; custom keys under {@code index.*} settings are rejected by
 * the cluster.
 */
@Repository
public class OpenSearchEngineClient implements SearchEngineClient {
    private static final Logger logger = LoggerFactory.getLogger(OpenSearchEngineClient.class);

    private static final String SET_FIELDS_SCRIPT =
        "for (entry in params.entrySet()) { ctx._source[entry.getKey()] = entry.getValue(); }";

    private final RestHighLevelClient client;
    private final IndexingMetrics metrics;

    public OpenSearchEngineClient(RestHighLevelClient client, IndexingMetrics metrics) {
        this.client = client;
        this.metrics = metrics;
    }

    @Override
    public boolean indexExists(String index) {
        try {
            return client.indices().exists(new GetIndexRequest(index), RequestOptions.DEFAULT);
        } catch (Exception e) {
            throw translate("index exists check", index, e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<String> getSetting(String index, String key) {
        try {
            GetMappingsResponse response = client.indices()
                .getMapping(new GetMappingsRequest().indices(index), RequestOptions.DEFAULT);
            Map<String, MappingMetadata> mappings = response.mappings();
            MappingMetadata mapping = mappings.containsKey(index)
                ? mappings.get(index)
                : mappings.values().stream().findFirst().orElse(null);
            if (mapping == null) {
                return Optional.empty();
            }
            Object meta = mapping.sourceAsMap().get("_meta");
            if (!(meta instanceof Map)) {
                return Optional.empty();
            }
            Object value = ((Map<String, Object>) meta).get(key);
            return Optional.ofNullable(value).map(Object::toString);
        } catch (Exception e) {
            throw translate("read marker " + key, index, e);
        }
    }

    @Override
    public void putSetting(String index, String key, String value) {
        try {
            PutMappingRequest request = new PutMappingRequest(index)
                .source(Map.of("_meta", Map.of(key, value)));
            boolean acknowledged = client.indices().putMapping(request, RequestOptions.DEFAULT).isAcknowledged();
            logger.debug("Set {}={} on {} (acknowledged={})", key, value, index, acknowledged);
        } catch (Exception e) {
            throw translate("write marker " + key, index, e);
        }
    }

    @Override
    public SearchPage search(String index, SearchSourceBuilder source) {
        try {
            SearchResponse response = client.search(new SearchRequest(index).source(source), RequestOptions.DEFAULT);
            return toPage(response);
        } catch (Exception e) {
            throw translate("search", index, e);
        }
    }

    @Override
    public SearchPage openScroll(String index, SearchSourceBuilder source, String keepAlive) {
        try {
            SearchRequest request = new SearchRequest(index).source(source).scroll(keepAlive);
            return toPage(client.search(request, RequestOptions.DEFAULT));
        } catch (Exception e) {
            throw translate("open scroll", index, e);
        }
    }

    @Override
    public SearchPage continueScroll(String scrollId, String keepAlive) {
        try {
            SearchScrollRequest request = new SearchScrollRequest(scrollId).scroll(keepAlive);
            return toPage(client.scroll(request, RequestOptions.DEFAULT));
        } catch (Exception e) {
            throw translate("continue scroll", null, e);
        }
    }

    @Override
    public boolean clearScroll(String scrollId) {
        if (scrollId == null) {
            return true;
        }
        try {
            ClearScrollRequest request = new ClearScrollRequest();
            request.addScrollId(scrollId);
            return client.clearScroll(request, RequestOptions.DEFAULT).isSucceeded();
        } catch (Exception e) {
            throw translate("clear scroll", null, e);
        }
    }

    @Override
    public BulkIndexResult bulkIndex(String index, Map<String, Map<String, Object>> documentsById) {
        if (documentsById.isEmpty()) {
            return BulkIndexResult.empty();
        }
        BulkRequest bulk = new BulkRequest();
        documentsById.forEach((id, source) -> bulk.add(new IndexRequest(index).id(id).source(source)));

        try {
            BulkResponse response = client.bulk(bulk, RequestOptions.DEFAULT);
            if (response.getTook() != null) {
                metrics.recordBulkLatency(response.getTook().millis());
            }

            int succeeded = 0;
            int failed = 0;
            for (BulkItemResponse item : response.getItems()) {
                if (item.isFailed()) {
                    failed++;
                } else {
                    succeeded++;
                }
            }
            metrics.recordDocumentsIndexed(succeeded);

            if (response.hasFailures()) {
                metrics.recordBulkFailures(failed);
                logger.error("Bulk request to {} had {} failures: {}", index, failed, response.buildFailureMessage());
                return new BulkIndexResult(succeeded, failed, response.buildFailureMessage());
            }
            logger.debug("Bulk indexed {} documents into {}", succeeded, index);
            return new BulkIndexResult(succeeded, 0, null);
        } catch (Exception e) {
            metrics.recordBulkFailures(documentsById.size());
            throw translate("bulk index", index, e);
        }
    }

    @Override
    public Optional<EventHit> getDocument(String index, String id) {
        try {
            GetResponse response = client.get(new GetRequest(index, id), RequestOptions.DEFAULT);
            if (!response.isExists()) {
                return Optional.empty();
            }
            return Optional.of(new EventHit(response.getId(), response.getIndex(),
                response.getSourceAsMap(), Collections.emptyList()));
        } catch (Exception e) {
            SearchEngineException translated = translate("get document", index, e);
            if (translated.getKind() == SearchEngineException.Kind.INDEX_NOT_FOUND) {
                return Optional.empty();
            }
            throw translated;
        }
    }

    @Override
    public boolean deleteIndex(String index) {
        try {
            boolean acknowledged = client.indices()
                .delete(new DeleteIndexRequest(index), RequestOptions.DEFAULT)
                .isAcknowledged();
            logger.info("Deleted index {} (acknowledged={})", index, acknowledged);
            return true;
        } catch (Exception e) {
            SearchEngineException translated = translate("delete index", index, e);
            if (translated.getKind() == SearchEngineException.Kind.INDEX_NOT_FOUND) {
                return false;
            }
            throw translated;
        }
    }

    @Override
    public long updateByQuery(String index, QueryBuilder query, Map<String, Object> fieldValues) {
        UpdateByQueryRequest request = new UpdateByQueryRequest(index);
        request.setQuery(query);
        request.setScript(new Script(ScriptType.INLINE, "painless", SET_FIELDS_SCRIPT, fieldValues));
        request.setConflicts("proceed");
        request.setRefresh(true);
        try {
            long updated = client.updateByQuery(request, RequestOptions.DEFAULT).getUpdated();
            logger.info("Updated {} documents in {} with {}", updated, index, fieldValues.keySet());
            return updated;
        } catch (Exception e) {
            throw translate("update by query", index, e);
        }
    }

    private SearchPage toPage(SearchResponse response) {
        SearchHits searchHits = response.getHits();
        List<EventHit> hits = new ArrayList<>();
        long total = 0;
        if (searchHits != null) {
            for (SearchHit hit : searchHits.getHits()) {
                Object[] sortValues = hit.getSortValues();
                hits.add(new EventHit(hit.getId(), hit.getIndex(), hit.getSourceAsMap(),
                    sortValues != null ? Arrays.asList(sortValues) : Collections.emptyList()));
            }
            total = searchHits.getTotalHits() != null ? searchHits.getTotalHits().value : hits.size();
        }
        long took = response.getTook() != null ? response.getTook().millis() : 0L;
        return new SearchPage(hits, total, convertAggregations(response.getAggregations()),
            response.getScrollId(), took);
    }

    private Map<String, Object> convertAggregations(Aggregations aggregations) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (aggregations == null) {
            return result;
        }
        for (Aggregation aggregation : aggregations) {
            result.put(aggregation.getName(), convertAggregation(aggregation));
        }
        return result;
    }

    /**
     * Metric aggregations become their value, bucket aggregations a list of
     * {@code key}/{@code doc_count} maps with nested sub-aggregations.
     */
    private Object convertAggregation(Aggregation aggregation) {
        if (aggregation instanceof NumericMetricsAggregation.SingleValue) {
            return ((NumericMetricsAggregation.SingleValue) aggregation).value();
        }
        List<Map<String, Object>> buckets = new ArrayList<>();
        if (aggregation instanceof Terms) {
            for (Terms.Bucket bucket : ((Terms) aggregation).getBuckets()) {
                buckets.add(convertBucket(bucket.getKey(), bucket.getDocCount(), bucket.getAggregations()));
            }
        } else if (aggregation instanceof Histogram) {
            for (Histogram.Bucket bucket : ((Histogram) aggregation).getBuckets()) {
                buckets.add(convertBucket(bucket.getKey(), bucket.getDocCount(), bucket.getAggregations()));
            }
        } else {
            return Map.of("name", aggregation.getName());
        }
        Map<String, Object> aggMap = new LinkedHashMap<>();
        aggMap.put("buckets", buckets);
        return aggMap;
    }

    private Map<String, Object> convertBucket(Object key, long docCount, Aggregations subAggregations) {
        Map<String, Object> bucketMap = new LinkedHashMap<>();
        bucketMap.put("key", key);
        bucketMap.put("doc_count", docCount);
        Map<String, Object> nested = convertAggregations(subAggregations);
        if (!nested.isEmpty()) {
            bucketMap.put("aggregations", nested);
        }
        return bucketMap;
    }

    SearchEngineException translate(String operation, String index, Exception e) {
        SearchEngineException.Kind kind = classify(e);
        if (kind == SearchEngineException.Kind.INDEX_NOT_FOUND) {
            logger.debug("OpenSearch {} on {}: index not found", operation, index);
        } else {
            logger.error("OpenSearch {} failed on {} ({})", operation, index, kind, e);
        }
        return new SearchEngineException(kind, index, operation + " failed: " + e.getMessage(), e);
    }

    static SearchEngineException.Kind classify(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SocketTimeoutException) {
                return SearchEngineException.Kind.TIMEOUT;
            }
            if (current instanceof ConnectException) {
                return SearchEngineException.Kind.UNAVAILABLE;
            }
            if (current instanceof OpenSearchException) {
                return classifyStatus(((OpenSearchException) current).status().getStatus(), current.getMessage());
            }
            current = current.getCause();
        }
        if (error instanceof IOException) {
            return SearchEngineException.Kind.UNAVAILABLE;
        }
        return SearchEngineException.Kind.UNKNOWN;
    }

    private static SearchEngineException.Kind classifyStatus(int status, String message) {
        if (status == 404 || (message != null && message.contains("index_not_found_exception"))) {
            return SearchEngineException.Kind.INDEX_NOT_FOUND;
        }
        return switch (status) {
            case 400 -> SearchEngineException.Kind.MALFORMED_QUERY;
            case 408, 504 -> SearchEngineException.Kind.TIMEOUT;
            case 429, 502, 503 -> SearchEngineException.Kind.UNAVAILABLE;
            default -> SearchEngineException.Kind.UNKNOWN;
        };
    }
}
