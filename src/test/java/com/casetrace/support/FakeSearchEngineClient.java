package com.casetrace.support;

import com.casetrace.domain.EventHit;
import com.casetrace.storage.hot.BulkIndexResult;
import com.casetrace.storage.hot.SearchEngineClient;
import com.casetrace.storage.hot.SearchEngineException;
import com.casetrace.storage.hot.SearchPage;
import org.opensearch.index.query.QueryBuilder;
import org.opensearch.index.query.TermQueryBuilder;
import org.opensearch.search.builder.SearchSourceBuilder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory document store. Queries are not evaluated: search and scroll
 * return every document of the index in insertion order, except that
 * {@link #updateByQuery} understands term queries.
 */
public class FakeSearchEngineClient implements SearchEngineClient {

    private final Map<String, LinkedHashMap<String, Map<String, Object>>> indices = new HashMap<>();
    private final Map<String, Map<String, String>> settings = new HashMap<>();
    private final Map<String, SearchEngineException> failures = new HashMap<>();
    private final Map<String, ScrollCursor> cursors = new HashMap<>();
    private final Set<String> clearedScrolls = new LinkedHashSet<>();
    private final List<String> deletedIndices = new ArrayList<>();
    private final AtomicInteger scrollIds = new AtomicInteger();
    private Map<String, Object> aggregations = new LinkedHashMap<>();
    private int continueScrollCalls;
    private int failContinueScrollAfter = -1;
    private boolean rejectBulk;
    private int searchCalls;

    public FakeSearchEngineClient createIndex(String index) {
        indices.computeIfAbsent(index, k -> new LinkedHashMap<>());
        return this;
    }

    public FakeSearchEngineClient withDocuments(String index, int count) {
        LinkedHashMap<String, Map<String, Object>> docs = indices.computeIfAbsent(index, k -> new LinkedHashMap<>());
        int start = docs.size();
        for (int i = start; i < start + count; i++) {
            Map<String, Object> source = new LinkedHashMap<>();
            source.put("seq", i);
            docs.put("doc-" + i, source);
        }
        return this;
    }

    public FakeSearchEngineClient withSetting(String index, String key, String value) {
        createIndex(index);
        settings.computeIfAbsent(index, k -> new HashMap<>()).put(key, value);
        return this;
    }

    public void setAggregations(Map<String, Object> aggregations) {
        this.aggregations = aggregations;
    }

    /**
     * Make every call of the named operation ({@code "search"},
     * {@code "openScroll"}, {@code "indexExists"} ...) throw.
     */
    public void failOn(String operation, SearchEngineException failure) {
        failures.put(operation, failure);
    }

    public void clearFailures() {
        failures.clear();
        failContinueScrollAfter = -1;
    }

    /**
     * Let the first {@code calls} scroll continuations succeed, then fail.
     */
    public void failContinueScrollAfter(int calls, SearchEngineException failure) {
        failContinueScrollAfter = calls;
        failures.put("continueScroll.deferred", failure);
    }

    public void setRejectBulk(boolean rejectBulk) {
        this.rejectBulk = rejectBulk;
    }

    public Map<String, Map<String, Object>> documents(String index) {
        return indices.getOrDefault(index, new LinkedHashMap<>());
    }

    public Set<String> getClearedScrolls() {
        return clearedScrolls;
    }

    public Set<String> getOpenScrolls() {
        return cursors.keySet();
    }

    public List<String> getDeletedIndices() {
        return deletedIndices;
    }

    public int getSearchCalls() {
        return searchCalls;
    }

    private void maybeFail(String operation) {
        SearchEngineException failure = failures.get(operation);
        if (failure != null) {
            throw failure;
        }
    }

    private LinkedHashMap<String, Map<String, Object>> requireIndex(String index) {
        LinkedHashMap<String, Map<String, Object>> docs = indices.get(index);
        if (docs == null) {
            throw new SearchEngineException(SearchEngineException.Kind.INDEX_NOT_FOUND, index, "no such index", null);
        }
        return docs;
    }

    private List<EventHit> slice(String index, int from, int size) {
        List<EventHit> hits = new ArrayList<>();
        int position = 0;
        for (Map.Entry<String, Map<String, Object>> entry : requireIndex(index).entrySet()) {
            if (position >= from && hits.size() < size) {
                hits.add(new EventHit(entry.getKey(), index, entry.getValue(), List.of()));
            }
            position++;
        }
        return hits;
    }

    @Override
    public boolean indexExists(String index) {
        maybeFail("indexExists");
        return indices.containsKey(index);
    }

    @Override
    public Optional<String> getSetting(String index, String key) {
        maybeFail("getSetting");
        requireIndex(index);
        return Optional.ofNullable(settings.getOrDefault(index, Map.of()).get(key));
    }

    @Override
    public void putSetting(String index, String key, String value) {
        maybeFail("putSetting");
        requireIndex(index);
        settings.computeIfAbsent(index, k -> new HashMap<>()).put(key, value);
    }

    @Override
    public SearchPage search(String index, SearchSourceBuilder source) {
        searchCalls++;
        maybeFail("search");
        int from = Math.max(source.from(), 0);
        int size = source.size() >= 0 ? source.size() : 10;
        List<EventHit> hits = slice(index, from, size);
        return new SearchPage(hits, requireIndex(index).size(), aggregations, null, 1);
    }

    @Override
    public SearchPage openScroll(String index, SearchSourceBuilder source, String keepAlive) {
        maybeFail("openScroll");
        int size = source.size() >= 0 ? source.size() : 10;
        String scrollId = "scroll-" + scrollIds.incrementAndGet();
        List<EventHit> hits = slice(index, 0, size);
        cursors.put(scrollId, new ScrollCursor(index, size, hits.size()));
        return new SearchPage(hits, requireIndex(index).size(), null, scrollId, 1);
    }

    @Override
    public SearchPage continueScroll(String scrollId, String keepAlive) {
        maybeFail("continueScroll");
        if (failContinueScrollAfter >= 0 && continueScrollCalls >= failContinueScrollAfter) {
            throw failures.get("continueScroll.deferred");
        }
        continueScrollCalls++;
        ScrollCursor cursor = cursors.get(scrollId);
        if (cursor == null) {
            throw new SearchEngineException(SearchEngineException.Kind.MALFORMED_QUERY, null,
                "unknown scroll id " + scrollId, null);
        }
        List<EventHit> hits = slice(cursor.index, cursor.offset, cursor.size);
        cursor.offset += hits.size();
        return new SearchPage(hits, requireIndex(cursor.index).size(), null, scrollId, 1);
    }

    @Override
    public boolean clearScroll(String scrollId) {
        maybeFail("clearScroll");
        clearedScrolls.add(scrollId);
        return cursors.remove(scrollId) != null;
    }

    @Override
    public BulkIndexResult bulkIndex(String index, Map<String, Map<String, Object>> documentsById) {
        maybeFail("bulkIndex");
        if (rejectBulk) {
            return new BulkIndexResult(0, documentsById.size(), "mapper_parsing_exception");
        }
        LinkedHashMap<String, Map<String, Object>> docs = indices.computeIfAbsent(index, k -> new LinkedHashMap<>());
        documentsById.forEach((id, source) -> docs.put(id, new LinkedHashMap<>(source)));
        return new BulkIndexResult(documentsById.size(), 0, null);
    }

    @Override
    public Optional<EventHit> getDocument(String index, String id) {
        maybeFail("getDocument");
        Map<String, Object> source = requireIndex(index).get(id);
        return source == null ? Optional.empty() : Optional.of(new EventHit(id, index, source, List.of()));
    }

    @Override
    public boolean deleteIndex(String index) {
        maybeFail("deleteIndex");
        deletedIndices.add(index);
        settings.remove(index);
        return indices.remove(index) != null;
    }

    @Override
    public long updateByQuery(String index, QueryBuilder query, Map<String, Object> fieldValues) {
        maybeFail("updateByQuery");
        if (!(query instanceof TermQueryBuilder)) {
            throw new UnsupportedOperationException("only term queries are supported: " + query);
        }
        TermQueryBuilder term = (TermQueryBuilder) query;
        long updated = 0;
        for (Map<String, Object> source : requireIndex(index).values()) {
            if (Objects.equals(String.valueOf(source.get(term.fieldName())), String.valueOf(term.value()))) {
                source.putAll(fieldValues);
                updated++;
            }
        }
        return updated;
    }

    private static class ScrollCursor {
        final String index;
        final int size;
        int offset;

        ScrollCursor(String index, int size, int offset) {
            this.index = index;
            this.size = size;
            this.offset = offset;
        }
    }
}
