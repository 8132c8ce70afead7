package com.casetrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One page of search results with the exact total hit count.
 */
public class SearchResult {

    @JsonProperty("hits")
    private List<EventHit> hits;

    @JsonProperty("total_count")
    private long totalCount;

    @JsonProperty("page")
    private int page;

    @JsonProperty("page_size")
    private int pageSize;

    @JsonProperty("aggregations")
    private Map<String, Object> aggregations;

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    public SearchResult() {
        this.hits = new ArrayList<>();
        this.aggregations = new LinkedHashMap<>();
    }

    public SearchResult(List<EventHit> hits, long totalCount, Map<String, Object> aggregations) {
        this.hits = hits != null ? hits : new ArrayList<>();
        this.totalCount = totalCount;
        this.aggregations = aggregations != null ? aggregations : new LinkedHashMap<>();
    }

    public List<EventHit> getHits() {
        return hits;
    }

    public void setHits(List<EventHit> hits) {
        this.hits = hits;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(long totalCount) {
        this.totalCount = totalCount;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public Map<String, Object> getAggregations() {
        return aggregations;
    }

    public void setAggregations(Map<String, Object> aggregations) {
        this.aggregations = aggregations;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    /**
     * Whether another page exists after this one
     */
    public boolean hasMore() {
        return (long) page * pageSize < totalCount;
    }
}
