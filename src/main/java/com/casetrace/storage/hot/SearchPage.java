package com.casetrace.storage.hot;

import com.casetrace.domain.EventHit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw page of hits returned by a search or scroll call.
 */
public class SearchPage {

    private final List<EventHit> hits;
    private final long totalHits;
    private final Map<String, Object> aggregations;
    private final String scrollId;
    private final long tookMillis;

    public SearchPage(List<EventHit> hits, long totalHits, Map<String, Object> aggregations,
                      String scrollId, long tookMillis) {
        this.hits = hits != null ? hits : new ArrayList<>();
        this.totalHits = totalHits;
        this.aggregations = aggregations != null ? aggregations : new LinkedHashMap<>();
        this.scrollId = scrollId;
        this.tookMillis = tookMillis;
    }

    public List<EventHit> getHits() {
        return hits;
    }

    public long getTotalHits() {
        return totalHits;
    }

    public Map<String, Object> getAggregations() {
        return aggregations;
    }

    /**
     * Cursor id, only set for scroll pages
     */
    public String getScrollId() {
        return scrollId;
    }

    public long getTookMillis() {
        return tookMillis;
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
