package com.casetrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Full result set pulled through a scroll cursor.
 *
 * {@code truncated} is set when a caller-supplied cap cut the export short,
 * so a capped export is never mistaken for a complete one.
 */
public class ExportResult {

    @JsonProperty("hits")
    private final List<EventHit> hits;

    @JsonProperty("total_count")
    private final long totalCount;

    @JsonProperty("batches")
    private final int batches;

    @JsonProperty("truncated")
    private final boolean truncated;

    public ExportResult(List<EventHit> hits, long totalCount, int batches, boolean truncated) {
        this.hits = hits;
        this.totalCount = totalCount;
        this.batches = batches;
        this.truncated = truncated;
    }

    public List<EventHit> getHits() {
        return hits;
    }

    /**
     * Total matching documents as reported by the engine
     */
    public long getTotalCount() {
        return totalCount;
    }

    public int getBatches() {
        return batches;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public int size() {
        return hits.size();
    }
}
