package com.casetrace.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One document returned from a case index.
 */
public class EventHit {

    @JsonProperty("_id")
    private final String id;

    @JsonProperty("_index")
    private final String index;

    @JsonProperty("_source")
    private final Map<String, Object> source;

    @JsonProperty("sort")
    private final List<Object> sortValues;

    public EventHit(String id, String index, Map<String, Object> source, List<Object> sortValues) {
        this.id = id;
        this.index = index;
        this.source = source != null ? source : Collections.emptyMap();
        this.sortValues = sortValues != null ? sortValues : Collections.emptyList();
    }

    public String getId() {
        return id;
    }

    public String getIndex() {
        return index;
    }

    public Map<String, Object> getSource() {
        return source;
    }

    public List<Object> getSortValues() {
        return sortValues;
    }

    @Override
    public String toString() {
        return "EventHit{id='" + id + "', index='" + index + "'}";
    }
}
