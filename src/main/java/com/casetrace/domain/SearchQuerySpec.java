package com.casetrace.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A search request as the query builder sees it. Built per request.
 */
public class SearchQuerySpec {

    private String text;
    private FlagFilter flagFilter = FlagFilter.ALL;
    private List<String> taggedIds = new ArrayList<>();
    private DateRangeMode dateRange = DateRangeMode.ALL;
    private Instant customStart;
    private Instant customEnd;
    private Instant referenceTime;
    private Set<SourceFormat> sourceFormats = EnumSet.allOf(SourceFormat.class);
    private VisibilityMode visibility = VisibilityMode.EXCLUDE_HIDDEN;
    private Map<String, Object> fieldFilters = new LinkedHashMap<>();

    public String getText() {
        return text;
    }

    public SearchQuerySpec setText(String text) {
        this.text = text;
        return this;
    }

    public FlagFilter getFlagFilter() {
        return flagFilter;
    }

    public SearchQuerySpec setFlagFilter(FlagFilter flagFilter) {
        this.flagFilter = flagFilter != null ? flagFilter : FlagFilter.ALL;
        return this;
    }

    public List<String> getTaggedIds() {
        return taggedIds;
    }

    public SearchQuerySpec setTaggedIds(List<String> taggedIds) {
        this.taggedIds = taggedIds != null ? new ArrayList<>(taggedIds) : new ArrayList<>();
        return this;
    }

    public DateRangeMode getDateRange() {
        return dateRange;
    }

    public SearchQuerySpec setDateRange(DateRangeMode dateRange) {
        this.dateRange = dateRange != null ? dateRange : DateRangeMode.ALL;
        return this;
    }

    public Instant getCustomStart() {
        return customStart;
    }

    public SearchQuerySpec setCustomStart(Instant customStart) {
        this.customStart = customStart;
        return this;
    }

    public Instant getCustomEnd() {
        return customEnd;
    }

    public SearchQuerySpec setCustomEnd(Instant customEnd) {
        this.customEnd = customEnd;
        return this;
    }

    /**
     * Newest event timestamp in the case, used as the end of relative windows
     */
    public Instant getReferenceTime() {
        return referenceTime;
    }

    public SearchQuerySpec setReferenceTime(Instant referenceTime) {
        this.referenceTime = referenceTime;
        return this;
    }

    public Set<SourceFormat> getSourceFormats() {
        return sourceFormats;
    }

    public SearchQuerySpec setSourceFormats(Set<SourceFormat> sourceFormats) {
        this.sourceFormats = sourceFormats == null || sourceFormats.isEmpty()
            ? EnumSet.allOf(SourceFormat.class)
            : EnumSet.copyOf(sourceFormats);
        return this;
    }

    public VisibilityMode getVisibility() {
        return visibility;
    }

    public SearchQuerySpec setVisibility(VisibilityMode visibility) {
        this.visibility = visibility != null ? visibility : VisibilityMode.EXCLUDE_HIDDEN;
        return this;
    }

    public Map<String, Object> getFieldFilters() {
        return fieldFilters;
    }

    public SearchQuerySpec setFieldFilters(Map<String, Object> fieldFilters) {
        this.fieldFilters = fieldFilters != null ? new LinkedHashMap<>(fieldFilters) : new LinkedHashMap<>();
        return this;
    }

    public SearchQuerySpec addFieldFilter(String field, Object value) {
        this.fieldFilters.put(field, value);
        return this;
    }

    @Override
    public String toString() {
        return "SearchQuerySpec{" +
            "text='" + text + '\'' +
            ", flagFilter=" + flagFilter +
            ", dateRange=" + dateRange +
            ", sourceFormats=" + sourceFormats +
            ", visibility=" + visibility +
            ", fieldFilters=" + fieldFilters.keySet() +
            '}';
    }
}
