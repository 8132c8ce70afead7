package com.casetrace.query;

import org.opensearch.search.sort.FieldSortBuilder;
import org.opensearch.search.sort.SortBuilders;
import org.opensearch.search.sort.SortOrder;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Maps a requested sort field onto something OpenSearch can sort on.
 *
 * Dynamically mapped text fields are only sortable through their
 * {@code .keyword} sub-field; the fields listed in {@link #SORTABLE_FIELDS}
 * are already stored in a sortable form and are used as-is. Shared by the
 * paged search and the scroll export so both order results the same way.
 */
@Component
public class SortFieldResolver {

    public static final String DEFAULT_SORT_FIELD = "System.TimeCreated.@attributes.SystemTime";

    static final Set<String> SORTABLE_FIELDS = Set.of(
        DEFAULT_SORT_FIELD,
        "System.EventID",
        "System.EventRecordID",
        "normalized_timestamp",
        "normalized_event_id",
        "normalized_computer",
        "ioc_count"
    );

    private static final String KEYWORD_SUFFIX = ".keyword";

    /**
     * @param field requested field, blank for the default creation-time sort
     * @param order {@code asc} or {@code desc}; anything else sorts descending
     */
    public FieldSortBuilder resolve(String field, String order) {
        if (field == null || field.isBlank()) {
            return SortBuilders.fieldSort(DEFAULT_SORT_FIELD)
                .order(SortOrder.DESC)
                .unmappedType("date");
        }

        SortOrder sortOrder = parseOrder(order);
        String trimmed = field.trim();
        if (trimmed.endsWith(KEYWORD_SUFFIX) || SORTABLE_FIELDS.contains(trimmed)) {
            return SortBuilders.fieldSort(trimmed)
                .order(sortOrder)
                .unmappedType("long");
        }
        return SortBuilders.fieldSort(trimmed + KEYWORD_SUFFIX)
            .order(sortOrder)
            .unmappedType("keyword");
    }

    static SortOrder parseOrder(String order) {
        if (order != null && "asc".equals(order.trim().toLowerCase(Locale.ROOT))) {
            return SortOrder.ASC;
        }
        return SortOrder.DESC;
    }
}
