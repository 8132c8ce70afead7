package com.casetrace.query;

import com.casetrace.domain.DateRangeMode;
import com.casetrace.domain.NormalizedFields;
import com.casetrace.domain.SearchQuerySpec;
import com.casetrace.domain.SourceFormat;
import org.opensearch.index.query.BoolQueryBuilder;
import org.opensearch.index.query.Operator;
import org.opensearch.index.query.QueryBuilder;
import org.opensearch.index.query.QueryBuilders;
import org.opensearch.index.query.RangeQueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Translates a {@link SearchQuerySpec} into an OpenSearch bool query.
 *
 * Free text goes into {@code must}; every other condition is a
 * {@code filter}. The builder does no I/O and equal input always yields an
 * equal query.
 */
@Component
public class SearchQueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SearchQueryBuilder.class);

    public static final String FORMAT_FIELD = "source_file_type";
    public static final String HIDDEN_FIELD = "is_hidden";
    public static final String SIGMA_FIELD = "has_sigma";
    public static final String IOC_FIELD = "has_ioc";
    public static final String IOC_COUNT_FIELD = "ioc_count";

    private static final List<String> EDR_MARKERS = List.of("process", "host", "ecs", "event.kind");

    public BoolQueryBuilder build(SearchQuerySpec spec) {
        BoolQueryBuilder query = QueryBuilders.boolQuery();

        addTextQuery(query, spec.getText());
        addFlagFilter(query, spec);
        addFormatFilter(query, spec.getSourceFormats());
        addDateFilter(query, spec);
        addFieldFilters(query, spec.getFieldFilters());
        addVisibilityFilter(query, spec);

        return query;
    }

    private void addTextQuery(BoolQueryBuilder query, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        query.must(QueryBuilders.queryStringQuery(text)
            .defaultOperator(Operator.AND)
            .analyzeWildcard(true));
    }

    private void addFlagFilter(BoolQueryBuilder query, SearchQuerySpec spec) {
        switch (spec.getFlagFilter()) {
            case SIGMA -> query.filter(QueryBuilders.termQuery(SIGMA_FIELD, true));
            case IOC -> query.filter(QueryBuilders.termQuery(IOC_FIELD, true));
            case IOC_2PLUS -> query.filter(QueryBuilders.rangeQuery(IOC_COUNT_FIELD).gte(2));
            case IOC_3PLUS -> query.filter(QueryBuilders.rangeQuery(IOC_COUNT_FIELD).gte(3));
            case SIGMA_AND_IOC -> query.filter(QueryBuilders.boolQuery()
                .must(QueryBuilders.termQuery(SIGMA_FIELD, true))
                .must(QueryBuilders.termQuery(IOC_FIELD, true)));
            case TAGGED -> query.filter(taggedFilter(spec.getTaggedIds()));
            default -> {
                // ALL: no flag restriction
            }
        }
    }

    /**
     * An empty tag list must match nothing, never everything.
     */
    private QueryBuilder taggedFilter(List<String> taggedIds) {
        if (taggedIds == null || taggedIds.isEmpty()) {
            return QueryBuilders.boolQuery().mustNot(QueryBuilders.matchAllQuery());
        }
        return QueryBuilders.idsQuery().addIds(taggedIds.toArray(new String[0]));
    }

    /**
     * Tagged documents match on their label; untagged legacy documents
     * match on a structural match for each selected format.
     */
    private void addFormatFilter(BoolQueryBuilder query, Set<SourceFormat> formats) {
        if (formats == null || formats.isEmpty() || formats.size() >= SourceFormat.values().length) {
            return;
        }

        List<String> labels = formats.stream()
            .sorted()
            .map(SourceFormat::getLabel)
            .collect(Collectors.toList());

        BoolQueryBuilder union = QueryBuilders.boolQuery().minimumShouldMatch(1);
        union.should(QueryBuilders.termsQuery(FORMAT_FIELD + ".keyword", labels));

        formats.stream().sorted().forEach(format -> union.should(QueryBuilders.boolQuery()
            .mustNot(QueryBuilders.existsQuery(FORMAT_FIELD))
            .filter(structuralMatch(format))));

        query.filter(union);
    }

    static QueryBuilder structuralMatch(SourceFormat format) {
        return switch (format) {
            case EVTX -> QueryBuilders.boolQuery()
                .minimumShouldMatch(1)
                .should(QueryBuilders.existsQuery("System"))
                .should(QueryBuilders.existsQuery("Event.System"));
            case EDR -> QueryBuilders.boolQuery()
                .must(QueryBuilders.existsQuery("@timestamp"))
                .must(anyExists(EDR_MARKERS));
            case CSV -> QueryBuilders.existsQuery("row_number");
            case JSON -> {
                BoolQueryBuilder noEdrMarkers = QueryBuilders.boolQuery();
                EDR_MARKERS.forEach(field -> noEdrMarkers.mustNot(QueryBuilders.existsQuery(field)));
                yield QueryBuilders.boolQuery()
                    .mustNot(QueryBuilders.existsQuery("System"))
                    .mustNot(QueryBuilders.existsQuery("Event.System"))
                    .mustNot(QueryBuilders.existsQuery("row_number"))
                    .must(QueryBuilders.boolQuery()
                        .minimumShouldMatch(1)
                        .should(QueryBuilders.boolQuery().mustNot(QueryBuilders.existsQuery("@timestamp")))
                        .should(noEdrMarkers));
            }
        };
    }

    private static QueryBuilder anyExists(List<String> fields) {
        BoolQueryBuilder any = QueryBuilders.boolQuery().minimumShouldMatch(1);
        fields.forEach(field -> any.should(QueryBuilders.existsQuery(field)));
        return any;
    }

    /**
     * Relative windows end at the case's newest event. Without that reference
     * no date filter is applied.
     */
    private void addDateFilter(BoolQueryBuilder query, SearchQuerySpec spec) {
        DateRangeMode mode = spec.getDateRange();
        if (mode == DateRangeMode.ALL) {
            return;
        }

        RangeQueryBuilder range = QueryBuilders.rangeQuery(NormalizedFields.TIMESTAMP_FIELD);
        if (mode.isRelative()) {
            Instant reference = spec.getReferenceTime();
            if (reference == null) {
                logger.debug("No reference time for {} window, date filter skipped", mode);
                return;
            }
            Instant start = reference.minus(mode.getWindow().orElseThrow());
            range.gte(start.toString()).lte(reference.toString());
        } else {
            if (spec.getCustomStart() == null && spec.getCustomEnd() == null) {
                return;
            }
            if (spec.getCustomStart() != null) {
                range.gte(spec.getCustomStart().toString());
            }
            if (spec.getCustomEnd() != null) {
                range.lte(spec.getCustomEnd().toString());
            }
        }
        query.filter(range);
    }

    private void addFieldFilters(BoolQueryBuilder query, Map<String, Object> fieldFilters) {
        if (fieldFilters == null) {
            return;
        }
        fieldFilters.forEach((field, value) -> query.filter(QueryBuilders.termQuery(field, value)));
    }

    private void addVisibilityFilter(BoolQueryBuilder query, SearchQuerySpec spec) {
        switch (spec.getVisibility()) {
            case EXCLUDE_HIDDEN -> query.filter(QueryBuilders.boolQuery()
                .minimumShouldMatch(1)
                .should(QueryBuilders.boolQuery().mustNot(QueryBuilders.existsQuery(HIDDEN_FIELD)))
                .should(QueryBuilders.termQuery(HIDDEN_FIELD, false)));
            case HIDDEN_ONLY -> query.filter(QueryBuilders.termQuery(HIDDEN_FIELD, true));
            default -> {
                // INCLUDE_ALL
            }
        }
    }
}
