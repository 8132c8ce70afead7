package com.casetrace.query;

import com.casetrace.domain.DateRangeMode;
import com.casetrace.domain.FlagFilter;
import com.casetrace.domain.NormalizedFields;
import com.casetrace.domain.SearchQuerySpec;
import com.casetrace.domain.SourceFormat;
import com.casetrace.domain.VisibilityMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.opensearch.index.query.BoolQueryBuilder;
import org.opensearch.index.query.IdsQueryBuilder;
import org.opensearch.index.query.MatchAllQueryBuilder;
import org.opensearch.index.query.QueryBuilder;
import org.opensearch.index.query.QueryStringQueryBuilder;
import org.opensearch.index.query.RangeQueryBuilder;
import org.opensearch.index.query.TermQueryBuilder;
import org.opensearch.index.query.TermsQueryBuilder;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SearchQueryBuilder Tests")
class SearchQueryBuilderTest {

    private SearchQueryBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SearchQueryBuilder();
    }

    private static <T extends QueryBuilder> Optional<T> findFilter(BoolQueryBuilder query, Class<T> type) {
        return query.filter().stream().filter(type::isInstance).map(type::cast).findFirst();
    }

    private static Optional<RangeQueryBuilder> rangeOn(BoolQueryBuilder query, String field) {
        return query.filter().stream()
            .filter(RangeQueryBuilder.class::isInstance)
            .map(RangeQueryBuilder.class::cast)
            .filter(range -> range.fieldName().equals(field))
            .findFirst();
    }

    @Test
    @DisplayName("Should build identical queries for the same input")
    void shouldBePure() {
        SearchQuerySpec spec = new SearchQuerySpec()
            .setText("mimikatz")
            .setFlagFilter(FlagFilter.SIGMA_AND_IOC)
            .setSourceFormats(EnumSet.of(SourceFormat.EVTX, SourceFormat.CSV))
            .setDateRange(DateRangeMode.LAST_7_DAYS)
            .setReferenceTime(Instant.parse("2024-03-08T00:00:00Z"))
            .addFieldFilter("normalized_event_id", "4624");

        assertThat(builder.build(spec)).isEqualTo(builder.build(spec));
        assertThat(builder.build(spec).toString()).isEqualTo(builder.build(spec).toString());
    }

    @Test
    @DisplayName("Should only exclude hidden files by default")
    void shouldApplyDefaults() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec());

        assertThat(query.must()).isEmpty();
        assertThat(query.filter()).hasSize(1);
        BoolQueryBuilder visibility = (BoolQueryBuilder) query.filter().get(0);
        assertThat(visibility.should()).hasSize(2);
        assertThat(visibility.should()).contains(new TermQueryBuilder(SearchQueryBuilder.HIDDEN_FIELD, false));
    }

    @Test
    @DisplayName("Should put free text into must with AND semantics")
    void shouldAddTextQuery() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec().setText("powershell -enc"));

        assertThat(query.must()).hasSize(1);
        QueryStringQueryBuilder text = (QueryStringQueryBuilder) query.must().get(0);
        assertThat(text.queryString()).isEqualTo("powershell -enc");
        assertThat(text.defaultOperator().name()).isEqualTo("AND");
    }

    @Test
    @DisplayName("Should match nothing for tagged-only with no tagged ids")
    void shouldMatchNothingForEmptyTagList() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec()
            .setFlagFilter(FlagFilter.TAGGED)
            .setTaggedIds(List.of()));

        BoolQueryBuilder nothing = query.filter().stream()
            .filter(BoolQueryBuilder.class::isInstance)
            .map(BoolQueryBuilder.class::cast)
            .filter(bool -> !bool.mustNot().isEmpty())
            .findFirst()
            .orElseThrow();
        assertThat(nothing.mustNot()).singleElement().isInstanceOf(MatchAllQueryBuilder.class);
    }

    @Test
    @DisplayName("Should restrict tagged-only searches to the tagged ids")
    void shouldFilterTaggedIds() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec()
            .setFlagFilter(FlagFilter.TAGGED)
            .setTaggedIds(List.of("a", "b")));

        assertThat(findFilter(query, IdsQueryBuilder.class)).hasValueSatisfying(
            ids -> assertThat(ids.ids()).containsExactlyInAnyOrder("a", "b"));
    }

    @Test
    @DisplayName("Should filter indicator counts for the 2+ selector")
    void shouldFilterIocCount() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec().setFlagFilter(FlagFilter.IOC_2PLUS));

        assertThat(rangeOn(query, SearchQueryBuilder.IOC_COUNT_FIELD))
            .hasValueSatisfying(range -> assertThat(range.from()).isEqualTo(2));
    }

    @Test
    @DisplayName("Should filter detection flags")
    void shouldFilterSigma() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec().setFlagFilter(FlagFilter.SIGMA));

        assertThat(query.filter()).contains(new TermQueryBuilder(SearchQueryBuilder.SIGMA_FIELD, true));
    }

    @Test
    @DisplayName("Should match format labels and structural matches for legacy documents")
    void shouldFilterFormats() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec()
            .setSourceFormats(EnumSet.of(SourceFormat.EVTX, SourceFormat.CSV)));

        BoolQueryBuilder union = query.filter().stream()
            .filter(BoolQueryBuilder.class::isInstance)
            .map(BoolQueryBuilder.class::cast)
            .filter(bool -> bool.should().stream().anyMatch(TermsQueryBuilder.class::isInstance))
            .findFirst()
            .orElseThrow();

        TermsQueryBuilder labels = (TermsQueryBuilder) union.should().get(0);
        assertThat(labels.fieldName()).isEqualTo("source_file_type.keyword");
        assertThat(labels.values()).containsExactly("EVTX", "CSV");
        assertThat(union.should()).hasSize(3);
        assertThat(union.minimumShouldMatch()).isEqualTo("1");
    }

    @Test
    @DisplayName("Should not filter formats when every format is selected")
    void shouldSkipFormatFilterForAllFormats() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec()
            .setVisibility(VisibilityMode.INCLUDE_ALL));

        assertThat(query.filter()).isEmpty();
    }

    @Test
    @DisplayName("Should anchor relative windows at the reference time")
    void shouldAnchorRelativeWindow() {
        Instant latest = Instant.parse("2024-03-08T12:00:00Z");
        BoolQueryBuilder query = builder.build(new SearchQuerySpec()
            .setDateRange(DateRangeMode.LAST_24_HOURS)
            .setReferenceTime(latest));

        assertThat(rangeOn(query, NormalizedFields.TIMESTAMP_FIELD)).hasValueSatisfying(range -> {
            assertThat(range.from()).isEqualTo("2024-03-07T12:00:00Z");
            assertThat(range.to()).isEqualTo("2024-03-08T12:00:00Z");
            assertThat(range.includeLower()).isTrue();
            assertThat(range.includeUpper()).isTrue();
        });
    }

    @Test
    @DisplayName("Should skip a relative window without a reference time")
    void shouldSkipRelativeWindowWithoutReference() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec().setDateRange(DateRangeMode.LAST_30_DAYS));

        assertThat(rangeOn(query, NormalizedFields.TIMESTAMP_FIELD)).isEmpty();
    }

    @Test
    @DisplayName("Should apply open-ended custom ranges")
    void shouldApplyCustomRange() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec()
            .setDateRange(DateRangeMode.CUSTOM)
            .setCustomStart(Instant.parse("2024-01-01T00:00:00Z")));

        assertThat(rangeOn(query, NormalizedFields.TIMESTAMP_FIELD)).hasValueSatisfying(range -> {
            assertThat(range.from()).isEqualTo("2024-01-01T00:00:00Z");
            assertThat(range.to()).isNull();
        });
    }

    @Test
    @DisplayName("Should select only hidden files on request")
    void shouldSelectHiddenOnly() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec().setVisibility(VisibilityMode.HIDDEN_ONLY));

        assertThat(query.filter()).containsExactly(new TermQueryBuilder(SearchQueryBuilder.HIDDEN_FIELD, true));
    }

    @Test
    @DisplayName("Should add exact field filters")
    void shouldAddFieldFilters() {
        BoolQueryBuilder query = builder.build(new SearchQuerySpec()
            .setVisibility(VisibilityMode.INCLUDE_ALL)
            .addFieldFilter("normalized_computer", "DC01"));

        assertThat(query.filter()).containsExactly(new TermQueryBuilder("normalized_computer", "DC01"));
    }
}
