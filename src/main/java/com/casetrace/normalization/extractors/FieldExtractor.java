package com.casetrace.normalization.extractors;

import com.casetrace.domain.SourceRecord;

import java.util.List;
import java.util.Optional;

/**
 * One strategy for pulling a single field out of a record.
 *
 * Extractors never throw for unexpected shapes; a value that is missing or
 * has the wrong type yields an empty result.
 */
public interface FieldExtractor {

    /**
     * Short name used in debug logging
     */
    String name();

    Optional<String> extract(SourceRecord record);

    /**
     * Run a chain in order and return the first non-empty value.
     */
    static Optional<String> firstPresent(List<FieldExtractor> chain, SourceRecord record) {
        for (FieldExtractor extractor : chain) {
            Optional<String> value = extractor.extract(record).filter(v -> !v.isBlank());
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
