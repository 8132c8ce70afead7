package com.casetrace.normalization.extractors;

import com.casetrace.domain.SourceRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tries a fixed list of top-level field names in order. Applies to every
 * record shape.
 */
public class FlatFieldExtractor implements FieldExtractor {

    private final String name;
    private final List<String> fieldNames;
    private final Function<Object, Optional<String>> reader;

    public FlatFieldExtractor(String name, List<String> fieldNames,
                              Function<Object, Optional<String>> reader) {
        this.name = name;
        this.fieldNames = List.copyOf(fieldNames);
        this.reader = reader;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<String> extract(SourceRecord record) {
        for (String field : fieldNames) {
            Optional<String> value = Optional.ofNullable(record.get(field)).flatMap(reader);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public List<String> getFieldNames() {
        return fieldNames;
    }
}
