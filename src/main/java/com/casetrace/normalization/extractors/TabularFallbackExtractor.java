package com.casetrace.normalization.extractors;

import com.casetrace.domain.SourceRecord;
import com.casetrace.domain.TabularRecord;

import java.util.List;
import java.util.Optional;

/**
 * Supplies a fixed label for CSV rows that carry any of a set of telltale
 * columns but no value for the field itself.
 */
public class TabularFallbackExtractor implements FieldExtractor {

    private final String name;
    private final String label;
    private final List<String> telltaleColumns;

    public TabularFallbackExtractor(String name, String label, List<String> telltaleColumns) {
        this.name = name;
        this.label = label;
        this.telltaleColumns = List.copyOf(telltaleColumns);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<String> extract(SourceRecord record) {
        if (!(record instanceof TabularRecord)) {
            return Optional.empty();
        }
        for (String column : telltaleColumns) {
            if (record.has(column)) {
                return Optional.of(label);
            }
        }
        return Optional.empty();
    }
}
