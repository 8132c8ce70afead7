package com.casetrace.normalization.extractors;

import com.casetrace.domain.EventLogRecord;
import com.casetrace.domain.SourceRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads a path inside the {@code System} block of an event log record,
 * either at the top level or under the {@code Event} import wrapper.
 * Records of other shapes yield nothing.
 */
public class StructuredFieldExtractor implements FieldExtractor {

    private final String name;
    private final boolean wrapped;
    private final List<String[]> paths;
    private final Function<Object, Optional<String>> reader;

    /**
     * @param name    label for logging
     * @param wrapped read under {@code Event.System} instead of {@code System}
     * @param reader  converts the raw value found at a path
     * @param paths   alternative paths below the System block, tried in order
     */
    public StructuredFieldExtractor(String name, boolean wrapped,
                                    Function<Object, Optional<String>> reader,
                                    String[]... paths) {
        this.name = name;
        this.wrapped = wrapped;
        this.reader = reader;
        this.paths = List.of(paths);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<String> extract(SourceRecord record) {
        if (!(record instanceof EventLogRecord)) {
            return Optional.empty();
        }
        EventLogRecord eventLog = (EventLogRecord) record;
        for (String[] path : paths) {
            Optional<String> value = (wrapped ? eventLog.wrappedSystem(path) : eventLog.system(path))
                .flatMap(reader);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
