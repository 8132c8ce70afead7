package com.casetrace.ingestion;

import com.casetrace.domain.SourceFormat;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Streams records out of an uploaded file.
 *
 * JSON files may be a single array or one object per line. Lines that do not
 * parse are skipped with a warning. CSV files need a header row; blank rows
 * are skipped and every row is tagged with its 1-based {@code row_number}.
 */
@Component
public class RecordReader {
    private static final Logger log = LoggerFactory.getLogger(RecordReader.class);

    public static final String ROW_NUMBER_FIELD = "row_number";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final char BOM = '\uFEFF';

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    public RecordReader() {
        this.objectMapper = new ObjectMapper();
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.csvMapper.enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE);
    }

    /**
     * @return number of records handed to {@code sink}
     */
    public long read(Path path, SourceFormat fileFormat, Consumer<Map<String, Object>> sink) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            if (fileFormat == SourceFormat.CSV) {
                return readCsv(reader, sink);
            }
            return readJson(reader, sink);
        }
    }

    long readJson(Reader source, Consumer<Map<String, Object>> sink) throws IOException {
        PushbackReader reader = new PushbackReader(source, 1);
        int first = skipLeading(reader);
        if (first == -1) {
            return 0;
        }
        reader.unread(first);
        if (first == '[') {
            return readJsonArray(reader, sink);
        }
        return readJsonLines(new BufferedReader(reader), sink);
    }

    private long readJsonArray(Reader reader, Consumer<Map<String, Object>> sink) throws IOException {
        long count = 0;
        try (JsonParser parser = objectMapper.getFactory().createParser(reader)) {
            parser.nextToken();
            int position = 0;
            JsonToken token;
            while ((token = parser.nextToken()) != null && token != JsonToken.END_ARRAY) {
                position++;
                if (token != JsonToken.START_OBJECT) {
                    log.warn("Skipping array element {}: expected an object, found {}", position, token);
                    parser.skipChildren();
                    continue;
                }
                Map<String, Object> record = objectMapper.readValue(parser, MAP_TYPE);
                sink.accept(record);
                count++;
            }
        }
        return count;
    }

    private long readJsonLines(BufferedReader reader, Consumer<Map<String, Object>> sink) throws IOException {
        long count = 0;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            Map<String, Object> record;
            try {
                record = objectMapper.readValue(line, MAP_TYPE);
            } catch (JsonProcessingException e) {
                log.warn("Skipping invalid JSON line {}: {}", lineNumber, e.getOriginalMessage());
                continue;
            }
            sink.accept(record);
            count++;
        }
        return count;
    }

    long readCsv(Reader source, Consumer<Map<String, Object>> sink) throws IOException {
        BufferedReader reader = new BufferedReader(source);
        String header = reader.readLine();
        if (header == null) {
            return 0;
        }
        if (!header.isEmpty() && header.charAt(0) == BOM) {
            header = header.substring(1);
        }

        char separator = detectSeparator(header);
        CsvSchema.Builder columns = CsvSchema.builder().setColumnSeparator(separator);
        for (String column : headerColumns(header, separator)) {
            columns.addColumn(column);
        }
        CsvSchema schema = columns.build();

        long count = 0;
        long rowNumber = 0;
        try (MappingIterator<Map<String, String>> rows = csvMapper
            .readerFor(new TypeReference<Map<String, String>>() {})
            .with(schema)
            .readValues(reader)) {
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                rowNumber++;
                if (isBlank(row)) {
                    continue;
                }
                Map<String, Object> record = new LinkedHashMap<>(row);
                record.put(ROW_NUMBER_FIELD, rowNumber);
                sink.accept(record);
                count++;
            }
        }
        return count;
    }

    private String[] headerColumns(String header, char separator) throws IOException {
        try (MappingIterator<String[]> lines = csvMapper
            .readerFor(String[].class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY)
            .with(CsvSchema.emptySchema().withColumnSeparator(separator))
            .readValues(header)) {
            return lines.hasNextValue() ? lines.nextValue() : new String[0];
        }
    }

    /**
     * Pick the most frequent of comma, semicolon and tab in the header line.
     */
    static char detectSeparator(String header) {
        char best = ',';
        long bestCount = header.chars().filter(c -> c == ',').count();
        for (char candidate : new char[] {';', '\t'}) {
            long count = header.chars().filter(c -> c == candidate).count();
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private static boolean isBlank(Map<String, String> row) {
        return row.isEmpty() || row.values().stream().allMatch(v -> v == null || v.isBlank());
    }

    private static int skipLeading(PushbackReader reader) throws IOException {
        int c = reader.read();
        while (c != -1 && (Character.isWhitespace(c) || c == BOM)) {
            c = reader.read();
        }
        return c;
    }
}
