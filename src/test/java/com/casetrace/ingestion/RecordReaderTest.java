package com.casetrace.ingestion;

import com.casetrace.domain.SourceFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecordReader Tests")
class RecordReaderTest {

    private final RecordReader reader = new RecordReader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should read one object per line and skip broken lines")
    void shouldReadJsonLines() throws IOException {
        String ndjson = "{\"EventID\": 4624, \"Computer\": \"WS-1\"}\n"
            + "\n"
            + "{not json}\n"
            + "{\"EventID\": 4625, \"nested\": {\"a\": [1, 2]}}\n";
        List<Map<String, Object>> records = new ArrayList<>();

        long count = reader.readJson(new StringReader(ndjson), records::add);

        assertThat(count).isEqualTo(2);
        assertThat(records.get(0)).containsEntry("Computer", "WS-1");
        assertThat(records.get(1).get("nested")).isInstanceOf(Map.class);
    }

    @Test
    @DisplayName("Should stream a top-level JSON array")
    void shouldReadJsonArray() throws IOException {
        String array = "  [ {\"a\": 1}, {\"a\": 2}, {\"a\": 3} ]";
        List<Map<String, Object>> records = new ArrayList<>();

        long count = reader.readJson(new StringReader(array), records::add);

        assertThat(count).isEqualTo(3);
        assertThat(records).extracting(r -> r.get("a")).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Should skip array elements that are not objects and keep reading")
    void shouldSkipNonObjectArrayElements() throws IOException {
        String array = "[{\"a\": 1}, 5, \"text\", [1, {\"x\": 2}], null, {\"b\": 2}]";
        List<Map<String, Object>> records = new ArrayList<>();

        long count = reader.readJson(new StringReader(array), records::add);

        assertThat(count).isEqualTo(2);
        assertThat(records.get(0)).containsEntry("a", 1);
        assertThat(records.get(1)).containsOnlyKeys("b");
    }

    @Test
    @DisplayName("Should read nothing from an empty file")
    void shouldHandleEmptyJson() throws IOException {
        assertThat(reader.readJson(new StringReader("  \n "), r -> { })).isZero();
        assertThat(reader.readCsv(new StringReader(""), r -> { })).isZero();
    }

    @Test
    @DisplayName("Should map CSV rows by header and number them")
    void shouldReadCsv() throws IOException {
        String csv = "\uFEFFDate,Src. IP,Dst. IP,Event\n"
            + "03/01/2024 12:30:45, 10.0.0.1 ,8.8.8.8,Allowed\n"
            + ",,,\n"
            + "03/01/2024 12:31:00,10.0.0.2,1.1.1.1,Blocked\n";
        List<Map<String, Object>> records = new ArrayList<>();

        long count = reader.readCsv(new StringReader(csv), records::add);

        assertThat(count).isEqualTo(2);
        assertThat(records.get(0))
            .containsEntry("Date", "03/01/2024 12:30:45")
            .containsEntry("Src. IP", "10.0.0.1")
            .containsEntry(RecordReader.ROW_NUMBER_FIELD, 1L);
        assertThat(records.get(1))
            .containsEntry("Event", "Blocked")
            .containsEntry(RecordReader.ROW_NUMBER_FIELD, 3L);
    }

    @Test
    @DisplayName("Should read a CSV whose header line exceeds one megabyte")
    void shouldReadVeryLongHeader() throws IOException {
        String wideColumn = "Note" + "x".repeat(1_100_000);
        String csv = "\uFEFFDate," + wideColumn + ",Action\n"
            + "03/01/2024 12:30:45,free text,allow\n";
        List<Map<String, Object>> records = new ArrayList<>();

        long count = reader.readCsv(new StringReader(csv), records::add);

        assertThat(count).isEqualTo(1);
        assertThat(records.get(0))
            .containsEntry("Date", "03/01/2024 12:30:45")
            .containsEntry(wideColumn, "free text")
            .containsEntry("Action", "allow");
    }

    @Test
    @DisplayName("Should keep quoted separators inside header names")
    void shouldParseQuotedHeader() throws IOException {
        List<Map<String, Object>> records = new ArrayList<>();

        reader.readCsv(new StringReader("\"Src, IP\",Action\n10.0.0.1,deny\n"), records::add);

        assertThat(records).singleElement()
            .satisfies(r -> assertThat(r).containsEntry("Src, IP", "10.0.0.1").containsEntry("Action", "deny"));
    }

    @Test
    @DisplayName("Should detect semicolon and tab separated exports")
    void shouldDetectSeparator() throws IOException {
        assertThat(RecordReader.detectSeparator("a;b;c")).isEqualTo(';');
        assertThat(RecordReader.detectSeparator("a\tb\tc")).isEqualTo('\t');
        assertThat(RecordReader.detectSeparator("a,b;c,d")).isEqualTo(',');
        assertThat(RecordReader.detectSeparator("single")).isEqualTo(',');

        List<Map<String, Object>> records = new ArrayList<>();
        reader.readCsv(new StringReader("host;event\nFS01;login\n"), records::add);
        assertThat(records).singleElement().satisfies(r -> assertThat(r).containsEntry("host", "FS01"));
    }

    @Test
    @DisplayName("Should pick the parser from the file format")
    void shouldReadFromPath() throws IOException {
        Path csv = tempDir.resolve("fw.csv");
        Files.writeString(csv, "Src. IP,Dst. IP\n10.0.0.1,8.8.8.8\n", StandardCharsets.UTF_8);
        Path json = tempDir.resolve("events.ndjson");
        Files.writeString(json, "{\"a\":1}\n{\"a\":2}\n", StandardCharsets.UTF_8);

        assertThat(reader.read(csv, SourceFormat.CSV, r -> { })).isEqualTo(1);
        assertThat(reader.read(json, SourceFormat.JSON, r -> { })).isEqualTo(2);
    }
}
