package com.catalogharvester.crawl.output;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvRecordWriterTest {
    @TempDir
    Path tempDir;

    @Test
    void writesHeaderAndQuotesValues() throws IOException {
        Path file = tempDir.resolve("out/import.csv");
        List<OutputRow> rows = List.of(
            OutputRow.builder()
                .set(OutputColumn.HANDLE, "bulb-1234")
                .set(OutputColumn.TITLE, "Bulb, \"H7\"")
                .set(OutputColumn.BODY_HTML, "<p>line one\nline two</p>")
                .build(),
            OutputRow.builder().set(OutputColumn.HANDLE, "bulb-1234").set(OutputColumn.IMAGE_SRC, "https://img/2.jpg").build()
        );

        new CsvRecordWriter().write(file, rows);

        try (Reader reader = Files.newBufferedReader(file);
             CSVParser parser = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build().parse(reader)) {
            assertThat(parser.getHeaderNames()).containsExactly(OutputColumn.headers());
            List<CSVRecord> records = parser.getRecords();
            assertThat(records).hasSize(2);
            assertThat(records.get(0).get("Title")).isEqualTo("Bulb, \"H7\"");
            assertThat(records.get(0).get("Body (HTML)")).isEqualTo("<p>line one\nline two</p>");
            assertThat(records.get(1).get("Title")).isEmpty();
            assertThat(records.get(1).get("Image Src")).isEqualTo("https://img/2.jpg");
        }
    }
}
