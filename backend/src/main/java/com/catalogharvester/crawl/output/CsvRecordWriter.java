package com.catalogharvester.crawl.output;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Component
public class CsvRecordWriter {

    public void write(Path file, List<OutputRow> rows) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(OutputColumn.headers()).build();
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (OutputRow row : rows) {
                printer.printRecord(row.values());
            }
        }
    }
}
