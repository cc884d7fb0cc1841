package com.catalogharvester.crawl.state;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Newline-delimited identifier or URL lists. Blank lines are ignored, duplicates dropped. */
public final class IdentifierListFile {
    private IdentifierListFile() {
    }

    public static List<String> read(Path file) throws IOException {
        Set<String> values = new LinkedHashSet<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String value = line.trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return new ArrayList<>(values);
    }

    public static void write(Path file, List<String> values) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        StringBuilder out = new StringBuilder();
        for (String value : values) {
            out.append(value).append('\n');
        }
        Files.writeString(file, out.toString(), StandardCharsets.UTF_8);
    }
}
