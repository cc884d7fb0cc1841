package com.catalogharvester.crawl.model;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

public record CompatibilityTable(
    CompatibilityStatus status,
    List<CompatibilityEntry> entries,
    SortedSet<String> makes,
    SortedSet<String> years,
    int totalPages,
    int pagesVisited,
    boolean truncated,
    String stopReason
) {
    public CompatibilityTable {
        entries = entries == null ? List.of() : List.copyOf(entries);
        makes = makes == null ? new TreeSet<>() : new TreeSet<>(makes);
        years = years == null ? new TreeSet<>() : new TreeSet<>(years);
    }

    public static CompatibilityTable notExtracted() {
        return new CompatibilityTable(CompatibilityStatus.NOT_EXTRACTED, List.of(), null, null, 0, 0, false, null);
    }

    public static CompatibilityTable absent() {
        return new CompatibilityTable(CompatibilityStatus.ABSENT, List.of(), null, null, 0, 0, false, null);
    }

    public boolean hasEntries() {
        return !entries.isEmpty();
    }
}
