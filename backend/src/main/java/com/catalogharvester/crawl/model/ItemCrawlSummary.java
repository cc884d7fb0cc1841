package com.catalogharvester.crawl.model;

import java.time.Instant;
import java.util.List;

public record ItemCrawlSummary(
    String target,
    Instant startedAt,
    Instant finishedAt,
    String status,
    int identifiersDiscovered,
    int itemsProcessed,
    int itemsSkipped,
    int totalSucceeded,
    int totalErrored,
    int withCompatibility,
    String checkpointPath,
    String jsonPath,
    String csvPath,
    List<String> sampleErrors
) {}
