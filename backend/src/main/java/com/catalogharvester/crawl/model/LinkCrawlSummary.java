package com.catalogharvester.crawl.model;

import java.time.Instant;
import java.util.Map;

public record LinkCrawlSummary(
    String domain,
    LinkScope scope,
    Instant startedAt,
    Instant finishedAt,
    int pagesCrawled,
    Map<PageType, Integer> pagesByType,
    int imagesFound,
    int uniqueImages,
    int errors,
    boolean budgetReached,
    String pagesCsvPath,
    String uniqueCsvPath,
    String pageAuditCsvPath
) {}
