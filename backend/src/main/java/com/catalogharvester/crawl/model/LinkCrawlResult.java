package com.catalogharvester.crawl.model;

import java.util.List;

public record LinkCrawlResult(
    List<PageSummary> pages,
    List<UniqueImage> images,
    List<PageError> errors,
    boolean budgetReached
) {}
