package com.catalogharvester.crawl.model;

import java.time.Instant;

public record CrawlRunStatusResponse(
    boolean running,
    String activeMode,
    Instant activeSince,
    ItemCrawlSummary lastItemRun,
    LinkCrawlSummary lastLinkRun
) {}
