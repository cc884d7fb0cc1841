package com.catalogharvester.crawl.model;

public record LinkCrawlRequest(
    String domain,
    LinkScope scope,
    Integer maxPages,
    Integer concurrency,
    Integer delayMs
) {
    public static LinkCrawlRequest defaults() {
        return new LinkCrawlRequest(null, null, null, null, null);
    }
}
