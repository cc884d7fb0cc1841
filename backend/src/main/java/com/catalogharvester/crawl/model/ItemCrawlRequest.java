package com.catalogharvester.crawl.model;

/**
 * Per-run overrides; null fields fall back to configuration.
 */
public record ItemCrawlRequest(
    String storeName,
    Integer maxItems,
    CompatibilityMode compatibilityMode,
    Boolean resume,
    String seedFile
) {
    public static ItemCrawlRequest defaults() {
        return new ItemCrawlRequest(null, null, null, null, null);
    }
}
