package com.catalogharvester.crawl.model;

public record ContentMetrics(
    int wordCount,
    int totalImageCount,
    int internalLinkCount,
    int externalLinkCount
) {
    public static ContentMetrics empty() {
        return new ContentMetrics(0, 0, 0, 0);
    }
}
