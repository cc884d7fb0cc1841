package com.catalogharvester.crawl.model;

/**
 * Head-level SEO fields of a crawled page. Blank values are stored as null.
 */
public record PageMeta(
    String title,
    String description,
    String h1,
    String canonical,
    String ogTitle,
    String ogDescription,
    String ogImage
) {
    public static PageMeta empty() {
        return new PageMeta(null, null, null, null, null, null, null);
    }
}
