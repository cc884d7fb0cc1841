package com.catalogharvester.crawl.model;

import java.util.List;
import java.util.Map;

/**
 * What link-following mode records about one crawled page. {@code images} holds only the images that
 * passed the exclusion and size filters; {@code metrics.totalImageCount()} counts every img tag.
 */
public record PageSummary(
    String url,
    int statusCode,
    PageType pageType,
    PageMeta meta,
    ContentMetrics metrics,
    List<String> schemaTypes,
    Map<String, String> productData,
    List<ImageRef> images
) {
    public PageSummary {
        meta = meta == null ? PageMeta.empty() : meta;
        metrics = metrics == null ? ContentMetrics.empty() : metrics;
        schemaTypes = schemaTypes == null ? List.of() : List.copyOf(schemaTypes);
        productData = productData == null ? Map.of() : Map.copyOf(productData);
        images = images == null ? List.of() : List.copyOf(images);
    }

    public String title() {
        return meta.title();
    }

    public boolean hasSchemaMarkup() {
        return !schemaTypes.isEmpty();
    }
}
