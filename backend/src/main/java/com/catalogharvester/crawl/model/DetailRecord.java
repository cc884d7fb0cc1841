package com.catalogharvester.crawl.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DetailRecord(
    String itemId,
    String url,
    String title,
    String price,
    String currency,
    String condition,
    String availability,
    String brand,
    String mpn,
    String productType,
    String description,
    List<String> images,
    Map<String, String> specifics,
    CompatibilityTable compatibility,
    Instant scrapedAt
) {
    public DetailRecord {
        images = images == null ? List.of() : List.copyOf(images);
        specifics = specifics == null ? new LinkedHashMap<>() : new LinkedHashMap<>(specifics);
        compatibility = compatibility == null ? CompatibilityTable.notExtracted() : compatibility;
    }
}
