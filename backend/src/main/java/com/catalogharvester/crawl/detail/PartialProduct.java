package com.catalogharvester.crawl.detail;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whatever one extraction strategy could read from a page. Null or blank means "not found here".
 */
public record PartialProduct(
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
    Map<String, String> specifics
) {
    public PartialProduct {
        images = images == null ? List.of() : List.copyOf(images);
        specifics = specifics == null ? Map.of() : new LinkedHashMap<>(specifics);
    }

    public static PartialProduct empty() {
        return new PartialProduct(null, null, null, null, null, null, null, null, null, List.of(), Map.of());
    }

    /**
     * Field-by-field merge where {@code this} wins and {@code lower} only fills blanks.
     */
    public PartialProduct fillFrom(PartialProduct lower) {
        if (lower == null) {
            return this;
        }
        Map<String, String> mergedSpecifics = new LinkedHashMap<>(specifics);
        lower.specifics().forEach(mergedSpecifics::putIfAbsent);
        return new PartialProduct(
            firstNonBlank(title, lower.title()),
            firstNonBlank(price, lower.price()),
            firstNonBlank(currency, lower.currency()),
            firstNonBlank(condition, lower.condition()),
            firstNonBlank(availability, lower.availability()),
            firstNonBlank(brand, lower.brand()),
            firstNonBlank(mpn, lower.mpn()),
            firstNonBlank(productType, lower.productType()),
            firstNonBlank(description, lower.description()),
            images.isEmpty() ? lower.images() : images,
            mergedSpecifics
        );
    }

    static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
