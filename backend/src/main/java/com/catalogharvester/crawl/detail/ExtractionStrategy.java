package com.catalogharvester.crawl.detail;

import org.jsoup.nodes.Document;

import java.util.Optional;

/**
 * One source of product fields on a detail page. Strategies are applied in {@code @Order}
 * sequence and merged per field, so an earlier strategy only wins the fields it actually found.
 */
public interface ExtractionStrategy {

    String name();

    Optional<PartialProduct> extract(Document document);
}
