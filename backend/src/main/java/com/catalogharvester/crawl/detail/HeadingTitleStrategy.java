package com.catalogharvester.crawl.detail;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Last resort for the title: the page's first h1. */
@Component
@Order(40)
public class HeadingTitleStrategy implements ExtractionStrategy {

    @Override
    public String name() {
        return "heading";
    }

    @Override
    public Optional<PartialProduct> extract(Document document) {
        Element heading = document.selectFirst("h1");
        if (heading == null || heading.text().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new PartialProduct(
            heading.text().trim(), null, null, null, null, null, null, null, null, List.of(), Map.of()
        ));
    }
}
