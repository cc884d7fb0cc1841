package com.catalogharvester.crawl.detail;

import com.catalogharvester.config.CrawlerProperties;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Labeled specification rows ("Brand: Acme"). Fills brand, part number and type when the
 * structured data leaves them out; the full key/value map is kept on the record.
 */
@Component
@Order(20)
public class ItemSpecificsStrategy implements ExtractionStrategy {
    static final int MAX_KEY_LENGTH = 80;
    static final String BRAND_KEY = "Brand";
    static final String MPN_KEY = "Manufacturer Part Number";

    private final CrawlerProperties.Detail config;
    private final List<String> typeFields;

    public ItemSpecificsStrategy(CrawlerProperties properties) {
        this.config = properties.getDetail();
        this.typeFields = properties.getOutput().getTypeFields();
    }

    @Override
    public String name() {
        return "item-specifics";
    }

    @Override
    public Optional<PartialProduct> extract(Document document) {
        Map<String, String> specifics = new LinkedHashMap<>();
        for (Element row : document.select(config.getSpecificsRowSelector())) {
            Element label = row.selectFirst(config.getSpecificsLabelSelector());
            Element value = row.selectFirst(config.getSpecificsValueSelector());
            if (label == null || value == null) {
                continue;
            }
            String key = label.text().trim().replaceAll(":$", "").trim();
            String text = value.text().trim();
            if (!key.isEmpty() && !text.isEmpty() && key.length() < MAX_KEY_LENGTH) {
                specifics.put(key, text);
            }
        }
        if (specifics.isEmpty()) {
            return Optional.empty();
        }
        String productType = null;
        for (String field : typeFields) {
            productType = PartialProduct.firstNonBlank(specifics.get(field));
            if (productType != null) {
                break;
            }
        }
        return Optional.of(new PartialProduct(
            null,
            null,
            null,
            null,
            null,
            specifics.get(BRAND_KEY),
            specifics.get(MPN_KEY),
            productType,
            null,
            List.of(),
            specifics
        ));
    }
}
