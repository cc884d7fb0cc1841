package com.catalogharvester.crawl.detail;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * schema.org microdata ({@code itemprop} attributes) for pages without JSON-LD.
 */
@Component
@Order(30)
public class MicrodataStrategy implements ExtractionStrategy {

    @Override
    public String name() {
        return "microdata";
    }

    @Override
    public Optional<PartialProduct> extract(Document document) {
        Element scope = document.selectFirst("[itemtype*=schema.org/Product]");
        Element root = scope != null ? scope : document;
        String name = prop(root, "name");
        String price = prop(root, "price");
        if (scope == null && name == null && price == null) {
            return Optional.empty();
        }
        List<String> images = new ArrayList<>();
        for (Element image : root.select("[itemprop=image]")) {
            String src = image.hasAttr("src") ? image.absUrl("src") : image.attr("content");
            if (!src.isBlank() && !images.contains(src)) {
                images.add(src);
            }
        }
        Element brandScope = root.selectFirst("[itemprop=brand]");
        String brand = null;
        if (brandScope != null) {
            brand = PartialProduct.firstNonBlank(prop(brandScope, "name"), valueOf(brandScope));
        }
        PartialProduct product = new PartialProduct(
            name,
            price,
            prop(root, "priceCurrency"),
            StructuredDataStrategy.stripSchemaPrefix(prop(root, "itemCondition")),
            StructuredDataStrategy.stripSchemaPrefix(prop(root, "availability")),
            brand,
            prop(root, "mpn"),
            null,
            prop(root, "description"),
            images,
            Map.of()
        );
        return Optional.of(product);
    }

    private String prop(Element root, String property) {
        Element element = root.selectFirst("[itemprop=" + property + "]");
        return element == null ? null : valueOf(element);
    }

    private String valueOf(Element element) {
        String value = element.hasAttr("content") ? element.attr("content") : element.text();
        return PartialProduct.firstNonBlank(value);
    }
}
