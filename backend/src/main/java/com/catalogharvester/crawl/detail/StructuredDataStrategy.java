package com.catalogharvester.crawl.detail;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON-LD {@code Product} blocks: a top-level object, an array of objects or an {@code @graph} container.
 * The first Product found is used.
 */
@Component
@Order(10)
public class StructuredDataStrategy implements ExtractionStrategy {
    private static final Logger log = LoggerFactory.getLogger(StructuredDataStrategy.class);

    private final ObjectMapper objectMapper;

    public StructuredDataStrategy(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "structured-data";
    }

    @Override
    public Optional<PartialProduct> extract(Document document) {
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            JsonNode product;
            try {
                product = findProduct(objectMapper.readTree(payload));
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block on {}: {}", document.location(), e.getOriginalMessage());
                continue;
            }
            if (product != null) {
                return Optional.of(normalize(product));
            }
        }
        return Optional.empty();
    }

    private JsonNode findProduct(JsonNode root) {
        if (root == null || root.isNull()) {
            return null;
        }
        if (root.isArray()) {
            for (JsonNode child : root) {
                JsonNode found = findProduct(child);
                if (found != null) {
                    return found;
                }
            }
            return null;
        }
        if (!root.isObject()) {
            return null;
        }
        if (isProductType(root.get("@type"))) {
            return root;
        }
        JsonNode graph = root.get("@graph");
        if (graph != null && graph.isArray()) {
            for (JsonNode child : graph) {
                if (isProductType(child.get("@type"))) {
                    return child;
                }
            }
        }
        return null;
    }

    private boolean isProductType(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return "product".equalsIgnoreCase(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && "product".equalsIgnoreCase(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private PartialProduct normalize(JsonNode product) {
        JsonNode offers = product.get("offers");
        if (offers != null && offers.isArray()) {
            offers = offers.size() > 0 ? offers.get(0) : null;
        }
        return new PartialProduct(
            text(product, "name"),
            text(offers, "price"),
            text(offers, "priceCurrency"),
            stripSchemaPrefix(text(offers, "itemCondition")),
            stripSchemaPrefix(text(offers, "availability")),
            brand(product.get("brand")),
            text(product, "mpn"),
            null,
            text(product, "description"),
            images(product.get("image")),
            Map.of()
        );
    }

    private String brand(JsonNode brandNode) {
        if (brandNode == null || brandNode.isNull()) {
            return null;
        }
        if (brandNode.isObject()) {
            return text(brandNode, "name");
        }
        return brandNode.isValueNode() ? PartialProduct.firstNonBlank(brandNode.asText()) : null;
    }

    private List<String> images(JsonNode imageNode) {
        List<String> images = new ArrayList<>();
        if (imageNode == null || imageNode.isNull()) {
            return images;
        }
        if (imageNode.isArray()) {
            for (JsonNode child : imageNode) {
                addImage(images, child);
            }
        } else {
            addImage(images, imageNode);
        }
        return images;
    }

    private void addImage(List<String> images, JsonNode node) {
        String url = node.isObject() ? text(node, "url") : (node.isTextual() ? node.asText() : null);
        if (url != null && !url.isBlank() && !images.contains(url.trim())) {
            images.add(url.trim());
        }
    }

    static String stripSchemaPrefix(String value) {
        if (value == null) {
            return null;
        }
        return value.replace("https://schema.org/", "").replace("http://schema.org/", "");
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }
}
