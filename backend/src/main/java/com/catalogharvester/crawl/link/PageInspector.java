package com.catalogharvester.crawl.link;

import com.catalogharvester.crawl.model.ContentMetrics;
import com.catalogharvester.crawl.model.ImageRef;
import com.catalogharvester.crawl.model.PageMeta;
import com.catalogharvester.crawl.model.PageSummary;
import com.catalogharvester.crawl.model.PageType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads what link-following mode reports about a page: SEO meta, content metrics, schema markup,
 * product fields and images.
 */
public class PageInspector {
    private static final Logger log = LoggerFactory.getLogger(PageInspector.class);
    private static final Pattern BACKGROUND_URL = Pattern.compile("url\\([\"']?([^\"')\\s]+)[\"']?\\)");
    private static final Pattern PRICE_TEXT = Pattern.compile("[\\d,.]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> IMAGE_SOURCE_ATTRIBUTES = List.of("src", "data-src", "data-lazy-src", "data-original");
    private static final List<String> PRICE_SELECTORS = List.of(
        ".price", ".product-price", ".current-price", "[data-price]", ".woocommerce-Price-amount"
    );

    private final ObjectMapper objectMapper;
    private final String siteHost;
    private final List<Pattern> imageExcludePatterns;
    private final int minImageWidth;
    private final int minImageHeight;

    /**
     * @param siteHost host of the crawled site; links to it (or its subdomains) count as internal
     */
    public PageInspector(
        ObjectMapper objectMapper,
        String siteHost,
        List<Pattern> imageExcludePatterns,
        int minImageWidth,
        int minImageHeight
    ) {
        this.objectMapper = objectMapper;
        String host = siteHost == null ? "" : siteHost.trim().toLowerCase(Locale.ROOT);
        this.siteHost = host.startsWith("www.") ? host.substring(4) : host;
        this.imageExcludePatterns = List.copyOf(imageExcludePatterns);
        this.minImageWidth = minImageWidth;
        this.minImageHeight = minImageHeight;
    }

    public PageSummary inspect(String url, int statusCode, PageType pageType, Document document) {
        List<String> schemaTypes = new ArrayList<>();
        Map<String, String> productData = productData(document, schemaTypes);
        return new PageSummary(
            url,
            statusCode,
            pageType,
            meta(document),
            metrics(document),
            schemaTypes,
            productData,
            images(document)
        );
    }

    PageMeta meta(Document document) {
        Element h1 = document.selectFirst("h1");
        return new PageMeta(
            firstNonBlank(document.title()),
            attr(document, "meta[name=description]", "content"),
            h1 == null ? null : firstNonBlank(h1.text()),
            attr(document, "link[rel=canonical]", "href"),
            attr(document, "meta[property=og:title]", "content"),
            attr(document, "meta[property=og:description]", "content"),
            attr(document, "meta[property=og:image]", "content")
        );
    }

    ContentMetrics metrics(Document document) {
        String text = document.body() == null ? "" : document.body().text().trim();
        int words = text.isEmpty() ? 0 : WHITESPACE.split(text).length;
        int internal = 0;
        int external = 0;
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href").trim();
            if (href.isEmpty() || href.startsWith("#") || href.startsWith("javascript:")) {
                continue;
            }
            String host = hostOf(anchor.absUrl("href"));
            if (host != null && !isInternalHost(host)) {
                external++;
            } else {
                internal++;
            }
        }
        return new ContentMetrics(words, document.select("img").size(), internal, external);
    }

    public List<String> links(Document document) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href");
            if (href.isBlank() || href.startsWith("#") || href.startsWith("javascript:") || href.startsWith("mailto:")) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            if (!absolute.isEmpty()) {
                links.add(FollowPolicy.normalize(absolute));
            }
        }
        return new ArrayList<>(links);
    }

    List<ImageRef> images(Document document) {
        List<ImageRef> images = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Element img : document.select("img")) {
            String attribute = null;
            for (String candidate : IMAGE_SOURCE_ATTRIBUTES) {
                if (!img.attr(candidate).isBlank()) {
                    attribute = candidate;
                    break;
                }
            }
            if (attribute == null || img.attr(attribute).trim().startsWith("data:")) {
                continue;
            }
            String src = img.absUrl(attribute);
            if (src.isEmpty()) {
                src = img.attr(attribute).trim();
            }
            if (!seen.add(src) || isExcluded(src) || tooSmall(img)) {
                continue;
            }
            images.add(new ImageRef(src, img.attr("alt").trim()));
        }
        for (Element styled : document.select("[style]")) {
            Matcher matcher = BACKGROUND_URL.matcher(styled.attr("style"));
            if (!matcher.find()) {
                continue;
            }
            String src = resolveStyleUrl(document, matcher.group(1));
            if (!seen.contains(src) && !isExcluded(src)) {
                seen.add(src);
                images.add(new ImageRef(src, "(background image)"));
            }
        }
        return images;
    }

    Map<String, String> productData(Document document) {
        return productData(document, new ArrayList<>());
    }

    private Map<String, String> productData(Document document, List<String> schemaTypes) {
        Map<String, String> data = new LinkedHashMap<>();
        Set<String> types = new LinkedHashSet<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                JsonNode root = objectMapper.readTree(payload);
                List<JsonNode> items = new ArrayList<>();
                if (root.isArray()) {
                    root.forEach(items::add);
                } else {
                    items.add(root);
                }
                for (JsonNode item : items) {
                    readSchemaItem(item, data, types);
                    JsonNode graph = item.get("@graph");
                    if (graph != null && graph.isArray()) {
                        graph.forEach(node -> readSchemaItem(node, data, types));
                    }
                }
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD on {}: {}", document.location(), e.getOriginalMessage());
            }
        }
        schemaTypes.addAll(types);
        putIfMissing(data, "name", microdata(document, "name"));
        putIfMissing(data, "price", microdata(document, "price"));
        putIfMissing(data, "sku", microdata(document, "sku"));
        putIfMissing(data, "brand", microdata(document, "brand"));
        putIfMissing(data, "price", displayedPrice(document));
        return data;
    }

    private void readSchemaItem(JsonNode item, Map<String, String> data, Set<String> types) {
        if (item == null || !item.isObject() || !item.has("@type")) {
            return;
        }
        JsonNode type = item.get("@type");
        boolean product = false;
        if (type.isArray()) {
            for (JsonNode entry : type) {
                if (entry.isTextual() && !entry.asText().isBlank()) {
                    types.add(entry.asText().trim());
                    product |= "Product".equals(entry.asText().trim());
                }
            }
        } else if (type.isTextual() && !type.asText().isBlank()) {
            types.add(type.asText().trim());
            product = "Product".equals(type.asText().trim());
        }
        if (product) {
            readProduct(item, data);
        }
    }

    private void readProduct(JsonNode item, Map<String, String> data) {
        putText(data, "name", item.get("name"));
        putText(data, "description", item.get("description"));
        putText(data, "sku", item.get("sku"));
        JsonNode brand = item.get("brand");
        if (brand != null && brand.isObject()) {
            putText(data, "brand", brand.get("name"));
        } else {
            putText(data, "brand", brand);
        }
        JsonNode offers = item.get("offers");
        if (offers != null && offers.isArray()) {
            offers = offers.size() > 0 ? offers.get(0) : null;
        }
        if (offers != null && offers.isObject()) {
            putText(data, "price", offers.get("price"));
            putText(data, "currency", offers.get("priceCurrency"));
            JsonNode availability = offers.get("availability");
            if (availability != null && availability.isTextual()) {
                data.put("availability", availability.asText()
                    .replace("https://schema.org/", "")
                    .replace("http://schema.org/", ""));
            }
        }
    }

    /** Last resort for the price: the number in the first common price element that carries one. */
    private String displayedPrice(Document document) {
        for (String selector : PRICE_SELECTORS) {
            Element element = document.selectFirst(selector);
            if (element == null) {
                continue;
            }
            Matcher matcher = PRICE_TEXT.matcher(element.text());
            if (matcher.find()) {
                return matcher.group();
            }
        }
        return null;
    }

    private void putText(Map<String, String> data, String key, JsonNode node) {
        if (node != null && node.isValueNode() && !node.asText().isBlank()) {
            data.put(key, node.asText().trim());
        }
    }

    private void putIfMissing(Map<String, String> data, String key, String value) {
        if (value != null && !data.containsKey(key)) {
            data.put(key, value);
        }
    }

    private String microdata(Document document, String property) {
        Element element = document.selectFirst("[itemprop=" + property + "]");
        if (element == null) {
            return null;
        }
        return firstNonBlank(element.attr("content"), element.text());
    }

    private boolean isInternalHost(String host) {
        return siteHost.isEmpty() || host.equals(siteHost) || host.endsWith("." + siteHost);
    }

    private boolean isExcluded(String src) {
        for (Pattern pattern : imageExcludePatterns) {
            if (pattern.matcher(src).find()) {
                return true;
            }
        }
        return false;
    }

    private boolean tooSmall(Element img) {
        int width = parseDimension(img.attr("width"));
        int height = parseDimension(img.attr("height"));
        return (minImageWidth > 0 && width > 0 && width < minImageWidth)
            || (minImageHeight > 0 && height > 0 && height < minImageHeight);
    }

    private static int parseDimension(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String hostOf(String url) {
        if (url == null || url.isEmpty()) {
            return null;
        }
        try {
            String host = URI.create(url).getHost();
            return host == null || host.isEmpty() ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String resolveStyleUrl(Document document, String raw) {
        String base = document.location();
        if (base == null || base.isBlank()) {
            return raw;
        }
        try {
            return URI.create(base).resolve(raw.trim()).toString();
        } catch (IllegalArgumentException e) {
            log.debug("Unresolvable background image {} on {}", raw, base);
            return raw;
        }
    }

    private static String attr(Document document, String selector, String attribute) {
        Element element = document.selectFirst(selector);
        return element == null ? null : firstNonBlank(element.attr(attribute));
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
