package com.catalogharvester.crawl.output;

import com.catalogharvester.crawl.model.ContentMetrics;
import com.catalogharvester.crawl.model.ImageRef;
import com.catalogharvester.crawl.model.PageMeta;
import com.catalogharvester.crawl.model.PageSummary;
import com.catalogharvester.crawl.model.UniqueImage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CSV reports for link-following runs: one image per row per page, one row per unique image,
 * and a per-page audit of SEO, content and schema fields.
 */
@Component
public class LinkCrawlReportWriter {
    static final String[] PAGE_HEADERS = {"page_url", "page_type", "page_title", "image_url", "image_alt"};
    static final String[] UNIQUE_HEADERS = {"src", "alt", "pages_found_on", "page_count"};
    static final String[] AUDIT_HEADERS = {
        "page_url", "status", "page_type",
        "meta_title", "meta_description", "h1", "canonical_url", "og_image", "og_title", "og_description",
        "word_count", "total_image_count", "internal_link_count", "external_link_count",
        "product_name", "product_price", "product_currency", "product_sku", "product_brand",
        "product_availability", "product_description",
        "has_schema_markup", "schema_types", "image_count"
    };

    private final ObjectMapper objectMapper;

    public LinkCrawlReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Pages without images are left out; page columns are only filled on a page's first row. */
    public void writePages(Path file, List<PageSummary> pages) throws IOException {
        try (CSVPrinter printer = open(file, PAGE_HEADERS)) {
            for (PageSummary page : pages) {
                List<ImageRef> images = page.images();
                for (int i = 0; i < images.size(); i++) {
                    boolean first = i == 0;
                    printer.printRecord(
                        first ? page.url() : "",
                        first ? page.pageType().name().toLowerCase(Locale.ROOT) : "",
                        first && page.title() != null ? page.title() : "",
                        images.get(i).src(),
                        images.get(i).alt()
                    );
                }
            }
        }
    }

    /** One row per crawled page, with or without images. */
    public void writePageAudit(Path file, List<PageSummary> pages) throws IOException {
        try (CSVPrinter printer = open(file, AUDIT_HEADERS)) {
            for (PageSummary page : pages) {
                PageMeta meta = page.meta();
                ContentMetrics metrics = page.metrics();
                Map<String, String> product = page.productData();
                printer.printRecord(
                    page.url(),
                    page.statusCode(),
                    page.pageType().name().toLowerCase(Locale.ROOT),
                    meta.title(),
                    meta.description(),
                    meta.h1(),
                    meta.canonical(),
                    meta.ogImage(),
                    meta.ogTitle(),
                    meta.ogDescription(),
                    metrics.wordCount(),
                    metrics.totalImageCount(),
                    metrics.internalLinkCount(),
                    metrics.externalLinkCount(),
                    product.get("name"),
                    product.get("price"),
                    product.get("currency"),
                    product.get("sku"),
                    product.get("brand"),
                    product.get("availability"),
                    product.get("description"),
                    page.hasSchemaMarkup(),
                    String.join(", ", page.schemaTypes()),
                    page.images().size()
                );
            }
        }
    }

    public void writeUniqueImages(Path file, List<UniqueImage> images) throws IOException {
        try (CSVPrinter printer = open(file, UNIQUE_HEADERS)) {
            for (UniqueImage image : images) {
                printer.printRecord(image.src(), image.alt(), toJson(image.foundOn()), image.foundOn().size());
            }
        }
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            return String.join(" ", values);
        }
    }

    private CSVPrinter open(Path file, String[] headers) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(headers).build());
    }
}
