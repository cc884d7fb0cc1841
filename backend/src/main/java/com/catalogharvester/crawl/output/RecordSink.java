package com.catalogharvester.crawl.output;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.model.DetailRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens detail records into product-import rows. A record with N images becomes N rows:
 * the first carries every field plus image 1, the rest carry only the handle and their image.
 * A record without images becomes a single row with empty image columns.
 */
@Component
public class RecordSink {
    private final CrawlerProperties.Output config;

    public RecordSink(CrawlerProperties properties) {
        this.config = properties.getOutput();
    }

    public List<OutputRow> toRows(List<DetailRecord> records) {
        List<OutputRow> rows = new ArrayList<>();
        for (DetailRecord record : records) {
            rows.addAll(toRows(record));
        }
        return rows;
    }

    public List<OutputRow> toRows(DetailRecord record) {
        String handle = HandleSlugger.handle(record.title(), record.itemId());
        String title = nullToEmpty(record.title());
        List<String> images = record.images();

        OutputRow.Builder first = OutputRow.builder()
            .set(OutputColumn.HANDLE, handle)
            .set(OutputColumn.TITLE, title)
            .set(OutputColumn.BODY_HTML, record.description())
            .set(OutputColumn.VENDOR, vendor(record))
            .set(OutputColumn.TYPE, record.productType())
            .set(OutputColumn.TAGS, tags(record))
            .set(OutputColumn.PUBLISHED, config.isPublished() ? "TRUE" : "FALSE")
            .set(OutputColumn.OPTION1_NAME, "Title")
            .set(OutputColumn.OPTION1_VALUE, "Default Title")
            .set(OutputColumn.VARIANT_SKU, record.itemId())
            .set(OutputColumn.VARIANT_GRAMS, "0")
            .set(OutputColumn.VARIANT_INVENTORY_POLICY, "deny")
            .set(OutputColumn.VARIANT_FULFILLMENT_SERVICE, "manual")
            .set(OutputColumn.VARIANT_PRICE, record.price())
            .set(OutputColumn.VARIANT_REQUIRES_SHIPPING, "TRUE")
            .set(OutputColumn.VARIANT_TAXABLE, "TRUE")
            .set(OutputColumn.STATUS, "active")
            .set(OutputColumn.COMPATIBLE_MAKES, String.join(", ", record.compatibility().makes()))
            .set(OutputColumn.COMPATIBLE_YEARS, String.join(", ", record.compatibility().years()));
        if (!images.isEmpty()) {
            first.set(OutputColumn.IMAGE_SRC, images.get(0))
                .set(OutputColumn.IMAGE_POSITION, "1")
                .set(OutputColumn.IMAGE_ALT_TEXT, title);
        }

        List<OutputRow> rows = new ArrayList<>(Math.max(1, images.size()));
        rows.add(first.build());
        for (int i = 1; i < images.size(); i++) {
            rows.add(OutputRow.builder()
                .set(OutputColumn.HANDLE, handle)
                .set(OutputColumn.IMAGE_SRC, images.get(i))
                .set(OutputColumn.IMAGE_POSITION, String.valueOf(i + 1))
                .set(OutputColumn.IMAGE_ALT_TEXT, title)
                .build());
        }
        return rows;
    }

    private String vendor(DetailRecord record) {
        if (config.getVendor() != null && !config.getVendor().isBlank()) {
            return config.getVendor().trim();
        }
        return record.brand();
    }

    private String tags(DetailRecord record) {
        List<String> tags = new ArrayList<>();
        for (String field : config.getTagFields()) {
            String value = record.specifics().get(field);
            if (value != null && !value.isBlank()) {
                tags.add(value.trim());
            }
        }
        return String.join(", ", tags);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
