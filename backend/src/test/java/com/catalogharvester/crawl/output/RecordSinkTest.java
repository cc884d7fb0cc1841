package com.catalogharvester.crawl.output;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.model.CompatibilityEntry;
import com.catalogharvester.crawl.model.CompatibilityStatus;
import com.catalogharvester.crawl.model.CompatibilityTable;
import com.catalogharvester.crawl.model.DetailRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class RecordSinkTest {
    private final CrawlerProperties properties = new CrawlerProperties();

    @Test
    void explodesOneRowPerImage() {
        DetailRecord record = record("Acme H7 Bulb", List.of("https://img/1.jpg", "https://img/2.jpg", "https://img/3.jpg"));

        List<OutputRow> rows = new RecordSink(properties).toRows(record);

        assertThat(rows).hasSize(3);
        OutputRow first = rows.get(0);
        assertThat(first.get(OutputColumn.HANDLE)).isEqualTo("acme-h7-bulb-9012");
        assertThat(first.get(OutputColumn.TITLE)).isEqualTo("Acme H7 Bulb");
        assertThat(first.get(OutputColumn.VARIANT_PRICE)).isEqualTo("12.99");
        assertThat(first.get(OutputColumn.VARIANT_SKU)).isEqualTo("123456789012");
        assertThat(first.get(OutputColumn.IMAGE_POSITION)).isEqualTo("1");
        assertThat(first.get(OutputColumn.COMPATIBLE_MAKES)).isEqualTo("Audi, Ford");
        assertThat(first.get(OutputColumn.COMPATIBLE_YEARS)).isEqualTo("2010, 2011");

        for (int i = 1; i < rows.size(); i++) {
            OutputRow continuation = rows.get(i);
            assertThat(continuation.get(OutputColumn.HANDLE)).isEqualTo(first.get(OutputColumn.HANDLE));
            assertThat(continuation.get(OutputColumn.IMAGE_SRC)).isEqualTo("https://img/" + (i + 1) + ".jpg");
            assertThat(continuation.get(OutputColumn.IMAGE_POSITION)).isEqualTo(String.valueOf(i + 1));
            for (OutputColumn column : OutputColumn.values()) {
                if (column != OutputColumn.HANDLE && !column.isImageSlot()) {
                    assertThat(continuation.isBlank(column)).as(column.header()).isTrue();
                }
            }
        }
    }

    @Test
    void recordWithoutImagesIsOneRowWithEmptyImageColumns() {
        List<OutputRow> rows = new RecordSink(properties).toRows(record("Wiper", List.of()));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).isBlank(OutputColumn.IMAGE_SRC)).isTrue();
        assertThat(rows.get(0).isBlank(OutputColumn.IMAGE_POSITION)).isTrue();
    }

    @Test
    void vendorFallsBackToBrandAndConfiguredVendorWins() {
        DetailRecord record = record("Wiper", List.of());

        assertThat(new RecordSink(properties).toRows(record).get(0).get(OutputColumn.VENDOR)).isEqualTo("Acme");

        properties.getOutput().setVendor("My Shop");
        assertThat(new RecordSink(properties).toRows(record).get(0).get(OutputColumn.VENDOR)).isEqualTo("My Shop");
    }

    @Test
    void tagsComeFromConfiguredSpecificsInOrder() {
        properties.getOutput().setTagFields(List.of("Bulb Type", "Colour", "Brand"));

        OutputRow row = new RecordSink(properties).toRows(record("Wiper", List.of())).get(0);

        assertThat(row.get(OutputColumn.TAGS)).isEqualTo("H7, Acme");
    }

    @Test
    void flattensRecordsInOrder() {
        List<OutputRow> rows = new RecordSink(properties).toRows(List.of(
            record("First", List.of("https://img/a.jpg", "https://img/b.jpg")),
            record("Second", List.of())
        ));

        assertThat(rows).extracting(row -> row.get(OutputColumn.HANDLE))
            .containsExactly("first-9012", "first-9012", "second-9012");
    }

    private static DetailRecord record(String title, List<String> images) {
        Map<String, String> specifics = new LinkedHashMap<>();
        specifics.put("Brand", "Acme");
        specifics.put("Bulb Type", "H7");
        CompatibilityTable compatibility = new CompatibilityTable(
            CompatibilityStatus.PRESENT,
            List.of(new CompatibilityEntry("Ford", "2010"), new CompatibilityEntry("Audi", "2011")),
            new TreeSet<>(List.of("Ford", "Audi")),
            new TreeSet<>(List.of("2011", "2010")),
            1,
            1,
            false,
            null
        );
        return new DetailRecord("123456789012", "https://shop.example/itm/123456789012", title, "12.99", "GBP",
            "New", "InStock", "Acme", "H7-55W", "H7", "<p>Bright</p>", images, specifics, compatibility,
            Instant.parse("2026-01-05T10:00:00Z"));
    }
}
