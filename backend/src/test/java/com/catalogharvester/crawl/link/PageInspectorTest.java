package com.catalogharvester.crawl.link;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.model.ImageRef;
import com.catalogharvester.crawl.model.PageSummary;
import com.catalogharvester.crawl.model.PageType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageInspectorTest {
    private final PageInspector inspector = new PageInspector(
        new ObjectMapper(),
        "www.shop.example",
        LinkRules.from(new CrawlerProperties().getLinkFollow()).imageExcludePatterns(),
        50,
        50
    );

    @Test
    void collectsImagesFromLazyAttributesAndBackgrounds() {
        Document document = Jsoup.parse("<html><body>"
            + "<img src=\"/media/a.jpg\" alt=\"Front\">"
            + "<img data-src=\"https://cdn.example/b.jpg\" alt=\" Side \">"
            + "<img src=\"data:image/gif;base64,AAAA\">"
            + "<img src=\"/media/spinner.gif\">"
            + "<img src=\"/media/tiny.png\" width=\"16\" height=\"16\">"
            + "<img src=\"/media/a.jpg\" alt=\"Duplicate\">"
            + "<div style=\"background-image: url('/media/hero.jpg')\"></div>"
            + "</body></html>", "https://shop.example/products/h7");

        List<ImageRef> images = inspector.images(document);

        assertThat(images).extracting(ImageRef::src).containsExactly(
            "https://shop.example/media/a.jpg",
            "https://cdn.example/b.jpg",
            "https://shop.example/media/hero.jpg"
        );
        assertThat(images.get(0).alt()).isEqualTo("Front");
        assertThat(images.get(1).alt()).isEqualTo("Side");
        assertThat(images.get(2).alt()).isEqualTo("(background image)");
    }

    @Test
    void readsSeoFieldsAndProductData() {
        Document document = Jsoup.parse("<html><head><title>H7 Bulb | Shop</title>"
            + "<meta name=\"description\" content=\"Bright bulb\">"
            + "<link rel=\"canonical\" href=\"https://shop.example/products/h7\">"
            + "<script type=\"application/ld+json\">{\"@graph\":[{\"@type\":\"Product\",\"name\":\"H7 Bulb\","
            + "\"sku\":\"H7-1\",\"brand\":{\"name\":\"Acme\"},"
            + "\"offers\":[{\"price\":\"9.50\",\"priceCurrency\":\"GBP\",\"availability\":\"https://schema.org/InStock\"}]}]}"
            + "</script></head><body><h1> H7 Bulb </h1></body></html>", "https://shop.example/products/h7");

        PageSummary summary = inspector.inspect("https://shop.example/products/h7", 200, PageType.PRODUCT, document);

        assertThat(summary.title()).isEqualTo("H7 Bulb | Shop");
        assertThat(summary.meta().description()).isEqualTo("Bright bulb");
        assertThat(summary.meta().h1()).isEqualTo("H7 Bulb");
        assertThat(summary.meta().canonical()).isEqualTo("https://shop.example/products/h7");
        assertThat(summary.schemaTypes()).containsExactly("Product");
        assertThat(summary.hasSchemaMarkup()).isTrue();
        assertThat(summary.productData())
            .containsEntry("name", "H7 Bulb")
            .containsEntry("brand", "Acme")
            .containsEntry("price", "9.50")
            .containsEntry("currency", "GBP")
            .containsEntry("availability", "InStock");
    }

    @Test
    void readsOpenGraphAndContentMetrics() {
        Document document = Jsoup.parse("<html><head><title>Lamps</title>"
            + "<meta property=\"og:title\" content=\"All lamps\">"
            + "<meta property=\"og:description\" content=\"Every lamp we sell\">"
            + "<meta property=\"og:image\" content=\"https://shop.example/og/lamps.jpg\">"
            + "<script type=\"application/ld+json\">[{\"@type\":\"CollectionPage\"},"
            + "{\"@type\":[\"Organization\",\"Brand\"]},{\"name\":\"untyped\"}]</script>"
            + "</head><body><p>Bright  lamps for\n every car</p>"
            + "<img src=\"/a.jpg\"><img src=\"/icon.png\" width=\"8\">"
            + "<a href=\"/collections/h7\">H7</a> "
            + "<a href=\"https://shop.example/about\">About</a> "
            + "<a href=\"https://cdn.shop.example/guide\">Guide</a> "
            + "<a href=\"https://other.example/\">Elsewhere</a> "
            + "<a href=\"#top\">Top</a> <a href=\"javascript:void(0)\">JS</a>"
            + "</body></html>", "https://shop.example/collections/lamps");

        PageSummary summary = inspector.inspect("https://shop.example/collections/lamps", 200, PageType.CATEGORY, document);

        assertThat(summary.title()).isEqualTo("Lamps");
        assertThat(summary.meta().ogTitle()).isEqualTo("All lamps");
        assertThat(summary.meta().ogDescription()).isEqualTo("Every lamp we sell");
        assertThat(summary.meta().ogImage()).isEqualTo("https://shop.example/og/lamps.jpg");
        assertThat(summary.metrics().wordCount()).isEqualTo(11);
        assertThat(summary.metrics().totalImageCount()).isEqualTo(2);
        assertThat(summary.metrics().internalLinkCount()).isEqualTo(3);
        assertThat(summary.metrics().externalLinkCount()).isEqualTo(1);
        assertThat(summary.schemaTypes()).containsExactly("CollectionPage", "Organization", "Brand");
        assertThat(summary.productData()).isEmpty();
    }

    @Test
    void pageWithoutSchemaHasNoMarkupAndFallsBackToDisplayedPrice() {
        Document document = Jsoup.parse("<html><body><h1>Wiper</h1>"
            + "<span class=\"price\">Now only</span>"
            + "<span class=\"product-price\">£1,299.00 inc VAT</span>"
            + "</body></html>", "https://shop.example/p/wiper");

        PageSummary summary = inspector.inspect("https://shop.example/p/wiper", 200, PageType.PRODUCT, document);

        assertThat(summary.hasSchemaMarkup()).isFalse();
        assertThat(summary.schemaTypes()).isEmpty();
        assertThat(summary.productData()).containsEntry("price", "1,299.00");
    }

    @Test
    void microdataPriceWinsOverDisplayedPrice() {
        Document document = Jsoup.parse("<html><body>"
            + "<meta itemprop=\"price\" content=\"4.00\"><span class=\"price\">5.00</span>"
            + "</body></html>", "https://shop.example/p/wiper");

        assertThat(inspector.productData(document)).containsEntry("price", "4.00");
    }

    @Test
    void microdataFillsMissingProductFields() {
        Document document = Jsoup.parse("<html><body><div itemscope itemtype=\"https://schema.org/Product\">"
            + "<span itemprop=\"name\">Wiper</span><meta itemprop=\"price\" content=\"4.00\"></div></body></html>",
            "https://shop.example/p/wiper");

        assertThat(inspector.productData(document)).containsEntry("name", "Wiper").containsEntry("price", "4.00");
    }

    @Test
    void linksAreAbsoluteAndFragmentFree() {
        Document document = Jsoup.parse("<html><body>"
            + "<a href=\"/collections/lamps#top\">Lamps</a>"
            + "<a href=\"#reviews\">Reviews</a>"
            + "<a href=\"mailto:hi@shop.example\">Mail</a>"
            + "<a href=\"javascript:void(0)\">JS</a>"
            + "<a href=\"/collections/lamps\">Again</a>"
            + "</body></html>", "https://shop.example/");

        assertThat(inspector.links(document)).containsExactly("https://shop.example/collections/lamps");
    }
}
