package com.catalogharvester.crawl.detail;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.compat.AttributeTableExtractor;
import com.catalogharvester.crawl.model.CompatibilityMode;
import com.catalogharvester.crawl.model.CompatibilityStatus;
import com.catalogharvester.crawl.model.DetailRecord;
import com.catalogharvester.crawl.model.ErrorKind;
import com.catalogharvester.crawl.model.ItemOutcome;
import com.catalogharvester.crawl.model.FetchFailureKind;
import com.catalogharvester.crawl.page.PageFetchException;
import com.catalogharvester.crawl.page.PageSource;
import com.catalogharvester.crawl.page.RenderedPage;
import com.catalogharvester.crawl.page.StaticRenderedPage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DetailExtractorTest {
    private static final String ITEM_ID = "123456789012";

    private CrawlerProperties properties;
    private final Deque<String> responses = new ArrayDeque<>();
    private final AtomicInteger loads = new AtomicInteger();
    private PageSource pageSource;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.getStore().setBaseUrl("https://shop.example");
        properties.getDetail().setBlockedRetryWaitMs(0);
        pageSource = new PageSource() {
            @Override
            public RenderedPage open(String url) {
                loads.incrementAndGet();
                String html = responses.size() > 1 ? responses.poll() : responses.peek();
                return new StaticRenderedPage(url, Jsoup.parse(html, url), () -> open(url));
            }
        };
    }

    @Test
    void structuredDataWinsOverSpecificsAndSpecificsFillTheGaps() {
        responses.add(page(
            "Acme Headlight",
            jsonLd("{\"@type\":\"Product\",\"name\":\"Acme H7 Headlight Bulb\",\"brand\":\"Acme\","
                + "\"offers\":{\"price\":\"12.99\",\"priceCurrency\":\"GBP\","
                + "\"itemCondition\":\"https://schema.org/NewCondition\"},"
                + "\"image\":[\"https://img.example/1.jpg\",\"https://img.example/2.jpg\"]}"),
            specifics("Brand", "Other Brand", "Manufacturer Part Number", "H7-55W", "Bulb Type", "H7")
        ));

        ItemOutcome outcome = extractor().extract(ITEM_ID, CompatibilityMode.SKIP);

        assertThat(outcome.isSuccess()).isTrue();
        DetailRecord record = outcome.record();
        assertThat(record.title()).isEqualTo("Acme H7 Headlight Bulb");
        assertThat(record.brand()).isEqualTo("Acme");
        assertThat(record.mpn()).isEqualTo("H7-55W");
        assertThat(record.productType()).isEqualTo("H7");
        assertThat(record.price()).isEqualTo("12.99");
        assertThat(record.condition()).isEqualTo("NewCondition");
        assertThat(record.images()).containsExactly("https://img.example/1.jpg", "https://img.example/2.jpg");
        assertThat(record.specifics()).containsEntry("Brand", "Other Brand");
        assertThat(record.url()).isEqualTo("https://shop.example/itm/" + ITEM_ID);
    }

    @Test
    void blankStructuredBrandFallsThroughToSpecifics() {
        responses.add(page(
            "Item",
            jsonLd("{\"@type\":\"Product\",\"name\":\"Wiper Blade\",\"brand\":\"\"}"),
            specifics("Brand", "Bosch")
        ));

        DetailRecord record = extractor().extract(ITEM_ID, CompatibilityMode.SKIP).record();

        assertThat(record.brand()).isEqualTo("Bosch");
        assertThat(record.currency()).isEqualTo("GBP");
    }

    @Test
    void headingIsTheLastResortForTheTitle() {
        responses.add("<html><head><title>Listing</title></head><body><h1>Door Mirror Left</h1></body></html>");

        DetailRecord record = extractor().extract(ITEM_ID, CompatibilityMode.SKIP).record();

        assertThat(record.title()).isEqualTo("Door Mirror Left");
        assertThat(record.price()).isNull();
        assertThat(record.images()).isEmpty();
    }

    @Test
    void pageWithoutAnyTitleIsMalformed() {
        responses.add("<html><body><p>nothing here</p></body></html>");

        ItemOutcome outcome = extractor().extract(ITEM_ID, CompatibilityMode.SKIP);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.error().kind()).isEqualTo(ErrorKind.MALFORMED_PAGE);
    }

    @Test
    void blockedPageIsRecheckedExactlyOnce() {
        responses.add("<html><head><title>Security Measure</title></head><body></body></html>");
        responses.add("<html><head><title>Security Measure</title></head><body></body></html>");

        ItemOutcome outcome = extractor().extract(ITEM_ID, CompatibilityMode.SKIP);

        assertThat(outcome.error().kind()).isEqualTo(ErrorKind.BLOCKED_PAGE);
        assertThat(loads.get()).isEqualTo(2);
    }

    @Test
    void interruptedBlockedWaitFailsWithoutRecheck() {
        properties.getDetail().setBlockedRetryWaitMs(5_000);
        responses.add("<html><head><title>Security Measure</title></head><body></body></html>");
        responses.add("<html><head><title>Item</title></head><body><h1>Fog Lamp</h1></body></html>");

        Thread.currentThread().interrupt();
        ItemOutcome outcome;
        try {
            outcome = extractor().extract(ITEM_ID, CompatibilityMode.SKIP);
        } finally {
            Thread.interrupted();
        }

        assertThat(outcome.error().kind()).isEqualTo(ErrorKind.FETCH_FAILED);
        assertThat(outcome.error().message()).contains("Interrupted");
        assertThat(loads.get()).isEqualTo(1);
    }

    @Test
    void blockedPageThatClearsOnRecheckSucceeds() {
        responses.add("<html><head><title>Security Measure</title></head><body></body></html>");
        responses.add(page("Item", "", specifics("Brand", "Acme")).replace("<body>", "<body><h1>Fog Lamp</h1>"));

        ItemOutcome outcome = extractor().extract(ITEM_ID, CompatibilityMode.SKIP);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.record().title()).isEqualTo("Fog Lamp");
        assertThat(loads.get()).isEqualTo(2);
    }

    @Test
    void timeoutBecomesFetchTimeoutError() {
        PageSource timingOut = url -> {
            throw new PageFetchException(url, FetchFailureKind.TIMEOUT, 0, "timeout: read timed out");
        };
        DetailExtractor extractor = new DetailExtractor(timingOut, strategies(), new AttributeTableExtractor(properties), properties);

        ItemOutcome outcome = extractor.extract(ITEM_ID, CompatibilityMode.SAMPLED);

        assertThat(outcome.error().kind()).isEqualTo(ErrorKind.FETCH_TIMEOUT);
        assertThat(outcome.error().itemId()).isEqualTo(ITEM_ID);
    }

    @Test
    void unexpectedExceptionIsContainedAsFetchFailure() {
        PageSource broken = url -> {
            throw new IllegalStateException("driver crashed");
        };
        DetailExtractor extractor = new DetailExtractor(broken, strategies(), new AttributeTableExtractor(properties), properties);

        ItemOutcome outcome = extractor.extract(ITEM_ID, CompatibilityMode.SAMPLED);

        assertThat(outcome.error().kind()).isEqualTo(ErrorKind.FETCH_FAILED);
        assertThat(outcome.error().message()).contains("driver crashed");
    }

    @Test
    void skipModeLeavesCompatibilityNotExtracted() {
        responses.add(page("Item", jsonLd("{\"@type\":\"Product\",\"name\":\"Bulb\"}"), compatibilityTable()));

        DetailRecord skipped = extractor().extract(ITEM_ID, CompatibilityMode.SKIP).record();
        DetailRecord sampled = extractor().extract(ITEM_ID, CompatibilityMode.SAMPLED).record();

        assertThat(skipped.compatibility().status()).isEqualTo(CompatibilityStatus.NOT_EXTRACTED);
        assertThat(sampled.compatibility().status()).isEqualTo(CompatibilityStatus.PRESENT);
        assertThat(sampled.compatibility().makes()).containsExactly("Ford");
    }

    @Test
    void fullUrlIdentifiersArePassedThrough() {
        assertThat(extractor().itemUrl("https://other.example/itm/1")).isEqualTo("https://other.example/itm/1");
    }

    private DetailExtractor extractor() {
        return new DetailExtractor(pageSource, strategies(), new AttributeTableExtractor(properties), properties);
    }

    private List<ExtractionStrategy> strategies() {
        return List.of(
            new StructuredDataStrategy(new ObjectMapper()),
            new ItemSpecificsStrategy(properties),
            new MicrodataStrategy(),
            new HeadingTitleStrategy()
        );
    }

    private static String page(String title, String head, String body) {
        return "<html><head><title>" + title + "</title>" + head + "</head><body>" + body + "</body></html>";
    }

    private static String jsonLd(String json) {
        return "<script type=\"application/ld+json\">" + json + "</script>";
    }

    private static String specifics(String... pairs) {
        StringBuilder html = new StringBuilder("<div class=\"ux-layout-section\">");
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            html.append("<div class=\"ux-labels-values\">")
                .append("<div class=\"ux-labels-values__labels\">").append(pairs[i]).append(":</div>")
                .append("<div class=\"ux-labels-values__values\">").append(pairs[i + 1]).append("</div>")
                .append("</div>");
        }
        return html.append("</div>").toString();
    }

    private static String compatibilityTable() {
        return "<div id=\"d-motors-compatibility-table\"><table>"
            + "<thead><tr><th>Make</th><th>Model</th><th>Year</th></tr></thead>"
            + "<tbody><tr><td>Ford</td><td>Focus</td><td>2011</td></tr></tbody>"
            + "</table></div>";
    }
}
