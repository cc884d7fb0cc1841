package com.catalogharvester.crawl.link;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.http.PoliteHttpClient;
import com.catalogharvester.crawl.model.LinkCrawlResult;
import com.catalogharvester.crawl.model.LinkScope;
import com.catalogharvester.crawl.model.PageSummary;
import com.catalogharvester.crawl.model.PageType;
import com.catalogharvester.crawl.model.UniqueImage;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class LinkFollowCrawlerTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient httpClient;
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();
    private final Map<String, String> site = Map.of(
        "/", "<a href=\"/collections/lamps\">Lamps</a><a href=\"/products/h7\">H7</a>"
            + "<a href=\"/products/gone\">Gone</a><a href=\"/cart/\">Cart</a><a href=\"https://elsewhere.example/\">Out</a>",
        "/collections/lamps", "<a href=\"/\">Home</a><a href=\"/products/h7#specs\">H7</a>"
            + "<img src=\"/img/shared.jpg\" alt=\"Shared\">",
        "/products/h7", "<h1>H7</h1><img src=\"/img/shared.jpg\" alt=\"Shared\"><img src=\"/img/h7.jpg\" alt=\"H7\">"
    );

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath();
                hits.computeIfAbsent(path, ignored -> new AtomicInteger()).incrementAndGet();
                String body = site.get(path);
                if (body == null) {
                    return new MockResponse().setResponseCode(404).setBody("not found");
                }
                return new MockResponse()
                    .setHeader("Content-Type", "text/html; charset=utf-8")
                    .setBody("<html><head><title>" + path + "</title></head><body>" + body + "</body></html>");
            }
        });
        server.start();

        CrawlerProperties properties = new CrawlerProperties();
        properties.getHttp().setMaxConcurrentRequests(4);
        properties.getHttp().setPerHostDelayMs(1);
        properties.getHttp().setMaxRetries(0);
        executor = Executors.newFixedThreadPool(4);
        httpClient = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void crawlsEachInternalPageOnceAndAggregatesImages() {
        LinkFollowCrawler crawler = crawler(LinkScope.ALL, 3, 0);

        LinkCrawlResult result = crawler.crawl(List.of(server.url("/").toString()));

        assertThat(result.pages()).extracting(PageSummary::url).containsExactlyInAnyOrder(
            server.url("/").toString(),
            server.url("/collections/lamps").toString(),
            server.url("/products/h7").toString()
        );
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).statusCode()).isEqualTo(404);
        assertThat(result.budgetReached()).isFalse();
        assertThat(hits.keySet()).doesNotContain("/cart/");
        hits.values().forEach(count -> assertThat(count.get()).isEqualTo(1));

        assertThat(result.images()).extracting(UniqueImage::src).containsExactly(
            server.url("/img/h7.jpg").toString(),
            server.url("/img/shared.jpg").toString()
        );
        UniqueImage shared = result.images().get(1);
        assertThat(shared.foundOn()).hasSize(2);
        assertThat(crawler.registry().pagesByType())
            .containsEntry(PageType.CATEGORY, 1)
            .containsEntry(PageType.PRODUCT, 1)
            .containsEntry(PageType.OTHER, 1);
    }

    @Test
    void pageBudgetStopsSchedulingAndDrains() {
        LinkFollowCrawler crawler = crawler(LinkScope.ALL, 1, 2);

        LinkCrawlResult result = crawler.crawl(List.of(server.url("/").toString()));

        assertThat(result.pages()).hasSize(2);
        assertThat(result.budgetReached()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void budgetIsNeverExceededWithParallelWorkers() {
        LinkFollowCrawler crawler = crawler(LinkScope.ALL, 4, 1);

        LinkCrawlResult result = crawler.crawl(List.of(server.url("/").toString()));

        assertThat(result.pages()).hasSize(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void restrictedScopeSkipsNonMatchingLinks() {
        LinkFollowCrawler crawler = crawler(LinkScope.CATEGORY, 2, 0);

        LinkCrawlResult result = crawler.crawl(List.of(server.url("/").toString()));

        assertThat(result.pages()).extracting(PageSummary::url).containsExactlyInAnyOrder(
            server.url("/").toString(),
            server.url("/collections/lamps").toString()
        );
        assertThat(hits).doesNotContainKey("/products/h7");
    }

    private LinkFollowCrawler crawler(LinkScope scope, int concurrency, int maxPages) {
        LinkRules rules = LinkRules.from(new CrawlerProperties().getLinkFollow());
        return new LinkFollowCrawler(
            httpClient,
            new LinkClassifier(rules.productPatterns(), rules.categoryPatterns(), Set.of(), Set.of()),
            new PageInspector(new ObjectMapper(), server.getHostName(), rules.imageExcludePatterns(), 50, 50),
            new FollowPolicy(server.getHostName(), scope, rules),
            concurrency,
            0,
            maxPages
        );
    }
}
