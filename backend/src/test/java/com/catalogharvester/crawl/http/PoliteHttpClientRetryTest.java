package com.catalogharvester.crawl.http;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.model.FetchFailureKind;
import com.catalogharvester.crawl.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        client = client(http -> {
        });
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesServerErrorsUntilSuccess() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(502));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));

        HttpFetchResult result = client.get(server.url("/page").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).contains("ok");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void givesUpAfterConfiguredRetries() {
        for (int i = 0; i < 4; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }

        HttpFetchResult result = client.get(server.url("/broken").toString());

        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(result.failure()).isNull();
        assertThat(result.describe()).isEqualTo("HTTP 500");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void doesNotRetryClientErrors() {
        server.enqueue(new MockResponse().setResponseCode(404));

        HttpFetchResult result = client.get(server.url("/missing").toString());

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.failure()).isNull();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void rateLimitedRequestIsRetriedAfterRetryAfter() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "0"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        HttpFetchResult result = client.get(server.url("/busy").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void forbiddenResponseHoldsBackTheHost() {
        PoliteHttpClient cooling = client(http -> http.setThrottleCooldownMs(400));
        server.enqueue(new MockResponse().setResponseCode(403));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        HttpFetchResult blocked = cooling.get(server.url("/blocked").toString());
        long started = System.nanoTime();
        HttpFetchResult next = cooling.get(server.url("/next").toString());
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(blocked.statusCode()).isEqualTo(403);
        assertThat(next.isSuccessful()).isTrue();
        assertThat(waitedMs).isGreaterThanOrEqualTo(300);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void slowResponseIsReportedAsTimeout() {
        PoliteHttpClient impatient = client(http -> {
            http.setTimeoutSeconds(1);
            http.setMaxRetries(0);
        });
        server.enqueue(new MockResponse().setResponseCode(200).setBody("late").setHeadersDelay(3, TimeUnit.SECONDS));

        HttpFetchResult result = impatient.get(server.url("/slow").toString());

        assertThat(result.failure()).isEqualTo(FetchFailureKind.TIMEOUT);
        assertThat(result.describe()).startsWith("timeout");
        assertThat(result.isSuccessful()).isFalse();
    }

    @Test
    void malformedUrlIsReportedNotThrown() {
        assertThat(client.get("https://").failure()).isEqualTo(FetchFailureKind.INVALID_URL);
        assertThat(client.get("ftp://shop.example/file").failure()).isEqualTo(FetchFailureKind.INVALID_URL);
        assertThat(client.get("  ").failure()).isEqualTo(FetchFailureKind.INVALID_URL);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void sendsConfiguredUserAgent() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        client.get(server.url("/ua").toString());

        assertThat(server.takeRequest().getHeader("User-Agent")).contains("catalog-harvester");
    }

    private PoliteHttpClient client(Consumer<CrawlerProperties.Http> overrides) {
        CrawlerProperties properties = new CrawlerProperties();
        CrawlerProperties.Http http = properties.getHttp();
        http.setMaxConcurrentRequests(1);
        http.setPerHostDelayMs(1);
        http.setTimeoutSeconds(5);
        http.setMaxRetries(2);
        http.setRetryBaseDelayMs(1);
        http.setRetryMaxDelayMs(5);
        http.setThrottleCooldownMs(0);
        overrides.accept(http);
        return new PoliteHttpClient(properties, executor);
    }
}
