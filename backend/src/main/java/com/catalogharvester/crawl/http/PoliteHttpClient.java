package com.catalogharvester.crawl.http;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.model.FetchFailureKind;
import com.catalogharvester.crawl.model.HttpFetchResult;
import com.catalogharvester.crawl.util.Pauses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Page fetcher used by the listing walk, HTTP detail pages and link-following mode.
 * Requests are GET-only, capped at {@code crawler.http.max-concurrent-requests} in flight,
 * paced per host, and retried according to {@link RetryPolicy}. A host that answers 403 or 429
 * is left alone for the configured cooldown. Nothing is thrown: failures come back in the result.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";

    private final CrawlerProperties.Http config;
    private final HttpClient client;
    private final Semaphore inFlight;
    private final HostPacer pacer;
    private final RetryPolicy retryPolicy;

    public PoliteHttpClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.config = properties.getHttp();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
            .executor(httpExecutor)
            .build();
        this.inFlight = new Semaphore(config.getMaxConcurrentRequests());
        this.pacer = new HostPacer(config.getPerHostDelayMs());
        this.retryPolicy = RetryPolicy.from(config);
    }

    public HttpFetchResult get(String url) {
        URI uri = toUri(url);
        if (uri == null) {
            return HttpFetchResult.failed(url, FetchFailureKind.INVALID_URL, "not an absolute http(s) URL", Duration.ZERO);
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int attempt = 1;
        while (true) {
            Attempt outcome = send(url, uri, host);
            HttpFetchResult result = outcome.result();
            if (!retryPolicy.shouldRetry(result, attempt)) {
                return result;
            }
            long wait = retryPolicy.delayBeforeRetry(attempt, outcome.retryAfter());
            log.debug("Retrying {} in {} ms after {} (attempt {})", url, wait, result.describe(), attempt);
            if (!Pauses.sleep(wait)) {
                return result;
            }
            attempt++;
        }
    }

    private Attempt send(String url, URI uri, String host) {
        Instant started = Instant.now();
        boolean permitted = false;
        try {
            inFlight.acquire();
            permitted = true;
            if (!pacer.awaitTurn(host)) {
                return new Attempt(failed(url, FetchFailureKind.INTERRUPTED, "interrupted while waiting for " + host, started), null);
            }
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .header("User-Agent", config.getUserAgent())
                .header("Accept", HTML_ACCEPT)
                .header("Accept-Language", "en-GB,en;q=0.8")
                .GET()
                .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status == 403 || status == 429) {
                pacer.coolDown(host, config.getThrottleCooldownMs());
                log.warn("{} answered {}, holding requests to {} for {} ms", url, status, host, config.getThrottleCooldownMs());
            }
            Duration elapsed = Duration.between(started, Instant.now());
            log.debug("GET {} -> {} in {} ms", url, status, elapsed.toMillis());
            HttpFetchResult result = HttpFetchResult.response(
                url,
                response.uri(),
                status,
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                elapsed
            );
            Duration retryAfter = RetryPolicy.parseRetryAfter(response.headers().firstValue("Retry-After").orElse(null));
            return new Attempt(result, retryAfter);
        } catch (HttpTimeoutException e) {
            return new Attempt(failed(url, FetchFailureKind.TIMEOUT, e.getMessage(), started), null);
        } catch (IOException e) {
            return new Attempt(failed(url, FetchFailureKind.NETWORK, e.getClass().getSimpleName() + ": " + e.getMessage(), started), null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Attempt(failed(url, FetchFailureKind.INTERRUPTED, "interrupted", started), null);
        } finally {
            if (permitted) {
                inFlight.release();
            }
        }
    }

    private static HttpFetchResult failed(String url, FetchFailureKind kind, String message, Instant started) {
        return HttpFetchResult.failed(url, kind, message, Duration.between(started, Instant.now()));
    }

    static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return null;
            }
            return uri.getHost() == null || uri.getHost().isBlank() ? null : uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private record Attempt(HttpFetchResult result, Duration retryAfter) {}
}
