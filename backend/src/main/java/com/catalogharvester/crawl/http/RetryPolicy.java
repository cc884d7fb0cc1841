package com.catalogharvester.crawl.http;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.model.FetchFailureKind;
import com.catalogharvester.crawl.model.HttpFetchResult;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Which fetch outcomes are repeated and how long to wait before doing so. Timeouts, connection
 * errors, 408, 429 and 5xx are transient; anything else is final on the first answer.
 */
final class RetryPolicy {
    private final int maxRetries;
    private final long baseDelayMillis;
    private final long maxDelayMillis;

    RetryPolicy(int maxRetries, long baseDelayMillis, long maxDelayMillis) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelayMillis = Math.max(0, baseDelayMillis);
        this.maxDelayMillis = Math.max(0, maxDelayMillis);
    }

    static RetryPolicy from(CrawlerProperties.Http http) {
        return new RetryPolicy(http.getMaxRetries(), http.getRetryBaseDelayMs(), http.getRetryMaxDelayMs());
    }

    /**
     * @param attempt 1-based number of the attempt that produced {@code result}
     */
    boolean shouldRetry(HttpFetchResult result, int attempt) {
        if (attempt > maxRetries) {
            return false;
        }
        if (result.failure() != null) {
            return result.failure() == FetchFailureKind.TIMEOUT || result.failure() == FetchFailureKind.NETWORK;
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    /**
     * Exponential backoff with jitter in [delay/2, delay]. A server-sent Retry-After replaces the
     * computed delay; both are capped at the configured maximum.
     */
    long delayBeforeRetry(int attempt, Duration retryAfter) {
        long delay;
        if (retryAfter != null) {
            delay = retryAfter.toMillis();
        } else {
            int shift = Math.min(20, Math.max(0, attempt - 1));
            delay = baseDelayMillis << shift;
            if (delay > 1) {
                delay = delay / 2 + ThreadLocalRandom.current().nextLong(delay / 2 + 1);
            }
        }
        return Math.max(0, Math.min(delay, maxDelayMillis));
    }

    /**
     * Reads a delta-seconds Retry-After value; HTTP dates and garbage yield null.
     */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
