package com.catalogharvester.crawl.model;

import java.net.URI;
import java.time.Duration;

/**
 * Outcome of one GET. Either a response arrived ({@code failure == null}, any status code)
 * or the request never completed and {@code failure} says why.
 */
public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Duration elapsed,
    FetchFailureKind failure,
    String failureMessage
) {
    public static HttpFetchResult response(
        String requestedUrl,
        URI finalUri,
        int statusCode,
        String body,
        String contentType,
        Duration elapsed
    ) {
        return new HttpFetchResult(requestedUrl, finalUri, statusCode, body, contentType, elapsed, null, null);
    }

    public static HttpFetchResult failed(String requestedUrl, FetchFailureKind failure, String message, Duration elapsed) {
        return new HttpFetchResult(requestedUrl, null, 0, null, null, elapsed, failure, message);
    }

    public boolean isSuccessful() {
        return failure == null && statusCode >= 200 && statusCode < 300;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public String describe() {
        if (failure != null) {
            return failureMessage == null ? failure.code() : failure.code() + ": " + failureMessage;
        }
        return "HTTP " + statusCode;
    }
}
