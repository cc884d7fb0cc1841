package com.catalogharvester.crawl.page;

import com.catalogharvester.crawl.model.FetchFailureKind;

public class PageFetchException extends RuntimeException {
    private final String url;
    private final FetchFailureKind kind;
    private final int statusCode;

    public PageFetchException(String url, FetchFailureKind kind, int statusCode, String message) {
        super(message);
        this.url = url;
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public PageFetchException(String url, FetchFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.kind = kind;
        this.statusCode = 0;
    }

    public String getUrl() {
        return url;
    }

    public FetchFailureKind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
