package com.catalogharvester.crawl.model;

public enum ErrorKind {
    FETCH_TIMEOUT,
    FETCH_FAILED,
    BLOCKED_PAGE,
    MALFORMED_PAGE
}
