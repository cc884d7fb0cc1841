package com.catalogharvester.crawl.model;

import java.util.Locale;

/**
 * Why a page could not be fetched. HTTP_STATUS means a response arrived with a non-2xx code.
 */
public enum FetchFailureKind {
    INVALID_URL,
    TIMEOUT,
    NETWORK,
    INTERRUPTED,
    HTTP_STATUS;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
