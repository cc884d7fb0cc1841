package com.catalogharvester.crawl.model;

public enum CompatibilityStatus {
    NOT_EXTRACTED,
    ABSENT,
    EMPTY,
    PRESENT
}
