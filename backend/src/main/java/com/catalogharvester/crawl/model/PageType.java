package com.catalogharvester.crawl.model;

public enum PageType {
    PRODUCT,
    CATEGORY,
    OTHER
}
