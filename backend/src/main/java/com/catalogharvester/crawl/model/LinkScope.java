package com.catalogharvester.crawl.model;

public enum LinkScope {
    CATEGORY,
    PRODUCT,
    BLOG,
    /** Every internal link. */
    ALL,
    /** Product and category links. */
    FULL
}
