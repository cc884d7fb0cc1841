package com.catalogharvester.crawl.model;

public enum CompatibilityMode {
    /** Compatibility table is not read at all. */
    SKIP,
    /** Only the sub-page visible on load. */
    SAMPLED,
    /** Every sub-page of the pagination control. */
    EXHAUSTIVE
}
