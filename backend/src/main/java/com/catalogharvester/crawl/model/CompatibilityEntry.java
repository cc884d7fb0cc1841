package com.catalogharvester.crawl.model;

/**
 * One (make, year) pair. The year is always a single token, ranges are expanded before an entry is built.
 */
public record CompatibilityEntry(String make, String year) {}
