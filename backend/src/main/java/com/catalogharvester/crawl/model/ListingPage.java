package com.catalogharvester.crawl.model;

import java.util.List;

public record ListingPage(
    int pageNumber,
    String url,
    List<String> identifiers,
    int newIdentifiers
) {}
