package com.catalogharvester.crawl.model;

public record ImageRef(String src, String alt) {}
