package com.catalogharvester.crawl.model;

public record PageError(String url, int statusCode, String message) {}
