package com.catalogharvester.crawl.model;

import java.time.Instant;

public record ErrorRecord(
    String itemId,
    String url,
    ErrorKind kind,
    String message,
    Instant occurredAt
) {}
