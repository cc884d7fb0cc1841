package com.catalogharvester.crawl.model;

/**
 * Result of processing one item: exactly one of {@code record} and {@code error} is set.
 */
public record ItemOutcome(String itemId, DetailRecord record, ErrorRecord error) {

    public static ItemOutcome success(DetailRecord record) {
        return new ItemOutcome(record.itemId(), record, null);
    }

    public static ItemOutcome failure(ErrorRecord error) {
        return new ItemOutcome(error.itemId(), null, error);
    }

    public boolean isSuccess() {
        return record != null;
    }
}
