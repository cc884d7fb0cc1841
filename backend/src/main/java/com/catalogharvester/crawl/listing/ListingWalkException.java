package com.catalogharvester.crawl.listing;

public class ListingWalkException extends RuntimeException {
    private final int pageNumber;

    public ListingWalkException(int pageNumber, String message, Throwable cause) {
        super(message, cause);
        this.pageNumber = pageNumber;
    }

    public int getPageNumber() {
        return pageNumber;
    }
}
