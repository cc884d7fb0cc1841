package com.catalogharvester.crawl.page;

public interface PageSource {

    /**
     * @throws PageFetchException on timeout, network failure or an error status
     */
    RenderedPage open(String url);
}
