package com.catalogharvester.crawl.page;

import org.jsoup.nodes.Document;

/**
 * A fetched page as seen by the extractors. Browser-backed pages can switch the
 * sub-table pagination in place; static pages cannot.
 */
public interface RenderedPage {

    String url();

    String title();

    /** Snapshot of the current DOM; refreshed after {@link #activateSubPage}. */
    Document document();

    /**
     * Clicks the pagination button labelled {@code pageNumber} inside {@code containerSelector}
     * and waits for the table to re-render.
     *
     * @return false when the button is missing, hidden or could not be activated
     */
    boolean activateSubPage(String containerSelector, String buttonSelector, int pageNumber);

    /** Re-reads the page after a wait, used to re-check interstitials. */
    RenderedPage recheck();
}
