package com.catalogharvester.crawl.listing;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.model.ListingPage;
import com.catalogharvester.crawl.page.PageFetchException;
import com.catalogharvester.crawl.page.PageSource;
import com.catalogharvester.crawl.page.RenderedPage;
import com.catalogharvester.crawl.util.Pauses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;

/**
 * Walks a paginated store listing page by page until it converges.
 * <p>
 * After each page: no identifiers at all means the catalog ended; identifiers that are all
 * already known means pagination wrapped or stalled. Either stops the walk. A fetch failure
 * is fatal for the walk and is not retried here.
 */
@Service
public class ListingPaginator {
    private static final Logger log = LoggerFactory.getLogger(ListingPaginator.class);

    private final PageSource pageSource;
    private final ItemIdentifierExtractor identifierExtractor;
    private final CrawlerProperties properties;

    public ListingPaginator(
        @Qualifier("catalogPageSource") PageSource pageSource,
        ItemIdentifierExtractor identifierExtractor,
        CrawlerProperties properties
    ) {
        this.pageSource = pageSource;
        this.identifierExtractor = identifierExtractor;
        this.properties = properties;
    }

    /**
     * Lazy walk over the listing of {@code storeName}; each iteration fetches one page.
     */
    public Iterable<ListingPage> walk(String storeName, int pageSize) {
        return () -> new ListingIterator(storeName, pageSize);
    }

    /**
     * Runs the walk to completion and returns the sorted union of all identifiers seen.
     */
    public List<String> collectIdentifiers(String storeName) {
        Set<String> union = new TreeSet<>();
        int pages = 0;
        for (ListingPage page : walk(storeName, properties.getStore().getPageSize())) {
            union.addAll(page.identifiers());
            pages++;
        }
        log.info("Listing walk for {} finished after {} pages with {} identifiers", storeName, pages, union.size());
        return new ArrayList<>(union);
    }

    String listingUrl(String storeName, int pageNumber, int pageSize) {
        CrawlerProperties.Store store = properties.getStore();
        String base = store.getBaseUrl() == null ? "" : store.getBaseUrl().replaceAll("/+$", "");
        return store.getListingUrlTemplate()
            .replace("{base}", base)
            .replace("{store}", URLEncoder.encode(storeName, StandardCharsets.UTF_8))
            .replace("{page}", String.valueOf(pageNumber))
            .replace("{pageSize}", String.valueOf(pageSize));
    }

    private final class ListingIterator implements Iterator<ListingPage> {
        private final String storeName;
        private final int pageSize;
        private final Set<String> seen = new LinkedHashSet<>();
        private int nextPage = 1;
        private boolean finished;
        private ListingPage pending;

        private ListingIterator(String storeName, int pageSize) {
            this.storeName = storeName;
            this.pageSize = pageSize;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            pending = fetchNext();
            return pending != null;
        }

        @Override
        public ListingPage next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ListingPage page = pending;
            pending = null;
            return page;
        }

        private ListingPage fetchNext() {
            int pageNumber = nextPage++;
            if (pageNumber > 1 && !Pauses.sleep(properties.getStore().getPageDelayMs())) {
                finished = true;
                return null;
            }
            String url = listingUrl(storeName, pageNumber, pageSize);
            Set<String> identifiers;
            try {
                RenderedPage page = pageSource.open(url);
                identifiers = identifierExtractor.extract(page.document());
            } catch (PageFetchException e) {
                finished = true;
                throw new ListingWalkException(pageNumber, "Listing page " + pageNumber + " failed: " + e.getMessage(), e);
            }

            if (identifiers.isEmpty()) {
                log.info("Listing page {} has no items, end of catalog", pageNumber);
                finished = true;
                return new ListingPage(pageNumber, url, List.of(), 0);
            }
            int before = seen.size();
            seen.addAll(identifiers);
            int added = seen.size() - before;
            if (added == 0) {
                log.info("Listing page {} has no new items, pagination converged", pageNumber);
                finished = true;
            } else {
                log.info("Listing page {}: {} items ({} new, {} total)", pageNumber, identifiers.size(), added, seen.size());
            }
            return new ListingPage(pageNumber, url, new ArrayList<>(identifiers), added);
        }
    }
}
