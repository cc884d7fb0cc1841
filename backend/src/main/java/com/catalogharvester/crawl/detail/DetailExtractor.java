package com.catalogharvester.crawl.detail;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.compat.AttributeTableExtractor;
import com.catalogharvester.crawl.model.CompatibilityMode;
import com.catalogharvester.crawl.model.CompatibilityStatus;
import com.catalogharvester.crawl.model.CompatibilityTable;
import com.catalogharvester.crawl.model.DetailRecord;
import com.catalogharvester.crawl.model.ErrorKind;
import com.catalogharvester.crawl.model.ErrorRecord;
import com.catalogharvester.crawl.model.ItemOutcome;
import com.catalogharvester.crawl.model.FetchFailureKind;
import com.catalogharvester.crawl.page.PageFetchException;
import com.catalogharvester.crawl.page.PageSource;
import com.catalogharvester.crawl.page.RenderedPage;
import com.catalogharvester.crawl.util.Pauses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fetches one item's detail page and turns it into a {@link DetailRecord} or an {@link ErrorRecord}.
 * Nothing thrown while handling a single item escapes {@link #extract}.
 */
@Service
public class DetailExtractor {
    private static final Logger log = LoggerFactory.getLogger(DetailExtractor.class);

    private final PageSource pageSource;
    private final List<ExtractionStrategy> strategies;
    private final AttributeTableExtractor attributeTableExtractor;
    private final CrawlerProperties properties;

    public DetailExtractor(
        @Qualifier("catalogPageSource") PageSource pageSource,
        List<ExtractionStrategy> strategies,
        AttributeTableExtractor attributeTableExtractor,
        CrawlerProperties properties
    ) {
        this.pageSource = pageSource;
        this.strategies = List.copyOf(strategies);
        this.attributeTableExtractor = attributeTableExtractor;
        this.properties = properties;
    }

    public ItemOutcome extract(String itemId, CompatibilityMode mode) {
        String url = itemUrl(itemId);
        try {
            RenderedPage page = pageSource.open(url);
            if (isBlocked(page.title())) {
                log.warn("Item {} looks blocked (title '{}'), waiting once before re-checking", itemId, page.title());
                if (!Pauses.sleep(properties.getDetail().getBlockedRetryWaitMs())) {
                    return failure(itemId, url, ErrorKind.FETCH_FAILED, "Interrupted while waiting on a blocked page");
                }
                page = page.recheck();
                if (isBlocked(page.title())) {
                    return failure(itemId, url, ErrorKind.BLOCKED_PAGE, "Blocked page: interstitial still present after retry");
                }
            }

            PartialProduct merged = mergeStrategies(page);
            if (merged.title() == null) {
                return failure(itemId, url, ErrorKind.MALFORMED_PAGE,
                    "No title in structured data, specification rows or heading");
            }
            CompatibilityTable compatibility = extractCompatibility(itemId, page, mode);
            String currency = merged.currency() != null ? merged.currency() : properties.getDetail().getDefaultCurrency();
            DetailRecord record = new DetailRecord(
                itemId,
                url,
                merged.title(),
                merged.price(),
                currency,
                merged.condition(),
                merged.availability(),
                merged.brand(),
                merged.mpn(),
                merged.productType(),
                merged.description(),
                merged.images(),
                merged.specifics(),
                compatibility,
                Instant.now()
            );
            return ItemOutcome.success(record);
        } catch (PageFetchException e) {
            ErrorKind kind = e.getKind() == FetchFailureKind.TIMEOUT ? ErrorKind.FETCH_TIMEOUT : ErrorKind.FETCH_FAILED;
            return failure(itemId, url, kind, e.getMessage());
        } catch (RuntimeException e) {
            return failure(itemId, url, ErrorKind.FETCH_FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public String itemUrl(String itemId) {
        if (itemId.startsWith("http://") || itemId.startsWith("https://")) {
            return itemId;
        }
        CrawlerProperties.Store store = properties.getStore();
        String base = store.getBaseUrl() == null ? "" : store.getBaseUrl().replaceAll("/+$", "");
        return store.getItemUrlTemplate().replace("{base}", base).replace("{id}", itemId);
    }

    PartialProduct mergeStrategies(RenderedPage page) {
        PartialProduct merged = PartialProduct.empty();
        for (ExtractionStrategy strategy : strategies) {
            Optional<PartialProduct> partial = strategy.extract(page.document());
            if (partial.isPresent()) {
                merged = merged.fillFrom(partial.get());
            } else {
                log.debug("Strategy {} found nothing on {}", strategy.name(), page.url());
            }
        }
        return merged;
    }

    private CompatibilityTable extractCompatibility(String itemId, RenderedPage page, CompatibilityMode mode) {
        try {
            return attributeTableExtractor.extract(page, mode);
        } catch (RuntimeException e) {
            log.warn("Compatibility extraction failed for item {}: {}", itemId, e.getMessage());
            return new CompatibilityTable(CompatibilityStatus.EMPTY, List.of(), null, null, 0, 0, true, "extraction_error");
        }
    }

    private boolean isBlocked(String title) {
        if (title == null || title.isBlank()) {
            return false;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        for (String marker : properties.getDetail().getBlockedTitleMarkers()) {
            if (marker != null && !marker.isBlank() && lower.contains(marker.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private ItemOutcome failure(String itemId, String url, ErrorKind kind, String message) {
        log.warn("Item {} failed ({}): {}", itemId, kind, message);
        return ItemOutcome.failure(new ErrorRecord(itemId, url, kind, message, Instant.now()));
    }
}
