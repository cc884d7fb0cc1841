package com.catalogharvester.crawl.link;

import com.catalogharvester.crawl.model.ImageRef;
import com.catalogharvester.crawl.model.PageError;
import com.catalogharvester.crawl.model.PageSummary;
import com.catalogharvester.crawl.model.PageType;
import com.catalogharvester.crawl.model.UniqueImage;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Accumulated state of one link-following run. Every read and write goes through the same lock,
 * so a URL is queued at most once and an image's page list never double counts a page.
 */
public class CrawlRegistry {
    private final Object lock = new Object();
    private final Set<String> seenUrls = new HashSet<>();
    private final List<PageSummary> pages = new ArrayList<>();
    private final Map<String, ImageAccumulator> images = new TreeMap<>();
    private final List<PageError> errors = new ArrayList<>();

    /**
     * @return true when the URL had not been seen before and is now claimed by the caller
     */
    public boolean markSeen(String url) {
        synchronized (lock) {
            return seenUrls.add(url);
        }
    }

    public void recordPage(PageSummary page) {
        synchronized (lock) {
            pages.add(page);
            for (ImageRef image : page.images()) {
                ImageAccumulator acc = images.computeIfAbsent(image.src(), src -> new ImageAccumulator(image.alt()));
                if (!acc.foundOn.contains(page.url())) {
                    acc.foundOn.add(page.url());
                }
            }
        }
    }

    public void recordError(PageError error) {
        synchronized (lock) {
            errors.add(error);
        }
    }

    public int pagesCrawled() {
        synchronized (lock) {
            return pages.size();
        }
    }

    public int seenCount() {
        synchronized (lock) {
            return seenUrls.size();
        }
    }

    public List<PageSummary> pages() {
        synchronized (lock) {
            return List.copyOf(pages);
        }
    }

    public List<PageError> errors() {
        synchronized (lock) {
            return List.copyOf(errors);
        }
    }

    /** Unique images sorted by URL. */
    public List<UniqueImage> uniqueImages() {
        synchronized (lock) {
            List<UniqueImage> out = new ArrayList<>(images.size());
            images.forEach((src, acc) -> out.add(new UniqueImage(src, acc.alt, acc.foundOn)));
            return out;
        }
    }

    public Map<PageType, Integer> pagesByType() {
        synchronized (lock) {
            Map<PageType, Integer> counts = new EnumMap<>(PageType.class);
            for (PageSummary page : pages) {
                counts.merge(page.pageType(), 1, Integer::sum);
            }
            return counts;
        }
    }

    private static final class ImageAccumulator {
        private final String alt;
        private final List<String> foundOn = new ArrayList<>();

        private ImageAccumulator(String alt) {
            this.alt = alt;
        }
    }
}
