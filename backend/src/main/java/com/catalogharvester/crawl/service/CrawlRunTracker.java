package com.catalogharvester.crawl.service;

import com.catalogharvester.crawl.model.CrawlRunStatusResponse;
import com.catalogharvester.crawl.model.ItemCrawlSummary;
import com.catalogharvester.crawl.model.LinkCrawlSummary;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Allows one crawl run at a time per process and remembers the last summary of each mode.
 */
@Component
public class CrawlRunTracker {
    private final AtomicReference<ActiveRun> active = new AtomicReference<>();
    private volatile ItemCrawlSummary lastItemRun;
    private volatile LinkCrawlSummary lastLinkRun;

    public Instant acquire(String mode) {
        ActiveRun run = new ActiveRun(mode, Instant.now());
        if (!active.compareAndSet(null, run)) {
            ActiveRun current = active.get();
            String description = current == null ? "another run" : current.mode() + " run started " + current.startedAt();
            throw new ActiveCrawlRunException("A crawl is already running: " + description);
        }
        return run.startedAt();
    }

    public void release() {
        active.set(null);
    }

    public void itemRunFinished(ItemCrawlSummary summary) {
        lastItemRun = summary;
    }

    public void linkRunFinished(LinkCrawlSummary summary) {
        lastLinkRun = summary;
    }

    public CrawlRunStatusResponse status() {
        ActiveRun run = active.get();
        return new CrawlRunStatusResponse(
            run != null,
            run == null ? null : run.mode(),
            run == null ? null : run.startedAt(),
            lastItemRun,
            lastLinkRun
        );
    }

    private record ActiveRun(String mode, Instant startedAt) {}
}
