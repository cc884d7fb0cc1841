package com.catalogharvester.crawl.link;

import com.catalogharvester.crawl.http.PoliteHttpClient;
import com.catalogharvester.crawl.model.HttpFetchResult;
import com.catalogharvester.crawl.model.LinkCrawlResult;
import com.catalogharvester.crawl.model.PageError;
import com.catalogharvester.crawl.model.PageSummary;
import com.catalogharvester.crawl.model.PageType;
import com.catalogharvester.crawl.util.Pauses;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Breadth-first discovery crawl over one site.
 * <p>
 * The calling thread owns the frontier: it hands URLs to a fixed pool of workers, takes their
 * completions one at a time, records them in the {@link CrawlRegistry} and queues newly found links.
 * Once the page budget is used up nothing new is scheduled and in-flight fetches drain.
 */
public class LinkFollowCrawler {
    private static final Logger log = LoggerFactory.getLogger(LinkFollowCrawler.class);

    private final PoliteHttpClient httpClient;
    private final LinkClassifier classifier;
    private final PageInspector inspector;
    private final FollowPolicy followPolicy;
    private final int concurrency;
    private final int delayMs;
    private final int maxPages;
    private final CrawlRegistry registry = new CrawlRegistry();

    public LinkFollowCrawler(
        PoliteHttpClient httpClient,
        LinkClassifier classifier,
        PageInspector inspector,
        FollowPolicy followPolicy,
        int concurrency,
        int delayMs,
        int maxPages
    ) {
        this.httpClient = httpClient;
        this.classifier = classifier;
        this.inspector = inspector;
        this.followPolicy = followPolicy;
        this.concurrency = Math.max(1, concurrency);
        this.delayMs = Math.max(0, delayMs);
        this.maxPages = Math.max(0, maxPages);
    }

    public CrawlRegistry registry() {
        return registry;
    }

    public LinkCrawlResult crawl(List<String> startUrls) {
        Deque<String> frontier = new ArrayDeque<>();
        for (String url : startUrls) {
            String normalized = FollowPolicy.normalize(url);
            if (normalized != null && !normalized.isEmpty() && registry.markSeen(normalized)) {
                frontier.add(normalized);
            }
        }

        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("link-crawl-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        CompletionService<FetchedPage> completions = new ExecutorCompletionService<>(workers);
        int inFlight = 0;
        boolean budgetReached = false;
        try {
            while (true) {
                while (inFlight < concurrency && !frontier.isEmpty() && hasBudget(inFlight)) {
                    String url = frontier.poll();
                    completions.submit(() -> fetch(url));
                    inFlight++;
                }
                if (inFlight == 0) {
                    break;
                }
                Future<FetchedPage> done;
                try {
                    done = completions.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Link crawl interrupted with {} fetches in flight", inFlight);
                    break;
                }
                inFlight--;
                FetchedPage page = resultOf(done);
                if (page == null) {
                    continue;
                }
                handle(page, frontier);
                if (maxPages > 0 && registry.pagesCrawled() >= maxPages && !budgetReached) {
                    budgetReached = true;
                    log.info("Page budget of {} reached, draining {} in-flight fetches", maxPages, inFlight);
                }
            }
        } finally {
            workers.shutdown();
        }
        if (!frontier.isEmpty()) {
            log.info("Link crawl stopped with {} queued URLs not fetched", frontier.size());
        }
        return new LinkCrawlResult(registry.pages(), registry.uniqueImages(), registry.errors(), budgetReached);
    }

    private boolean hasBudget(int inFlight) {
        return maxPages == 0 || registry.pagesCrawled() + inFlight < maxPages;
    }

    private FetchedPage resultOf(Future<FetchedPage> done) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Link crawl worker failed: {}", cause.getMessage());
            registry.recordError(new PageError(null, 0, cause.getClass().getSimpleName() + ": " + cause.getMessage()));
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private void handle(FetchedPage page, Deque<String> frontier) {
        if (page.error() != null) {
            registry.recordError(page.error());
            log.warn("Page error {}: {}", page.error().url(), page.error().message());
            return;
        }
        if (!page.finalUrl().equals(page.requestedUrl()) && !registry.markSeen(page.finalUrl())) {
            log.debug("{} redirected to already seen {}", page.requestedUrl(), page.finalUrl());
            return;
        }
        registry.recordPage(page.summary());
        log.info("Crawled [{}] {} - {} images", page.summary().pageType(), page.finalUrl(), page.summary().images().size());
        if (maxPages > 0 && registry.pagesCrawled() >= maxPages) {
            return;
        }
        for (String link : page.links()) {
            if (followPolicy.allows(link) && registry.markSeen(link)) {
                frontier.add(link);
            }
        }
    }

    private FetchedPage fetch(String url) {
        try {
            HttpFetchResult result = httpClient.get(url);
            if (result.failure() != null) {
                return FetchedPage.failed(url, new PageError(url, 0, result.describe()));
            }
            if (result.statusCode() >= 400) {
                return FetchedPage.failed(url, new PageError(url, result.statusCode(), "HTTP " + result.statusCode()));
            }
            String finalUrl = FollowPolicy.normalize(result.finalUrlOrRequested());
            Document document = Jsoup.parse(result.body() == null ? "" : result.body(), finalUrl);
            PageType type = classifier.classify(finalUrl);
            PageSummary summary = inspector.inspect(finalUrl, result.statusCode(), type, document);
            List<String> links = isHtml(result.contentType()) ? inspector.links(document) : List.of();
            return new FetchedPage(url, finalUrl, summary, links, null);
        } finally {
            Pauses.sleep(delayMs);
        }
    }

    private static boolean isHtml(String contentType) {
        return contentType == null || contentType.toLowerCase(Locale.ROOT).contains("html");
    }

    private record FetchedPage(
        String requestedUrl,
        String finalUrl,
        PageSummary summary,
        List<String> links,
        PageError error
    ) {
        static FetchedPage failed(String url, PageError error) {
            return new FetchedPage(url, url, null, List.of(), error);
        }
    }
}
