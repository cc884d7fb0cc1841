package com.catalogharvester.crawl.service;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.http.PoliteHttpClient;
import com.catalogharvester.crawl.link.FollowPolicy;
import com.catalogharvester.crawl.link.LinkClassifier;
import com.catalogharvester.crawl.link.LinkFollowCrawler;
import com.catalogharvester.crawl.link.LinkRules;
import com.catalogharvester.crawl.link.PageInspector;
import com.catalogharvester.crawl.model.LinkCrawlRequest;
import com.catalogharvester.crawl.model.LinkCrawlResult;
import com.catalogharvester.crawl.model.LinkCrawlSummary;
import com.catalogharvester.crawl.model.LinkScope;
import com.catalogharvester.crawl.model.PageError;
import com.catalogharvester.crawl.model.PageSummary;
import com.catalogharvester.crawl.output.LinkCrawlReportWriter;
import com.catalogharvester.crawl.state.IdentifierListFile;
import com.catalogharvester.crawl.state.RunLayout;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Link-following mode: breadth-first discovery over one site, reporting pages and images.
 */
@Service
public class LinkCrawlService {
    private static final Logger log = LoggerFactory.getLogger(LinkCrawlService.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final CrawlerProperties properties;
    private final PoliteHttpClient httpClient;
    private final LinkCrawlReportWriter reportWriter;
    private final ObjectMapper objectMapper;
    private final CrawlRunTracker runTracker;
    private final ExecutorService crawlRunExecutor;

    public LinkCrawlService(
        CrawlerProperties properties,
        PoliteHttpClient httpClient,
        LinkCrawlReportWriter reportWriter,
        ObjectMapper objectMapper,
        CrawlRunTracker runTracker,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.reportWriter = reportWriter;
        this.objectMapper = objectMapper;
        this.runTracker = runTracker;
        this.crawlRunExecutor = crawlRunExecutor;
    }

    public LinkCrawlSummary run(LinkCrawlRequest request) {
        RunSettings settings = resolve(request);
        Instant startedAt = runTracker.acquire("links");
        try {
            return execute(settings, startedAt);
        } finally {
            runTracker.release();
        }
    }

    public Instant startAsync(LinkCrawlRequest request) {
        RunSettings settings = resolve(request);
        Instant startedAt = runTracker.acquire("links");
        try {
            crawlRunExecutor.submit(() -> {
                try {
                    execute(settings, startedAt);
                } catch (RuntimeException e) {
                    log.error("Link crawl for {} failed", settings.domain(), e);
                } finally {
                    runTracker.release();
                }
            });
        } catch (RuntimeException e) {
            runTracker.release();
            throw e;
        }
        return startedAt;
    }

    RunSettings resolve(LinkCrawlRequest request) {
        LinkCrawlRequest safe = request == null ? LinkCrawlRequest.defaults() : request;
        CrawlerProperties.LinkFollow config = properties.getLinkFollow();
        String domain = safe.domain() != null && !safe.domain().isBlank() ? safe.domain().trim() : config.getDomain();
        if (domain == null || domain.isBlank()) {
            throw new InvalidRunConfigurationException("A domain is required for link-following mode (crawler.link-follow.domain)");
        }
        String startUrl = startUrl(domain.trim());
        URI uri;
        try {
            uri = URI.create(startUrl);
        } catch (IllegalArgumentException e) {
            throw new InvalidRunConfigurationException("Invalid domain: " + domain, e);
        }
        if (uri.getHost() == null) {
            throw new InvalidRunConfigurationException("Invalid domain: " + domain);
        }
        int maxPages = safe.maxPages() != null ? safe.maxPages() : config.getMaxPages();
        if (maxPages < 0) {
            throw new InvalidRunConfigurationException("maxPages must be 0 (unlimited) or positive, got " + maxPages);
        }
        int concurrency = safe.concurrency() != null ? safe.concurrency() : config.getConcurrency();
        if (concurrency < 1) {
            throw new InvalidRunConfigurationException("concurrency must be at least 1, got " + concurrency);
        }
        int delayMs = safe.delayMs() != null ? safe.delayMs() : config.getDelayMs();
        if (delayMs < 0) {
            throw new InvalidRunConfigurationException("delayMs must not be negative, got " + delayMs);
        }
        LinkScope scope = safe.scope() != null ? safe.scope() : config.getScope();
        return new RunSettings(domain.trim(), uri.getHost(), startUrl, scope, maxPages, concurrency, delayMs);
    }

    private LinkCrawlSummary execute(RunSettings settings, Instant startedAt) {
        CrawlerProperties.LinkFollow config = properties.getLinkFollow();
        LinkRules rules = LinkRules.from(config);
        Set<String> knownProducts = new LinkedHashSet<>(readOptionalList(config.getKnownProductFile(), "known product URLs"));
        Set<String> knownCategories = new LinkedHashSet<>(readOptionalList(config.getKnownCategoryFile(), "known category URLs"));
        List<String> startUrls = new ArrayList<>();
        startUrls.add(settings.startUrl());
        for (String seed : readOptionalList(config.getSeedFile(), "seed URLs")) {
            if (!startUrls.contains(seed)) {
                startUrls.add(seed);
            }
        }

        LinkFollowCrawler crawler = new LinkFollowCrawler(
            httpClient,
            new LinkClassifier(rules.productPatterns(), rules.categoryPatterns(), knownProducts, knownCategories),
            new PageInspector(objectMapper, settings.host(), rules.imageExcludePatterns(), config.getMinImageWidth(), config.getMinImageHeight()),
            new FollowPolicy(settings.host(), settings.scope(), rules),
            settings.concurrency(),
            settings.delayMs(),
            settings.maxPages()
        );
        log.info("Link crawl {} scope={} maxPages={} concurrency={} delayMs={} starts={}",
            settings.domain(), settings.scope(), settings.maxPages(), settings.concurrency(), settings.delayMs(), startUrls.size());
        LinkCrawlResult result = crawler.crawl(startUrls);

        String siteSlug = RunLayout.siteSlug(settings.domain());
        Path directory = Path.of(properties.getState().getOutputDir()).resolve(siteSlug);
        String base = siteSlug + "-" + settings.scope().name().toLowerCase(Locale.ROOT) + "-"
            + LocalDateTime.now().format(FILE_TIMESTAMP);
        Path pagesCsv = directory.resolve(base + ".csv");
        Path uniqueCsv = directory.resolve(base + "_unique.csv");
        Path auditCsv = directory.resolve(base + "_pages.csv");
        try {
            reportWriter.writePages(pagesCsv, result.pages());
            reportWriter.writeUniqueImages(uniqueCsv, result.images());
            reportWriter.writePageAudit(auditCsv, result.pages());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write link crawl reports for " + settings.domain(), e);
        }

        int imagesFound = 0;
        for (PageSummary page : result.pages()) {
            imagesFound += page.images().size();
        }
        LinkCrawlSummary summary = new LinkCrawlSummary(
            settings.domain(),
            settings.scope(),
            startedAt,
            Instant.now(),
            result.pages().size(),
            crawler.registry().pagesByType(),
            imagesFound,
            result.images().size(),
            result.errors().size(),
            result.budgetReached(),
            pagesCsv.toString(),
            uniqueCsv.toString(),
            auditCsv.toString()
        );
        runTracker.linkRunFinished(summary);
        log.info("Link crawl {} done: {} pages {}, {} unique images, {} errors{}",
            summary.domain(), summary.pagesCrawled(), summary.pagesByType(), summary.uniqueImages(), summary.errors(),
            summary.budgetReached() ? " (page budget reached)" : "");
        for (PageError error : result.errors().subList(0, Math.min(5, result.errors().size()))) {
            log.warn("  error {}: {}", error.url(), error.message());
        }
        return summary;
    }

    private List<String> readOptionalList(String file, String label) {
        if (file == null || file.isBlank()) {
            return List.of();
        }
        Path path = Path.of(file.trim());
        if (!Files.exists(path)) {
            log.warn("File with {} not found: {}", label, path);
            return List.of();
        }
        try {
            List<String> values = IdentifierListFile.read(path);
            log.info("Loaded {} {} from {}", values.size(), label, path);
            return values;
        } catch (IOException e) {
            throw new InvalidRunConfigurationException("Could not read " + label + " from " + path, e);
        }
    }

    static String startUrl(String domain) {
        if (domain.startsWith("http://") || domain.startsWith("https://")) {
            return domain.endsWith("/") ? domain : domain + "/";
        }
        return "https://" + domain.replaceAll("/+$", "") + "/";
    }

    record RunSettings(
        String domain,
        String host,
        String startUrl,
        LinkScope scope,
        int maxPages,
        int concurrency,
        int delayMs
    ) {}
}
