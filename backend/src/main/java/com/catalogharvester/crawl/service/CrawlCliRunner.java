package com.catalogharvester.crawl.service;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.model.ItemCrawlRequest;
import com.catalogharvester.crawl.model.ItemCrawlSummary;
import com.catalogharvester.crawl.model.LinkCrawlRequest;
import com.catalogharvester.crawl.model.LinkCrawlSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final ItemCrawlService itemCrawlService;
    private final LinkCrawlService linkCrawlService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        ItemCrawlService itemCrawlService,
        LinkCrawlService linkCrawlService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.itemCrawlService = itemCrawlService;
        this.linkCrawlService = linkCrawlService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        String mode = properties.getCli().getMode() == null
            ? "items"
            : properties.getCli().getMode().trim().toLowerCase(Locale.ROOT);
        int exitCode = 0;
        switch (mode) {
            case "items": {
                ItemCrawlSummary summary = itemCrawlService.run(ItemCrawlRequest.defaults());
                log.info("Item crawl {} finished with status {}: {} products, {} errors",
                    summary.target(), summary.status(), summary.totalSucceeded(), summary.totalErrored());
                break;
            }
            case "links": {
                LinkCrawlSummary summary = linkCrawlService.run(LinkCrawlRequest.defaults());
                log.info("Link crawl {} finished: {} pages, {} unique images",
                    summary.domain(), summary.pagesCrawled(), summary.uniqueImages());
                break;
            }
            default:
                log.error("Unknown crawler.cli.mode '{}', expected items or links", mode);
                exitCode = 2;
        }

        if (properties.getCli().isExitAfterRun()) {
            int code = exitCode;
            int springExit = SpringApplication.exit(applicationContext, () -> code);
            System.exit(springExit);
        }
    }
}
