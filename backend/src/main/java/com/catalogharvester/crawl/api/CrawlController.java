package com.catalogharvester.crawl.api;

import com.catalogharvester.crawl.model.CrawlRunStatusResponse;
import com.catalogharvester.crawl.model.ItemCrawlRequest;
import com.catalogharvester.crawl.model.LinkCrawlRequest;
import com.catalogharvester.crawl.service.CrawlRunTracker;
import com.catalogharvester.crawl.service.ItemCrawlService;
import com.catalogharvester.crawl.service.LinkCrawlService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/crawl")
public class CrawlController {
    private final ItemCrawlService itemCrawlService;
    private final LinkCrawlService linkCrawlService;
    private final CrawlRunTracker runTracker;

    public CrawlController(
        ItemCrawlService itemCrawlService,
        LinkCrawlService linkCrawlService,
        CrawlRunTracker runTracker
    ) {
        this.itemCrawlService = itemCrawlService;
        this.linkCrawlService = linkCrawlService;
        this.runTracker = runTracker;
    }

    @PostMapping("/items")
    public ResponseEntity<Map<String, Object>> startItemCrawl(@RequestBody(required = false) ItemCrawlRequest request) {
        Instant startedAt = itemCrawlService.startAsync(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("mode", "items", "startedAt", startedAt));
    }

    @PostMapping("/links")
    public ResponseEntity<Map<String, Object>> startLinkCrawl(@RequestBody(required = false) LinkCrawlRequest request) {
        Instant startedAt = linkCrawlService.startAsync(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("mode", "links", "startedAt", startedAt));
    }

    @GetMapping("/status")
    public CrawlRunStatusResponse status() {
        return runTracker.status();
    }
}
