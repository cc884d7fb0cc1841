package com.catalogharvester.crawl.service;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.detail.DetailExtractor;
import com.catalogharvester.crawl.listing.ListingPaginator;
import com.catalogharvester.crawl.model.CompatibilityMode;
import com.catalogharvester.crawl.model.DetailRecord;
import com.catalogharvester.crawl.model.ErrorRecord;
import com.catalogharvester.crawl.model.ItemCrawlRequest;
import com.catalogharvester.crawl.model.ItemCrawlSummary;
import com.catalogharvester.crawl.model.ItemOutcome;
import com.catalogharvester.crawl.output.CsvRecordWriter;
import com.catalogharvester.crawl.output.RecordSink;
import com.catalogharvester.crawl.state.CheckpointException;
import com.catalogharvester.crawl.state.CrawlProgress;
import com.catalogharvester.crawl.state.CrawlStateStore;
import com.catalogharvester.crawl.state.IdentifierListFile;
import com.catalogharvester.crawl.state.RunLayout;
import com.catalogharvester.crawl.util.Pauses;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Sequential item mode: collect identifiers, then fetch and extract one item at a time,
 * checkpointing as it goes, and finally write the JSON dump and the product-import CSV.
 */
@Service
public class ItemCrawlService {
    private static final Logger log = LoggerFactory.getLogger(ItemCrawlService.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final int SAMPLE_ERROR_LIMIT = 10;

    private final CrawlerProperties properties;
    private final ListingPaginator listingPaginator;
    private final DetailExtractor detailExtractor;
    private final CrawlStateStore stateStore;
    private final RecordSink recordSink;
    private final CsvRecordWriter csvRecordWriter;
    private final ObjectMapper objectMapper;
    private final CrawlRunTracker runTracker;
    private final ExecutorService crawlRunExecutor;

    public ItemCrawlService(
        CrawlerProperties properties,
        ListingPaginator listingPaginator,
        DetailExtractor detailExtractor,
        CrawlStateStore stateStore,
        RecordSink recordSink,
        CsvRecordWriter csvRecordWriter,
        ObjectMapper objectMapper,
        CrawlRunTracker runTracker,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor
    ) {
        this.properties = properties;
        this.listingPaginator = listingPaginator;
        this.detailExtractor = detailExtractor;
        this.stateStore = stateStore;
        this.recordSink = recordSink;
        this.csvRecordWriter = csvRecordWriter;
        this.objectMapper = objectMapper;
        this.runTracker = runTracker;
        this.crawlRunExecutor = crawlRunExecutor;
    }

    public ItemCrawlSummary run(ItemCrawlRequest request) {
        RunSettings settings = resolve(request);
        Instant startedAt = runTracker.acquire("items");
        try {
            return execute(settings, startedAt);
        } finally {
            runTracker.release();
        }
    }

    /**
     * Validates the request, claims the run slot and runs in the background.
     */
    public Instant startAsync(ItemCrawlRequest request) {
        RunSettings settings = resolve(request);
        Instant startedAt = runTracker.acquire("items");
        try {
            crawlRunExecutor.submit(() -> {
                try {
                    execute(settings, startedAt);
                } catch (RuntimeException e) {
                    log.error("Item crawl for {} failed", settings.storeName(), e);
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

    RunSettings resolve(ItemCrawlRequest request) {
        ItemCrawlRequest safe = request == null ? ItemCrawlRequest.defaults() : request;
        String storeName = firstNonBlank(safe.storeName(), properties.getStore().getName());
        if (storeName == null) {
            throw new InvalidRunConfigurationException("A store name is required (crawler.store.name or request storeName)");
        }
        int maxItems = safe.maxItems() != null ? safe.maxItems() : properties.getStore().getMaxItems();
        if (maxItems < 0) {
            throw new InvalidRunConfigurationException("maxItems must be 0 (unlimited) or positive, got " + maxItems);
        }
        CompatibilityMode mode = safe.compatibilityMode() != null
            ? safe.compatibilityMode()
            : properties.getDetail().getCompatibilityMode();
        boolean resume = safe.resume() != null ? safe.resume() : properties.getState().isResume();
        String seedFile = firstNonBlank(safe.seedFile(), properties.getStore().getSeedFile());
        if (seedFile != null && !Files.isReadable(Path.of(seedFile))) {
            throw new InvalidRunConfigurationException("Seed file is not readable: " + seedFile);
        }
        return new RunSettings(storeName, maxItems, mode, resume, seedFile);
    }

    private ItemCrawlSummary execute(RunSettings settings, Instant startedAt) {
        RunLayout layout = RunLayout.forStore(
            properties.getState().getOutputDir(),
            properties.getStore().getBaseUrl(),
            settings.storeName()
        );
        log.info("Item crawl {} (compatibility={}, resume={}, maxItems={})",
            layout.target(), settings.mode(), settings.resume(), settings.maxItems());

        List<String> identifiers = loadIdentifiers(settings, layout);
        int discovered = identifiers.size();
        if (settings.maxItems() > 0 && identifiers.size() > settings.maxItems()) {
            identifiers = new ArrayList<>(identifiers.subList(0, settings.maxItems()));
        }
        log.info("Items to process for {}: {}", layout.target(), identifiers.size());

        CrawlProgress progress = settings.resume() ? stateStore.resume(layout) : new CrawlProgress(layout.target());
        int interval = properties.getState().getCheckpointInterval();
        int processed = 0;
        int skipped = 0;
        String status = "COMPLETED";
        boolean checkpointFailed = false;
        try {
            for (int i = 0; i < identifiers.size(); i++) {
                String itemId = identifiers.get(i);
                if (progress.isProcessed(itemId)) {
                    skipped++;
                    continue;
                }
                if (Thread.currentThread().isInterrupted()) {
                    status = "INTERRUPTED";
                    break;
                }
                log.info("[{}/{}] {}", i + 1, identifiers.size(), itemId);
                ItemOutcome outcome = detailExtractor.extract(itemId, settings.mode());
                progress.record(outcome);
                processed++;
                logOutcome(outcome);
                if (processed % interval == 0) {
                    stateStore.checkpoint(layout, progress);
                }
                if (i < identifiers.size() - 1 && !Pauses.sleep(properties.getStore().getItemDelayMs())) {
                    status = "INTERRUPTED";
                    break;
                }
            }
        } catch (CheckpointException e) {
            checkpointFailed = true;
            throw e;
        } finally {
            if (!checkpointFailed) {
                stateStore.checkpoint(layout, progress);
            }
        }

        String timestamp = LocalDateTime.now().format(FILE_TIMESTAMP);
        Path jsonPath = layout.jsonOutput(timestamp);
        Path csvPath = layout.csvOutput(timestamp);
        List<DetailRecord> records = progress.records();
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(jsonPath.toFile(), records);
            csvRecordWriter.write(csvPath, recordSink.toRows(records));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write outputs for " + layout.target(), e);
        }

        ItemCrawlSummary summary = summarize(layout, settings, startedAt, status, discovered, processed, skipped,
            progress, jsonPath, csvPath);
        runTracker.itemRunFinished(summary);
        logSummary(summary, progress.errors());
        return summary;
    }

    private List<String> loadIdentifiers(RunSettings settings, RunLayout layout) {
        Path saved = layout.identifiersFile();
        try {
            if (settings.resume() && Files.exists(saved)) {
                List<String> identifiers = IdentifierListFile.read(saved);
                log.info("Resumed {} identifiers from {}", identifiers.size(), saved);
                return identifiers;
            }
            List<String> identifiers;
            if (settings.seedFile() != null) {
                identifiers = IdentifierListFile.read(Path.of(settings.seedFile()));
                log.info("Loaded {} identifiers from seed file {}", identifiers.size(), settings.seedFile());
            } else {
                identifiers = listingPaginator.collectIdentifiers(settings.storeName());
            }
            IdentifierListFile.write(saved, identifiers);
            log.info("Saved {} identifiers to {}", identifiers.size(), saved);
            return identifiers;
        } catch (IOException e) {
            throw new CheckpointException("Could not read or save the identifier list for " + layout.target(), e);
        }
    }

    private void logOutcome(ItemOutcome outcome) {
        if (!outcome.isSuccess()) {
            return;
        }
        DetailRecord record = outcome.record();
        String title = record.title().length() > 55 ? record.title().substring(0, 55) : record.title();
        log.info("  {} | {} {} | {} images | compatibility {} ({} makes, {} years)",
            title,
            record.currency(),
            record.price() == null ? "?" : record.price(),
            record.images().size(),
            record.compatibility().status(),
            record.compatibility().makes().size(),
            record.compatibility().years().size());
    }

    private ItemCrawlSummary summarize(
        RunLayout layout,
        RunSettings settings,
        Instant startedAt,
        String status,
        int discovered,
        int processed,
        int skipped,
        CrawlProgress progress,
        Path jsonPath,
        Path csvPath
    ) {
        int withCompatibility = 0;
        for (DetailRecord record : progress.records()) {
            if (!record.compatibility().makes().isEmpty()) {
                withCompatibility++;
            }
        }
        List<String> sampleErrors = new ArrayList<>();
        for (ErrorRecord error : progress.errors()) {
            if (sampleErrors.size() >= SAMPLE_ERROR_LIMIT) {
                break;
            }
            sampleErrors.add(error.itemId() + ": " + error.kind() + " " + error.message());
        }
        return new ItemCrawlSummary(
            layout.target(),
            startedAt,
            Instant.now(),
            status,
            discovered,
            processed,
            skipped,
            progress.completedCount(),
            progress.erroredCount(),
            withCompatibility,
            layout.checkpointFile().toString(),
            jsonPath.toString(),
            csvPath.toString(),
            sampleErrors
        );
    }

    private void logSummary(ItemCrawlSummary summary, List<ErrorRecord> errors) {
        log.info("Item crawl {} {}: {} products ({} with compatibility), {} errors, {} processed this run, {} skipped",
            summary.target(),
            summary.status(),
            summary.totalSucceeded(),
            summary.withCompatibility(),
            summary.totalErrored(),
            summary.itemsProcessed(),
            summary.itemsSkipped());
        log.info("Outputs: json={} csv={}", summary.jsonPath(), summary.csvPath());
        if (!errors.isEmpty()) {
            for (String error : summary.sampleErrors()) {
                log.warn("  error {}", error);
            }
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    record RunSettings(
        String storeName,
        int maxItems,
        CompatibilityMode mode,
        boolean resume,
        String seedFile
    ) {}
}
