package com.catalogharvester.crawl.state;

import com.catalogharvester.crawl.model.DetailRecord;
import com.catalogharvester.crawl.model.ErrorRecord;
import com.catalogharvester.crawl.model.ItemOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Which identifiers a run has completed or errored, with their results. Append-only: an
 * identifier that has an outcome keeps it, so completed plus errored never shrinks.
 * Owned by exactly one run; not thread-safe.
 */
public class CrawlProgress {
    private final String target;
    private final Map<String, DetailRecord> records = new LinkedHashMap<>();
    private final Map<String, ErrorRecord> errors = new LinkedHashMap<>();

    public CrawlProgress(String target) {
        this.target = target;
    }

    public static CrawlProgress restore(CheckpointData data) {
        CrawlProgress progress = new CrawlProgress(data.target());
        for (DetailRecord record : data.records()) {
            progress.records.putIfAbsent(record.itemId(), record);
        }
        for (ErrorRecord error : data.errors()) {
            if (!progress.records.containsKey(error.itemId())) {
                progress.errors.putIfAbsent(error.itemId(), error);
            }
        }
        return progress;
    }

    /**
     * @return false when the identifier already had an outcome (the new one is ignored)
     */
    public boolean record(ItemOutcome outcome) {
        if (isProcessed(outcome.itemId())) {
            return false;
        }
        if (outcome.isSuccess()) {
            records.put(outcome.itemId(), outcome.record());
        } else {
            errors.put(outcome.itemId(), outcome.error());
        }
        return true;
    }

    public boolean isProcessed(String itemId) {
        return records.containsKey(itemId) || errors.containsKey(itemId);
    }

    public String target() {
        return target;
    }

    public List<DetailRecord> records() {
        return new ArrayList<>(records.values());
    }

    public List<ErrorRecord> errors() {
        return new ArrayList<>(errors.values());
    }

    public int completedCount() {
        return records.size();
    }

    public int erroredCount() {
        return errors.size();
    }

    public CheckpointData snapshot(Instant at) {
        return new CheckpointData(target, at, records(), errors());
    }
}
