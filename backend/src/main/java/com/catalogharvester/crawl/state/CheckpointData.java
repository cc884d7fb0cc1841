package com.catalogharvester.crawl.state;

import com.catalogharvester.crawl.model.DetailRecord;
import com.catalogharvester.crawl.model.ErrorRecord;

import java.time.Instant;
import java.util.List;

/** On-disk shape of a checkpoint file. */
public record CheckpointData(
    String target,
    Instant updatedAt,
    List<DetailRecord> records,
    List<ErrorRecord> errors
) {
    public CheckpointData {
        records = records == null ? List.of() : records;
        errors = errors == null ? List.of() : errors;
    }
}
