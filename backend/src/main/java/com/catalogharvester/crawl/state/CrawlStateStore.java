package com.catalogharvester.crawl.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;

/**
 * Loads and writes item-mode checkpoints. Each write goes to a temp file that is then moved over
 * the checkpoint, so a crash mid-write leaves the previous checkpoint intact.
 * A failed write is fatal for the run.
 */
@Component
public class CrawlStateStore {
    private static final Logger log = LoggerFactory.getLogger(CrawlStateStore.class);

    private final ObjectMapper objectMapper;

    public CrawlStateStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Progress saved for the layout's target, or an empty progress when there is no checkpoint yet.
     */
    public CrawlProgress resume(RunLayout layout) {
        Path file = layout.checkpointFile();
        if (!Files.exists(file)) {
            log.info("No checkpoint for {}, starting fresh", layout.target());
            return new CrawlProgress(layout.target());
        }
        try {
            CheckpointData data = objectMapper.readValue(file.toFile(), CheckpointData.class);
            if (data.target() != null && !data.target().equals(layout.target())) {
                throw new CheckpointException(
                    "Checkpoint " + file + " belongs to " + data.target() + ", not " + layout.target(), null);
            }
            CrawlProgress progress = CrawlProgress.restore(
                new CheckpointData(layout.target(), data.updatedAt(), data.records(), data.errors()));
            log.info("Resuming {}: {} done, {} errors", layout.target(), progress.completedCount(), progress.erroredCount());
            return progress;
        } catch (IOException e) {
            throw new CheckpointException("Could not read checkpoint " + file, e);
        }
    }

    public void checkpoint(RunLayout layout, CrawlProgress progress) {
        Path file = layout.checkpointFile();
        try {
            Files.createDirectories(layout.directory());
            Path temp = Files.createTempFile(layout.directory(), "checkpoint-", ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), progress.snapshot(Instant.now()));
                move(temp, file);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Checkpoint {}: {} done, {} errors", layout.target(), progress.completedCount(), progress.erroredCount());
        } catch (IOException e) {
            throw new CheckpointException("Could not write checkpoint " + file, e);
        }
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
