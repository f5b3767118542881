package com.logvault.application.usecase;

import com.logvault.application.exceptions.ImportFailedException;
import com.logvault.application.exceptions.LogVaultException;
import com.logvault.application.exceptions.SourceNotFoundException;
import com.logvault.application.exceptions.StorageException;
import com.logvault.application.ports.RecordStore;
import com.logvault.domain.ImportStats;
import com.logvault.infrastructure.LineSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Streams a line source into a {@link RecordStore} in batches.
 * <p>
 * Only the current line and the batch being filled are held in memory. Runs on the same importer
 * are executed one after another.
 */
public class RecordImporter {

    private static final Logger log = LoggerFactory.getLogger(RecordImporter.class);

    private final RecordStore store;
    private final ReentrantLock runLock = new ReentrantLock();

    public RecordImporter(RecordStore store) {
        this.store = store;
    }

    public ImportStats importFile(Path file, int batchSize, boolean deduplicate) {
        return importFile(file, new ImportRun(batchSize, deduplicate));
    }

    public ImportStats importFile(Path file, ImportRun run) {
        try (LineSource source = LineSource.open(file)) {
            return run(run, source);
        } catch (IOException e) {
            log.warn("Could not close {}: {}", file, e.getMessage());
            return run.snapshot();
        }
    }

    /**
     * Drains {@code source} into the store.
     *
     * @throws ImportFailedException if a batch cannot be written or the source stops being readable;
     *         carries the partial statistics and the kind of the underlying failure
     */
    public ImportStats run(ImportRun run, LineSource source) {
        runLock.lock();
        try {
            run.start();
            log.info("Starting import from: {} (deduplication {})",
                    source.getName(), run.isDeduplicate() ? "enabled" : "disabled");

            List<String> batch = new ArrayList<>(Math.min(run.getBatchSize(), 1 << 16));
            try {
                while (!run.isCancelRequested() && source.hasNext()) {
                    batch.add(source.next());
                    run.lineRead();
                    if (batch.size() >= run.getBatchSize()) {
                        flush(run, batch);
                        batch.clear();
                    }
                }
                if (!batch.isEmpty() && !run.isCancelRequested()) {
                    flush(run, batch);
                }
            } catch (LogVaultException e) {
                throw abort(run, source, e);
            } catch (UncheckedIOException e) {
                throw abort(run, source, new SourceNotFoundException(source.getName(), e.getCause()));
            }

            run.emptyLinesSkipped(source.getEmptyLines());
            run.finish();
            ImportStats stats = run.snapshot();
            if (run.isCancelRequested()) {
                log.warn("Import of {} cancelled after {} records", source.getName(), stats.imported());
            }
            logSummary(stats);
            return stats;
        } finally {
            runLock.unlock();
        }
    }

    private ImportFailedException abort(ImportRun run, LineSource source, LogVaultException cause) {
        run.emptyLinesSkipped(source.getEmptyLines());
        run.finish();
        ImportStats partial = run.snapshot();
        log.error("Import of {} failed after {} records", source.getName(), partial.imported(), cause);
        return new ImportFailedException(source.getName(), partial, cause);
    }

    private void flush(ImportRun run, List<String> batch) {
        List<String> toInsert = run.filter(batch);
        if (toInsert.isEmpty()) {
            return;
        }
        try {
            int inserted = store.insertBatch(toInsert, run.getBatchSize());
            run.recordsImported(inserted);
        } catch (StorageException e) {
            run.recordsImported(e.getCommittedBeforeFailure());
            throw e;
        }
    }

    private static void logSummary(ImportStats stats) {
        log.info("Import completed: {} lines read, {} imported, {} duplicates skipped, {} empty lines skipped",
                stats.totalLines(), stats.imported(), stats.duplicates(), stats.emptyLines());
        log.info("Duration: {} ms, speed: {} records/second",
                stats.duration().toMillis(), String.format("%.0f", stats.recordsPerSecond()));
    }
}
