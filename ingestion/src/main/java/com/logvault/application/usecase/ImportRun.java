package com.logvault.application.usecase;

import com.logvault.domain.ImportStats;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of a single import: counters, the run's {@link Deduplicator} and a stop flag.
 * Create one per import and drop it afterwards.
 */
public class ImportRun {

    private final int batchSize;
    private final boolean deduplicate;
    private final Deduplicator deduplicator;
    private final Clock clock;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private volatile long totalLines;
    private volatile long imported;
    private volatile long duplicates;
    private volatile long emptyLines;
    private volatile Instant startTime;
    private volatile Instant endTime;

    public ImportRun(int batchSize, boolean deduplicate) {
        this(batchSize, deduplicate, Clock.systemUTC());
    }

    public ImportRun(int batchSize, boolean deduplicate, Clock clock) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
        this.deduplicate = deduplicate;
        this.deduplicator = deduplicate ? new Deduplicator() : null;
        this.clock = clock;
    }

    // takes effect once the batch being written has committed
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isDeduplicate() {
        return deduplicate;
    }

    void start() {
        startTime = clock.instant();
    }

    void finish() {
        endTime = clock.instant();
    }

    void lineRead() {
        totalLines++;
    }

    void emptyLinesSkipped(long count) {
        emptyLines = count;
    }

    void recordsImported(long count) {
        imported += count;
    }

    List<String> filter(List<String> batch) {
        if (!deduplicate) {
            return batch;
        }
        List<String> unique = deduplicator.filter(batch);
        duplicates += batch.size() - unique.size();
        return unique;
    }

    public ImportStats snapshot() {
        Instant end = endTime != null ? endTime : clock.instant();
        return new ImportStats(totalLines, imported, duplicates, emptyLines, startTime, end, isCancelRequested());
    }
}
