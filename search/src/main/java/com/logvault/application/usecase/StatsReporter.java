package com.logvault.application.usecase;

import com.logvault.application.dto.StatsDto;
import com.logvault.application.exceptions.LogVaultException;
import com.logvault.application.ports.RecordStore;
import com.logvault.domain.StoreStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class StatsReporter {

    private static final Logger log = LoggerFactory.getLogger(StatsReporter.class);
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final RecordStore store;

    public StatsReporter(RecordStore store) {
        this.store = store;
    }

    public StatsDto report() {
        try {
            StoreStats stats = store.stats();
            return new StatsDto(
                    stats.recordCount(),
                    toMegabytes(stats.sizeBytes()),
                    stats.path(),
                    stats.lastImport() == null ? null : stats.lastImport().toString(),
                    null);
        } catch (LogVaultException e) {
            log.error("Error getting stats: {}", e.getMessage());
            return StatsDto.failure(e.getMessage());
        }
    }

    static double toMegabytes(long bytes) {
        return BigDecimal.valueOf(bytes / BYTES_PER_MB)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
