package com.logvault.domain;

import java.time.Instant;

public record StoreStats(
        long recordCount,
        long sizeBytes,
        String path,
        Instant lastImport) {
}
