package com.logvault.config;

public record ImporterConfig(
        int batchSize,
        boolean deduplicate) {

    public static final int DEFAULT_BATCH_SIZE = 10_000;

    public ImporterConfig {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
    }

    public static ImporterConfig defaults() {
        return new ImporterConfig(DEFAULT_BATCH_SIZE, true);
    }
}
