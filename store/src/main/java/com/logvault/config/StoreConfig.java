package com.logvault.config;

public record StoreConfig(
        String dbPath,
        long openTimeoutMs,
        int maxPoolSize) {

    public static final String DEFAULT_DB_PATH = "logs_database.db";
    public static final long DEFAULT_OPEN_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_POOL_SIZE = 8;

    public StoreConfig {
        if (dbPath == null || dbPath.isBlank()) {
            throw new IllegalArgumentException("dbPath cannot be null or empty");
        }
        if (openTimeoutMs < 250) {
            throw new IllegalArgumentException("openTimeoutMs must be at least 250ms");
        }
        if (maxPoolSize < 1) {
            throw new IllegalArgumentException("maxPoolSize must be positive");
        }
    }

    public static StoreConfig at(String dbPath) {
        return new StoreConfig(dbPath, DEFAULT_OPEN_TIMEOUT_MS, DEFAULT_POOL_SIZE);
    }
}
