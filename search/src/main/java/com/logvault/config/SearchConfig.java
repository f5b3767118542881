package com.logvault.config;

public record SearchConfig(int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 30;

    public SearchConfig {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
    }

    public static SearchConfig defaults() {
        return new SearchConfig(DEFAULT_PAGE_SIZE);
    }
}
