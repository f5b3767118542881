package com.logvault.domain;

import java.util.List;

public record SearchResult(
        String query,
        List<String> records,
        long totalMatches,
        int limit,
        int offset) {

    public SearchResult {
        records = List.copyOf(records);
    }

    public static SearchResult empty(String query, int limit, int offset) {
        return new SearchResult(query, List.of(), 0, limit, offset);
    }

    public boolean hasMore() {
        return offset + records.size() < totalMatches;
    }
}
