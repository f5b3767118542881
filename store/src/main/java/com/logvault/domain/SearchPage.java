package com.logvault.domain;

import java.util.List;

public record SearchPage(
        List<String> records,
        long totalMatches) {

    private static final SearchPage EMPTY = new SearchPage(List.of(), 0);

    public SearchPage {
        records = List.copyOf(records);
    }

    public static SearchPage empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
