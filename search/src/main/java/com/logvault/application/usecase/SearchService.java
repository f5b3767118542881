package com.logvault.application.usecase;

import com.logvault.application.ports.RecordStore;
import com.logvault.config.SearchConfig;
import com.logvault.domain.MatchExpression;
import com.logvault.domain.SearchPage;
import com.logvault.domain.SearchResult;
import com.logvault.infrastructure.query.QuerySanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final RecordStore store;
    private final SearchConfig config;

    public SearchService(RecordStore store, SearchConfig config) {
        this.store = store;
        this.config = config;
    }

    public SearchResult search(String rawQuery) {
        return search(rawQuery, config.pageSize(), 0);
    }

    /**
     * Sanitizes {@code rawQuery} and returns one ranked page. {@code limit} values below one or above
     * the configured page size fall back to the page size.
     *
     * @throws com.logvault.application.exceptions.QueryException if the store rejects the expression
     */
    public SearchResult search(String rawQuery, int limit, int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative: " + offset);
        }
        int pageSize = limit < 1 || limit > config.pageSize() ? config.pageSize() : limit;

        MatchExpression match = QuerySanitizer.sanitize(rawQuery);
        if (match.isEmpty()) {
            return SearchResult.empty(rawQuery, pageSize, offset);
        }

        SearchPage page = store.search(match.expression(), pageSize, offset);
        log.info("Search for '{}': {} total, {} returned", rawQuery, page.totalMatches(), page.records().size());
        return new SearchResult(rawQuery, page.records(), page.totalMatches(), pageSize, offset);
    }
}
