package com.logvault.application.usecase;

import com.logvault.config.SearchConfig;
import com.logvault.config.StoreConfig;
import com.logvault.domain.SearchResult;
import com.logvault.infrastructure.SqliteRecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class SearchServiceTest {

    @TempDir
    Path tempDir;

    private SqliteRecordStore store;
    private SearchService searchService;

    @BeforeEach
    void setup() {
        store = SqliteRecordStore.open(StoreConfig.at(tempDir.resolve("search.db").toString()));
        searchService = new SearchService(store, new SearchConfig(5));
        store.insertBatch(List.of(
                "alpha only here",
                "beta only here",
                "alpha and beta together",
                "neither word present",
                "a b c letters"), 100);
    }

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    void empty_and_blank_queries_return_nothing() {
        for (String q : new String[]{"", "   "}) {
            SearchResult result = searchService.search(q, 10, 0);
            assertEquals(List.of(), result.records());
            assertEquals(0, result.totalMatches());
        }
    }

    @Test
    void multi_token_query_is_disjunctive() {
        SearchResult result = searchService.search("alpha beta");

        assertEquals(3, result.totalMatches());
        assertTrue(result.records().contains("alpha only here"));
        assertTrue(result.records().contains("beta only here"));
        assertFalse(result.records().contains("neither word present"));
    }

    @Test
    void repeated_search_is_deterministic() {
        SearchResult first = searchService.search("alpha beta here");
        SearchResult second = searchService.search("alpha beta here");

        assertEquals(first.records(), second.records());
        assertEquals(first.totalMatches(), second.totalMatches());
    }

    @Test
    void reserved_characters_never_reach_the_engine() {
        SearchResult result = assertDoesNotThrow(() -> searchService.search("a*b\"c"));

        assertEquals(List.of("a b c letters"), result.records());
    }

    @Test
    void nul_characters_never_reach_the_engine() {
        SearchResult split = assertDoesNotThrow(() -> searchService.search("a\u0000b"));
        SearchResult lone = assertDoesNotThrow(() -> searchService.search("\u0000"));

        assertEquals(List.of("a b c letters"), split.records());
        assertEquals(0, lone.totalMatches());
    }

    @Test
    void limit_is_capped_by_page_size() {
        store.insertBatch(IntStream.range(0, 12)
                .mapToObj(i -> "paged record " + i)
                .collect(Collectors.toList()), 100);

        SearchResult result = searchService.search("paged", 50, 0);

        assertEquals(5, result.limit());
        assertEquals(5, result.records().size());
        assertEquals(12, result.totalMatches());
        assertTrue(result.hasMore());
    }

    @Test
    void offset_walks_through_all_matches() {
        store.insertBatch(IntStream.range(0, 12)
                .mapToObj(i -> "paged record " + i)
                .collect(Collectors.toList()), 100);

        long seen = IntStream.iterate(0, o -> o + 5)
                .limit(3)
                .mapToObj(o -> searchService.search("paged", 5, o))
                .mapToLong(r -> r.records().size())
                .sum();

        assertEquals(12, seen);
    }

    @Test
    void negative_offset_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> searchService.search("alpha", 5, -1));
    }
}
