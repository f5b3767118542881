package com.logvault.benchmark;

import com.logvault.application.usecase.SearchService;
import com.logvault.config.SearchConfig;
import com.logvault.config.StoreConfig;
import com.logvault.domain.SearchResult;
import com.logvault.infrastructure.SqliteRecordStore;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(1)
@State(Scope.Benchmark)
public class SearchBenchmarks {

    @Param({"200000"})
    public int recordCount;

    @Param({"10000"})
    public int batchSize;

    @Param({"book,science,death,war,love"})
    public String queryTerms;

    private static final String[] WORDS = {
            "book", "science", "death", "war", "love", "mail", "shop", "admin", "login", "portal",
            "alpha", "beta", "gamma", "delta", "server", "client", "token", "secret", "user", "guest"
    };

    private Path workDir;
    private SqliteRecordStore store;
    private SearchService searchService;
    private List<String> queries;
    private AtomicInteger rr;

    @Setup(Level.Trial)
    public void setup() throws IOException {
        workDir = Files.createTempDirectory("logvault-bench");
        store = SqliteRecordStore.open(StoreConfig.at(workDir.resolve("bench.db").toString()));
        searchService = new SearchService(store, SearchConfig.defaults());
        queries = List.of(queryTerms.split(","));
        rr = new AtomicInteger(0);

        Random random = new Random(42);
        List<String> batch = new ArrayList<>(batchSize);
        for (int i = 0; i < recordCount; i++) {
            batch.add(syntheticLine(random, i));
            if (batch.size() == batchSize) {
                store.insertBatch(batch, batchSize);
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            store.insertBatch(batch, batchSize);
        }
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        store.close();
        try (var files = Files.walk(workDir)) {
            files.sorted((a, b) -> b.getNameCount() - a.getNameCount()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String syntheticLine(Random random, int i) {
        return WORDS[random.nextInt(WORDS.length)] + "." + WORDS[random.nextInt(WORDS.length)]
                + ".example.com:" + WORDS[random.nextInt(WORDS.length)] + i + ":" + Integer.toHexString(random.nextInt());
    }

    @Benchmark
    public void singleTermSearch(Blackhole bh) {
        String q = queries.get(Math.floorMod(rr.getAndIncrement(), queries.size()));
        SearchResult result = searchService.search(q);
        bh.consume(result);
    }

    @Benchmark
    public void multiTermSearch(Blackhole bh) {
        int i = Math.floorMod(rr.getAndIncrement(), queries.size());
        String q = queries.get(i) + " " + queries.get((i + 1) % queries.size());
        bh.consume(searchService.search(q));
    }

    @Benchmark
    public void deepPageSearch(Blackhole bh) {
        String q = queries.get(Math.floorMod(rr.getAndIncrement(), queries.size()));
        bh.consume(searchService.search(q, 30, 3000));
    }

    public static void main(String[] args) throws RunnerException, IOException {
        Files.createDirectories(Path.of("benchmarking_results/search"));
        Options opt = new OptionsBuilder()
                .include(SearchBenchmarks.class.getSimpleName())
                .resultFormat(ResultFormatType.CSV)
                .result("benchmarking_results/search/search_summary.csv")
                .build();
        new Runner(opt).run();
    }
}
