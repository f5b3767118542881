package com.logvault;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.logvault.application.exceptions.ImportFailedException;
import com.logvault.application.exceptions.LogVaultException;
import com.logvault.application.usecase.RecordImporter;
import com.logvault.config.ImporterConfig;
import com.logvault.config.StoreConfig;
import com.logvault.domain.ImportStats;
import com.logvault.domain.StoreStats;
import com.logvault.infrastructure.SqliteRecordStore;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.out.println("Usage: ingestion <log_file_path> [--no-dedupe]");
            System.out.println();
            System.out.println("Example:");
            System.out.println("  ingestion data/logs.txt");
            System.out.println("  ingestion data/logs.txt --no-dedupe");
            System.exit(1);
        }

        var dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        var storeConfig = checkStoreEnvVars(dotenv);
        var importerConfig = checkImporterEnvVars(dotenv, args);

        System.exit(runImport(Path.of(args[0]), storeConfig, importerConfig));
    }

    static int runImport(Path file, StoreConfig storeConfig, ImporterConfig importerConfig) {
        Gson gson = createGson();
        try (var store = SqliteRecordStore.open(storeConfig)) {
            var importer = new RecordImporter(store);
            try {
                ImportStats stats = importer.importFile(file, importerConfig.batchSize(), importerConfig.deduplicate());
                System.out.println(gson.toJson(toResponse(stats, store.stats())));
                return 0;
            } catch (ImportFailedException e) {
                System.out.println(gson.toJson(Map.of(
                        "error", e.getMessage(),
                        "kind", e.getKind().name(),
                        "partial", e.getPartialStats())));
                return 1;
            }
        } catch (LogVaultException e) {
            log.error("Import failed: {}", e.getMessage());
            System.out.println(gson.toJson(Map.of("error", e.getMessage(), "kind", e.getKind().name())));
            return 1;
        }
    }

    private static Map<String, Object> toResponse(ImportStats stats, StoreStats storeStats) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("total_lines", stats.totalLines());
        response.put("imported", stats.imported());
        response.put("duplicates", stats.duplicates());
        response.put("empty_lines", stats.emptyLines());
        response.put("elapsed_time", stats.duration().toMillis() + "ms");
        response.put("records_per_second", Math.round(stats.recordsPerSecond()));
        response.put("total_records", storeStats.recordCount());
        response.put("db_path", storeStats.path());
        return response;
    }

    private static Gson createGson() {
        return new GsonBuilder()
                .registerTypeAdapter(Instant.class,
                        (JsonSerializer<Instant>) (src, typeOfSrc, context) ->
                                src == null ? null : new JsonPrimitive(src.toString()))
                .setPrettyPrinting()
                .create();
    }

    private static StoreConfig checkStoreEnvVars(Dotenv dotenv) {
        String dbPath = env(dotenv, "DB_PATH").orElse(StoreConfig.DEFAULT_DB_PATH);
        long openTimeout = env(dotenv, "DB_OPEN_TIMEOUT_MS")
                .map(Long::parseLong)
                .orElse(StoreConfig.DEFAULT_OPEN_TIMEOUT_MS);
        return new StoreConfig(dbPath, openTimeout, StoreConfig.DEFAULT_POOL_SIZE);
    }

    private static ImporterConfig checkImporterEnvVars(Dotenv dotenv, String[] args) {
        int batchSize = env(dotenv, "BATCH_SIZE")
                .map(Integer::parseInt)
                .orElse(ImporterConfig.DEFAULT_BATCH_SIZE);
        boolean deduplicate = Arrays.stream(args).noneMatch("--no-dedupe"::equals);
        return new ImporterConfig(batchSize, deduplicate);
    }

    private static Optional<String> env(Dotenv dotenv, String key) {
        return Optional.ofNullable(dotenv.get(key))
                .or(() -> Optional.ofNullable(System.getenv(key)));
    }
}
