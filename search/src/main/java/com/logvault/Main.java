package com.logvault;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.logvault.application.exceptions.LogVaultException;
import com.logvault.application.usecase.SearchService;
import com.logvault.application.usecase.StatsReporter;
import com.logvault.config.SearchConfig;
import com.logvault.config.StoreConfig;
import com.logvault.infrastructure.SqliteRecordStore;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            printUsage();
            System.exit(1);
        }

        var dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        var storeConfig = checkStoreEnvVars(dotenv);
        var searchConfig = checkSearchEnvVars(dotenv);

        System.exit(run(args, storeConfig, searchConfig));
    }

    static int run(String[] args, StoreConfig storeConfig, SearchConfig searchConfig) {
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        try (var store = SqliteRecordStore.open(storeConfig)) {
            switch (args[0]) {
                case "search" -> {
                    if (args.length < 2 || args[1].isBlank()) {
                        System.out.println(gson.toJson(new ErrorResponse("Query is required")));
                        return 1;
                    }
                    int limit = args.length > 2 ? Integer.parseInt(args[2]) : searchConfig.pageSize();
                    int offset = args.length > 3 ? Integer.parseInt(args[3]) : 0;
                    var results = new SearchService(store, searchConfig).search(args[1], limit, offset);
                    System.out.println(gson.toJson(results));
                    return 0;
                }
                case "stats" -> {
                    var stats = new StatsReporter(store).report();
                    System.out.println(gson.toJson(stats));
                    return stats.isFailure() ? 1 : 0;
                }
                case "clear" -> {
                    store.clearAll();
                    System.out.println(gson.toJson(Map.of("status", "cleared")));
                    return 0;
                }
                default -> {
                    printUsage();
                    return 1;
                }
            }
        } catch (LogVaultException e) {
            log.error("{} failed: {}", args[0], e.getMessage());
            System.out.println(gson.toJson(new ErrorResponse(e.getKind().name() + ": " + e.getMessage())));
            return 1;
        } catch (NumberFormatException e) {
            System.out.println(gson.toJson(new ErrorResponse("limit and offset must be integers")));
            return 1;
        }
    }

    public static class ErrorResponse {
        public String error;

        public ErrorResponse(String error) {
            this.error = error;
        }
    }

    private static void printUsage() {
        System.out.println("Usage:");
        System.out.println("  search search <query> [limit] [offset]");
        System.out.println("  search stats");
        System.out.println("  search clear");
    }

    private static StoreConfig checkStoreEnvVars(Dotenv dotenv) {
        String dbPath = env(dotenv, "DB_PATH").orElse(StoreConfig.DEFAULT_DB_PATH);
        long openTimeout = env(dotenv, "DB_OPEN_TIMEOUT_MS")
                .map(Long::parseLong)
                .orElse(StoreConfig.DEFAULT_OPEN_TIMEOUT_MS);
        return new StoreConfig(dbPath, openTimeout, StoreConfig.DEFAULT_POOL_SIZE);
    }

    private static SearchConfig checkSearchEnvVars(Dotenv dotenv) {
        int pageSize = env(dotenv, "PAGE_SIZE")
                .map(Integer::parseInt)
                .orElse(SearchConfig.DEFAULT_PAGE_SIZE);
        return new SearchConfig(pageSize);
    }

    private static Optional<String> env(Dotenv dotenv, String key) {
        return Optional.ofNullable(dotenv.get(key))
                .or(() -> Optional.ofNullable(System.getenv(key)));
    }
}
