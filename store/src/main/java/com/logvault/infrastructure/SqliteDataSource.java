package com.logvault.infrastructure;

import com.logvault.config.StoreConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.nio.file.Path;

/**
 * Builds the connection pool for one SQLite file. The pragmas are driver properties so every
 * pooled connection is opened with them, not only the first one.
 */
public final class SqliteDataSource {

    static final String JOURNAL_MODE = "WAL";
    static final String SYNCHRONOUS = "NORMAL";
    static final String TEMP_STORE = "MEMORY";
    static final String CACHE_SIZE_KIB = "-64000";

    private SqliteDataSource() {}

    public static HikariDataSource create(StoreConfig storeConfig, Path dbFile) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("logvault-" + dbFile.getFileName());
        config.setJdbcUrl("jdbc:sqlite:" + dbFile);
        config.setMaximumPoolSize(storeConfig.maxPoolSize());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(storeConfig.openTimeoutMs());
        config.setInitializationFailTimeout(storeConfig.openTimeoutMs());
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);

        config.addDataSourceProperty("journal_mode", JOURNAL_MODE);
        config.addDataSourceProperty("synchronous", SYNCHRONOUS);
        config.addDataSourceProperty("temp_store", TEMP_STORE);
        config.addDataSourceProperty("cache_size", CACHE_SIZE_KIB);
        config.addDataSourceProperty("busy_timeout", String.valueOf(storeConfig.openTimeoutMs()));

        return new HikariDataSource(config);
    }
}
