package com.logvault.infrastructure;

import com.logvault.application.exceptions.NotConnectedException;
import com.logvault.application.exceptions.QueryException;
import com.logvault.application.exceptions.StorageException;
import com.logvault.application.ports.RecordStore;
import com.logvault.config.StoreConfig;
import com.logvault.domain.BatchResult;
import com.logvault.domain.SearchPage;
import com.logvault.domain.StoreStats;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link RecordStore} backed by an SQLite FTS5 table.
 * <p>
 * The database runs in WAL mode so searches keep reading while an import writes. Inserts and
 * deletes take {@link #writeLock}, so only one write transaction is in flight per store.
 * {@link #clearAll()} does not VACUUM: the file keeps its size until SQLite reuses the pages.
 */
public class SqliteRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteRecordStore.class);

    private static final String CREATE_FTS_TABLE = """
            CREATE VIRTUAL TABLE IF NOT EXISTS records_fts
            USING fts5(
                raw_data,
                tokenize='porter unicode61 remove_diacritics 2'
            )""";
    private static final String CREATE_METADATA_TABLE =
            "CREATE TABLE IF NOT EXISTS metadata (key TEXT PRIMARY KEY, value TEXT)";

    private static final String INSERT_RECORD = "INSERT INTO records_fts(raw_data) VALUES (?)";
    private static final String OPTIMIZE_INDEX = "INSERT INTO records_fts(records_fts) VALUES('optimize')";
    private static final String COUNT_MATCHES = "SELECT COUNT(*) FROM records_fts WHERE records_fts MATCH ?";
    private static final String SEARCH_PAGE = """
            SELECT raw_data
            FROM records_fts
            WHERE records_fts MATCH ?
            ORDER BY rank, rowid
            LIMIT ? OFFSET ?""";
    private static final String COUNT_ALL = "SELECT COUNT(*) FROM records_fts";
    private static final String DELETE_ALL = "DELETE FROM records_fts";
    private static final String UPSERT_METADATA = "INSERT OR REPLACE INTO metadata(key, value) VALUES (?, ?)";
    private static final String SELECT_METADATA = "SELECT value FROM metadata WHERE key = ?";

    static final String LAST_IMPORT_KEY = "last_import";

    private final Path dbFile;
    private final DataSource ds;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SqliteRecordStore(Path dbFile, DataSource ds) {
        this.dbFile = dbFile;
        this.ds = ds;
    }

    public static SqliteRecordStore open(StoreConfig config) {
        Path dbFile = Path.of(config.dbPath()).toAbsolutePath().normalize();
        try {
            Path parent = dbFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageException("Could not create directory for " + dbFile, e);
        }

        HikariDataSource ds;
        try {
            ds = SqliteDataSource.create(config, dbFile);
        } catch (RuntimeException e) {
            throw new StorageException("Could not open database " + dbFile, e);
        }

        try {
            return open(dbFile, ds);
        } catch (StorageException e) {
            ds.close();
            throw e;
        }
    }

    static SqliteRecordStore open(Path dbFile, DataSource ds) {
        SqliteRecordStore store = new SqliteRecordStore(dbFile, ds);
        try {
            store.initSchema();
        } catch (SQLException e) {
            throw new StorageException("Could not initialize schema in " + dbFile, e);
        }
        log.info("Database connected: {}", dbFile);
        return store;
    }

    private void initSchema() throws SQLException {
        try (Connection conn = ds.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_FTS_TABLE);
            stmt.execute(CREATE_METADATA_TABLE);
        }
        log.debug("Schema ready in {}", dbFile);
    }

    @Override
    public int insertBatch(List<String> records, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        ensureOpen();
        if (records.isEmpty()) {
            return 0;
        }

        writeLock.lock();
        try (Connection conn = ds.getConnection()) {
            int totalInserted = 0;
            for (int from = 0; from < records.size(); from += batchSize) {
                List<String> group = records.subList(from, Math.min(from + batchSize, records.size()));
                BatchResult result = commitGroup(conn, group);
                if (!result.isCommitted()) {
                    log.error("Error inserting group at position {}: {}", from, result.getFailureReason());
                    throw new StorageException(result.getFailureReason(), result.getCause(), totalInserted);
                }
                totalInserted += result.getCommitted();
            }

            try (Statement stmt = conn.createStatement()) {
                stmt.execute(OPTIMIZE_INDEX);
            }
            writeMetadata(conn, LAST_IMPORT_KEY, Instant.now().toString());

            log.debug("Bulk insert completed: {} records", totalInserted);
            return totalInserted;
        } catch (SQLException e) {
            throw new StorageException("Error during bulk insert into " + dbFile, e);
        } finally {
            writeLock.unlock();
        }
    }

    private BatchResult commitGroup(Connection conn, List<String> group) throws SQLException {
        conn.setAutoCommit(false);
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_RECORD)) {
            for (String record : group) {
                stmt.setString(1, record);
                stmt.addBatch();
            }
            stmt.executeBatch();
            conn.commit();
        } catch (SQLException e) {
            try {
                conn.rollback();
                conn.setAutoCommit(true);
            } catch (SQLException rollbackError) {
                // autocommit stays off: switching it back on would commit the half-written group.
                // The pool rolls the open transaction back when the connection is returned.
                e.addSuppressed(rollbackError);
                log.error("Rollback failed, connection returned with an open transaction", rollbackError);
            }
            return BatchResult.failed("Insert of " + group.size() + " records rolled back: " + e.getMessage(), e);
        }
        conn.setAutoCommit(true);
        return BatchResult.committed(group.size());
    }

    @Override
    public SearchPage search(String matchExpression, int limit, int offset) {
        ensureOpen();
        if (matchExpression == null || matchExpression.isBlank()) {
            return SearchPage.empty();
        }

        try (Connection conn = ds.getConnection()) {
            long total;
            try (PreparedStatement stmt = conn.prepareStatement(COUNT_MATCHES)) {
                stmt.setString(1, matchExpression);
                try (ResultSet rs = stmt.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0;
                }
            }

            List<String> results = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(SEARCH_PAGE)) {
                stmt.setString(1, matchExpression);
                stmt.setInt(2, limit);
                stmt.setInt(3, offset);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        results.add(rs.getString(1));
                    }
                }
            }

            log.debug("Search for '{}': {} total, {} returned", matchExpression, total, results.size());
            return new SearchPage(results, total);
        } catch (SQLException e) {
            log.error("Search error for match expression '{}'", matchExpression, e);
            throw new QueryException(matchExpression, e);
        }
    }

    @Override
    public StoreStats stats() {
        ensureOpen();
        try (Connection conn = ds.getConnection()) {
            long count;
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(COUNT_ALL)) {
                count = rs.next() ? rs.getLong(1) : 0;
            }
            return new StoreStats(count, sizeOnDisk(), dbFile.toString(), readLastImport(conn));
        } catch (SQLException | IOException e) {
            log.error("Error getting stats for {}", dbFile, e);
            throw new StorageException("Could not read stats of " + dbFile, e);
        }
    }

    private long sizeOnDisk() throws IOException {
        long size = 0;
        for (Path file : List.of(dbFile, Path.of(dbFile + "-wal"))) {
            if (Files.exists(file)) {
                size += Files.size(file);
            }
        }
        return size;
    }

    private Instant readLastImport(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_METADATA)) {
            stmt.setString(1, LAST_IMPORT_KEY);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                try {
                    return Instant.parse(rs.getString(1));
                } catch (DateTimeParseException e) {
                    log.warn("Ignoring unparseable {} value in metadata", LAST_IMPORT_KEY);
                    return null;
                }
            }
        }
    }

    private void writeMetadata(Connection conn, String key, String value) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(UPSERT_METADATA)) {
            stmt.setString(1, key);
            stmt.setString(2, value);
            stmt.executeUpdate();
        }
    }

    @Override
    public void clearAll() {
        ensureOpen();
        writeLock.lock();
        try (Connection conn = ds.getConnection();
             Statement stmt = conn.createStatement()) {
            int deleted = stmt.executeUpdate(DELETE_ALL);
            log.warn("All data cleared from database {} ({} records)", dbFile, deleted);
        } catch (SQLException e) {
            throw new StorageException("Could not clear " + dbFile, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            if (ds instanceof HikariDataSource hikari) {
                hikari.close();
            }
            log.info("Database disconnected: {}", dbFile);
        }
    }

    public Path getDbFile() {
        return dbFile;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new NotConnectedException(dbFile.toString());
        }
    }
}
