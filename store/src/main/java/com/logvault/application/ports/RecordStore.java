package com.logvault.application.ports;

import com.logvault.domain.SearchPage;
import com.logvault.domain.StoreStats;

import java.util.List;

/**
 * Durable container for text records with a full-text index.
 * <p>
 * Reads ({@link #search}, {@link #stats}) may run concurrently with each other and with a running
 * import. Writes are serialized by the implementation. Every method throws
 * {@link com.logvault.application.exceptions.NotConnectedException} once the store is closed.
 */
public interface RecordStore extends AutoCloseable {

    /**
     * Inserts {@code records} in transactions of at most {@code batchSize} rows each, then
     * consolidates the index. Groups committed before a failing group stay committed.
     *
     * @return number of rows inserted
     * @throws com.logvault.application.exceptions.StorageException if a group fails; it carries
     *         the rows already committed by this call
     */
    int insertBatch(List<String> records, int batchSize);

    // blank expression -> SearchPage.empty() without querying
    SearchPage search(String matchExpression, int limit, int offset);

    StoreStats stats();

    // irreversible; file space is not reclaimed
    void clearAll();

    boolean isOpen();

    @Override
    void close();
}
