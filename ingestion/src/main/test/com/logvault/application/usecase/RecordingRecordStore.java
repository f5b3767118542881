package com.logvault.application.usecase;

import com.logvault.application.exceptions.LogVaultException;
import com.logvault.application.exceptions.StorageException;
import com.logvault.application.ports.RecordStore;
import com.logvault.domain.SearchPage;
import com.logvault.domain.StoreStats;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

class RecordingRecordStore implements RecordStore {

    final List<List<String>> insertCalls = new ArrayList<>();
    final List<String> stored = new ArrayList<>();
    private int failOnCall = -1;
    private Supplier<LogVaultException> failure = () -> new StorageException("disk full", new SQLException("SQLITE_FULL"));
    private Consumer<Integer> afterInsert = call -> {};
    private boolean open = true;

    void failOnCall(int callNumber) {
        this.failOnCall = callNumber;
    }

    void failOnCall(int callNumber, Supplier<LogVaultException> failure) {
        this.failOnCall = callNumber;
        this.failure = failure;
    }

    void afterInsert(Consumer<Integer> hook) {
        this.afterInsert = hook;
    }

    @Override
    public int insertBatch(List<String> records, int batchSize) {
        insertCalls.add(List.copyOf(records));
        int call = insertCalls.size();
        if (call == failOnCall) {
            throw failure.get();
        }
        stored.addAll(records);
        afterInsert.accept(call);
        return records.size();
    }

    @Override
    public SearchPage search(String matchExpression, int limit, int offset) {
        return SearchPage.empty();
    }

    @Override
    public StoreStats stats() {
        return new StoreStats(stored.size(), 0, "memory", null);
    }

    @Override
    public void clearAll() {
        stored.clear();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }
}
