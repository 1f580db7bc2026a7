package com.lbg.markets.surveillance.courier.tracker;

import com.lbg.markets.surveillance.courier.domain.FileRecord;

import java.util.Map;

/**
 * Durable storage for pipeline state. Each map is stored as a whole; a save
 * replaces what was there before and is durable once the call returns.
 */
public interface StateStore {

    /**
     * Ledger keyed by path. Missing or unparseable state reads as an empty map.
     *
     * @throws StateStoreException if the state exists but cannot be read at all
     */
    Map<String, FileRecord> loadHistory();

    void saveHistory(Map<String, FileRecord> history);

    Map<String, Long> loadSizeCache();

    void saveSizeCache(Map<String, Long> sizes);

    /**
     * Replace ledger and size cache with empty state.
     */
    default void clearAll() {
        saveHistory(Map.of());
        saveSizeCache(Map.of());
    }
}
