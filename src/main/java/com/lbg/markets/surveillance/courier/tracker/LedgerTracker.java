package com.lbg.markets.surveillance.courier.tracker;

import com.lbg.markets.surveillance.courier.domain.FileRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tracker backed by a {@link StateStore}. The full ledger is held in memory and
 * written through on every commit; a failed write leaves the in-memory view untouched.
 */
@ApplicationScoped
public class LedgerTracker implements Tracker {

    private static final Logger LOG = Logger.getLogger(LedgerTracker.class);

    private final StateStore store;
    private Map<String, FileRecord> records;

    @Inject
    public LedgerTracker(StateStore store) {
        this.store = store;
    }

    @Override
    public synchronized boolean lookupByHash(String hash) {
        return loaded().values().stream().anyMatch(rec -> hash.equals(rec.hash()));
    }

    @Override
    public synchronized boolean isStaleOrNew(String path, String hash) {
        FileRecord existing = loaded().get(path);
        return existing == null || !existing.hash().equals(hash);
    }

    @Override
    public synchronized void commit(FileRecord record) {
        if (record.path() == null || record.path().isBlank()) {
            throw new IllegalArgumentException("Cannot commit a record without a path");
        }
        Map<String, FileRecord> updated = new LinkedHashMap<>(loaded());
        updated.put(record.path(), record);
        store.saveHistory(updated);
        records = updated;
        LOG.debugf("Committed %s (file_id %d)", record.path(), record.sequenceId());
    }

    @Override
    public synchronized long maxSequenceId() {
        return loaded().values().stream()
                .mapToLong(FileRecord::sequenceId)
                .max()
                .orElse(0L);
    }

    @Override
    public synchronized Optional<FileRecord> findByPath(String path) {
        return Optional.ofNullable(loaded().get(path));
    }

    @Override
    public synchronized Optional<FileRecord> findBySequenceId(long sequenceId) {
        return loaded().values().stream()
                .filter(rec -> rec.sequenceId() == sequenceId)
                .findFirst();
    }

    @Override
    public synchronized Map<String, FileRecord> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(loaded()));
    }

    @Override
    public synchronized void reload() {
        records = new LinkedHashMap<>(store.loadHistory());
        LOG.debugf("Loaded %d history entries", records.size());
    }

    @Override
    public synchronized void reset() {
        store.saveHistory(Map.of());
        records = new LinkedHashMap<>();
        LOG.info("Delivery history cleared");
    }

    private Map<String, FileRecord> loaded() {
        if (records == null) {
            reload();
        }
        return records;
    }
}
