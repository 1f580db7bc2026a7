package com.lbg.markets.surveillance.courier.tracker;

import com.lbg.markets.surveillance.courier.domain.FileRecord;

import java.util.Map;
import java.util.Optional;

/**
 * Delivery history, keyed by path. This is the authority for deduplication:
 * a candidate is only archived and sent when the ledger says it has not seen
 * that content before.
 */
public interface Tracker {

    /**
     * True if any record, under any path, carries this fingerprint.
     * A renamed or copied file that was already delivered is therefore skipped.
     */
    boolean lookupByHash(String hash);

    /**
     * True if there is no record for the path or the stored fingerprint differs.
     */
    boolean isStaleOrNew(String path, String hash);

    /**
     * Upsert the record for its path and persist the whole ledger before returning.
     */
    void commit(FileRecord record);

    /**
     * Highest sequence id in the ledger, 0 when empty.
     */
    long maxSequenceId();

    /**
     * Sequence id for the next successful delivery.
     */
    default long nextSequenceId() {
        return maxSequenceId() + 1;
    }

    Optional<FileRecord> findByPath(String path);

    Optional<FileRecord> findBySequenceId(long sequenceId);

    /**
     * Immutable copy of the current ledger.
     */
    Map<String, FileRecord> snapshot();

    /**
     * Drop in-memory state and read the persisted ledger again.
     */
    void reload();

    /**
     * Replace the ledger with an empty one, in memory and on disk.
     */
    void reset();
}
