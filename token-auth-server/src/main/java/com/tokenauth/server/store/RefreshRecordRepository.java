package com.tokenauth.server.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent storage for refresh records. Implement this over a key-value store or a table;
 * {@link #compareAndSet} must be atomic (a conditional write or a row-level transaction).
 */
public interface RefreshRecordRepository {

    Optional<RefreshRecord> find(String tokenFamilyId);

    /**
     * @throws StorageConflictException if a record with the same family id already exists
     */
    void insert(RefreshRecord record);

    /**
     * Replaces {@code expected} with {@code replacement} only if the stored record still equals
     * {@code expected}.
     *
     * @return false if the record changed or disappeared in the meantime
     */
    boolean compareAndSet(RefreshRecord expected, RefreshRecord replacement);

    List<String> findFamilyIdsBySubject(String subjectId);

    /**
     * @return number of records removed
     */
    int deleteExpired(Instant now);
}
