package com.tokenauth.server.store;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process repository. Compare-and-set relies on {@link ConcurrentHashMap#replace(Object, Object, Object)}
 * and value equality of {@link RefreshRecord}.
 */
public class InMemoryRefreshRecordRepository implements RefreshRecordRepository {

    private final ConcurrentHashMap<String, RefreshRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<RefreshRecord> find(String tokenFamilyId) {
        return Optional.ofNullable(records.get(tokenFamilyId));
    }

    @Override
    public void insert(RefreshRecord record) {
        if (records.putIfAbsent(record.tokenFamilyId(), record) != null) {
            throw new StorageConflictException("Token family " + record.tokenFamilyId() + " already exists");
        }
    }

    @Override
    public boolean compareAndSet(RefreshRecord expected, RefreshRecord replacement) {
        if (!expected.tokenFamilyId().equals(replacement.tokenFamilyId())) {
            throw new IllegalArgumentException("Cannot move a record to another token family");
        }
        return records.replace(expected.tokenFamilyId(), expected, replacement);
    }

    @Override
    public List<String> findFamilyIdsBySubject(String subjectId) {
        return records.values().stream()
            .filter(r -> r.subjectId().equals(subjectId))
            .map(RefreshRecord::tokenFamilyId)
            .toList();
    }

    @Override
    public int deleteExpired(Instant now) {
        int removed = 0;
        Iterator<Map.Entry<String, RefreshRecord>> it = records.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return records.size();
    }
}
