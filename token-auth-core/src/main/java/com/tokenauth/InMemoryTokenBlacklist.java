package com.tokenauth;

import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTokenBlacklist implements TokenBlacklist {

    private final ConcurrentHashMap<String, Instant> entries = new ConcurrentHashMap<>();

    @Override
    public void add(String key, Instant expiresAt) {
        entries.merge(key, expiresAt, (current, next) -> next.isAfter(current) ? next : current);
    }

    @Override
    public boolean contains(String key, Instant now) {
        Instant expiresAt = entries.get(key);
        return expiresAt != null && now.isBefore(expiresAt);
    }

    @Override
    public int purgeExpired(Instant now) {
        int removed = 0;
        Iterator<Map.Entry<String, Instant>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (!now.isBefore(it.next().getValue())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }
}
