package com.tokenauth;

import java.time.Instant;

/**
 * Storage for blacklisted keys, each kept until its own expiry.
 * Implement this over Redis, a table, or anything with TTL semantics.
 */
public interface TokenBlacklist {

    void add(String key, Instant expiresAt);

    boolean contains(String key, Instant now);

    /**
     * @return number of entries removed
     */
    int purgeExpired(Instant now);
}
