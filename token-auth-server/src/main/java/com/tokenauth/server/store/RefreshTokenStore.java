package com.tokenauth.server.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Tracks which refresh token is current for each token family and whether the family is revoked.
 * <p>
 * At most one refresh token per family is current at any time. Presenting any other token of
 * the family counts as reuse and revokes the whole family.
 */
public interface RefreshTokenStore {

    /**
     * Records a new family whose current refresh token has {@code refreshTokenHash}.
     *
     * @return the family id
     * @throws StorageConflictException if the family id is already taken
     */
    String createFamily(String tokenFamilyId, String subjectId, String refreshTokenHash, Instant expiresAt);

    /**
     * Atomically swaps {@code oldHash} for {@code newHash} if {@code oldHash} is current and the
     * family is not revoked. A mismatch revokes the family and reports {@link RotationResult#REUSE_DETECTED}.
     * A family whose expiry plus the store's leeway has passed is {@link RotationResult#NOT_FOUND}.
     *
     * @throws StorageConflictException if a concurrent writer changed the record between read and write
     */
    RotationResult rotate(String tokenFamilyId, String oldHash, String newHash, Instant newExpiresAt);

    /**
     * Idempotent. Unknown families are ignored.
     *
     * @throws StorageConflictException if the record kept changing under a retried compare-and-set
     */
    void revoke(String tokenFamilyId);

    /**
     * Unknown or garbage-collected families count as revoked.
     */
    boolean isRevoked(String tokenFamilyId);

    /**
     * Revokes every live family of a subject.
     *
     * @return ids of the families this call revoked
     */
    List<String> revokeSubject(String subjectId);

    Optional<RefreshRecord> find(String tokenFamilyId);

    /**
     * @return number of records removed
     */
    int purgeExpired(Instant now);
}
