package com.tokenauth.server.store;

import java.time.Instant;
import java.util.Objects;

/**
 * Server-side state of one token family: the hash of its only current refresh token,
 * its revocation flag and how many times it has been rotated.
 */
public record RefreshRecord(
    String tokenFamilyId,
    String currentRefreshTokenHash,
    String subjectId,
    Instant issuedAt,
    Instant expiresAt,
    boolean revoked,
    int rotationCount
) {

    public RefreshRecord {
        Objects.requireNonNull(tokenFamilyId, "tokenFamilyId");
        Objects.requireNonNull(currentRefreshTokenHash, "currentRefreshTokenHash");
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public static RefreshRecord newFamily(String tokenFamilyId, String subjectId, String refreshTokenHash,
                                          Instant issuedAt, Instant expiresAt) {
        return new RefreshRecord(tokenFamilyId, refreshTokenHash, subjectId, issuedAt, expiresAt, false, 0);
    }

    public RefreshRecord rotatedTo(String newHash, Instant newExpiresAt) {
        return new RefreshRecord(tokenFamilyId, newHash, subjectId, issuedAt, newExpiresAt, revoked, rotationCount + 1);
    }

    public RefreshRecord asRevoked() {
        return new RefreshRecord(tokenFamilyId, currentRefreshTokenHash, subjectId, issuedAt, expiresAt, true, rotationCount);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "RefreshRecord[family=" + tokenFamilyId + ", subject=" + subjectId + ", revoked=" + revoked
            + ", rotations=" + rotationCount + ", exp=" + expiresAt + "]";
    }
}
