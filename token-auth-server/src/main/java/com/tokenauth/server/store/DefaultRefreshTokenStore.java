package com.tokenauth.server.store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rotation and revocation rules on top of a {@link RefreshRecordRepository}.
 * Every write is a compare-and-set, so two requests racing on the same stale token
 * cannot both rotate.
 * <p>
 * {@code expiryLeeway} should match the codec's clock skew; a refresh token the codec still
 * accepts then still finds its family.
 */
@Slf4j
@AllArgsConstructor
public class DefaultRefreshTokenStore implements RefreshTokenStore {

    private final RefreshRecordRepository repository;
    private final Clock clock;
    private final Duration expiryLeeway;

    public DefaultRefreshTokenStore(RefreshRecordRepository repository, Clock clock) {
        this(repository, clock, Duration.ZERO);
    }

    @Override
    public String createFamily(String tokenFamilyId, String subjectId, String refreshTokenHash, Instant expiresAt) {
        repository.insert(RefreshRecord.newFamily(tokenFamilyId, subjectId, refreshTokenHash, clock.instant(), expiresAt));
        return tokenFamilyId;
    }

    @Override
    public RotationResult rotate(String tokenFamilyId, String oldHash, String newHash, Instant newExpiresAt) {
        Optional<RefreshRecord> found = repository.find(tokenFamilyId);
        if (found.isEmpty()) return RotationResult.NOT_FOUND;

        RefreshRecord current = found.get();
        if (current.revoked()) return RotationResult.REVOKED;
        if (current.isExpired(clock.instant().minus(expiryLeeway))) return RotationResult.NOT_FOUND;

        if (!hashesMatch(current.currentRefreshTokenHash(), oldHash)) {
            revoke(tokenFamilyId);
            log.warn("Refresh token reuse detected for family {} (subject {}, rotation {}), family revoked",
                tokenFamilyId, current.subjectId(), current.rotationCount());
            return RotationResult.REUSE_DETECTED;
        }

        if (!repository.compareAndSet(current, current.rotatedTo(newHash, newExpiresAt))) {
            throw new StorageConflictException("Token family " + tokenFamilyId + " changed during rotation");
        }
        log.debug("Rotated token family {} to rotation {}", tokenFamilyId, current.rotationCount() + 1);
        return RotationResult.ROTATED;
    }

    @Override
    public void revoke(String tokenFamilyId) {
        for (int attempt = 0; attempt < 2; attempt++) {
            Optional<RefreshRecord> found = repository.find(tokenFamilyId);
            if (found.isEmpty() || found.get().revoked()) return;
            if (repository.compareAndSet(found.get(), found.get().asRevoked())) {
                log.info("Revoked token family {}", tokenFamilyId);
                return;
            }
        }
        throw new StorageConflictException("Token family " + tokenFamilyId + " kept changing during revocation");
    }

    @Override
    public boolean isRevoked(String tokenFamilyId) {
        return repository.find(tokenFamilyId).map(RefreshRecord::revoked).orElse(true);
    }

    @Override
    public List<String> revokeSubject(String subjectId) {
        List<String> revoked = new ArrayList<>();
        for (String familyId : repository.findFamilyIdsBySubject(subjectId)) {
            if (!isRevoked(familyId)) {
                revoke(familyId);
                revoked.add(familyId);
            }
        }
        return revoked;
    }

    @Override
    public Optional<RefreshRecord> find(String tokenFamilyId) {
        return repository.find(tokenFamilyId);
    }

    @Override
    public int purgeExpired(Instant now) {
        return repository.deleteExpired(now.minus(expiryLeeway));
    }

    private static boolean hashesMatch(String stored, String presented) {
        if (presented == null) return false;
        return MessageDigest.isEqual(stored.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }
}
