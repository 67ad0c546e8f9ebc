package com.tokenauth.server;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Supplier;

import com.tokenauth.AccessTokenBlacklist;
import com.tokenauth.IssuedToken;
import com.tokenauth.Principal;
import com.tokenauth.TokenAuthConfig;
import com.tokenauth.TokenClaims;
import com.tokenauth.TokenCodec;
import com.tokenauth.TokenType;
import com.tokenauth.TokenVerificationException;
import com.tokenauth.server.store.RefreshTokenHasher;
import com.tokenauth.server.store.RefreshTokenStore;
import com.tokenauth.server.store.RotationResult;
import com.tokenauth.server.store.StorageConflictException;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues token pairs for logins and refreshes, and ends sessions.
 * <p>
 * Every login starts a new token family. Each refresh rotates the family's refresh token:
 * the presented token stops being current and a new one takes its place. Presenting a
 * superseded refresh token revokes the whole family, so a stolen token that is replayed
 * forces its owner back through a full login as well.
 * <p>
 * A concurrent write on the same family surfaces from the store as a conflict; the
 * rotation is retried once against the new state before {@link GrantError#CONFLICT} is
 * reported.
 */
@Slf4j
public class GrantEngine {

    private final IdentityVerifier identityVerifier;
    private final TokenCodec codec;
    private final RefreshTokenStore tokenStore;
    private final AccessTokenBlacklist blacklist;
    private final TokenAuthConfig config;
    private final Clock clock;

    public GrantEngine(IdentityVerifier identityVerifier,
                       TokenCodec codec,
                       RefreshTokenStore tokenStore,
                       AccessTokenBlacklist blacklist,
                       TokenAuthConfig config,
                       Clock clock) {
        this.identityVerifier = identityVerifier;
        this.codec = codec;
        this.tokenStore = tokenStore;
        this.blacklist = effectiveBlacklist(blacklist, config);
        this.config = config;
        this.clock = clock;
    }

    private static AccessTokenBlacklist effectiveBlacklist(AccessTokenBlacklist blacklist, TokenAuthConfig config) {
        if (blacklist == null) return AccessTokenBlacklist.disabled();
        if (!config.isAccessTokenBlacklistEnabled()) {
            if (blacklist.isEnabled()) {
                log.warn("Access token blacklist supplied but disabled by configuration, revocations will not reach access tokens");
            }
            return AccessTokenBlacklist.disabled();
        }
        return blacklist;
    }

    public TokenPair passwordGrant(String identifier, String secret) {
        return passwordGrant(identifier, secret, Set.of());
    }

    /**
     * Logs a principal in. An empty {@code requestedScopes} grants every scope the principal holds.
     *
     * @throws GrantException {@link GrantError#INVALID_CREDENTIALS} for unknown identifiers and wrong
     *         secrets alike, {@link GrantError#INSUFFICIENT_SCOPE} when a requested scope is not held
     */
    public TokenPair passwordGrant(String identifier, String secret, Set<String> requestedScopes) {
        if (identifier == null || identifier.isBlank() || secret == null || secret.isEmpty()) {
            throw new GrantException(GrantError.INVALID_CREDENTIALS, "Missing credentials");
        }
        Principal principal = identityVerifier.verifyCredentials(identifier, secret)
            .orElseThrow(() -> new GrantException(GrantError.INVALID_CREDENTIALS, "Credentials rejected"));

        Set<String> scopes = grantedScopes(principal, requestedScopes);
        TokenPair pair = retryOnConflict(() -> startFamily(principal.subjectId(), scopes));
        log.info("Login for subject {} started token family {}", principal.subjectId(), pair.tokenFamilyId());
        return pair;
    }

    /**
     * Exchanges a current refresh token for a new access token and a rotated refresh token.
     *
     * @throws GrantException {@link GrantError#INVALID_GRANT} for an unusable token,
     *         {@link GrantError#TOKEN_FAMILY_REVOKED} on reuse or after logout
     */
    public TokenPair refreshGrant(String refreshToken) {
        TokenClaims presented = decodeRefreshToken(refreshToken);
        String familyId = presented.tokenFamilyId();
        String presentedHash = RefreshTokenHasher.hash(refreshToken);

        IssuedToken rotated = codec.issue(TokenClaims.of(presented.subjectId(), presented.scopes(), clock.instant(),
            config.getRefreshTokenTtl(), familyId, TokenType.REFRESH));
        String rotatedHash = RefreshTokenHasher.hash(rotated.value());

        RotationResult result = retryOnConflict(
            () -> tokenStore.rotate(familyId, presentedHash, rotatedHash, rotated.expiresAt()));

        switch (result) {
            case ROTATED:
                break;
            case REUSE_DETECTED:
                blacklistFamily(familyId);
                throw new GrantException(GrantError.TOKEN_FAMILY_REVOKED,
                    "Superseded refresh token presented for family " + familyId);
            case REVOKED:
                throw new GrantException(GrantError.TOKEN_FAMILY_REVOKED, "Token family " + familyId + " is revoked");
            case NOT_FOUND:
            default:
                throw new GrantException(GrantError.INVALID_GRANT, "Unknown token family " + familyId);
        }

        IssuedToken access = codec.issue(TokenClaims.of(presented.subjectId(), presented.scopes(), clock.instant(),
            config.getAccessTokenTtl(), familyId, TokenType.ACCESS));
        return new TokenPair(access, rotated);
    }

    public void logout(String tokenFamilyId) {
        retryOnConflict(() -> {
            tokenStore.revoke(tokenFamilyId);
            return tokenFamilyId;
        });
        blacklistFamily(tokenFamilyId);
        log.info("Logged out token family {}", tokenFamilyId);
    }

    /**
     * Logs out the family a valid refresh token belongs to.
     *
     * @return the revoked family id
     */
    public String logoutWithRefreshToken(String refreshToken) {
        String familyId = decodeRefreshToken(refreshToken).tokenFamilyId();
        logout(familyId);
        return familyId;
    }

    /**
     * Ends every session of a subject, e.g. after a password change.
     *
     * @return number of families revoked
     */
    public int revokeAll(String subjectId) {
        var families = retryOnConflict(() -> tokenStore.revokeSubject(subjectId));
        families.forEach(this::blacklistFamily);
        log.info("Revoked {} token families of subject {}", families.size(), subjectId);
        return families.size();
    }

    private TokenPair startFamily(String subjectId, Set<String> scopes) {
        String familyId = UUID.randomUUID().toString();
        Instant now = clock.instant();

        IssuedToken refresh = codec.issue(TokenClaims.of(subjectId, scopes, now, config.getRefreshTokenTtl(),
            familyId, TokenType.REFRESH));
        tokenStore.createFamily(familyId, subjectId, RefreshTokenHasher.hash(refresh.value()), refresh.expiresAt());

        IssuedToken access = codec.issue(TokenClaims.of(subjectId, scopes, now, config.getAccessTokenTtl(),
            familyId, TokenType.ACCESS));
        return new TokenPair(access, refresh);
    }

    private TokenClaims decodeRefreshToken(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new GrantException(GrantError.INVALID_GRANT, "Missing refresh token");
        }
        TokenClaims claims;
        try {
            claims = codec.verify(refreshToken);
        } catch (TokenVerificationException e) {
            log.debug("Refresh token rejected: {}", e.getReason());
            throw new GrantException(GrantError.INVALID_GRANT, "Refresh token rejected: " + e.getReason(), e);
        }
        if (claims.tokenType() != TokenType.REFRESH) {
            throw new GrantException(GrantError.INVALID_GRANT, "Token is not a refresh token");
        }
        return claims;
    }

    private static Set<String> grantedScopes(Principal principal, Set<String> requested) {
        if (requested == null || requested.isEmpty()) return principal.scopes();
        Set<String> missing = new TreeSet<>(requested);
        missing.removeAll(principal.scopes());
        if (!missing.isEmpty()) {
            throw new GrantException(GrantError.INSUFFICIENT_SCOPE, "Scopes not granted to principal: " + missing);
        }
        return Set.copyOf(requested);
    }

    private void blacklistFamily(String tokenFamilyId) {
        if (!blacklist.isEnabled()) return;
        // outlives every access token of the family, including the verification skew
        blacklist.revokeFamily(tokenFamilyId, clock.instant().plus(config.getAccessTokenTtl()).plus(config.getClockSkew()));
    }

    private static <T> T retryOnConflict(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (StorageConflictException first) {
            log.debug("Storage conflict, retrying once: {}", first.getMessage());
            try {
                return operation.get();
            } catch (StorageConflictException second) {
                throw new GrantException(GrantError.CONFLICT, "Concurrent update, retry the request", second);
            }
        }
    }
}
