package com.tokenauth;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Set;
import java.util.UUID;

/**
 * Assertions carried inside an issued token.
 * <p>
 * Timestamps are kept at whole-second precision, the resolution of the {@code iat} and
 * {@code exp} claims, so a decoded token compares equal to the claims it was issued from.
 * Schema rules (subject present, positive lifetime) are enforced by the codec at issue time.
 */
public record TokenClaims(
    String subjectId,
    Set<String> scopes,
    Instant issuedAt,
    Instant expiresAt,
    String tokenFamilyId,
    TokenType tokenType,
    String tokenId
) {

    public TokenClaims {
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        issuedAt = issuedAt == null ? null : issuedAt.truncatedTo(ChronoUnit.SECONDS);
        expiresAt = expiresAt == null ? null : expiresAt.truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Claims for a fresh token with a random token id.
     */
    public static TokenClaims of(String subjectId,
                                 Set<String> scopes,
                                 Instant issuedAt,
                                 Duration lifetime,
                                 String tokenFamilyId,
                                 TokenType tokenType) {
        Instant iat = issuedAt.truncatedTo(ChronoUnit.SECONDS);
        return new TokenClaims(subjectId, scopes, iat, iat.plus(lifetime), tokenFamilyId, tokenType,
            UUID.randomUUID().toString());
    }

    public Duration lifetime() {
        return Duration.between(issuedAt, expiresAt);
    }

    public Principal toPrincipal() {
        return new Principal(subjectId, scopes);
    }
}
