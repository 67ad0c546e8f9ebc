package com.tokenauth;

import java.time.Instant;
import java.util.Objects;

/**
 * A signed token together with the claims it was issued from.
 */
public record IssuedToken(String value, TokenClaims claims) {

    public IssuedToken {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(claims, "claims");
    }

    public Instant expiresAt() {
        return claims.expiresAt();
    }

    public long expiresInSeconds() {
        return claims.lifetime().toSeconds();
    }

    @Override
    public String toString() {
        return "IssuedToken[type=" + claims.tokenType() + ", family=" + claims.tokenFamilyId()
            + ", jti=" + claims.tokenId() + ", exp=" + claims.expiresAt() + "]";
    }
}
