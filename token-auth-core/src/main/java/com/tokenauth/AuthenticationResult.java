package com.tokenauth;

/**
 * Outcome of checking an access token at a protected resource.
 */
public sealed interface AuthenticationResult {

    record Authenticated(Principal principal, TokenClaims claims) implements AuthenticationResult {
    }

    record Rejected(RejectionReason reason) implements AuthenticationResult {
    }

    default boolean isAuthenticated() {
        return this instanceof Authenticated;
    }
}
