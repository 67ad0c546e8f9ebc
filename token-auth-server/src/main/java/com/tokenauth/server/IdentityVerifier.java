package com.tokenauth.server;

import java.util.Optional;

import com.tokenauth.Principal;

/**
 * Checks login credentials against an identity store.
 * Implement this over a user table, a directory, or any store with a vetted password hash.
 */
public interface IdentityVerifier {

    /**
     * @return the principal, or empty when the identifier is unknown or the secret is wrong;
     *         implementations must not let callers tell the two apart
     */
    Optional<Principal> verifyCredentials(String identifier, String secret);
}
