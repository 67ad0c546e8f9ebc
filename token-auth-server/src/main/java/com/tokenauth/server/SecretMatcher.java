package com.tokenauth.server;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Compares a presented secret with the stored one. Plug a password-hash check in here.
 */
@FunctionalInterface
public interface SecretMatcher {

    boolean matches(String presented, String stored);

    static SecretMatcher constantTime() {
        return (presented, stored) -> presented != null && stored != null
            && MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), stored.getBytes(StandardCharsets.UTF_8));
    }
}
