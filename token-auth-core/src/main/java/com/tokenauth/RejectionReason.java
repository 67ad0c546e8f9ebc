package com.tokenauth;

/**
 * Why a presented token was not accepted.
 */
public enum RejectionReason {
    /** No token was presented. */
    MISSING,
    /** The token could not be parsed or lacks required claims. */
    MALFORMED,
    /** The token is past its expiry, beyond the configured clock skew. */
    EXPIRED,
    /** The signature does not match or was made with an unknown key. */
    SIGNATURE_INVALID,
    /** The token or its family is on the blacklist. */
    REVOKED
}
