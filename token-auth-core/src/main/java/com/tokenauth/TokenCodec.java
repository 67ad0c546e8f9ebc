package com.tokenauth;

/**
 * Encodes claims into signed, tamper-evident tokens and decodes them back.
 * Verification is pure: it never consults a store.
 */
public interface TokenCodec {

    /**
     * @throws TokenEncodingException if the claims fail schema validation
     */
    IssuedToken issue(TokenClaims claims);

    /**
     * @throws TokenVerificationException with {@link RejectionReason#MALFORMED},
     *         {@link RejectionReason#SIGNATURE_INVALID} or {@link RejectionReason#EXPIRED}
     */
    TokenClaims verify(String token);
}
