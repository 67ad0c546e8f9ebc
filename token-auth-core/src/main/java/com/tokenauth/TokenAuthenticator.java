package com.tokenauth;

/**
 * What request-routing middleware calls to gate a protected resource.
 */
public interface TokenAuthenticator {

    String BEARER_PREFIX = "Bearer ";

    AuthenticationResult authenticate(String rawToken);

    /**
     * Same as {@link #authenticate(String)} for an {@code Authorization: Bearer <token>} header value.
     */
    default AuthenticationResult authenticateHeader(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return new AuthenticationResult.Rejected(RejectionReason.MISSING);
        }
        String value = authorizationHeader.trim();
        if (value.equalsIgnoreCase(BEARER_PREFIX.trim())) return new AuthenticationResult.Rejected(RejectionReason.MISSING);
        if (!value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return new AuthenticationResult.Rejected(RejectionReason.MALFORMED);
        }
        return authenticate(value.substring(BEARER_PREFIX.length()).trim());
    }
}
